/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.term;

/**
 * Indicates that a byte sequence is not a well-formed encoded term.
 *
 * This typically reflects:
 * <ul>
 *   <li>Missing or wrong version byte</li>
 *   <li>Unknown or unsupported type tag</li>
 *   <li>Truncated input or trailing bytes after the term</li>
 *   <li>Nesting deeper than the decoder allows</li>
 * </ul>
 */
public final class TermDecodeException extends RuntimeException {

    public TermDecodeException(String message) {
        super(message);
    }

    public TermDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
