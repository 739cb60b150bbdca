/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.transform;

/**
 * A field transform rejected its input. Aborts the decode of the whole record.
 */
public final class FieldTransformException extends RuntimeException {

    public FieldTransformException(String message) {
        super(message);
    }
}
