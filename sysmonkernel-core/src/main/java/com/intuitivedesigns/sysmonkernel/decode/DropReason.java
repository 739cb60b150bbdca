/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.decode;

/**
 * Why a payload produced no record.
 */
public enum DropReason {
    /** Bytes are not a well-formed term, or the term is not a tagged tuple. */
    DECODE_ERROR("decode_error", "Badly formatted sysmon message"),
    UNKNOWN_TYPE("unknown_type", "Unknown record"),
    ARITY_MISMATCH("arity_mismatch", "Unknown record"),
    /** A field transform rejected its value, or decoding failed unexpectedly. */
    TRANSFORM_ERROR("transform_error", "Badly formatted sysmon message");

    private final String code;
    private final String description;

    DropReason(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String code() {
        return code;
    }

    public String description() {
        return description;
    }
}
