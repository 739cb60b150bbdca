/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.schema;

import com.intuitivedesigns.sysmonkernel.transform.FieldTransforms;

import java.util.function.UnaryOperator;

/**
 * Single-argument field transforms, bound to their implementation when the schema is built.
 */
public enum FieldTransform {
    NULLABLE(FieldTransforms::nullable),
    TIMESTAMP(FieldTransforms::timestamp),
    FORMAT_FUNCTION(FieldTransforms::formatFunction),
    FORMAT_STACKTRACE(FieldTransforms::formatStacktrace);

    private final UnaryOperator<Object> fn;

    FieldTransform(UnaryOperator<Object> fn) {
        this.fn = fn;
    }

    public Object apply(Object value) {
        return fn.apply(value);
    }
}
