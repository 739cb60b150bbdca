/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.schema;

import com.intuitivedesigns.sysmonkernel.transform.FieldTransforms;

/**
 * Field transforms that take a static integer argument from the schema.
 */
public enum BoundedFieldTransform {
    TO_STRING {
        @Override
        public Object apply(Object value, int limit) {
            return FieldTransforms.toString(value, limit);
        }
    };

    public abstract Object apply(Object value, int arg);
}
