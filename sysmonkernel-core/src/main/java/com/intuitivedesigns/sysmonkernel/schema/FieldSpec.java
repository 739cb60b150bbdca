/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.schema;

import java.util.Objects;

/**
 * How one positional raw value becomes one named stored value.
 */
public sealed interface FieldSpec permits FieldSpec.Bare, FieldSpec.Mapped, FieldSpec.Bounded {

    String name();

    Object apply(Object raw);

    static FieldSpec bare(String name) {
        return new Bare(name);
    }

    static FieldSpec mapped(String name, FieldTransform transform) {
        return new Mapped(name, transform);
    }

    static FieldSpec bounded(String name, BoundedFieldTransform transform, int arg) {
        return new Bounded(name, transform, arg);
    }

    /** Passed through unchanged. */
    record Bare(String name) implements FieldSpec {
        public Bare {
            requireName(name);
        }

        @Override
        public Object apply(Object raw) {
            return raw;
        }
    }

    record Mapped(String name, FieldTransform transform) implements FieldSpec {
        public Mapped {
            requireName(name);
            Objects.requireNonNull(transform, "transform");
        }

        @Override
        public Object apply(Object raw) {
            return transform.apply(raw);
        }
    }

    record Bounded(String name, BoundedFieldTransform transform, int arg) implements FieldSpec {
        public Bounded {
            requireName(name);
            Objects.requireNonNull(transform, "transform");
        }

        @Override
        public Object apply(Object raw) {
            return transform.apply(raw, arg);
        }
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
    }
}
