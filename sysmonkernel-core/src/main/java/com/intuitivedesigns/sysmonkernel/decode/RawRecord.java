/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.decode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A type tag and its positional values, before any schema is applied. Values are untyped.
 */
public record RawRecord(Object tag, List<Object> values) {

    public RawRecord {
        Objects.requireNonNull(values, "values");
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static RawRecord of(Object tag, Object... values) {
        final List<Object> list = new ArrayList<>(values.length);
        Collections.addAll(list, values);
        return new RawRecord(tag, list);
    }
}
