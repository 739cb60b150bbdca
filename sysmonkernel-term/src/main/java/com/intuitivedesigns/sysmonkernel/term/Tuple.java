/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.term;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Fixed-size ordered group of terms.
 */
public record Tuple(List<Object> elements) {

    public Tuple {
        Objects.requireNonNull(elements, "elements");
        // Nulls are tolerated so callers can model the absent marker with plain Java values
        elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public static Tuple of(Object... elements) {
        return new Tuple(Arrays.asList(elements));
    }

    public int size() {
        return elements.size();
    }

    public Object get(int index) {
        return elements.get(index);
    }
}
