/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.term;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A list whose tail is not the empty list, e.g. {@code [a, b | c]}.
 */
public record ImproperList(List<Object> head, Object tail) {

    public ImproperList {
        Objects.requireNonNull(head, "head");
        if (head.isEmpty()) {
            throw new IllegalArgumentException("An improper list needs at least one element before its tail");
        }
        head = Collections.unmodifiableList(new ArrayList<>(head));
    }
}
