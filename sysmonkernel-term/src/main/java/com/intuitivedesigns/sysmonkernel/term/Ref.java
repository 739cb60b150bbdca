/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.term;

import java.util.List;
import java.util.Objects;

/**
 * Unique reference. {@code ids} keep wire order (least significant word first).
 */
public record Ref(Atom node, long creation, List<Long> ids) {

    public Ref {
        Objects.requireNonNull(node, "node");
        ids = List.copyOf(ids);
    }
}
