/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.term;

import java.util.Objects;

/**
 * Process identifier. Rendered as {@code <0.id.serial>}.
 */
public record Pid(Atom node, long id, long serial, long creation) {

    public Pid {
        Objects.requireNonNull(node, "node");
    }
}
