/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.term;

import java.util.Objects;

/**
 * Port identifier. Rendered as {@code #Port<0.id>}.
 */
public record Port(Atom node, long id, long creation) {

    public Port {
        Objects.requireNonNull(node, "node");
    }
}
