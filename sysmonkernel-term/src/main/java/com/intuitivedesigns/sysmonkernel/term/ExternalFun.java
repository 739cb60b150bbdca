/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.term;

import java.util.Objects;

/**
 * A {@code fun Module:Function/Arity} reference.
 */
public record ExternalFun(Atom module, Atom function, long arity) {

    public ExternalFun {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(function, "function");
    }
}
