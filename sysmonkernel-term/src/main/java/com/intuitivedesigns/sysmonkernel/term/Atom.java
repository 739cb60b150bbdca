/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.term;

import java.util.Objects;

/**
 * A symbolic constant. Module names, function names, record tags and node names all travel as atoms.
 */
public record Atom(String name) {

    public static final Atom UNDEFINED = new Atom("undefined");
    public static final Atom TRUE = new Atom("true");
    public static final Atom FALSE = new Atom("false");

    public Atom {
        Objects.requireNonNull(name, "name");
    }

    public static Atom of(String name) {
        return new Atom(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
