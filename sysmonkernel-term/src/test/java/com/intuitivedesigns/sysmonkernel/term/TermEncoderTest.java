/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.term;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TermEncoderTest {

    private final TermEncoder encoder = new TermEncoder();

    @Test
    void writesVersionAndSmallInteger() {
        assertArrayEquals(new byte[]{(byte) 131, 97, 42}, encoder.encode(42));
    }

    @Test
    void writesAtomsAsUtf8() {
        assertArrayEquals(new byte[]{(byte) 131, 119, 2, 'o', 'k'}, encoder.encode(Atom.of("ok")));
        assertArrayEquals(new byte[]{(byte) 131, 119, 4, 't', 'r', 'u', 'e'}, encoder.encode(true));
    }

    @Test
    void writesLatin1StringsAsStringExtAndOthersAsLists() {
        assertArrayEquals(new byte[]{(byte) 131, 107, 0, 2, 'h', 'i'}, encoder.encode("hi"));
        assertArrayEquals(new byte[]{(byte) 131, 106}, encoder.encode(""));

        byte[] wide = encoder.encode("Ā");
        assertEquals(108, wide[1]);
        assertEquals(List.of(256L), new TermDecoder().decode(wide));
    }

    @Test
    void writesNegativeAndLargeIntegers() {
        assertArrayEquals(new byte[]{(byte) 131, 98, -1, -1, -1, -1}, encoder.encode(-1L));
        byte[] big = encoder.encode(Long.MAX_VALUE);
        assertEquals(110, big[1]);
        assertEquals(8, big[2]);
        assertEquals(Long.MAX_VALUE, new TermDecoder().decode(big));
    }

    @Test
    void writesEmptyTupleAndNestedStructures() {
        assertArrayEquals(new byte[]{(byte) 131, 104, 0}, encoder.encode(Tuple.of()));
        Tuple nested = Tuple.of(Atom.of("a"), List.of(Tuple.of(1L, 2.5)), Binary.of(new byte[]{0, 1}));
        assertEquals(nested, new TermDecoder().decode(encoder.encode(nested)));
    }

    @Test
    void rejectsNullAndUnsupportedTypes() {
        assertThrows(IllegalArgumentException.class, () -> encoder.encode(null));
        assertThrows(IllegalArgumentException.class, () -> encoder.encode(Tuple.of(1L, null)));
        assertThrows(IllegalArgumentException.class, () -> encoder.encode(new Object()));
    }
}
