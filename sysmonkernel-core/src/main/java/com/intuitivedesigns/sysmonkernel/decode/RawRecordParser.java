/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.decode;

import com.intuitivedesigns.sysmonkernel.term.TermDecodeException;
import com.intuitivedesigns.sysmonkernel.term.TermDecoder;
import com.intuitivedesigns.sysmonkernel.term.TermPrinter;
import com.intuitivedesigns.sysmonkernel.term.Tuple;

import java.util.Objects;

/**
 * Turns a binary payload into a {@link RawRecord}: the payload must hold one non-empty tuple whose
 * first element is the tag.
 */
public final class RawRecordParser {

    private final TermDecoder termDecoder;

    public RawRecordParser() {
        this(new TermDecoder());
    }

    public RawRecordParser(TermDecoder termDecoder) {
        this.termDecoder = Objects.requireNonNull(termDecoder, "termDecoder");
    }

    /**
     * @throws TermDecodeException if the bytes are malformed or do not hold a non-empty tuple
     */
    public RawRecord parse(byte[] payload) {
        if (payload == null) {
            throw new TermDecodeException("Payload is null");
        }
        final Object term = termDecoder.decode(payload);
        if (!(term instanceof Tuple tuple) || tuple.size() == 0) {
            throw new TermDecodeException("Expected a non-empty tuple, got " + TermPrinter.print(term, 120));
        }
        return new RawRecord(tuple.get(0), tuple.elements().subList(1, tuple.size()));
    }
}
