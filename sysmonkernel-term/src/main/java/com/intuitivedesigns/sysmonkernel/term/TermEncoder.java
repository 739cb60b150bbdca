/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.term;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.intuitivedesigns.sysmonkernel.term.ExternalTermFormat.*;

/**
 * Encodes Java values into the external term format (version 131, uncompressed).
 *
 * <p>Accepts the same value model {@link TermDecoder} produces, plus a few Java conveniences:
 * {@link Integer}/{@link Short}/{@link Byte} as integers, {@link Float} as float, {@link Boolean} as the
 * atoms {@code true}/{@code false} and {@code byte[]} as binary. A {@link String} is encoded as a
 * character list; {@code null} is rejected.</p>
 */
public final class TermEncoder {

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    public byte[] encode(Object term) {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream(64);
        final DataOutputStream out = new DataOutputStream(bytes);
        try {
            out.writeByte(VERSION);
            writeTerm(out, term);
            out.flush();
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw; kept for the DataOutput contract
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    private void writeTerm(DataOutputStream out, Object term) throws IOException {
        if (term == null) {
            throw new IllegalArgumentException("null cannot be encoded as a term");
        }
        if (term instanceof Atom atom) {
            writeAtom(out, atom);
        } else if (term instanceof Boolean b) {
            writeAtom(out, b ? Atom.TRUE : Atom.FALSE);
        } else if (term instanceof Long || term instanceof Integer || term instanceof Short || term instanceof Byte) {
            writeInteger(out, ((Number) term).longValue());
        } else if (term instanceof BigInteger big) {
            if (big.compareTo(LONG_MIN) >= 0 && big.compareTo(LONG_MAX) <= 0) {
                writeInteger(out, big.longValue());
            } else {
                writeBig(out, big);
            }
        } else if (term instanceof Double || term instanceof Float) {
            out.writeByte(NEW_FLOAT_EXT);
            out.writeDouble(((Number) term).doubleValue());
        } else if (term instanceof String s) {
            writeString(out, s);
        } else if (term instanceof Binary bin) {
            writeBinary(out, bin.toByteArray());
        } else if (term instanceof byte[] raw) {
            writeBinary(out, raw);
        } else if (term instanceof Tuple tuple) {
            writeTuple(out, tuple);
        } else if (term instanceof List<?> list) {
            writeList(out, list, null);
        } else if (term instanceof ImproperList improper) {
            writeList(out, improper.head(), improper.tail());
        } else if (term instanceof Map<?, ?> map) {
            writeMap(out, map);
        } else if (term instanceof Pid pid) {
            out.writeByte(NEW_PID_EXT);
            writeAtom(out, pid.node());
            out.writeInt((int) pid.id());
            out.writeInt((int) pid.serial());
            out.writeInt((int) pid.creation());
        } else if (term instanceof Port port) {
            out.writeByte(V4_PORT_EXT);
            writeAtom(out, port.node());
            out.writeLong(port.id());
            out.writeInt((int) port.creation());
        } else if (term instanceof Ref ref) {
            out.writeByte(NEWER_REFERENCE_EXT);
            out.writeShort(ref.ids().size());
            writeAtom(out, ref.node());
            out.writeInt((int) ref.creation());
            for (Long id : ref.ids()) {
                out.writeInt(id.intValue());
            }
        } else if (term instanceof ExternalFun fun) {
            out.writeByte(EXPORT_EXT);
            writeAtom(out, fun.module());
            writeAtom(out, fun.function());
            writeInteger(out, fun.arity());
        } else {
            throw new IllegalArgumentException("Cannot encode " + term.getClass().getName() + " as a term");
        }
    }

    private static void writeAtom(DataOutputStream out, Atom atom) throws IOException {
        final String name = atom.name();
        if (name.codePointCount(0, name.length()) > TermDecoder.MAX_ATOM_CHARACTERS) {
            throw new IllegalArgumentException("Atom longer than " + TermDecoder.MAX_ATOM_CHARACTERS + " characters");
        }
        final byte[] utf8 = name.getBytes(StandardCharsets.UTF_8);
        if (utf8.length <= 0xFF) {
            out.writeByte(SMALL_ATOM_UTF8_EXT);
            out.writeByte(utf8.length);
        } else {
            out.writeByte(ATOM_UTF8_EXT);
            out.writeShort(utf8.length);
        }
        out.write(utf8);
    }

    private static void writeInteger(DataOutputStream out, long value) throws IOException {
        if (value >= 0 && value <= 0xFF) {
            out.writeByte(SMALL_INTEGER_EXT);
            out.writeByte((int) value);
        } else if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            out.writeByte(INTEGER_EXT);
            out.writeInt((int) value);
        } else {
            writeBig(out, BigInteger.valueOf(value));
        }
    }

    private static void writeBig(DataOutputStream out, BigInteger value) throws IOException {
        final byte[] magnitude = value.abs().toByteArray();
        // toByteArray is big-endian and may carry a leading sign byte
        int start = (magnitude.length > 1 && magnitude[0] == 0) ? 1 : 0;
        final int n = magnitude.length - start;
        if (n <= 0xFF) {
            out.writeByte(SMALL_BIG_EXT);
            out.writeByte(n);
        } else {
            out.writeByte(LARGE_BIG_EXT);
            out.writeInt(n);
        }
        out.writeByte(value.signum() < 0 ? 1 : 0);
        for (int i = magnitude.length - 1; i >= start; i--) {
            out.writeByte(magnitude[i]);
        }
    }

    private void writeString(DataOutputStream out, String s) throws IOException {
        if (s.isEmpty()) {
            out.writeByte(NIL_EXT);
            return;
        }
        boolean latin1 = s.length() <= 0xFFFF;
        for (int i = 0; latin1 && i < s.length(); i++) {
            latin1 = s.charAt(i) <= 0xFF;
        }
        if (latin1) {
            out.writeByte(STRING_EXT);
            out.writeShort(s.length());
            out.write(s.getBytes(StandardCharsets.ISO_8859_1));
            return;
        }
        final int[] codePoints = s.codePoints().toArray();
        out.writeByte(LIST_EXT);
        out.writeInt(codePoints.length);
        for (int cp : codePoints) {
            writeInteger(out, cp);
        }
        out.writeByte(NIL_EXT);
    }

    private static void writeBinary(DataOutputStream out, byte[] data) throws IOException {
        out.writeByte(BINARY_EXT);
        out.writeInt(data.length);
        out.write(data);
    }

    private void writeTuple(DataOutputStream out, Tuple tuple) throws IOException {
        final int arity = tuple.size();
        if (arity <= 0xFF) {
            out.writeByte(SMALL_TUPLE_EXT);
            out.writeByte(arity);
        } else {
            out.writeByte(LARGE_TUPLE_EXT);
            out.writeInt(arity);
        }
        for (Object element : tuple.elements()) {
            writeTerm(out, element);
        }
    }

    private void writeList(DataOutputStream out, List<?> elements, Object tail) throws IOException {
        if (elements.isEmpty() && tail == null) {
            out.writeByte(NIL_EXT);
            return;
        }
        out.writeByte(LIST_EXT);
        out.writeInt(elements.size());
        for (Object element : elements) {
            writeTerm(out, element);
        }
        if (tail == null) {
            out.writeByte(NIL_EXT);
        } else {
            writeTerm(out, tail);
        }
    }

    private void writeMap(DataOutputStream out, Map<?, ?> map) throws IOException {
        out.writeByte(MAP_EXT);
        out.writeInt(map.size());
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            writeTerm(out, Objects.requireNonNull(entry.getKey(), "map key"));
            writeTerm(out, entry.getValue());
        }
    }
}
