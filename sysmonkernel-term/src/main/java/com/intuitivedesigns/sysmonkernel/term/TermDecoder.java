/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.term;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

import static com.intuitivedesigns.sysmonkernel.term.ExternalTermFormat.*;

/**
 * Decodes the external term format into plain Java values.
 *
 * <p>Mapping: atom → {@link Atom}, integer → {@link Long} (or {@link BigInteger} outside the long range),
 * float → {@link Double}, tuple → {@link Tuple}, nil and proper lists → {@link List}, string → {@link String},
 * binary → {@link Binary}, map → {@link Map} (wire order kept), improper list → {@link ImproperList},
 * pid/port/reference/export → {@link Pid}/{@link Port}/{@link Ref}/{@link ExternalFun}.</p>
 *
 * <p>Decoders are stateless and thread-safe. Every failure surfaces as {@link TermDecodeException}.</p>
 */
public final class TermDecoder {

    public static final int DEFAULT_MAX_DEPTH = 1024;

    /** Longest atom the runtime will produce, in characters. */
    public static final int MAX_ATOM_CHARACTERS = 255;

    // Compressed payloads above this size are rejected before inflation
    private static final long MAX_INFLATED_SIZE = 64L * 1024 * 1024;

    private static final int INFLATE_CHUNK = 8 * 1024;

    private final int maxDepth;

    public TermDecoder() {
        this(DEFAULT_MAX_DEPTH);
    }

    public TermDecoder(int maxDepth) {
        if (maxDepth <= 0) throw new IllegalArgumentException("maxDepth must be > 0");
        this.maxDepth = maxDepth;
    }

    /**
     * Decodes exactly one versioned term. Trailing bytes are an error.
     */
    public Object decode(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        final ByteBuffer buf = ByteBuffer.wrap(bytes);
        try {
            if (!buf.hasRemaining()) {
                throw new TermDecodeException("Empty input");
            }
            final int version = u8(buf);
            if (version != VERSION) {
                throw new TermDecodeException("Unsupported format version byte: " + version);
            }
            if (buf.hasRemaining() && (buf.get(buf.position()) & 0xFF) == COMPRESSED) {
                buf.get();
                return decodeCompressed(buf);
            }
            final Object term = readTerm(buf, 0);
            requireFullyConsumed(buf);
            return term;
        } catch (BufferUnderflowException e) {
            throw new TermDecodeException("Unexpected end of input at offset " + buf.position(), e);
        }
    }

    private Object decodeCompressed(ByteBuffer buf) {
        final long size = u32(buf);
        if (size > MAX_INFLATED_SIZE) {
            throw new TermDecodeException("Compressed term too large: " + size + " bytes");
        }
        // The output grows with what actually inflates; the declared size only caps it
        final ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.min(size, INFLATE_CHUNK));
        final byte[] chunk = new byte[INFLATE_CHUNK];
        final Inflater inflater = new Inflater();
        long produced = 0;
        try {
            inflater.setInput(buf.array(), buf.arrayOffset() + buf.position(), buf.remaining());
            while (!inflater.finished()) {
                final int n = inflater.inflate(chunk);
                if (n == 0) break;
                produced += n;
                if (produced > size) {
                    throw new TermDecodeException("Compressed term inflates past its declared size " + size);
                }
                out.write(chunk, 0, n);
            }
            if (!inflater.finished() || produced != size) {
                throw new TermDecodeException("Compressed term does not inflate to its declared size " + size);
            }
            if (inflater.getRemaining() > 0) {
                throw new TermDecodeException(inflater.getRemaining() + " trailing byte(s) after compressed term");
            }
        } catch (DataFormatException e) {
            throw new TermDecodeException("Corrupt compressed term", e);
        } finally {
            inflater.end();
        }

        final ByteBuffer inner = ByteBuffer.wrap(out.toByteArray());
        try {
            final Object term = readTerm(inner, 0);
            requireFullyConsumed(inner);
            return term;
        } catch (BufferUnderflowException e) {
            throw new TermDecodeException("Unexpected end of compressed term at offset " + inner.position(), e);
        }
    }

    private Object readTerm(ByteBuffer buf, int depth) {
        if (depth > maxDepth) {
            throw new TermDecodeException("Term nesting exceeds " + maxDepth + " levels");
        }
        final int tag = u8(buf);
        return switch (tag) {
            case SMALL_INTEGER_EXT -> (long) u8(buf);
            case INTEGER_EXT -> (long) buf.getInt();
            case SMALL_BIG_EXT -> readBig(buf, u8(buf));
            case LARGE_BIG_EXT -> readBig(buf, u32(buf));
            case NEW_FLOAT_EXT -> buf.getDouble();
            case FLOAT_EXT -> readOldFloat(buf);
            case ATOM_EXT -> readAtom(buf, u16(buf), StandardCharsets.ISO_8859_1);
            case SMALL_ATOM_EXT -> readAtom(buf, u8(buf), StandardCharsets.ISO_8859_1);
            case ATOM_UTF8_EXT -> readAtom(buf, u16(buf), StandardCharsets.UTF_8);
            case SMALL_ATOM_UTF8_EXT -> readAtom(buf, u8(buf), StandardCharsets.UTF_8);
            case SMALL_TUPLE_EXT -> new Tuple(readElements(buf, u8(buf), depth));
            case LARGE_TUPLE_EXT -> new Tuple(readElements(buf, u32(buf), depth));
            case NIL_EXT -> List.of();
            case STRING_EXT -> readText(buf, u16(buf), StandardCharsets.ISO_8859_1);
            case LIST_EXT -> readList(buf, depth);
            case BINARY_EXT -> Binary.wrap(readBytes(buf, u32(buf)));
            case MAP_EXT -> readMap(buf, depth);
            case PID_EXT -> new Pid(readNode(buf, depth), u32(buf), u32(buf), u8(buf));
            case NEW_PID_EXT -> new Pid(readNode(buf, depth), u32(buf), u32(buf), u32(buf));
            case PORT_EXT -> new Port(readNode(buf, depth), u32(buf), u8(buf));
            case NEW_PORT_EXT -> new Port(readNode(buf, depth), u32(buf), u32(buf));
            case V4_PORT_EXT -> new Port(readNode(buf, depth), buf.getLong(), u32(buf));
            case REFERENCE_EXT -> readOldReference(buf, depth);
            case NEW_REFERENCE_EXT -> readReference(buf, depth, false);
            case NEWER_REFERENCE_EXT -> readReference(buf, depth, true);
            case EXPORT_EXT -> readExport(buf, depth);
            case NEW_FUN_EXT, BIT_BINARY_EXT ->
                    throw new TermDecodeException("Unsupported term tag " + tag + " at offset " + (buf.position() - 1));
            default -> throw new TermDecodeException("Unknown term tag " + tag + " at offset " + (buf.position() - 1));
        };
    }

    private List<Object> readElements(ByteBuffer buf, long count, int depth) {
        // Every element needs at least one byte, so a count beyond the remaining input is malformed
        requireAvailable(buf, count);
        final List<Object> out = new ArrayList<>((int) count);
        for (long i = 0; i < count; i++) {
            out.add(readTerm(buf, depth + 1));
        }
        return out;
    }

    private Object readList(ByteBuffer buf, int depth) {
        final long count = u32(buf);
        final List<Object> head = readElements(buf, count, depth);
        final Object tail = readTerm(buf, depth + 1);
        if (tail instanceof List<?> l && l.isEmpty()) {
            return head;
        }
        if (head.isEmpty()) {
            // Degenerate encoding of a bare tail
            return tail;
        }
        return new ImproperList(head, tail);
    }

    private Map<Object, Object> readMap(ByteBuffer buf, int depth) {
        final long arity = u32(buf);
        requireAvailable(buf, arity * 2);
        final Map<Object, Object> out = new LinkedHashMap<>();
        for (long i = 0; i < arity; i++) {
            final Object key = readTerm(buf, depth + 1);
            final Object value = readTerm(buf, depth + 1);
            out.put(key, value);
        }
        return out;
    }

    private Object readBig(ByteBuffer buf, long n) {
        final int sign = u8(buf);
        final byte[] little = readBytes(buf, n);
        final byte[] big = new byte[little.length];
        for (int i = 0; i < little.length; i++) {
            big[i] = little[little.length - 1 - i];
        }
        BigInteger value = new BigInteger(1, big);
        if (sign != 0) value = value.negate();
        return value.bitLength() < 64 ? (Object) value.longValue() : value;
    }

    private Object readOldFloat(ByteBuffer buf) {
        final String text = new String(readBytes(buf, 31), StandardCharsets.ISO_8859_1);
        final int nul = text.indexOf('\0');
        final String trimmed = (nul >= 0 ? text.substring(0, nul) : text).trim();
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            throw new TermDecodeException("Malformed float text '" + trimmed + "'", e);
        }
    }

    private Atom readNode(ByteBuffer buf, int depth) {
        final Object node = readTerm(buf, depth + 1);
        if (node instanceof Atom atom) return atom;
        throw new TermDecodeException("Expected node atom, got " + TermPrinter.print(node, 64));
    }

    private Ref readOldReference(ByteBuffer buf, int depth) {
        final Atom node = readNode(buf, depth);
        final long id = u32(buf);
        final long creation = u8(buf);
        return new Ref(node, creation, List.of(id));
    }

    private Ref readReference(ByteBuffer buf, int depth, boolean wideCreation) {
        final int len = u16(buf);
        final Atom node = readNode(buf, depth);
        final long creation = wideCreation ? u32(buf) : u8(buf);
        requireAvailable(buf, 4L * len);
        final List<Long> ids = new ArrayList<>(len);
        for (int i = 0; i < len; i++) {
            ids.add(u32(buf));
        }
        return new Ref(node, creation, ids);
    }

    private ExternalFun readExport(ByteBuffer buf, int depth) {
        final Object module = readTerm(buf, depth + 1);
        final Object function = readTerm(buf, depth + 1);
        final Object arity = readTerm(buf, depth + 1);
        if (module instanceof Atom m && function instanceof Atom f && arity instanceof Long a) {
            return new ExternalFun(m, f, a);
        }
        throw new TermDecodeException("Malformed export: " + TermPrinter.print(Tuple.of(module, function, arity), 128));
    }

    private static Atom readAtom(ByteBuffer buf, long len, Charset charset) {
        final String name;
        try {
            name = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(readBytes(buf, len)))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new TermDecodeException("Atom text is not valid " + charset.name() + " at offset " + buf.position(), e);
        }
        final int chars = name.codePointCount(0, name.length());
        if (chars > MAX_ATOM_CHARACTERS) {
            throw new TermDecodeException("Atom of " + chars + " characters exceeds " + MAX_ATOM_CHARACTERS);
        }
        return new Atom(name);
    }

    private static String readText(ByteBuffer buf, long len, Charset charset) {
        return new String(readBytes(buf, len), charset);
    }

    private static byte[] readBytes(ByteBuffer buf, long len) {
        requireAvailable(buf, len);
        final byte[] out = new byte[(int) len];
        buf.get(out);
        return out;
    }

    private static void requireAvailable(ByteBuffer buf, long needed) {
        if (needed < 0 || needed > buf.remaining()) {
            throw new TermDecodeException("Declared length " + needed + " exceeds the " + buf.remaining()
                    + " remaining byte(s) at offset " + buf.position());
        }
    }

    private static void requireFullyConsumed(ByteBuffer buf) {
        if (buf.hasRemaining()) {
            throw new TermDecodeException(buf.remaining() + " trailing byte(s) after term");
        }
    }

    private static int u8(ByteBuffer buf) {
        return buf.get() & 0xFF;
    }

    private static int u16(ByteBuffer buf) {
        return buf.getShort() & 0xFFFF;
    }

    private static long u32(ByteBuffer buf) {
        return buf.getInt() & 0xFFFF_FFFFL;
    }
}
