/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.term;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders any value as single-line term text, in the style of the {@code ~p} format directive.
 *
 * <p>Total by construction: output stops once the character budget is spent, nesting deeper than
 * {@value #MAX_DEPTH} levels and self-containing collections render as {@code ...}, and a foreign
 * object whose {@code toString()} fails renders as {@code #Object<ClassName>}.</p>
 */
public final class TermPrinter {

    public static final int MAX_DEPTH = 100;

    private static final String ELLIPSIS = "...";

    private static final Set<String> RESERVED_WORDS = Set.of(
            "after", "and", "andalso", "band", "begin", "bnot", "bor", "bsl", "bsr", "bxor",
            "case", "catch", "cond", "div", "else", "end", "fun", "if", "let", "maybe", "not",
            "of", "or", "orelse", "receive", "rem", "try", "when", "xor");

    private final StringBuilder out;
    private final int budget;
    private final Set<Object> path = Collections.newSetFromMap(new IdentityHashMap<>());

    private TermPrinter(int budget) {
        this.budget = budget;
        this.out = new StringBuilder(Math.min(budget, 256));
    }

    public static String print(Object term) {
        return print(term, Integer.MAX_VALUE);
    }

    /**
     * Renders {@code term}, producing at most {@code maxChars} characters (negative means zero).
     */
    public static String print(Object term, int maxChars) {
        final TermPrinter printer = new TermPrinter(Math.max(0, maxChars));
        printer.write(term, 0);
        return printer.out.toString();
    }

    /**
     * True for a {@link CharSequence} or a list of integer character codes whose characters are all
     * printable Latin-1. The empty list counts as printable.
     */
    public static boolean isPrintableLatin1(Object value) {
        if (value instanceof CharSequence cs) {
            for (int i = 0; i < cs.length(); i++) {
                if (!isPrintableLatin1Char(cs.charAt(i))) return false;
            }
            return true;
        }
        if (value instanceof List<?> list) {
            for (Object element : list) {
                if (!(element instanceof Number n) || !isIntegral(n)) return false;
                final long c = n.longValue();
                if (c < 0 || c > 0xFF || !isPrintableLatin1Char((int) c)) return false;
            }
            return true;
        }
        return false;
    }

    /**
     * The text of a printable value; callers must check {@link #isPrintableLatin1(Object)} first.
     */
    public static String printableText(Object value) {
        if (value instanceof CharSequence cs) return cs.toString();
        final List<?> list = (List<?>) value;
        final StringBuilder sb = new StringBuilder(list.size());
        for (Object element : list) {
            sb.append((char) ((Number) element).longValue());
        }
        return sb.toString();
    }

    static boolean isPrintableLatin1Char(int c) {
        return (c >= 32 && c <= 126)
                || (c >= 160 && c <= 255)
                || c == '\n' || c == '\r' || c == '\t'
                || c == 0x0B || c == '\b' || c == '\f' || c == 0x1B;
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    // --- rendering ---

    private boolean full() {
        return out.length() >= budget;
    }

    private void emit(String s) {
        final int room = budget - out.length();
        if (room <= 0) return;
        if (s.length() <= room) {
            out.append(s);
        } else {
            out.append(s, 0, room);
        }
    }

    private void emit(char c) {
        if (out.length() < budget) out.append(c);
    }

    private void write(Object term, int depth) {
        if (full()) return;
        if (depth > MAX_DEPTH) {
            emit(ELLIPSIS);
            return;
        }
        if (term == null) {
            emit(Atom.UNDEFINED.name());
        } else if (term instanceof Atom atom) {
            writeAtom(atom.name());
        } else if (term instanceof Boolean b) {
            emit(b.toString());
        } else if (term instanceof Double || term instanceof Float) {
            emit(formatFloat(((Number) term).doubleValue()));
        } else if (term instanceof Number n) {
            emit(n.toString());
        } else if (term instanceof CharSequence cs) {
            writeCharSequence(cs);
        } else if (term instanceof Binary bin) {
            writeBinary(bin);
        } else if (term instanceof byte[] raw) {
            writeBinary(Binary.wrap(raw));
        } else if (term instanceof Pid pid) {
            emit("<0." + pid.id() + "." + pid.serial() + ">");
        } else if (term instanceof Port port) {
            emit("#Port<0." + port.id() + ">");
        } else if (term instanceof Ref ref) {
            writeRef(ref);
        } else if (term instanceof ExternalFun fun) {
            emit("fun ");
            writeAtom(fun.module().name());
            emit(':');
            writeAtom(fun.function().name());
            emit("/" + fun.arity());
        } else if (term instanceof Tuple tuple) {
            writeContainer(tuple, "{", tuple.elements(), null, "}", depth);
        } else if (term instanceof ImproperList improper) {
            writeContainer(improper, "[", improper.head(), improper.tail(), "]", depth);
        } else if (term instanceof List<?> list) {
            if (!list.isEmpty() && isPrintableLatin1(list)) {
                writeQuoted(printableText(list), '"');
            } else {
                writeContainer(list, "[", list, null, "]", depth);
            }
        } else if (term instanceof Map<?, ?> map) {
            writeMap(map, depth);
        } else if (term instanceof Collection<?> collection) {
            writeContainer(collection, "[", collection, null, "]", depth);
        } else if (term instanceof Object[] array) {
            writeContainer(array, "[", Arrays.asList(array), null, "]", depth);
        } else {
            writeForeign(term);
        }
    }

    private void writeCharSequence(CharSequence cs) {
        if (isPrintableLatin1(cs)) {
            writeQuoted(cs.toString(), '"');
            return;
        }
        // Not printable: show the character codes, as a list of integers would be shown
        emit('[');
        for (int i = 0; i < cs.length() && !full(); i++) {
            if (i > 0) emit(',');
            emit(Integer.toString(cs.charAt(i)));
        }
        emit(']');
    }

    private void writeContainer(Object identity, String open, Iterable<?> elements, Object tail, String close, int depth) {
        if (!path.add(identity)) {
            emit(ELLIPSIS);
            return;
        }
        try {
            emit(open);
            final Iterator<?> it = elements.iterator();
            boolean first = true;
            while (it.hasNext() && !full()) {
                if (!first) emit(',');
                write(it.next(), depth + 1);
                first = false;
            }
            if (tail != null && !full()) {
                emit('|');
                write(tail, depth + 1);
            }
            emit(close);
        } finally {
            path.remove(identity);
        }
    }

    private void writeMap(Map<?, ?> map, int depth) {
        if (!path.add(map)) {
            emit(ELLIPSIS);
            return;
        }
        try {
            emit("#{");
            boolean first = true;
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (full()) break;
                if (!first) emit(',');
                write(entry.getKey(), depth + 1);
                emit(" => ");
                write(entry.getValue(), depth + 1);
                first = false;
            }
            emit('}');
        } finally {
            path.remove(map);
        }
    }

    private void writeBinary(Binary bin) {
        final int size = bin.size();
        boolean printable = size > 0;
        for (int i = 0; printable && i < size; i++) {
            printable = isPrintableLatin1Char(bin.byteAt(i));
        }
        emit("<<");
        if (printable) {
            final StringBuilder text = new StringBuilder(size);
            for (int i = 0; i < size; i++) {
                text.append((char) bin.byteAt(i));
            }
            writeQuoted(text.toString(), '"');
        } else {
            for (int i = 0; i < size && !full(); i++) {
                if (i > 0) emit(',');
                emit(Integer.toString(bin.byteAt(i)));
            }
        }
        emit(">>");
    }

    private void writeRef(Ref ref) {
        final StringBuilder sb = new StringBuilder("#Ref<0");
        final List<Long> ids = ref.ids();
        // Most significant word first, as the runtime shows it
        for (int i = ids.size() - 1; i >= 0; i--) {
            sb.append('.').append(ids.get(i));
        }
        emit(sb.append('>').toString());
    }

    private void writeForeign(Object term) {
        String text;
        try {
            text = String.valueOf(term);
        } catch (RuntimeException e) {
            text = "#Object<" + term.getClass().getName() + ">";
        }
        emit(text);
    }

    private void writeAtom(String name) {
        if (isUnquotedAtom(name)) {
            emit(name);
        } else {
            writeQuoted(name, '\'');
        }
    }

    private static boolean isUnquotedAtom(String name) {
        if (name.isEmpty()) return false;
        final char first = name.charAt(0);
        if (first < 'a' || first > 'z') return false;
        for (int i = 1; i < name.length(); i++) {
            final char c = name.charAt(i);
            final boolean ok = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
                    || (c >= '0' && c <= '9') || c == '_' || c == '@';
            if (!ok) return false;
        }
        return !RESERVED_WORDS.contains(name);
    }

    private void writeQuoted(String text, char quote) {
        emit(quote);
        for (int i = 0; i < text.length() && !full(); i++) {
            final char c = text.charAt(i);
            if (c == quote || c == '\\') {
                emit("\\" + c);
            } else {
                switch (c) {
                    case '\n' -> emit("\\n");
                    case '\r' -> emit("\\r");
                    case '\t' -> emit("\\t");
                    case 0x0B -> emit("\\v");
                    case '\b' -> emit("\\b");
                    case '\f' -> emit("\\f");
                    case 0x1B -> emit("\\e");
                    default -> emit(c);
                }
            }
        }
        emit(quote);
    }

    static String formatFloat(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) return Double.toString(d);
        return Double.toString(d).replace('E', 'e');
    }
}
