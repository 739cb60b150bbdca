/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.transform;

import com.intuitivedesigns.sysmonkernel.term.Atom;
import com.intuitivedesigns.sysmonkernel.term.TermPrinter;
import com.intuitivedesigns.sysmonkernel.term.Tuple;

import java.math.BigInteger;
import java.util.List;

/**
 * Pure, stateless conversions from one raw field value to its storage-ready form.
 *
 * <p>Every function is total except {@link #timestamp(Object)}, which rejects anything that is not
 * a three-element time tuple.</p>
 */
public final class FieldTransforms {

    public static final String NO_DATA = "no data";

    static final int MODULE_NAME_LIMIT = 30;
    static final int FUNCTION_NAME_LIMIT = 40;

    private FieldTransforms() {}

    /**
     * Maps the absent marker ({@code undefined} or Java {@code null}) to the empty list.
     */
    public static Object nullable(Object value) {
        if (value == null || Atom.UNDEFINED.equals(value)) {
            return List.of();
        }
        return value;
    }

    /**
     * Checks the {@code {MegaSecs, Secs, MicroSecs}} shape and passes the tuple through unchanged.
     *
     * @throws FieldTransformException if the value is not a three-element tuple
     */
    public static Object timestamp(Object value) {
        if (value instanceof Tuple t && t.size() == 3) {
            return t;
        }
        throw new FieldTransformException("Expected a {MegaSecs, Secs, MicroSecs} tuple, got "
                + TermPrinter.print(value, 120));
    }

    /**
     * Printable text is used as-is, anything else is rendered as term text; the result is cut to {@code limit}.
     */
    public static String toString(Object value, int limit) {
        final int max = Math.max(0, limit);
        if (TermPrinter.isPrintableLatin1(value)) {
            final String text = TermPrinter.printableText(value);
            return text.length() <= max ? text : text.substring(0, max);
        }
        return TermPrinter.print(value, max);
    }

    /**
     * Renders {@code {Module, Function, Arity}} as {@code module:function/arity}, or {@value #NO_DATA}.
     */
    public static String formatFunction(Object value) {
        if (value instanceof Tuple t
                && t.size() == 3
                && t.get(0) instanceof Atom module
                && t.get(1) instanceof Atom function
                && isInteger(t.get(2))) {
            return truncate(module.name(), MODULE_NAME_LIMIT)
                    + ':' + truncate(function.name(), FUNCTION_NAME_LIMIT)
                    + '/' + t.get(2);
        }
        return NO_DATA;
    }

    /**
     * Renders a stack trace (or anything else) as term text. Never fails.
     */
    public static String formatStacktrace(Object value) {
        return TermPrinter.print(value);
    }

    private static boolean isInteger(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof BigInteger;
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
