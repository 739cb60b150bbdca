/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.diagnostics;

import com.intuitivedesigns.sysmonkernel.decode.DropReason;

import java.util.List;
import java.util.Objects;

/**
 * Everything known about a dropped payload at the point it was dropped.
 *
 * @param reason  drop category
 * @param tag     record tag, when the payload parsed far enough to have one
 * @param values  raw positional values, when known
 * @param payload original bytes, when the drop happened on the byte path
 * @param error   the failure, for decode and transform errors
 */
public record DropDiagnostic(DropReason reason,
                             Object tag,
                             List<Object> values,
                             byte[] payload,
                             Throwable error) {

    public DropDiagnostic {
        Objects.requireNonNull(reason, "reason");
    }

    public static DropDiagnostic rejected(DropReason reason, Object tag, List<Object> values) {
        return new DropDiagnostic(reason, tag, values, null, null);
    }

    public static DropDiagnostic failed(DropReason reason, Object tag, List<Object> values, byte[] payload, Throwable error) {
        return new DropDiagnostic(reason, tag, values, payload, error);
    }
}
