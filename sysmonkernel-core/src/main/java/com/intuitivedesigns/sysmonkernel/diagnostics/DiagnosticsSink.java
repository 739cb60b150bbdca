/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.diagnostics;

/**
 * Receives one report per dropped payload. Implementations must not throw.
 */
public interface DiagnosticsSink {

    void report(DropDiagnostic diagnostic);
}
