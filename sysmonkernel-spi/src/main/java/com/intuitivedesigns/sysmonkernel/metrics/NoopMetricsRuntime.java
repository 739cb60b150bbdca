/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.metrics;

/** Used wherever no metrics runtime was supplied. */
final class NoopMetricsRuntime implements MetricsRuntime {

    static final NoopMetricsRuntime INSTANCE = new NoopMetricsRuntime();

    private static final Object NO_REGISTRY = new Object();

    private NoopMetricsRuntime() {}

    @Override
    public Object registry() {
        return NO_REGISTRY;
    }
}
