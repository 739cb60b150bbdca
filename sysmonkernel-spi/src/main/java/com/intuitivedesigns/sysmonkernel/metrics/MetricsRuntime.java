/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.metrics;

/**
 * Metrics facade used by the decode and routing stages, so neither depends on a metrics library.
 * Every method defaults to doing nothing; {@link #noop()} is the instance to pass when metrics are off.
 */
public interface MetricsRuntime extends AutoCloseable {

    /** The backing registry, e.g. a Micrometer {@code MeterRegistry}. */
    Object registry();

    default boolean enabled() { return false; }

    /** Implementation name for logs, e.g. {@code MICROMETER} or {@code NOOP}. */
    default String type() { return "NOOP"; }

    /**
     * Adds {@code increment} to the counter {@code name}.
     *
     * @param tags alternating tag keys and values, e.g. {@code "table", "opstat"}
     */
    default void counter(String name, double increment, String... tags) {}

    /** Sets the gauge {@code name} to {@code value}. */
    default void gauge(String name, double value) {}

    @Override
    default void close() {}

    static MetricsRuntime noop() {
        return NoopMetricsRuntime.INSTANCE;
    }
}
