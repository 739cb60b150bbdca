/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.metrics;

import com.intuitivedesigns.sysmonkernel.config.PipelineConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsRuntime} backed by a Micrometer composite registry.
 *
 * <p>An in-memory {@link SimpleMeterRegistry} is always attached so counts can be read back with
 * {@link #count(String)}; exporters are added with {@link #addRegistry(MeterRegistry)}. Keys of the form
 * {@code metrics.tag.<name>=<value>} become common tags on every meter.</p>
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private static final String KEY_TAG_PREFIX = "metrics.tag.";

    private final CompositeMeterRegistry registry = new CompositeMeterRegistry();

    // Gauge values as raw double bits. Micrometer only holds the state weakly, so this map keeps it alive.
    private final Map<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRuntime() {
        registry.add(new SimpleMeterRegistry());
    }

    public static MicrometerMetricsRuntime fromConfig(PipelineConfig config) {
        Objects.requireNonNull(config, "config");
        final MicrometerMetricsRuntime runtime = new MicrometerMetricsRuntime();

        for (String key : config.keys()) {
            if (!key.startsWith(KEY_TAG_PREFIX)) continue;
            final String tag = key.substring(KEY_TAG_PREFIX.length()).trim();
            final String value = config.getString(key, "").trim();
            if (tag.isEmpty() || value.isEmpty()) {
                log.debug("Ignoring empty metrics tag '{}'", key);
                continue;
            }
            runtime.registry.config().commonTags(tag, value);
        }

        log.info("Metrics runtime initialized (Type: MICROMETER)");
        return runtime;
    }

    public void addRegistry(MeterRegistry exporter) {
        registry.add(exporter);
    }

    /**
     * Total of the counter {@code name} across all of its tag sets, 0 if it was never incremented.
     */
    public double count(String name) {
        return registry.find(name).counters().stream().mapToDouble(Counter::count).sum();
    }

    /** Value of the counter {@code name} for one tag value. */
    public double count(String name, String tagKey, String tagValue) {
        final Counter counter = registry.find(name).tag(tagKey, tagValue).counter();
        return counter == null ? 0.0 : counter.count();
    }

    @Override
    public Object registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return "MICROMETER";
    }

    @Override
    public void counter(String name, double increment, String... tags) {
        if (increment <= 0) return;
        registry.counter(name, tags).increment(increment);
    }

    @Override
    public void gauge(String name, double value) {
        final AtomicLong bits = gauges.computeIfAbsent(name,
                key -> registry.gauge(key, new AtomicLong(), state -> Double.longBitsToDouble(state.get())));
        bits.set(Double.doubleToLongBits(value));
    }

    @Override
    public void close() {
        registry.close();
        log.info("Metrics runtime closed.");
    }
}
