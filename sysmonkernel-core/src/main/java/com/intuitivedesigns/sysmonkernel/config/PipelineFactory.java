/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.config;

import com.intuitivedesigns.sysmonkernel.core.OutputSink;
import com.intuitivedesigns.sysmonkernel.core.Transformer;
import com.intuitivedesigns.sysmonkernel.decode.DecodedRecord;
import com.intuitivedesigns.sysmonkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sysmonkernel.route.RoutedRecord;
import com.intuitivedesigns.sysmonkernel.route.SinkConfiguration;
import com.intuitivedesigns.sysmonkernel.spi.PipelinePlugin;
import com.intuitivedesigns.sysmonkernel.spi.PluginCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds receiver stages from the plugins on the classpath.
 * {@code transform.type} selects the decode stage and {@code sink.type} the sink behind every table slot.
 */
public final class PipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(PipelineFactory.class);

    public static final String KEY_TRANSFORM_TYPE = "transform.type";
    public static final String KEY_SINK_TYPE = "sink.type";

    public static final String DEFAULT_TRANSFORM = "SYSMON";
    public static final String DEFAULT_SINK = "TABLE_LOG";

    private static final PluginCatalog CATALOG = PluginCatalog.load(resolveClassLoader());

    private PipelineFactory() {}

    public static Transformer<?, ?> createTransformer(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");
        final String id = pluginId(config, KEY_TRANSFORM_TYPE, DEFAULT_TRANSFORM);
        return instantiate(CATALOG.transformers().require(id, KEY_TRANSFORM_TYPE), config, metrics);
    }

    /** A fresh sink on every call. */
    public static OutputSink<?> createSink(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");
        final String id = pluginId(config, KEY_SINK_TYPE, DEFAULT_SINK);
        return instantiate(CATALOG.sinks().require(id, KEY_SINK_TYPE), config, metrics);
    }

    /**
     * The configured transformer, initialized, as the bytes-to-record stage. The plugin must produce
     * {@link DecodedRecord}s from encoded message bytes.
     */
    @SuppressWarnings("unchecked")
    public static Transformer<byte[], DecodedRecord> createDecodeStage(PipelineConfig config, MetricsRuntime metrics) throws Exception {
        final Transformer<byte[], DecodedRecord> stage = (Transformer<byte[], DecodedRecord>) createTransformer(config, metrics);
        stage.init();
        log.info("Decode stage ready ({}={})", KEY_TRANSFORM_TYPE, pluginId(config, KEY_TRANSFORM_TYPE, DEFAULT_TRANSFORM));
        return stage;
    }

    /** Opens the sink behind one table slot. */
    @SuppressWarnings("unchecked")
    public static OutputSink<RoutedRecord> createSlot(PipelineConfig config, MetricsRuntime metrics, SinkConfiguration slot) {
        Objects.requireNonNull(slot, "slot");
        final OutputSink<RoutedRecord> sink = (OutputSink<RoutedRecord>) createSink(config, metrics);
        log.debug("Created sink {} for table '{}'", sink.id(), slot.table());
        return sink;
    }

    public static void logAvailablePlugins() {
        log.info("Available plugins: {}", CATALOG.availableIds());
    }

    private static String pluginId(PipelineConfig config, String key, String fallback) {
        final String raw = config.getString(key, fallback);
        return (raw == null || raw.isBlank()) ? fallback : raw.trim();
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : PipelineFactory.class.getClassLoader();
    }

    private static <T> T instantiate(PipelinePlugin<T> plugin, PipelineConfig config, MetricsRuntime metrics) {
        try {
            return plugin.create(config, metrics);
        } catch (Exception e) {
            throw new IllegalStateException("Plugin " + plugin.kind() + " [" + plugin.id() + "] failed to start: " + e.getMessage(), e);
        }
    }
}
