/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.plugins;

import com.intuitivedesigns.sysmonkernel.config.PipelineConfig;
import com.intuitivedesigns.sysmonkernel.core.Transformer;
import com.intuitivedesigns.sysmonkernel.decode.RecordDecoder;
import com.intuitivedesigns.sysmonkernel.diagnostics.Slf4jDiagnosticsSink;
import com.intuitivedesigns.sysmonkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sysmonkernel.plugins.transform.SysmonDecodeTransformer;
import com.intuitivedesigns.sysmonkernel.schema.SchemaRegistry;
import com.intuitivedesigns.sysmonkernel.spi.TransformerPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Decode stage for sysmon messages: external term bytes in, schema-checked records out.
 * Rejected messages are logged through {@link Slf4jDiagnosticsSink} and filtered from the stream.
 * <p>
 * ID: SYSMON
 */
public final class SysmonTransformerPlugin implements TransformerPlugin {

    public static final String ID = "SYSMON";
    private static final Logger log = LoggerFactory.getLogger(SysmonTransformerPlugin.class);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Transformer<?, ?> create(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");

        final SchemaRegistry registry = SchemaRegistry.fromConfig(config);
        final RecordDecoder decoder = new RecordDecoder(registry, Slf4jDiagnosticsSink.fromConfig(config));

        log.info("Initialized SYSMON transformer (legacyTags={})", registry.acceptsLegacyTags());
        return new SysmonDecodeTransformer(decoder, metrics);
    }
}
