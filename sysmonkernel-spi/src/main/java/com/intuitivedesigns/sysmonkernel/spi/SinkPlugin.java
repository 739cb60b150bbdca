/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.spi;

import com.intuitivedesigns.sysmonkernel.config.PipelineConfig;
import com.intuitivedesigns.sysmonkernel.core.OutputSink;
import com.intuitivedesigns.sysmonkernel.metrics.MetricsRuntime;

/**
 * Provides the sink behind a table slot. Selected with {@code sink.type}.
 *
 * <p>{@link #create} is called once per slot and must return a new instance each time.</p>
 */
public interface SinkPlugin extends PipelinePlugin<OutputSink<?>> {

    @Override
    default PluginKind kind() {
        return PluginKind.SINK;
    }

    @Override
    OutputSink<?> create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}
