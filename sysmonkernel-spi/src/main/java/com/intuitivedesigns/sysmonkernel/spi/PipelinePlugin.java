/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.spi;

import com.intuitivedesigns.sysmonkernel.config.PipelineConfig;
import com.intuitivedesigns.sysmonkernel.metrics.MetricsRuntime;

/**
 * Common shape of every plugin discovered through {@link java.util.ServiceLoader}.
 *
 * @param <T> the component the plugin builds
 */
public interface PipelinePlugin<T> {

    String id();          // e.g. "SYSMON", "TABLE_LOG"

    PluginKind kind();    // TRANSFORMER / SINK

    T create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}
