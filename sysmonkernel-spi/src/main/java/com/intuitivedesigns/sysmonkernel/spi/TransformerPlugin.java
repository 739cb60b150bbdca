/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.spi;

import com.intuitivedesigns.sysmonkernel.config.PipelineConfig;
import com.intuitivedesigns.sysmonkernel.core.Transformer;
import com.intuitivedesigns.sysmonkernel.metrics.MetricsRuntime;

/**
 * Provides the decode stage. Selected with {@code transform.type}.
 *
 * <p>The result is typed with wildcards because the stage changes the content type; the receiver
 * expects encoded bytes in and decoded records out.</p>
 */
public interface TransformerPlugin extends PipelinePlugin<Transformer<?, ?>> {

    @Override
    default PluginKind kind() {
        return PluginKind.TRANSFORMER;
    }

    @Override
    Transformer<?, ?> create(PipelineConfig config, MetricsRuntime metrics) throws Exception;
}
