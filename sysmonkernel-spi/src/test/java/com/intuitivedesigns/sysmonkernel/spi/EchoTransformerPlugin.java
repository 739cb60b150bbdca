/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.spi;

import com.intuitivedesigns.sysmonkernel.config.PipelineConfig;
import com.intuitivedesigns.sysmonkernel.core.PipelinePayload;
import com.intuitivedesigns.sysmonkernel.core.Transformer;
import com.intuitivedesigns.sysmonkernel.metrics.MetricsRuntime;

/**
 * Pass-through transformer registered through test resources.
 */
public final class EchoTransformerPlugin implements TransformerPlugin {

    @Override
    public String id() {
        return " echo ";
    }

    @Override
    public Transformer<?, ?> create(PipelineConfig config, MetricsRuntime metrics) {
        return new Transformer<Object, Object>() {
            @Override
            public PipelinePayload<Object> transform(PipelinePayload<Object> input) {
                return input;
            }
        };
    }
}
