/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.config;

import com.intuitivedesigns.sysmonkernel.metrics.MetricsRuntime;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineFactoryTest {

    @Test
    void unknownTransformerIdFailsWithAvailableOptions() {
        PipelineConfig config = PipelineConfig.of(Map.of(PipelineFactory.KEY_TRANSFORM_TYPE, "NO_SUCH_TRANSFORM"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> PipelineFactory.createTransformer(config, MetricsRuntime.noop()));

        assertTrue(e.getMessage().contains("transform.type=NO_SUCH_TRANSFORM"));
        assertTrue(e.getMessage().contains("Available options"));
    }

    @Test
    void unknownSinkIdFails() {
        PipelineConfig config = PipelineConfig.of(Map.of(PipelineFactory.KEY_SINK_TYPE, "NO_SUCH_SINK"));

        assertThrows(IllegalArgumentException.class, () -> PipelineFactory.createSink(config, MetricsRuntime.noop()));
    }

    @Test
    void requiresConfigAndMetrics() {
        assertThrows(NullPointerException.class, () -> PipelineFactory.createSink(null, MetricsRuntime.noop()));
        assertThrows(NullPointerException.class, () -> PipelineFactory.createTransformer(PipelineConfig.empty(), null));
    }
}
