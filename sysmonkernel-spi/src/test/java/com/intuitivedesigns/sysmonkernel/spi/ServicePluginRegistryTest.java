/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.spi;

import com.intuitivedesigns.sysmonkernel.config.PipelineConfig;
import com.intuitivedesigns.sysmonkernel.metrics.MetricsRuntime;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ServicePluginRegistryTest {

    private final PluginCatalog catalog = PluginCatalog.load(getClass().getClassLoader());

    @Test
    void discoversPluginsWithNormalizedIds() throws Exception {
        ServicePluginRegistry<TransformerPlugin> transformers = catalog.transformers();

        assertTrue(transformers.availableIds().contains("ECHO"));
        TransformerPlugin plugin = transformers.require("Echo", "transform.type");
        assertEquals(PluginKind.TRANSFORMER, plugin.kind());
        assertNotNull(plugin.create(PipelineConfig.empty(), MetricsRuntime.noop()));
        assertTrue(transformers.get(" echo").isPresent());
    }

    @Test
    void missingPluginNamesConfigKey() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> catalog.sinks().require("TABLE_LOG", "sink.type"));

        assertTrue(e.getMessage().contains("sink.type=TABLE_LOG"));
        assertTrue(catalog.sinks().get("TABLE_LOG").isEmpty());
        assertEquals(Set.of(), catalog.availableIds().get(PluginKind.SINK));
        assertEquals(Set.of("ECHO"), catalog.availableIds().get(PluginKind.TRANSFORMER));
    }

    @Test
    void normalizesIds() {
        assertEquals("TABLE_LOG", PluginIds.normalize(" table_log "));
        assertEquals("", PluginIds.normalize(null));
    }
}
