/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.spi;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Every plugin visible to one class loader, split by {@link PluginKind}.
 */
public final class PluginCatalog {

    private final ServicePluginRegistry<TransformerPlugin> transformers;
    private final ServicePluginRegistry<SinkPlugin> sinks;

    private PluginCatalog(ServicePluginRegistry<TransformerPlugin> transformers, ServicePluginRegistry<SinkPlugin> sinks) {
        this.transformers = transformers;
        this.sinks = sinks;
    }

    public static PluginCatalog load(ClassLoader cl) {
        return new PluginCatalog(
                ServicePluginRegistry.load(TransformerPlugin.class, cl),
                ServicePluginRegistry.load(SinkPlugin.class, cl));
    }

    public ServicePluginRegistry<TransformerPlugin> transformers() {
        return transformers;
    }

    public ServicePluginRegistry<SinkPlugin> sinks() {
        return sinks;
    }

    public Map<PluginKind, Set<String>> availableIds() {
        final Map<PluginKind, Set<String>> ids = new EnumMap<>(PluginKind.class);
        ids.put(PluginKind.TRANSFORMER, transformers.availableIds());
        ids.put(PluginKind.SINK, sinks.availableIds());
        return ids;
    }
}
