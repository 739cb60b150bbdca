/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Plugins of one SPI type, keyed by normalized id (see {@link PluginIds}).
 *
 * <p>The {@link ServiceLoader} scan runs once, in {@link #load}. A blank or duplicated id fails the
 * scan, since either would make {@code transform.type}/{@code sink.type} ambiguous.</p>
 *
 * @param <T> SPI type, e.g. {@link TransformerPlugin}
 */
public final class ServicePluginRegistry<T extends PipelinePlugin<?>> {

    private static final Logger log = LoggerFactory.getLogger(ServicePluginRegistry.class);

    private final String spiName;
    private final Map<String, T> byId;

    private ServicePluginRegistry(String spiName, Map<String, T> byId) {
        this.spiName = spiName;
        this.byId = Collections.unmodifiableMap(byId);
    }

    public static <T extends PipelinePlugin<?>> ServicePluginRegistry<T> load(Class<T> spiType, ClassLoader cl) {
        final Map<String, T> found = new LinkedHashMap<>();
        for (T plugin : ServiceLoader.load(spiType, cl)) {
            final String id = PluginIds.normalize(plugin.id());
            if (id.isEmpty()) {
                throw new IllegalStateException("Blank plugin id from " + plugin.getClass().getName());
            }
            final T previous = found.putIfAbsent(id, plugin);
            if (previous != null) {
                throw new IllegalStateException(spiType.getSimpleName() + " id '" + id + "' is claimed by both "
                        + previous.getClass().getName() + " and " + plugin.getClass().getName());
            }
            log.debug("Discovered {} '{}' ({})", spiType.getSimpleName(), id, plugin.getClass().getName());
        }
        return new ServicePluginRegistry<>(spiType.getSimpleName(), found);
    }

    /**
     * @param configKey the key {@code id} was read from, quoted in the error message
     * @throws IllegalArgumentException if no plugin has that id
     */
    public T require(String id, String configKey) {
        return get(id).orElseThrow(() -> new IllegalArgumentException(
                "No " + spiName + " found for '" + configKey + "=" + id + "'. Available options: " + byId.keySet()));
    }

    public Optional<T> get(String id) {
        return Optional.ofNullable(byId.get(PluginIds.normalize(id)));
    }

    public Set<String> availableIds() {
        return byId.keySet();
    }
}
