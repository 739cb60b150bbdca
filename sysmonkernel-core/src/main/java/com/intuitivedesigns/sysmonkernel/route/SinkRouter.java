/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.route;

import com.intuitivedesigns.sysmonkernel.config.PipelineConfig;
import com.intuitivedesigns.sysmonkernel.schema.RecordType;
import com.intuitivedesigns.sysmonkernel.schema.SchemaEntry;
import com.intuitivedesigns.sysmonkernel.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Derives the sink configuration of each record type. Performs no I/O.
 *
 * <p>The registry is static, so every configuration is computed once at construction.</p>
 */
public final class SinkRouter {

    private static final Logger log = LoggerFactory.getLogger(SinkRouter.class);

    public static final String CFG_RETENTION_DAYS = "sysmon.retention.days";
    public static final String CFG_PARTITION_DAYS = "sysmon.partition.days";

    private final Partitioning partitioning;
    private final Map<RecordType, SinkConfiguration> configurations;

    public SinkRouter(SchemaRegistry registry, Partitioning partitioning) {
        Objects.requireNonNull(registry, "registry");
        this.partitioning = Objects.requireNonNull(partitioning, "partitioning");

        final EnumMap<RecordType, SinkConfiguration> m = new EnumMap<>(RecordType.class);
        for (RecordType type : RecordType.values()) {
            final SchemaEntry entry = registry.lookup(type);
            m.put(type, new SinkConfiguration(entry.table(), entry.fieldNames(), partitioning));
        }
        this.configurations = m;
    }

    /**
     * Reads {@value #CFG_PARTITION_DAYS} and {@value #CFG_RETENTION_DAYS}; absent keys take the defaults.
     *
     * @throws IllegalArgumentException if a configured value is out of range
     */
    public static SinkRouter fromConfig(PipelineConfig config, SchemaRegistry registry) {
        Objects.requireNonNull(config, "config");
        final int bucketDays = config.getInt(CFG_PARTITION_DAYS, Partitioning.DEFAULT_BUCKET_DAYS);
        final int retentionDays = config.getInt(CFG_RETENTION_DAYS, Partitioning.DEFAULT_RETENTION_DAYS);
        final Partitioning partitioning = Partitioning.byTime(bucketDays, retentionDays);
        log.info("Sink routing: bucketDays={} retentionDays={} index={}",
                bucketDays, retentionDays, partitioning.indexFields());
        return new SinkRouter(registry, partitioning);
    }

    public SinkConfiguration route(RecordType type) {
        return configurations.get(Objects.requireNonNull(type, "type"));
    }

    public Partitioning partitioning() {
        return partitioning;
    }
}
