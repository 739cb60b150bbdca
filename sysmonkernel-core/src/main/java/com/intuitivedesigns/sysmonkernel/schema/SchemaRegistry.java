/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.schema;

import com.intuitivedesigns.sysmonkernel.config.PipelineConfig;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.intuitivedesigns.sysmonkernel.schema.BoundedFieldTransform.TO_STRING;
import static com.intuitivedesigns.sysmonkernel.schema.FieldSpec.bare;
import static com.intuitivedesigns.sysmonkernel.schema.FieldSpec.bounded;
import static com.intuitivedesigns.sysmonkernel.schema.FieldSpec.mapped;
import static com.intuitivedesigns.sysmonkernel.schema.FieldTransform.FORMAT_FUNCTION;
import static com.intuitivedesigns.sysmonkernel.schema.FieldTransform.FORMAT_STACKTRACE;
import static com.intuitivedesigns.sysmonkernel.schema.FieldTransform.NULLABLE;
import static com.intuitivedesigns.sysmonkernel.schema.FieldTransform.TIMESTAMP;

/**
 * Static mapping from record type to its table and field contract.
 *
 * <p>The table is built once and never mutated, so a registry can be shared by any number of threads.
 * Instances differ only in whether legacy wire tags are recognised.</p>
 */
public final class SchemaRegistry {

    public static final String CFG_LEGACY_TAGS = "sysmon.legacy.tags.enabled";

    private static final Map<RecordType, SchemaEntry> SCHEMAS = buildSchemas();

    private final boolean acceptLegacyTags;

    public SchemaRegistry() {
        this(true);
    }

    public SchemaRegistry(boolean acceptLegacyTags) {
        this.acceptLegacyTags = acceptLegacyTags;
    }

    public static SchemaRegistry fromConfig(PipelineConfig config) {
        return new SchemaRegistry(config.getBoolean(CFG_LEGACY_TAGS, true));
    }

    public boolean acceptsLegacyTags() {
        return acceptLegacyTags;
    }

    /** Every type has an entry, so this never returns null. */
    public SchemaEntry lookup(RecordType type) {
        return SCHEMAS.get(type);
    }

    /**
     * Resolves a raw wire tag to its type and schema; empty for anything outside the known set.
     */
    public Optional<Map.Entry<RecordType, SchemaEntry>> lookup(Object tag) {
        return RecordType.fromTag(tag, acceptLegacyTags).map(t -> Map.entry(t, SCHEMAS.get(t)));
    }

    public Map<RecordType, SchemaEntry> entries() {
        return SCHEMAS;
    }

    private static Map<RecordType, SchemaEntry> buildSchemas() {
        EnumMap<RecordType, SchemaEntry> m = new EnumMap<>(RecordType.class);

        m.put(RecordType.OP_STAT, new SchemaEntry("opstat", List.of(
                bounded("name", TO_STRING, 60),
                bounded("data", TO_STRING, 50),
                bounded("unit", TO_STRING, 10),
                mapped("sess", NULLABLE),
                bare("node"),
                mapped("ts", TIMESTAMP))));

        m.put(RecordType.PROC_TOP, new SchemaEntry("prc", List.of(
                bare("node"),
                mapped("ts", TIMESTAMP),
                bounded("pid", TO_STRING, 34),
                bare("dreductions"),
                bare("dmemory"),
                bare("reductions"),
                bare("memory"),
                bare("message_queue_len"),
                mapped("current_function", FORMAT_FUNCTION),
                mapped("initial_call", FORMAT_FUNCTION),
                bounded("registered_name", TO_STRING, 39),
                bare("stack_size"),
                bare("heap_size"),
                bare("total_heap_size"),
                mapped("current_stacktrace", FORMAT_STACKTRACE),
                bare("group_leader"))));

        m.put(RecordType.FUN_TOP, new SchemaEntry("fun_top", List.of(
                bare("node"),
                mapped("ts", TIMESTAMP),
                mapped("fun", FORMAT_FUNCTION),
                bare("fun_type"),
                bare("num_processes"))));

        m.put(RecordType.APP_TOP, new SchemaEntry("app_top", List.of(
                bare("node"),
                mapped("ts", TIMESTAMP),
                bounded("application", TO_STRING, 60),
                bounded("unit", TO_STRING, 60),
                bare("value"))));

        m.put(RecordType.NODE_ROLE, new SchemaEntry("node_role", List.of(
                bare("node"),
                mapped("ts", TIMESTAMP),
                bare("data"))));

        if (m.size() != RecordType.values().length) {
            throw new IllegalStateException("Schema table is missing record types");
        }
        return Collections.unmodifiableMap(m);
    }
}
