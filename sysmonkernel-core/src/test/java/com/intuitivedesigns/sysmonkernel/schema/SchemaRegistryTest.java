/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.schema;

import com.intuitivedesigns.sysmonkernel.config.PipelineConfig;
import com.intuitivedesigns.sysmonkernel.term.Atom;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchemaRegistryTest {

    private final SchemaRegistry registry = new SchemaRegistry();

    @Test
    void everyRecordTypeHasTableAndFields() {
        for (RecordType type : RecordType.values()) {
            SchemaEntry entry = registry.lookup(type);
            assertNotNull(entry, type.name());
            assertFalse(entry.table().isBlank(), type.name());
            assertTrue(entry.arity() >= 1, type.name());
        }
        assertEquals(RecordType.values().length, registry.entries().size());
    }

    @Test
    void tablesAndFieldOrder() {
        assertEquals("opstat", registry.lookup(RecordType.OP_STAT).table());
        assertEquals(List.of("name", "data", "unit", "sess", "node", "ts"),
                registry.lookup(RecordType.OP_STAT).fieldNames());

        assertEquals("node_role", registry.lookup(RecordType.NODE_ROLE).table());
        assertEquals(List.of("node", "ts", "data"), registry.lookup(RecordType.NODE_ROLE).fieldNames());

        assertEquals("prc", registry.lookup(RecordType.PROC_TOP).table());
        assertEquals(16, registry.lookup(RecordType.PROC_TOP).arity());
        assertEquals(5, registry.lookup(RecordType.FUN_TOP).arity());
        assertEquals(5, registry.lookup(RecordType.APP_TOP).arity());
    }

    @Test
    void fieldSpecsCarryTheirTransforms() {
        List<FieldSpec> opStat = registry.lookup(RecordType.OP_STAT).fields();
        assertEquals(FieldSpec.bounded("name", BoundedFieldTransform.TO_STRING, 60), opStat.get(0));
        assertEquals(FieldSpec.mapped("sess", FieldTransform.NULLABLE), opStat.get(3));
        assertEquals(FieldSpec.bare("node"), opStat.get(4));
        assertEquals(FieldSpec.mapped("ts", FieldTransform.TIMESTAMP), opStat.get(5));
    }

    @Test
    void resolvesWireTags() {
        Map.Entry<RecordType, SchemaEntry> match = registry.lookup(Atom.of("node_role")).orElseThrow();
        assertEquals(RecordType.NODE_ROLE, match.getKey());
        assertEquals("node_role", match.getValue().table());

        assertEquals(RecordType.OP_STAT, registry.lookup(Atom.of("op_stat_kafka_msg1")).orElseThrow().getKey());
        assertEquals(RecordType.PROC_TOP, registry.lookup(Atom.of("erl_top")).orElseThrow().getKey());
    }

    @Test
    void unknownTagsResolveToEmpty() {
        assertTrue(registry.lookup(Atom.of("no_such_record")).isEmpty());
        assertTrue(registry.lookup("node_role").isEmpty());
        assertTrue(registry.lookup((Object) null).isEmpty());
        assertTrue(registry.lookup(42L).isEmpty());
    }

    @Test
    void legacyTagsCanBeDisabled() {
        SchemaRegistry strict = SchemaRegistry.fromConfig(
                PipelineConfig.of(Map.of(SchemaRegistry.CFG_LEGACY_TAGS, "false")));

        assertFalse(strict.acceptsLegacyTags());
        assertTrue(strict.lookup(Atom.of("erl_top")).isEmpty());
        assertTrue(strict.lookup(Atom.of("proc_top")).isPresent());
    }

    @Test
    void schemaEntryRejectsBadShapes() {
        assertThrows(IllegalArgumentException.class, () -> new SchemaEntry("t", List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new SchemaEntry("t", List.of(FieldSpec.bare("a"), FieldSpec.bare("a"))));
        assertThrows(IllegalArgumentException.class, () -> FieldSpec.bare(" "));
    }
}
