/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.schema;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Target table plus the ordered field contract for one record type.
 */
public record SchemaEntry(String table, List<FieldSpec> fields) {

    public SchemaEntry {
        Objects.requireNonNull(table, "table");
        if (table.isBlank()) throw new IllegalArgumentException("table must not be blank");
        fields = List.copyOf(fields);
        if (fields.isEmpty()) throw new IllegalArgumentException("Schema for '" + table + "' has no fields");
        Set<String> seen = new HashSet<>();
        for (FieldSpec f : fields) {
            if (!seen.add(f.name())) {
                throw new IllegalArgumentException("Duplicate field '" + f.name() + "' in schema for '" + table + "'");
            }
        }
    }

    public int arity() {
        return fields.size();
    }

    public List<String> fieldNames() {
        return fields.stream().map(FieldSpec::name).toList();
    }
}
