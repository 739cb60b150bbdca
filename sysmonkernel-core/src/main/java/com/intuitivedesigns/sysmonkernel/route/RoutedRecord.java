/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.route;

import com.intuitivedesigns.sysmonkernel.decode.DecodedRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A decoded record paired with the sink configuration of its type: the unit a table sink writes.
 */
public record RoutedRecord(SinkConfiguration configuration, DecodedRecord record) {

    public RoutedRecord {
        Objects.requireNonNull(configuration, "configuration");
        Objects.requireNonNull(record, "record");
    }

    public String table() {
        return configuration.table();
    }

    /** Column values in the configured field order. */
    public List<Object> row() {
        final List<Object> row = new ArrayList<>(configuration.fields().size());
        for (String field : configuration.fields()) {
            row.add(record.get(field));
        }
        return row;
    }
}
