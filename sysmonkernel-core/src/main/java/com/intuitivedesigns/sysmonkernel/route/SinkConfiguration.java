/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.route;

import java.util.List;
import java.util.Objects;

/**
 * What a table sink needs to know to store one record type.
 */
public record SinkConfiguration(String table, List<String> fields, Partitioning partitioning) {

    public SinkConfiguration {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(partitioning, "partitioning");
        fields = List.copyOf(fields);
    }
}
