/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.decode;

import com.intuitivedesigns.sysmonkernel.schema.RecordType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A validated record: field name to stored value, iterating in schema order. Never mutated.
 */
public record DecodedRecord(RecordType type, Map<String, Object> fields) {

    public DecodedRecord {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(fields, "fields");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public List<String> fieldNames() {
        return new ArrayList<>(fields.keySet());
    }
}
