/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.schema;

import com.intuitivedesigns.sysmonkernel.term.Atom;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed set of telemetry record shapes.
 *
 * <p>Each type has one current wire tag and, for some, a legacy tag still emitted by older producers.</p>
 */
public enum RecordType {
    OP_STAT("op_stat", "op_stat_kafka_msg1"),
    PROC_TOP("proc_top", "erl_top"),
    FUN_TOP("fun_top"),
    APP_TOP("app_top"),
    NODE_ROLE("node_role");

    private static final Map<String, RecordType> BY_TAG = new HashMap<>();
    private static final Map<String, RecordType> BY_LEGACY_TAG = new HashMap<>();

    static {
        for (RecordType type : values()) {
            BY_TAG.put(type.tag, type);
            for (String legacy : type.legacyTags) {
                BY_LEGACY_TAG.put(legacy, type);
            }
        }
    }

    private final String tag;
    private final List<String> legacyTags;

    RecordType(String tag, String... legacyTags) {
        this.tag = tag;
        this.legacyTags = List.of(legacyTags);
    }

    public String tag() {
        return tag;
    }

    /**
     * Resolves a wire tag. Anything that is not an atom naming a known type resolves to empty.
     */
    public static Optional<RecordType> fromTag(Object tag, boolean acceptLegacy) {
        if (!(tag instanceof Atom atom)) {
            return Optional.empty();
        }
        RecordType type = BY_TAG.get(atom.name());
        if (type == null && acceptLegacy) {
            type = BY_LEGACY_TAG.get(atom.name());
        }
        return Optional.ofNullable(type);
    }
}
