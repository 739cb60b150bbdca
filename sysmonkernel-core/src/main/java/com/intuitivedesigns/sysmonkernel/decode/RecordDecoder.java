/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.decode;

import com.intuitivedesigns.sysmonkernel.diagnostics.DiagnosticsSink;
import com.intuitivedesigns.sysmonkernel.diagnostics.DropDiagnostic;
import com.intuitivedesigns.sysmonkernel.diagnostics.Slf4jDiagnosticsSink;
import com.intuitivedesigns.sysmonkernel.schema.FieldSpec;
import com.intuitivedesigns.sysmonkernel.schema.RecordType;
import com.intuitivedesigns.sysmonkernel.schema.SchemaEntry;
import com.intuitivedesigns.sysmonkernel.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Validates raw records against the schema registry and applies field transforms.
 *
 * <p><b>Contract:</b> {@code decode} never throws for bad input. Every outcome is either a fully
 * populated {@link DecodedRecord} or a {@link DecodeResult.Dropped}, and every drop is reported to the
 * {@link DiagnosticsSink} exactly once.</p>
 *
 * <p>Stateless apart from its collaborators; safe to share across threads when they are.</p>
 */
public final class RecordDecoder {

    private static final Logger log = LoggerFactory.getLogger(RecordDecoder.class);

    private final SchemaRegistry registry;
    private final RawRecordParser parser;
    private final DiagnosticsSink diagnostics;

    public RecordDecoder() {
        this(new SchemaRegistry(), new RawRecordParser(), new Slf4jDiagnosticsSink());
    }

    public RecordDecoder(SchemaRegistry registry, DiagnosticsSink diagnostics) {
        this(registry, new RawRecordParser(), diagnostics);
    }

    public RecordDecoder(SchemaRegistry registry, RawRecordParser parser, DiagnosticsSink diagnostics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public SchemaRegistry registry() {
        return registry;
    }

    /**
     * Decodes one binary payload.
     */
    public DecodeResult decode(byte[] payload) {
        final RawRecord raw;
        try {
            raw = parser.parse(payload);
        } catch (RuntimeException e) {
            return drop(DropDiagnostic.failed(DropReason.DECODE_ERROR, null, null, payload, e), e.getMessage());
        }
        return decode(raw, payload);
    }

    /**
     * Decodes a record that has already been split into tag and values.
     */
    public DecodeResult decode(RawRecord raw) {
        Objects.requireNonNull(raw, "raw");
        return decode(raw, null);
    }

    private DecodeResult decode(RawRecord raw, byte[] payload) {
        final Optional<Map.Entry<RecordType, SchemaEntry>> match = registry.lookup(raw.tag());
        if (match.isEmpty()) {
            return drop(DropDiagnostic.rejected(DropReason.UNKNOWN_TYPE, raw.tag(), raw.values()),
                    "No schema for tag " + raw.tag());
        }

        final RecordType type = match.get().getKey();
        final SchemaEntry schema = match.get().getValue();
        final List<Object> values = raw.values();
        if (values.size() != schema.arity()) {
            return drop(DropDiagnostic.rejected(DropReason.ARITY_MISMATCH, raw.tag(), values),
                    type + " expects " + schema.arity() + " values, got " + values.size());
        }

        final DecodedRecord record;
        try {
            record = applySchema(type, schema, values);
        } catch (RuntimeException e) {
            // Includes FieldTransformException; either way nothing partial escapes
            return drop(DropDiagnostic.failed(DropReason.TRANSFORM_ERROR, raw.tag(), values, payload, e),
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        if (log.isTraceEnabled()) {
            log.trace("Decoded {} into table {}", type, schema.table());
        }
        return new DecodeResult.Decoded(record);
    }

    private static DecodedRecord applySchema(RecordType type, SchemaEntry schema, List<Object> values) {
        final List<FieldSpec> columns = schema.fields();
        final Map<String, Object> fields = new LinkedHashMap<>(columns.size() * 2);
        for (int i = 0; i < columns.size(); i++) {
            final FieldSpec column = columns.get(i);
            fields.put(column.name(), column.apply(values.get(i)));
        }
        return new DecodedRecord(type, fields);
    }

    private DecodeResult drop(DropDiagnostic diagnostic, String detail) {
        diagnostics.report(diagnostic);
        return new DecodeResult.Dropped(diagnostic.reason(), detail);
    }
}
