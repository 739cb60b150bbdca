/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.core;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Envelope carried between pipeline stages: an encoded sysmon message on the way in, a decoded record
 * after the decode stage.
 *
 * <p>The envelope is immutable. {@link #withData(Object)} swaps the content while keeping the id,
 * receive time and consumer headers, so a dropped or routed record can always be traced back to the
 * message it came from.</p>
 *
 * @param id correlation id, usually derived from the consumer position
 * @param data the content
 * @param timestamp when the message was received
 * @param metadata consumer headers such as {@link #META_OFFSET}
 */
public record PipelinePayload<T>(
        String id,
        T data,
        Instant timestamp,
        Map<String, String> metadata
) {

    /** Header holding the position of the message in its source stream. */
    public static final String META_OFFSET = "offset";

    public PipelinePayload {
        Objects.requireNonNull(id, "PipelinePayload id cannot be null");
        if (timestamp == null) timestamp = Instant.now();
        metadata = (metadata == null) ? Map.of() : Map.copyOf(metadata);
    }

    public PipelinePayload(String id, T data, Map<String, String> metadata) {
        this(id, data, Instant.now(), metadata);
    }

    public PipelinePayload(String id, T data) {
        this(id, data, Instant.now(), Map.of());
    }

    public static <T> PipelinePayload<T> of(T data) {
        return new PipelinePayload<>(UUID.randomUUID().toString(), data, Instant.now(), Map.of());
    }

    /**
     * Payload for a message read at {@code offset}; the offset doubles as the id.
     */
    public static <T> PipelinePayload<T> atOffset(long offset, T data) {
        final String position = Long.toString(offset);
        return new PipelinePayload<>(position, data, Instant.now(), Map.of(META_OFFSET, position));
    }

    public Optional<String> header(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    public <R> PipelinePayload<R> withData(R newData) {
        return new PipelinePayload<>(id, newData, timestamp, metadata);
    }
}
