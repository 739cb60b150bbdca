/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.core;

/**
 * Destination for routed records. The receiver opens one instance per destination table and writes
 * every record for that table through it, so an instance only ever sees rows of a single shape.
 *
 * <p>Write failures propagate to the caller. Instances may be written from several threads.</p>
 *
 * @param <T> content type
 */
public interface OutputSink<T> extends AutoCloseable {

    void write(PipelinePayload<T> payload) throws Exception;

    /** Pushes buffered rows out. Sinks that do not buffer keep the default. */
    default void flush() throws Exception {
    }

    /** Identifier used in logs, e.g. {@code table-log}. */
    default String id() {
        return getClass().getSimpleName();
    }

    @Override
    default void close() throws Exception {
        flush();
    }
}
