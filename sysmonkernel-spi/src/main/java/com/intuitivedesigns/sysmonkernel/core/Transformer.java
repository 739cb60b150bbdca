/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.core;

/**
 * A stage that turns one payload into another, or filters it out.
 *
 * <p>The decode stage is the main implementation: encoded message bytes in, decoded record out, and
 * {@code null} for a message that was rejected. A rejected message is not an error; exceptions are
 * reserved for failures the caller cannot continue past.</p>
 *
 * @param <I> input content type
 * @param <O> output content type
 */
public interface Transformer<I, O> extends AutoCloseable {

    /** Called once before the first {@link #transform}. */
    default void init() throws Exception {
    }

    /**
     * Implementations should build the result with {@code input.withData(...)} so the envelope survives.
     *
     * @return the transformed payload, or {@code null} to drop it
     */
    PipelinePayload<O> transform(PipelinePayload<I> input) throws Exception;

    @Override
    default void close() throws Exception {
    }
}
