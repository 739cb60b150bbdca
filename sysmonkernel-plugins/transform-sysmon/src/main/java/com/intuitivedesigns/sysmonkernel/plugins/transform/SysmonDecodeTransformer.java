/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.plugins.transform;

import com.intuitivedesigns.sysmonkernel.core.PipelinePayload;
import com.intuitivedesigns.sysmonkernel.core.Transformer;
import com.intuitivedesigns.sysmonkernel.decode.DecodeResult;
import com.intuitivedesigns.sysmonkernel.decode.DecodedRecord;
import com.intuitivedesigns.sysmonkernel.decode.RecordDecoder;
import com.intuitivedesigns.sysmonkernel.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Sysmon decode stage.
 * Turns a binary sysmon payload into a {@link DecodedRecord}, or returns {@code null} to drop it.
 * Drops have already been reported by the decoder's diagnostics sink.
 */
public final class SysmonDecodeTransformer implements Transformer<byte[], DecodedRecord> {

    private static final Logger log = LoggerFactory.getLogger(SysmonDecodeTransformer.class);

    static final String METRIC_DECODED = "sysmon.records.decoded";
    static final String METRIC_DROPPED_PREFIX = "sysmon.records.dropped.";

    private final RecordDecoder decoder;
    private final MetricsRuntime metrics;

    public SysmonDecodeTransformer(RecordDecoder decoder, MetricsRuntime metrics) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.noop();
    }

    @Override
    public PipelinePayload<DecodedRecord> transform(PipelinePayload<byte[]> input) {
        if (input == null) return null;

        final DecodeResult result = decoder.decode(input.data());
        if (result instanceof DecodeResult.Dropped dropped) {
            metrics.counter(METRIC_DROPPED_PREFIX + dropped.reason().code(), 1.0);
            if (log.isDebugEnabled()) {
                log.debug("[SYSMON] Dropped ID={} offset={} reason={} detail={}", input.id(),
                        input.header(PipelinePayload.META_OFFSET).orElse("-"), dropped.reason().code(), dropped.detail());
            }
            return null;
        }

        final DecodedRecord record = ((DecodeResult.Decoded) result).value();
        metrics.counter(METRIC_DECODED, 1.0);
        return input.withData(record);
    }
}
