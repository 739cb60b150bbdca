/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.core;

import com.intuitivedesigns.sysmonkernel.config.PipelineConfig;
import com.intuitivedesigns.sysmonkernel.config.PipelineFactory;
import com.intuitivedesigns.sysmonkernel.decode.DecodedRecord;
import com.intuitivedesigns.sysmonkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sysmonkernel.route.RoutedRecord;
import com.intuitivedesigns.sysmonkernel.route.SinkConfiguration;
import com.intuitivedesigns.sysmonkernel.route.SinkRouter;
import com.intuitivedesigns.sysmonkernel.schema.RecordType;
import com.intuitivedesigns.sysmonkernel.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Receiving end of the sysmon stream: decode, route, then write to the sink slot of the record's type.
 *
 * <p>Slots are opened lazily, one per record type, the first time a record of that type is routed.
 * Dropped payloads never reach a slot. Sink write failures propagate to the caller and are not retried.</p>
 */
public final class SysmonReceiver implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SysmonReceiver.class);

    static final String METRIC_ROUTED = "sysmon.records.routed";
    static final String METRIC_OPEN_SLOTS = "sysmon.slots.open";

    private final Transformer<byte[], DecodedRecord> decoder;
    private final SinkRouter router;
    private final Function<SinkConfiguration, OutputSink<RoutedRecord>> slotFactory;
    private final MetricsRuntime metrics;

    // Guarded by itself
    private final Map<RecordType, OutputSink<RoutedRecord>> slots = new EnumMap<>(RecordType.class);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SysmonReceiver(Transformer<byte[], DecodedRecord> decoder,
                          SinkRouter router,
                          Function<SinkConfiguration, OutputSink<RoutedRecord>> slotFactory,
                          MetricsRuntime metrics) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.router = Objects.requireNonNull(router, "router");
        this.slotFactory = Objects.requireNonNull(slotFactory, "slotFactory");
        this.metrics = (metrics != null) ? metrics : MetricsRuntime.noop();
    }

    /**
     * Wires a receiver from plugins: {@code transform.type} decodes, {@code sink.type} backs every slot.
     */
    public static SysmonReceiver fromConfig(PipelineConfig config, MetricsRuntime metrics) throws Exception {
        Objects.requireNonNull(config, "config");
        final MetricsRuntime safeMetrics = (metrics != null) ? metrics : MetricsRuntime.noop();

        final Transformer<byte[], DecodedRecord> decoder = PipelineFactory.createDecodeStage(config, safeMetrics);
        final SinkRouter router = SinkRouter.fromConfig(config, SchemaRegistry.fromConfig(config));
        return new SysmonReceiver(
                decoder,
                router,
                slot -> PipelineFactory.createSlot(config, safeMetrics, slot),
                safeMetrics);
    }

    /**
     * @return true if the payload was decoded and written, false if it was dropped
     * @throws Exception if the sink slot rejects the write
     */
    public boolean accept(PipelinePayload<byte[]> payload) throws Exception {
        Objects.requireNonNull(payload, "payload");
        requireOpen();

        final PipelinePayload<DecodedRecord> decoded = decoder.transform(payload);
        if (decoded == null || decoded.data() == null) {
            return false;
        }

        final DecodedRecord record = decoded.data();
        final SinkConfiguration configuration = router.route(record.type());
        final OutputSink<RoutedRecord> slot = slotFor(record.type(), configuration);

        slot.write(decoded.withData(new RoutedRecord(configuration, record)));
        metrics.counter(METRIC_ROUTED, 1.0, "table", configuration.table());
        return true;
    }

    public void flush() throws Exception {
        Exception failure = null;
        for (OutputSink<RoutedRecord> slot : openSlots().values()) {
            try {
                slot.flush();
            } catch (Exception e) {
                failure = chain(failure, e);
            }
        }
        if (failure != null) throw failure;
    }

    @Override
    public void close() throws Exception {
        if (!closed.compareAndSet(false, true)) return;

        final Map<RecordType, OutputSink<RoutedRecord>> toClose = openSlots();
        Exception failure = null;
        for (Map.Entry<RecordType, OutputSink<RoutedRecord>> e : toClose.entrySet()) {
            try {
                e.getValue().close();
            } catch (Exception ex) {
                log.warn("Error closing sink slot {} ({})", e.getKey(), e.getValue().id(), ex);
                failure = chain(failure, ex);
            }
        }
        try {
            decoder.close();
        } catch (Exception ex) {
            failure = chain(failure, ex);
        }
        log.info("Receiver closed. slots={}", toClose.keySet());
        if (failure != null) throw failure;
    }

    /** Snapshot of the slots opened so far. */
    public Map<RecordType, OutputSink<RoutedRecord>> openSlots() {
        synchronized (slots) {
            return slots.isEmpty() ? Map.of() : new EnumMap<>(slots);
        }
    }

    // close() marks the receiver closed before it snapshots the slots under the same lock, so a slot is
    // either in that snapshot or never opened.
    private OutputSink<RoutedRecord> slotFor(RecordType type, SinkConfiguration configuration) throws Exception {
        synchronized (slots) {
            requireOpen();
            OutputSink<RoutedRecord> slot = slots.get(type);
            if (slot == null) {
                slot = Objects.requireNonNull(slotFactory.apply(configuration), "slotFactory returned null");
                if (closed.get()) {
                    // The factory closed this receiver re-entrantly
                    slot.close();
                    throw new IllegalStateException("Receiver closed while opening slot for table '" + configuration.table() + "'");
                }
                slots.put(type, slot);
                metrics.gauge(METRIC_OPEN_SLOTS, slots.size());
                log.info("Opened sink slot {} for table '{}' fields={}", slot.id(), configuration.table(), configuration.fields());
            }
            return slot;
        }
    }

    private void requireOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Receiver is closed");
        }
    }

    private static Exception chain(Exception first, Exception next) {
        if (first == null) return next;
        first.addSuppressed(next);
        return first;
    }
}
