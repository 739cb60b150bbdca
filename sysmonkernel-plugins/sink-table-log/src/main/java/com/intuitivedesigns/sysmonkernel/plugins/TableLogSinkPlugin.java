/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.plugins;

import com.intuitivedesigns.sysmonkernel.config.PipelineConfig;
import com.intuitivedesigns.sysmonkernel.core.OutputSink;
import com.intuitivedesigns.sysmonkernel.core.PipelinePayload;
import com.intuitivedesigns.sysmonkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sysmonkernel.route.Partitioning;
import com.intuitivedesigns.sysmonkernel.route.RoutedRecord;
import com.intuitivedesigns.sysmonkernel.spi.SinkPlugin;
import com.intuitivedesigns.sysmonkernel.term.TermPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;

/**
 * A table sink that logs each routed row instead of storing it.
 * Useful for development, debugging, or dry runs before a storage sink is wired in.
 * <p>
 * ID: TABLE_LOG
 */
public final class TableLogSinkPlugin implements SinkPlugin {

    public static final String ID = "TABLE_LOG";
    private static final Logger log = LoggerFactory.getLogger(TableLogSinkPlugin.class);

    // Config keys
    static final String CFG_LOG_LEVEL = "table.log.level";
    static final String CFG_MAX_LOG_CHARS = "table.log.max.chars";
    static final String CFG_METRIC_NAME = "table.log.metric.name";

    // Defaults
    private static final String DEFAULT_LOG_LEVEL = "INFO";
    private static final int DEFAULT_MAX_LOG_CHARS = 1024;
    private static final String DEFAULT_METRIC_NAME = "sysmon.table.rows";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public OutputSink<?> create(PipelineConfig config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");

        final String level = normalizeLevel(config.getString(CFG_LOG_LEVEL, DEFAULT_LOG_LEVEL));
        final int maxChars = clampInt(config.getInt(CFG_MAX_LOG_CHARS, DEFAULT_MAX_LOG_CHARS), 0, 1_048_576);
        final String metricName = config.getString(CFG_METRIC_NAME, DEFAULT_METRIC_NAME);
        final MetricsRuntime safeMetrics = (metrics != null) ? metrics : MetricsRuntime.noop();

        log.debug("Initialized table log sink (Level={}, MaxChars={}, Metric={})", level, maxChars, metricName);
        return new TableLogSink(level, maxChars, metricName, safeMetrics);
    }

    static final class TableLogSink implements OutputSink<RoutedRecord> {

        private final String level;
        private final int maxChars;
        private final String metricName;
        private final MetricsRuntime metrics;
        private final LongAdder rows = new LongAdder();

        TableLogSink(String level, int maxChars, String metricName, MetricsRuntime metrics) {
            this.level = level;
            this.maxChars = maxChars;
            this.metricName = metricName;
            this.metrics = metrics;
        }

        @Override
        public void write(PipelinePayload<RoutedRecord> payload) {
            if (payload == null || payload.data() == null) return;

            final RoutedRecord routed = payload.data();
            rows.increment();
            metrics.counter(metricName, 1.0, "table", routed.table());

            if (!shouldLog(level)) return;

            final Partitioning p = routed.configuration().partitioning();
            logAtLevel(level, "[TABLE] {} ID: {} | Columns: {} | Row: {} | Partition: {}d/{}d by {}",
                    routed.table(),
                    payload.id(),
                    routed.configuration().fields(),
                    TermPrinter.print(routed.row(), maxChars),
                    p.bucketDays(),
                    p.retentionDays(),
                    p.indexFields());
        }

        long rowsWritten() {
            return rows.sum();
        }

        @Override
        public String id() {
            return "table-log";
        }

        @Override
        public void close() {
            log.debug("Table log sink closed after {} row(s)", rows.sum());
        }
    }

    // --- Helpers ---

    private static boolean shouldLog(String level) {
        return switch (level) {
            case "ERROR" -> log.isErrorEnabled();
            case "WARN"  -> log.isWarnEnabled();
            case "DEBUG" -> log.isDebugEnabled();
            case "TRACE" -> log.isTraceEnabled();
            case "OFF"   -> false;
            default      -> log.isInfoEnabled();
        };
    }

    private static void logAtLevel(String level, String fmt, Object... args) {
        switch (level) {
            case "ERROR" -> log.error(fmt, args);
            case "WARN"  -> log.warn(fmt, args);
            case "DEBUG" -> log.debug(fmt, args);
            case "TRACE" -> log.trace(fmt, args);
            case "OFF"   -> { /* no-op */ }
            default      -> log.info(fmt, args);
        }
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }

    private static String normalizeLevel(String s) {
        if (s == null || s.isBlank()) return DEFAULT_LOG_LEVEL;
        return s.trim().toUpperCase(Locale.ROOT);
    }
}
