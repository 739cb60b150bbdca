/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.plugins;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.intuitivedesigns.sysmonkernel.config.PipelineConfig;
import com.intuitivedesigns.sysmonkernel.config.PipelineFactory;
import com.intuitivedesigns.sysmonkernel.core.OutputSink;
import com.intuitivedesigns.sysmonkernel.core.PipelinePayload;
import com.intuitivedesigns.sysmonkernel.decode.DecodedRecord;
import com.intuitivedesigns.sysmonkernel.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.sysmonkernel.route.Partitioning;
import com.intuitivedesigns.sysmonkernel.route.RoutedRecord;
import com.intuitivedesigns.sysmonkernel.route.SinkConfiguration;
import com.intuitivedesigns.sysmonkernel.schema.RecordType;
import com.intuitivedesigns.sysmonkernel.term.Tuple;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TableLogSinkPluginTest {

    private Logger logger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach() {
        logger = (Logger) LoggerFactory.getLogger(TableLogSinkPlugin.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
    }

    @Test
    void logsOneLinePerRowWithColumnsAndPartitioning() throws Exception {
        MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime();
        @SuppressWarnings("unchecked")
        OutputSink<RoutedRecord> sink = (OutputSink<RoutedRecord>) new TableLogSinkPlugin().create(PipelineConfig.empty(), metrics);

        sink.write(new PipelinePayload<>("evt-1", nodeRole("nodeA")));

        List<ILoggingEvent> infos = appender.list.stream().filter(e -> e.getLevel() == Level.INFO).toList();
        assertEquals(1, infos.size());
        String line = infos.get(0).getFormattedMessage();
        assertTrue(line.contains("[TABLE] node_role"), line);
        assertTrue(line.contains("[node, ts, data]"), line);
        assertTrue(line.contains("[\"nodeA\",{1,2,3},\"d\"]"), line);
        assertTrue(line.contains("1d/30d by [ts]"), line);
        assertEquals(1.0, metrics.count("sysmon.table.rows", "table", "node_role"));
    }

    @Test
    void levelOffStillCountsRows() throws Exception {
        PipelineConfig config = PipelineConfig.of(Map.of(TableLogSinkPlugin.CFG_LOG_LEVEL, "off"));
        TableLogSinkPlugin.TableLogSink sink =
                (TableLogSinkPlugin.TableLogSink) new TableLogSinkPlugin().create(config, null);

        sink.write(new PipelinePayload<>("evt-1", nodeRole("a")));
        sink.write(new PipelinePayload<>("evt-2", nodeRole("b")));
        sink.write(null);

        assertEquals(2, sink.rowsWritten());
        assertTrue(appender.list.stream().noneMatch(e -> e.getFormattedMessage().startsWith("[TABLE]")));
    }

    @Test
    void factoryCreatesFreshTableLogSinkPerCall() {
        MicrometerMetricsRuntime metrics = new MicrometerMetricsRuntime();
        OutputSink<?> a = PipelineFactory.createSink(PipelineConfig.empty(), metrics);
        OutputSink<?> b = PipelineFactory.createSink(PipelineConfig.of(Map.of(PipelineFactory.KEY_SINK_TYPE, "table_log")), metrics);

        assertInstanceOf(TableLogSinkPlugin.TableLogSink.class, a);
        assertNotSame(a, b);
        assertEquals("table-log", a.id());
    }

    private static RoutedRecord nodeRole(String node) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("node", node);
        fields.put("ts", Tuple.of(1L, 2L, 3L));
        fields.put("data", "d");
        SinkConfiguration cfg = new SinkConfiguration("node_role", List.of("node", "ts", "data"), Partitioning.defaults());
        return new RoutedRecord(cfg, new DecodedRecord(RecordType.NODE_ROLE, fields));
    }
}
