/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.diagnostics;

import com.intuitivedesigns.sysmonkernel.config.PipelineConfig;
import com.intuitivedesigns.sysmonkernel.term.Binary;
import com.intuitivedesigns.sysmonkernel.term.TermPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.LoggingEventBuilder;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Logs drop diagnostics as WARN events with structured key-value pairs.
 */
public final class Slf4jDiagnosticsSink implements DiagnosticsSink {

    private static final Logger log = LoggerFactory.getLogger(Slf4jDiagnosticsSink.class);

    public static final String CFG_MAX_CHARS = "sysmon.diagnostics.max.chars";
    public static final int DEFAULT_MAX_CHARS = 1024;

    private final int maxChars;

    public Slf4jDiagnosticsSink() {
        this(DEFAULT_MAX_CHARS);
    }

    public Slf4jDiagnosticsSink(int maxChars) {
        this.maxChars = Math.max(0, maxChars);
    }

    public static Slf4jDiagnosticsSink fromConfig(PipelineConfig config) {
        return new Slf4jDiagnosticsSink(config.getInt(CFG_MAX_CHARS, DEFAULT_MAX_CHARS));
    }

    @Override
    public void report(DropDiagnostic d) {
        if (!log.isWarnEnabled()) return;

        LoggingEventBuilder event = log.atWarn()
                .addKeyValue("what", d.reason().description())
                .addKeyValue("reason", d.reason().code());

        if (d.tag() != null) {
            event = event.addKeyValue("record", TermPrinter.print(d.tag(), maxChars));
        }
        if (d.values() != null) {
            event = event.addKeyValue("fields", TermPrinter.print(d.values(), maxChars));
        }
        if (d.payload() != null) {
            event = event.addKeyValue("message", TermPrinter.print(Binary.of(d.payload()), maxChars));
        }
        final Throwable error = d.error();
        if (error != null) {
            event = event.addKeyValue("error_class", error.getClass().getName())
                    .addKeyValue("error", truncate(String.valueOf(error.getMessage())))
                    .addKeyValue("stacktrace", truncate(stackTrace(error)));
        }
        event.log(d.reason().description());
    }

    private String truncate(String s) {
        return s.length() <= maxChars ? s : s.substring(0, maxChars);
    }

    private static String stackTrace(Throwable t) {
        final StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }
}
