/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Flat key/value configuration for the receiver, backed by {@link Properties}.
 * <p>
 * {@link #get()} is the process-wide instance, read once from the file named by
 * {@code -Dsysmon.config.path} or {@code SYSMON_CONFIG_PATH}. Embedded receivers and tests build
 * their own with {@link #of(Map)} or {@link #load(Path)}.
 * <p>
 * A missing key yields the caller's default, and so does an unparsable value (with a warning).
 * Range checks belong to the component that owns the key.
 */
public final class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    private static final String PROP_CONFIG_PATH = "sysmon.config.path";
    private static final String ENV_CONFIG_PATH = "SYSMON_CONFIG_PATH";

    private static volatile PipelineConfig instance;

    private final Properties props;

    private PipelineConfig(Properties props) {
        this.props = props;
    }

    public static PipelineConfig get() {
        PipelineConfig local = instance;
        if (local == null) {
            synchronized (PipelineConfig.class) {
                local = instance;
                if (local == null) {
                    local = new PipelineConfig(fromEnvironment());
                    instance = local;
                }
            }
        }
        return local;
    }

    public static PipelineConfig of(Properties source) {
        Objects.requireNonNull(source, "source");
        final Properties copy = new Properties();
        source.stringPropertyNames().forEach(name -> copy.setProperty(name, source.getProperty(name)));
        return new PipelineConfig(copy);
    }

    public static PipelineConfig of(Map<String, String> source) {
        Objects.requireNonNull(source, "source");
        final Properties copy = new Properties();
        source.forEach(copy::setProperty);
        return new PipelineConfig(copy);
    }

    /**
     * @throws IOException if the file cannot be read
     */
    public static PipelineConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        return new PipelineConfig(read(path));
    }

    public static PipelineConfig empty() {
        return new PipelineConfig(new Properties());
    }

    private static Properties fromEnvironment() {
        String path = System.getProperty(PROP_CONFIG_PATH);
        if (path == null || path.isBlank()) {
            path = System.getenv(ENV_CONFIG_PATH);
        }
        if (path == null || path.isBlank()) {
            log.warn("No configuration file given, using defaults. Usage: -D{}=/path/to/sysmon.properties", PROP_CONFIG_PATH);
            return new Properties();
        }

        try {
            final Properties props = read(Path.of(path));
            log.info("Loaded {} properties from {}", props.size(), path);
            return props;
        } catch (IOException e) {
            log.error("Failed to read configuration file {}, using defaults", path, e);
            return new Properties();
        }
    }

    private static Properties read(Path path) throws IOException {
        final Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
        }
        return props;
    }

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        final String raw = props.getProperty(key);
        if (raw == null) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-integer value for '{}': '{}' (using {})", key, raw, defaultValue);
            return defaultValue;
        }
    }

    /** Accepts {@code true} or {@code false} in any case. */
    public boolean getBoolean(String key, boolean defaultValue) {
        final String raw = props.getProperty(key);
        if (raw == null) return defaultValue;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> {
                log.warn("Ignoring non-boolean value for '{}': '{}' (using {})", key, raw, defaultValue);
                yield defaultValue;
            }
        };
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }
}
