/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sysmonkernel.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigTest {

    @Test
    void readsTypedValues() {
        PipelineConfig config = PipelineConfig.of(Map.of(
                "sysmon.retention.days", " 45 ",
                "sysmon.legacy.tags.enabled", " FALSE",
                "sink.type", "TABLE_LOG"));

        assertEquals(45, config.getInt("sysmon.retention.days", 30));
        assertFalse(config.getBoolean("sysmon.legacy.tags.enabled", true));
        assertEquals("TABLE_LOG", config.getString("sink.type", "X"));
    }

    @Test
    void missingAndMalformedValuesFallBack() {
        PipelineConfig config = PipelineConfig.of(Map.of(
                "sysmon.partition.days", "one",
                "sysmon.legacy.tags.enabled", "nope"));

        assertEquals(1, config.getInt("sysmon.partition.days", 1));
        assertEquals(30, config.getInt("sysmon.retention.days", 30));
        assertTrue(config.getBoolean("sysmon.legacy.tags.enabled", true));
        assertFalse(config.getBoolean("absent", false));
        assertEquals("dflt", config.getString("absent", "dflt"));
    }

    @Test
    void copiesItsSource() {
        Properties props = new Properties();
        props.setProperty("transform.type", "SYSMON");
        PipelineConfig config = PipelineConfig.of(props);
        props.setProperty("transform.type", "OTHER");

        assertEquals("SYSMON", config.getString("transform.type", null));
        assertEquals(Set.of("transform.type"), config.keys());
        assertTrue(PipelineConfig.empty().keys().isEmpty());
    }

    @Test
    void loadsPropertiesFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("sysmon.properties");
        Files.writeString(file, "sysmon.retention.days=60\n# comment\nsink.type = TABLE_LOG\n");

        PipelineConfig config = PipelineConfig.load(file);

        assertEquals(60, config.getInt("sysmon.retention.days", 30));
        assertEquals("TABLE_LOG", config.getString("sink.type", null));
        assertThrows(IOException.class, () -> PipelineConfig.load(dir.resolve("missing.properties")));
    }

    @Test
    void processWideInstanceIsShared() {
        assertSame(PipelineConfig.get(), PipelineConfig.get());
    }
}
