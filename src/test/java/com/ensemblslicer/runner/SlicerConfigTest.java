package com.ensemblslicer.runner;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SlicerConfigTest {
    @AfterEach
    void clearProperties() {
        System.clearProperty("SLICER_POLL_INTERVAL_MS");
        System.clearProperty("SLICER_DOWNLOAD_WAIT_MS");
        System.clearProperty("SLICER_FIELD_WAIT_MS");
        System.clearProperty("SLICER_BROWSER");
    }

    @Test
    void defaultsMatchDocumentedValues() {
        SlicerConfig config = SlicerConfig.defaults();
        assertEquals(SlicerConfig.DEFAULT_TARGET_URL, config.targetUrl());
        assertEquals("chromium", config.browser());
        assertEquals(Duration.ofSeconds(10), config.fieldWait());
        assertEquals(Duration.ofSeconds(3), config.pollInterval());
        assertEquals(Duration.ofSeconds(60), config.downloadWait());
        assertEquals(Duration.ofMillis(500), config.stabilityCheckInterval());
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty("SLICER_POLL_INTERVAL_MS", "1500");
        System.setProperty("SLICER_BROWSER", "FireFox");

        SlicerConfig config = SlicerConfig.fromEnv();

        assertEquals(Duration.ofMillis(1500), config.pollInterval());
        assertEquals("firefox", config.browser());
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        System.setProperty("SLICER_DOWNLOAD_WAIT_MS", "soon");
        System.setProperty("SLICER_FIELD_WAIT_MS", "-1");

        SlicerConfig config = SlicerConfig.fromEnv();

        assertEquals(Duration.ofSeconds(60), config.downloadWait());
        assertEquals(Duration.ofSeconds(10), config.fieldWait());
    }
}
