package com.ensemblslicer.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Runtime settings for the runner. Every value can be overridden by an environment variable or, when the
 * variable is absent, a JVM system property of the same name.
 */
public final class SlicerConfig {
    private static final Logger logger = LoggerFactory.getLogger(SlicerConfig.class);

    public static final String DEFAULT_TARGET_URL = "https://www.ensembl.org/Homo_sapiens/Tools/DataSlicer?db=core;expand_form=true";

    private String targetUrl = DEFAULT_TARGET_URL;
    private String browser = "chromium";
    private Duration fieldWait = Duration.ofSeconds(10);
    private Duration pollInterval = Duration.ofSeconds(3);
    private Duration downloadWait = Duration.ofSeconds(60);
    private Duration stabilityCheckInterval = Duration.ofMillis(500);
    private Duration settleWait = Duration.ofSeconds(5);
    private Duration actionTimeout = Duration.ofSeconds(30);

    private SlicerConfig() {}

    public static SlicerConfig defaults() {
        return new SlicerConfig();
    }

    public static SlicerConfig fromEnv() {
        SlicerConfig config = new SlicerConfig();
        config.targetUrl = envOrProp("SLICER_TARGET_URL", config.targetUrl);
        config.browser = envOrProp("SLICER_BROWSER", config.browser).trim().toLowerCase(java.util.Locale.ROOT);
        config.fieldWait = millis("SLICER_FIELD_WAIT_MS", config.fieldWait);
        config.pollInterval = millis("SLICER_POLL_INTERVAL_MS", config.pollInterval);
        config.downloadWait = millis("SLICER_DOWNLOAD_WAIT_MS", config.downloadWait);
        config.stabilityCheckInterval = millis("SLICER_STABILITY_CHECK_MS", config.stabilityCheckInterval);
        config.settleWait = millis("SLICER_SETTLE_WAIT_MS", config.settleWait);
        config.actionTimeout = millis("SLICER_ACTION_TIMEOUT_MS", config.actionTimeout);
        return config;
    }

    static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null && !ev.isBlank()) return ev;
        String prop = System.getProperty(key);
        return prop != null && !prop.isBlank() ? prop : defaultVal;
    }

    private static Duration millis(String key, Duration defaultVal) {
        String raw = envOrProp(key, null);
        if (raw == null) return defaultVal;
        try {
            long ms = Long.parseLong(raw.trim());
            if (ms > 0) return Duration.ofMillis(ms);
            logger.warn("{} must be positive but was {}; using default {} ms", key, ms, defaultVal.toMillis());
        } catch (NumberFormatException e) {
            logger.warn("{} is not a number ('{}'); using default {} ms", key, raw, defaultVal.toMillis());
        }
        return defaultVal;
    }

    public String targetUrl() {
        return targetUrl;
    }

    public String browser() {
        return browser;
    }

    public Duration fieldWait() {
        return fieldWait;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration downloadWait() {
        return downloadWait;
    }

    public Duration stabilityCheckInterval() {
        return stabilityCheckInterval;
    }

    public Duration settleWait() {
        return settleWait;
    }

    public Duration actionTimeout() {
        return actionTimeout;
    }

    // Fluent setters for tests and embedding callers
    public SlicerConfig withTargetUrl(String url) {
        this.targetUrl = url;
        return this;
    }

    public SlicerConfig withBrowser(String browser) {
        this.browser = browser;
        return this;
    }

    public SlicerConfig withFieldWait(Duration fieldWait) {
        this.fieldWait = fieldWait;
        return this;
    }

    public SlicerConfig withPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
        return this;
    }

    public SlicerConfig withDownloadWait(Duration downloadWait) {
        this.downloadWait = downloadWait;
        return this;
    }

    public SlicerConfig withStabilityCheckInterval(Duration interval) {
        this.stabilityCheckInterval = interval;
        return this;
    }

    public SlicerConfig withSettleWait(Duration settleWait) {
        this.settleWait = settleWait;
        return this;
    }

    public SlicerConfig withActionTimeout(Duration actionTimeout) {
        this.actionTimeout = actionTimeout;
        return this;
    }

    @Override
    public String toString() {
        return "SlicerConfig{" +
                "targetUrl='" + targetUrl + '\'' +
                ", browser=" + browser +
                ", fieldWaitMs=" + fieldWait.toMillis() +
                ", pollIntervalMs=" + pollInterval.toMillis() +
                ", downloadWaitMs=" + downloadWait.toMillis() +
                '}';
    }
}
