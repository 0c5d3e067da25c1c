package com.ensemblslicer.runner;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builders for sessions and requests shared by the tests.
 */
final class TestSessions {
    private TestSessions() {}

    static BrowserSession session(FakePageDriver driver, Path dir, AtomicInteger closeCount) {
        return new BrowserSession(driver, dir, BrowserSession.snapshot(dir), closeCount::incrementAndGet);
    }

    static JobRequest.Builder scenarioA(Path dir) {
        return JobRequest.builder()
            .outputDirectory(dir)
            .jobName("J2807")
            .fileFormat(FileFormat.VCF)
            .region("3:146142335-146301179")
            .sourceUrl(CliArguments.DEFAULT_GENOTYPE_URL)
            .filterMode(FilterMode.POPULATIONS)
            .mappingUrl(CliArguments.DEFAULT_MAPPING_URL)
            .populations(java.util.List.of("CEU"))
            .timeout(Duration.ofSeconds(300));
    }

    static SlicerConfig fastConfig() {
        return SlicerConfig.defaults()
            .withFieldWait(Duration.ofMillis(50))
            .withSettleWait(Duration.ofMillis(10))
            .withPollInterval(Duration.ofSeconds(3))
            .withDownloadWait(Duration.ofSeconds(10))
            .withStabilityCheckInterval(Duration.ofMillis(500));
    }
}
