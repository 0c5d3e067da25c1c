package com.ensemblslicer.runner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ManifestServiceTest {
    @TempDir
    Path dir;

    @Test
    void writesManifestNamedAfterSanitizedJob() throws Exception {
        ManifestService service = new ManifestService(new ManualClock());
        JobRequest request = TestSessions.scenarioA(dir).jobName("J2807 chr3:slice").build();
        Path file = Files.write(dir.resolve("result.vcf.gz"), new byte[128]);

        Path manifestFile = service.write(request, new Artifact(file, 128, FileFormat.VCF), Duration.ofSeconds(42));

        assertEquals(dir.resolve("J2807_chr3_slice" + ManifestService.MANIFEST_SUFFIX), manifestFile);
        ManifestService.JobManifest manifest = service.read(manifestFile);
        assertEquals("J2807 chr3:slice", manifest.jobName());
        assertEquals("VCF", manifest.fileFormat());
        assertEquals("populations", manifest.filter());
        assertEquals(List.of("CEU"), manifest.populations());
        assertEquals(CliArguments.DEFAULT_MAPPING_URL, manifest.mappingUrl());
        assertEquals("result.vcf.gz", manifest.artifact());
        assertEquals(128, manifest.sizeBytes());
        assertEquals(42_000, manifest.elapsedMs());
        assertEquals("2024-05-01T10:00:00Z", manifest.completedAt());
    }
}
