package com.ensemblslicer.runner;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CliArgumentsTest {
    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);

    @Test
    void defaultsDescribeThePopulationSliceOfChromosomeThree() {
        JobRequest request = CliArguments.parse(new String[0]).toJobRequest(FIXED);

        assertEquals("slice_20240501_101530", request.jobName());
        assertEquals(FileFormat.VCF, request.fileFormat());
        assertEquals(CliArguments.DEFAULT_REGION, request.region().toString());
        assertEquals(CliArguments.DEFAULT_GENOTYPE_URL, request.sourceUrl());
        assertEquals(FilterMode.POPULATIONS, request.filterMode());
        assertEquals(List.of("CEU"), request.populations());
        assertEquals(Duration.ofSeconds(300), request.timeout());
        assertTrue(request.headless());
        assertTrue(request.outputDirectory().isAbsolute());
    }

    @Test
    void parsesEveryOption() {
        JobRequest request = CliArguments.parse(new String[]{
            "-o", "out", "-j", "J2807", "-ff", "bam", "-r", "X:10-20", "-g", "https://example.test/a.bam",
            "-f", "individuals", "-i", "HG00096, NA12878", "-to", "1", "--open"
        }).toJobRequest(FIXED);

        assertEquals(Paths.get("out").toAbsolutePath(), request.outputDirectory());
        assertEquals("J2807", request.jobName());
        assertEquals(FileFormat.BAM, request.fileFormat());
        assertEquals(new Region("X", 10, 20), request.region());
        assertEquals("https://example.test/a.bam", request.sourceUrl());
        assertEquals(FilterMode.INDIVIDUALS, request.filterMode());
        assertEquals(List.of("HG00096", "NA12878"), request.individuals());
        assertEquals(Duration.ofSeconds(1), request.timeout());
        assertFalse(request.headless());
    }

    @Test
    void longOptionsMatchShortOnes() {
        JobRequest request = CliArguments.parse(new String[]{
            "--jobname", "long", "--populations", "CEU GBR,YRI", "--timeout", "60"
        }).toJobRequest(FIXED);

        assertEquals("long", request.jobName());
        assertEquals(List.of("CEU", "GBR", "YRI"), request.populations());
        assertEquals(Duration.ofSeconds(60), request.timeout());
    }

    @Test
    void helpFlagIsRecognised() {
        assertTrue(CliArguments.parse(new String[]{"-h"}).helpRequested());
        assertFalse(CliArguments.parse(new String[]{"-j", "x"}).helpRequested());
    }

    @Test
    void rejectsUnknownOptionsAndMissingValues() {
        assertThrows(IllegalArgumentException.class, () -> CliArguments.parse(new String[]{"--verbose"}));
        assertThrows(IllegalArgumentException.class, () -> CliArguments.parse(new String[]{"-j"}));
        assertThrows(IllegalArgumentException.class, () -> CliArguments.parse(new String[]{"-j", "--open"}));
        assertThrows(IllegalArgumentException.class, () -> CliArguments.parse(new String[]{"-to", "5m"}));
    }

    @Test
    void shortFlagIsNeverTakenAsAValue() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> CliArguments.parse(new String[]{"-o", "-j", "J1"}));
        assertTrue(e.getMessage().contains("-o"));
        assertThrows(IllegalArgumentException.class, () -> CliArguments.parse(new String[]{"-p", "-to", "60"}));
    }

    @Test
    void dashPrefixedValueThatIsNotAFlagIsAccepted() {
        assertThrows(IllegalArgumentException.class,
            () -> CliArguments.parse(new String[]{"-to", "-5"}).toJobRequest(FIXED));
        assertEquals("-tmp", CliArguments.parse(new String[]{"-j", "-tmp"}).toJobRequest(FIXED).jobName());
    }

    @Test
    void invalidValuesFailWhenBuildingTheRequest() {
        assertThrows(IllegalArgumentException.class,
            () -> CliArguments.parse(new String[]{"-to", "0"}).toJobRequest(FIXED));
        assertThrows(IllegalArgumentException.class,
            () -> CliArguments.parse(new String[]{"-ff", "CRAM"}).toJobRequest(FIXED));
        assertThrows(IllegalArgumentException.class,
            () -> CliArguments.parse(new String[]{"-r", "3:146301179-146142335"}).toJobRequest(FIXED));
    }

    @Test
    void splitsListsOnCommasAndWhitespace() {
        assertEquals(List.of("a", "b", "c"), CliArguments.splitList(" a,b  c, "));
        assertTrue(CliArguments.splitList(null).isEmpty());
        assertTrue(CliArguments.splitList("").isEmpty());
    }
}
