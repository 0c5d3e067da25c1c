package com.ensemblslicer.runner;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JobRequestTest {
    private static final Path OUT = Paths.get("target", "job-request-test");

    @Test
    void parsesRegionLookup() {
        Region region = Region.parse("3:146142335-146301179");
        assertEquals("3", region.chromosome());
        assertEquals(146142335L, region.start());
        assertEquals(146301179L, region.end());
        assertEquals("3:146142335-146301179", region.toString());
    }

    @Test
    void acceptsSingleBaseRegionAndNamedChromosomes() {
        assertEquals(new Region("X", 10, 10), Region.parse("X:10-10"));
        assertEquals("MT", Region.parse(" MT:1-16569 ").chromosome());
    }

    @Test
    void rejectsRegionWithStartAfterEnd() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> Region.parse("3:146301179-146142335"));
        assertTrue(e.getMessage().contains("after end"));
    }

    @Test
    void rejectsMalformedRegions() {
        assertThrows(IllegalArgumentException.class, () -> Region.parse("3-146142335:146301179"));
        assertThrows(IllegalArgumentException.class, () -> Region.parse("3:0-10"));
        assertThrows(IllegalArgumentException.class, () -> Region.parse("chr3"));
        assertThrows(IllegalArgumentException.class, () -> Region.parse(null));
        assertThrows(IllegalArgumentException.class, () -> Region.parse("3:1-99999999999999999999"));
    }

    @Test
    void malformedRegionFailsBeforeAnyBrowserWork() {
        // the builder parses eagerly, so no request object and no session can exist
        assertThrows(IllegalArgumentException.class,
            () -> TestSessions.scenarioA(OUT).region("3:200-100").build());
    }

    @Test
    void buildsScenarioRequest() {
        JobRequest request = TestSessions.scenarioA(OUT).build();
        assertEquals("J2807", request.jobName());
        assertEquals(FileFormat.VCF, request.fileFormat());
        assertEquals(List.of("CEU"), request.populations());
        assertEquals(Duration.ofSeconds(300), request.timeout());
        assertTrue(request.headless());
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class,
            () -> TestSessions.scenarioA(OUT).timeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
            () -> TestSessions.scenarioA(OUT).timeout(Duration.ofSeconds(-5)).build());
    }

    @Test
    void rejectsBlankJobNameAndSource() {
        assertThrows(IllegalArgumentException.class, () -> TestSessions.scenarioA(OUT).jobName("  ").build());
        assertThrows(IllegalArgumentException.class, () -> TestSessions.scenarioA(OUT).sourceUrl("").build());
    }

    @Test
    void populationFilterNeedsMappingAndCodes() {
        assertThrows(IllegalArgumentException.class,
            () -> TestSessions.scenarioA(OUT).populations(List.of(" ", "")).build());
        assertThrows(IllegalArgumentException.class,
            () -> TestSessions.scenarioA(OUT).mappingUrl(null).build());
    }

    @Test
    void individualsFilterNeedsIndividuals() {
        assertThrows(IllegalArgumentException.class,
            () -> TestSessions.scenarioA(OUT).filterMode(FilterMode.INDIVIDUALS).build());
        JobRequest ok = TestSessions.scenarioA(OUT)
            .filterMode(FilterMode.INDIVIDUALS)
            .individuals(List.of("HG00096", " NA12878 "))
            .build();
        assertEquals(List.of("HG00096", "NA12878"), ok.individuals());
    }

    @Test
    void noFilterNeedsNeitherPopulationsNorMapping() {
        JobRequest request = TestSessions.scenarioA(OUT)
            .filterMode(FilterMode.NONE)
            .mappingUrl(null)
            .populations(null)
            .build();
        assertTrue(request.populations().isEmpty());
    }

    @Test
    void resolvesEnumeratedValues() {
        assertEquals(FileFormat.BAM, FileFormat.fromLabel("bam"));
        assertEquals(FilterMode.NONE, FilterMode.fromFormValue("null"));
        assertEquals(FilterMode.POPULATIONS, FilterMode.fromFormValue("populations"));
        assertThrows(IllegalArgumentException.class, () -> FileFormat.fromLabel("CRAM"));
        assertThrows(IllegalArgumentException.class, () -> FilterMode.fromFormValue("samples"));
    }
}
