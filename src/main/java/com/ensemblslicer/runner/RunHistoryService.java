package com.ensemblslicer.runner;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Appends run outcomes to {@code slicer-runs.csv} in the request's output directory using OpenCSV.
 * The header row is written when the file is first created.
 */
public class RunHistoryService implements RunHistoryServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(RunHistoryService.class);
    public static final String HISTORY_FILE = "slicer-runs.csv";

    static final List<String> CSV_FIELDS = List.of(
        "Timestamp", "JobName", "Region", "Format", "Filter", "Populations", "Outcome", "Detail", "Artifact", "ElapsedMs"
    );

    private final Clock clock;

    public RunHistoryService() {
        this(Clock.systemUTC());
    }

    public RunHistoryService(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void record(JobRequest request, RunOutcome outcome, String detail, Artifact artifact, Duration elapsed) {
        Path file = request.outputDirectory().resolve(HISTORY_FILE);
        boolean newFile = !Files.exists(file);
        try (CSVWriter writer = new CSVWriter(new FileWriter(file.toFile(), StandardCharsets.UTF_8, true))) {
            if (newFile) {
                writer.writeNext(CSV_FIELDS.toArray(String[]::new));
            }
            writer.writeNext(new String[]{
                Instant.now(clock).toString(),
                request.jobName(),
                request.region().toString(),
                request.fileFormat().label(),
                request.filterMode().formValue(),
                String.join(" ", request.populations()),
                outcome.name(),
                safe(detail),
                artifact == null ? "" : artifact.fileName(),
                Long.toString(elapsed == null ? 0 : elapsed.toMillis())
            });
            logger.info("Recorded {} run of '{}' in {}", outcome, request.jobName(), file);
        } catch (IOException e) {
            logger.warn("Failed to write run history {}: {}", file, e.getMessage());
        }
    }

    private static String safe(String s) {
        // keep one run per line
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}
