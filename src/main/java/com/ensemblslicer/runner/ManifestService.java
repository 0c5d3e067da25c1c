package com.ensemblslicer.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Writes a JSON manifest describing a completed job next to its artifact.
 */
public class ManifestService {
    private static final Logger logger = LoggerFactory.getLogger(ManifestService.class);
    public static final String MANIFEST_SUFFIX = ".manifest.json";

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final Clock clock;

    public ManifestService() {
        this(Clock.systemUTC());
    }

    public ManifestService(Clock clock) {
        this.clock = clock;
    }

    /**
     * Serialized form of a finished job.
     */
    public record JobManifest(
        String jobName,
        String region,
        String fileFormat,
        String filter,
        List<String> populations,
        List<String> individuals,
        String sourceUrl,
        String mappingUrl,
        String artifact,
        long sizeBytes,
        long elapsedMs,
        String completedAt
    ) {}

    /**
     * @return Path of the written manifest
     * @throws IOException if the manifest cannot be written
     */
    public Path write(JobRequest request, Artifact artifact, Duration elapsed) throws IOException {
        JobManifest manifest = new JobManifest(
            request.jobName(),
            request.region().toString(),
            request.fileFormat().label(),
            request.filterMode().formValue(),
            request.populations(),
            request.individuals(),
            request.sourceUrl(),
            request.mappingUrl(),
            artifact.fileName(),
            artifact.sizeBytes(),
            elapsed.toMillis(),
            Instant.now(clock).toString()
        );
        Path file = request.outputDirectory().resolve(Utils.sanitizeFilename(request.jobName()) + MANIFEST_SUFFIX);
        mapper.writeValue(file.toFile(), manifest);
        logger.info("Wrote job manifest {}", file);
        return file;
    }

    public JobManifest read(Path file) throws IOException {
        return mapper.readValue(file.toFile(), JobManifest.class);
    }
}
