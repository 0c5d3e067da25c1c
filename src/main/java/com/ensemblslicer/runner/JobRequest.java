package com.ensemblslicer.runner;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable, validated parameters for one Data Slicer job.
 * <p>
 * Validation happens at construction so a malformed request never reaches the browser:
 * <ul>
 *   <li>{@code region} is a parsed {@link Region}, so start &lt;= end already holds.</li>
 *   <li>{@code timeout} must be strictly positive.</li>
 *   <li>{@code jobName} and {@code sourceUrl} must be non-blank.</li>
 *   <li>The POPULATIONS filter needs a mapping URL and at least one population code; INDIVIDUALS needs at least one individual.</li>
 * </ul>
 *
 * @author Data Slicer Runner Team
 * @since 1.0
 */
public record JobRequest(
    Path outputDirectory,
    String jobName,
    FileFormat fileFormat,
    Region region,
    String sourceUrl,
    FilterMode filterMode,
    String mappingUrl,
    List<String> populations,
    List<String> individuals,
    Duration timeout,
    boolean headless
) {
    public JobRequest {
        if (outputDirectory == null) {
            throw new IllegalArgumentException("Output directory cannot be null");
        }
        if (jobName == null || jobName.isBlank()) {
            throw new IllegalArgumentException("Job name cannot be null or empty");
        }
        if (fileFormat == null) {
            throw new IllegalArgumentException("File format cannot be null");
        }
        if (region == null) {
            throw new IllegalArgumentException("Region cannot be null");
        }
        if (sourceUrl == null || sourceUrl.isBlank()) {
            throw new IllegalArgumentException("Source file URL cannot be null or empty");
        }
        if (filterMode == null) {
            throw new IllegalArgumentException("Filter mode cannot be null");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be greater than zero but was " + timeout);
        }
        populations = clean(populations);
        individuals = clean(individuals);
        if (filterMode == FilterMode.POPULATIONS) {
            if (mappingUrl == null || mappingUrl.isBlank()) {
                throw new IllegalArgumentException("Population filter requires a sample-population mapping URL");
            }
            if (populations.isEmpty()) {
                throw new IllegalArgumentException("Population filter requires at least one population code");
            }
        }
        if (filterMode == FilterMode.INDIVIDUALS && individuals.isEmpty()) {
            throw new IllegalArgumentException("Individuals filter requires at least one individual");
        }
    }

    private static List<String> clean(List<String> values) {
        List<String> out = new ArrayList<>();
        if (values == null) return List.of();
        for (String v : values) {
            if (v != null && !v.isBlank()) out.add(v.trim());
        }
        return List.copyOf(out);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for JobRequest; {@link #build()} runs the record's validation.
     */
    public static final class Builder {
        private Path outputDirectory;
        private String jobName;
        private FileFormat fileFormat = FileFormat.VCF;
        private Region region;
        private String sourceUrl;
        private FilterMode filterMode = FilterMode.POPULATIONS;
        private String mappingUrl;
        private List<String> populations = List.of();
        private List<String> individuals = List.of();
        private Duration timeout = Duration.ofSeconds(300);
        private boolean headless = true;

        private Builder() {}

        public Builder outputDirectory(Path outputDirectory) { this.outputDirectory = outputDirectory; return this; }
        public Builder jobName(String jobName) { this.jobName = jobName; return this; }
        public Builder fileFormat(FileFormat fileFormat) { this.fileFormat = fileFormat; return this; }
        public Builder region(Region region) { this.region = region; return this; }
        public Builder region(String region) { this.region = Region.parse(region); return this; }
        public Builder sourceUrl(String sourceUrl) { this.sourceUrl = sourceUrl; return this; }
        public Builder filterMode(FilterMode filterMode) { this.filterMode = filterMode; return this; }
        public Builder mappingUrl(String mappingUrl) { this.mappingUrl = mappingUrl; return this; }
        public Builder populations(List<String> populations) { this.populations = populations; return this; }
        public Builder individuals(List<String> individuals) { this.individuals = individuals; return this; }
        public Builder timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Builder headless(boolean headless) { this.headless = headless; return this; }

        public JobRequest build() {
            return new JobRequest(outputDirectory, jobName, fileFormat, region, sourceUrl, filterMode,
                mappingUrl, populations, individuals, timeout, headless);
        }
    }
}
