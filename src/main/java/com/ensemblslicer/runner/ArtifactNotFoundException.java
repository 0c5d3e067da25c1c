package com.ensemblslicer.runner;

import java.nio.file.Path;
import java.time.Duration;

/**
 * The job completed but no stable result file appeared in the download directory.
 */
public class ArtifactNotFoundException extends SlicerException {
    private final Path directory;
    private final Duration elapsed;

    public ArtifactNotFoundException(Path directory, Duration elapsed) {
        super("No completed download appeared in " + directory + " within " + Utils.formatDuration(elapsed));
        this.directory = directory;
        this.elapsed = elapsed;
    }

    public Path directory() {
        return directory;
    }

    public Duration elapsed() {
        return elapsed;
    }
}
