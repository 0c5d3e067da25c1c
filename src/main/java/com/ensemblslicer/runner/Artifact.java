package com.ensemblslicer.runner;

import java.nio.file.Path;

/**
 * Result file of a completed job, confirmed present and no longer growing.
 */
public record Artifact(Path path, long sizeBytes, FileFormat format) {
    public String fileName() {
        return path.getFileName().toString();
    }
}
