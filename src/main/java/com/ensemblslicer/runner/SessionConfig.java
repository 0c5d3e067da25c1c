package com.ensemblslicer.runner;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Launch settings for one browser session.
 * @param downloadDirectory Existing directory that receives downloads
 * @param headless Run without a visible window
 * @param browser Engine name: chromium, firefox, or webkit
 * @param actionTimeout Default timeout for individual page actions
 */
public record SessionConfig(Path downloadDirectory, boolean headless, String browser, Duration actionTimeout) {
    public static SessionConfig of(JobRequest request, SlicerConfig config) {
        return new SessionConfig(request.outputDirectory(), request.headless(), config.browser(), config.actionTimeout());
    }
}
