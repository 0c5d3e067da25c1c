package com.ensemblslicer.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;

/**
 * Runs one Data Slicer job end to end.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Opens a browser session on the request's output directory.</li>
 *   <li>Fills in and submits the form, then waits for a terminal job state.</li>
 *   <li>FAILED and TIMED_OUT become {@link JobFailedException} and {@link JobTimedOutException}.</li>
 *   <li>COMPLETED leads to artifact retrieval and a JSON manifest.</li>
 *   <li>The session is closed exactly once on every path, and the outcome is appended to the run history.</li>
 * </ul>
 *
 * @author Data Slicer Runner Team
 * @since 1.0
 */
public class DataSlicerJobRunner {
    private static final Logger logger = LoggerFactory.getLogger(DataSlicerJobRunner.class);

    private final SlicerConfig config;
    private final BrowserSessionServiceInterface sessionService;
    private final FormServiceInterface formService;
    private final CompletionMonitor completionMonitor;
    private final ArtifactService artifactService;
    private final RunHistoryServiceInterface historyService;
    private final ManifestService manifestService;
    private final Clock clock;

    public DataSlicerJobRunner(SlicerConfig config) {
        this(config, new BrowserSessionService(), new FormService(config), new CompletionMonitor(config),
            new ArtifactService(config), new RunHistoryService(), new ManifestService(), Clock.systemUTC());
    }

    public DataSlicerJobRunner(SlicerConfig config,
                               BrowserSessionServiceInterface sessionService,
                               FormServiceInterface formService,
                               CompletionMonitor completionMonitor,
                               ArtifactService artifactService,
                               RunHistoryServiceInterface historyService,
                               ManifestService manifestService,
                               Clock clock) {
        this.config = config;
        this.sessionService = sessionService;
        this.formService = formService;
        this.completionMonitor = completionMonitor;
        this.artifactService = artifactService;
        this.historyService = historyService;
        this.manifestService = manifestService;
        this.clock = clock;
    }

    /**
     * Submits the request and returns the downloaded result.
     * @param request Validated request
     * @return Artifact in the request's output directory
     * @throws SlicerException subtype describing why the run did not produce an artifact
     */
    public Artifact run(JobRequest request) {
        long start = clock.millis();
        logger.info("Starting job '{}' for region {} ({})", request.jobName(), request.region(), request.fileFormat().label());
        Artifact artifact = null;
        RuntimeException failure = null;
        try {
            artifact = execute(request);
            return artifact;
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            Duration elapsed = Duration.ofMillis(clock.millis() - start);
            RunOutcome outcome = RunOutcome.of(failure);
            historyService.record(request, outcome, failure == null ? "" : failure.getMessage(), artifact, elapsed);
            if (failure == null) {
                writeManifest(request, artifact, elapsed);
                logger.info("Job '{}' completed in {}: {}", request.jobName(), Utils.formatDuration(elapsed), artifact.path());
            } else {
                logger.error("Job '{}' ended with {}: {}", request.jobName(), outcome, failure.getMessage());
            }
        }
    }

    private Artifact execute(JobRequest request) {
        BrowserSession session = sessionService.open(SessionConfig.of(request, config));
        try {
            formService.fillAndSubmit(session, request);
            CompletionResult result = completionMonitor.awaitCompletion(session, request.timeout());
            switch (result.state()) {
                case FAILED:
                    throw new JobFailedException(request.jobName(), result.failureMessage(), result.elapsed());
                case TIMED_OUT:
                    throw new JobTimedOutException(request.jobName(), result.elapsed(), request.timeout());
                default:
                    return artifactService.fetchResult(session, request, result.state());
            }
        } finally {
            sessionService.close(session);
        }
    }

    private void writeManifest(JobRequest request, Artifact artifact, Duration elapsed) {
        try {
            manifestService.write(request, artifact, elapsed);
        } catch (IOException e) {
            logger.warn("Failed to write manifest for '{}': {}", request.jobName(), e.getMessage());
        }
    }
}
