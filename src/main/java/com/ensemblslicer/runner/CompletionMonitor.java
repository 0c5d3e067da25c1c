package com.ensemblslicer.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Polls the page after submission until the job reaches a terminal state or the deadline passes.
 * <p>
 * The form exposes no job id or status API, so the state is read from the page itself:
 * <ul>
 *   <li>An error marker in the ticket list means FAILED; its text becomes the failure message.</li>
 *   <li>A clickable {@code [View results]} link means COMPLETED.</li>
 *   <li>Anything else, including a page that cannot be read, means PENDING.</li>
 * </ul>
 * The page is inspected at a fixed interval. No sleep extends past the deadline, so the monitor returns
 * TIMED_OUT no later than one poll interval after the timeout.
 *
 * @author Data Slicer Runner Team
 * @since 1.0
 */
public class CompletionMonitor {
    private static final Logger logger = LoggerFactory.getLogger(CompletionMonitor.class);
    static final String UNKNOWN_FAILURE = "Job failed without an error message on the page";

    private final Duration pollInterval;
    private final Clock clock;
    private final Sleeper sleeper;

    public CompletionMonitor(SlicerConfig config) {
        this(config.pollInterval(), Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public CompletionMonitor(Duration pollInterval, Clock clock, Sleeper sleeper) {
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        this.pollInterval = pollInterval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Waits for the submitted job to finish.
     * @param session Session whose page shows the submitted job
     * @param timeout Maximum time to wait, measured from this call
     * @return Terminal result: COMPLETED, FAILED (with message), or TIMED_OUT
     */
    public CompletionResult awaitCompletion(BrowserSession session, Duration timeout) {
        PageDriver driver = session.driver();
        long start = clock.millis();
        long deadline = start + timeout.toMillis();
        JobState state = JobState.SUBMITTED;
        logger.info("Job {}; waiting for the results (timeout {})...", state, Utils.formatDuration(timeout));
        int polls = 0;
        while (true) {
            polls++;
            CompletionResult terminal = inspect(driver, start, polls);
            if (terminal != null) {
                return terminal;
            }
            if (state == JobState.SUBMITTED) {
                state = JobState.PENDING;
                logger.info("Job {} (in the queue)...", state);
            }
            long now = clock.millis();
            if (now >= deadline) {
                Duration elapsed = Duration.ofMillis(now - start);
                logger.warn("Job still pending after {}; giving up.", Utils.formatDuration(elapsed));
                return CompletionResult.timedOut(elapsed);
            }
            long pause = Math.min(pollInterval.toMillis(), deadline - now);
            logger.debug("Check {} pending; next in {} ms", polls, pause);
            try {
                sleeper.sleep(Duration.ofMillis(pause));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                Duration elapsed = elapsedSince(start);
                logger.warn("Interrupted while waiting for the job; treating as timed out after {}", Utils.formatDuration(elapsed));
                return CompletionResult.timedOut(elapsed);
            }
        }
    }

    /**
     * @return Terminal result shown on the page, or null while the job is still pending
     */
    private CompletionResult inspect(PageDriver driver, long start, int polls) {
        try {
            if (driver.isVisible(FormFieldRegistry.JOB_ERROR)) {
                String message = driver.textOf(FormFieldRegistry.JOB_ERROR);
                Duration elapsed = elapsedSince(start);
                logger.error("Job failed after {}: {}", Utils.formatDuration(elapsed), message);
                return CompletionResult.failed(message == null || message.isBlank() ? UNKNOWN_FAILURE : message, elapsed);
            }
            if (driver.isVisible(FormFieldRegistry.VIEW_RESULTS)) {
                Duration elapsed = elapsedSince(start);
                logger.info("Results are ready after {} ({} checks).", Utils.formatDuration(elapsed), polls);
                return CompletionResult.completed(elapsed);
            }
        } catch (RuntimeException e) {
            // the ticket list reloads while the job runs; a failed read counts as still pending
            logger.warn("Could not read job status on check {}: {}", polls, e.getMessage());
        }
        return null;
    }

    private Duration elapsedSince(long start) {
        return Duration.ofMillis(clock.millis() - start);
    }
}
