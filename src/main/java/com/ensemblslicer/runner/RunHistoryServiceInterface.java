package com.ensemblslicer.runner;

import java.time.Duration;

/**
 * Interface for the per-directory run history ledger.
 */
public interface RunHistoryServiceInterface {
    /**
     * Appends one row describing how a run ended. Never throws; write failures are logged.
     * @param request Request that was run
     * @param outcome How the run ended
     * @param detail Failure message, or empty on success
     * @param artifact Artifact produced, or null
     * @param elapsed Wall-clock duration of the run
     */
    void record(JobRequest request, RunOutcome outcome, String detail, Artifact artifact, Duration elapsed);
}
