package com.ensemblslicer.runner;

/**
 * Job state as inferred from the page.
 * <p>
 * Transitions: SUBMITTED → PENDING → COMPLETED | FAILED, or PENDING → TIMED_OUT once the deadline passes.
 */
public enum JobState {
    SUBMITTED,
    PENDING,
    COMPLETED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMED_OUT;
    }
}
