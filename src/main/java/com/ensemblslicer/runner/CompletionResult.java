package com.ensemblslicer.runner;

import java.time.Duration;

/**
 * Terminal outcome of {@link CompletionMonitor#awaitCompletion}. {@code failureMessage} is only set for FAILED.
 */
public record CompletionResult(JobState state, String failureMessage, Duration elapsed) {
    public static CompletionResult completed(Duration elapsed) {
        return new CompletionResult(JobState.COMPLETED, null, elapsed);
    }

    public static CompletionResult failed(String message, Duration elapsed) {
        return new CompletionResult(JobState.FAILED, message, elapsed);
    }

    public static CompletionResult timedOut(Duration elapsed) {
        return new CompletionResult(JobState.TIMED_OUT, null, elapsed);
    }
}
