package com.ensemblslicer.runner;

import java.time.Duration;

/**
 * The job was still pending when the request timeout elapsed. Re-running with a longer timeout may succeed.
 */
public class JobTimedOutException extends SlicerException {
    private final Duration elapsed;
    private final Duration timeout;

    public JobTimedOutException(String jobName, Duration elapsed, Duration timeout) {
        super("Job '" + jobName + "' still pending after " + Utils.formatDuration(elapsed)
            + " (timeout " + Utils.formatDuration(timeout) + ")");
        this.elapsed = elapsed;
        this.timeout = timeout;
    }

    public Duration elapsed() {
        return elapsed;
    }

    public Duration timeout() {
        return timeout;
    }
}
