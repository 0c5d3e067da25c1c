package com.ensemblslicer.runner;

import java.time.Duration;

/**
 * The server reported the job as failed.
 */
public class JobFailedException extends SlicerException {
    private final String serverMessage;
    private final Duration elapsed;

    public JobFailedException(String jobName, String serverMessage, Duration elapsed) {
        super("Job '" + jobName + "' failed after " + Utils.formatDuration(elapsed) + ": " + serverMessage);
        this.serverMessage = serverMessage;
        this.elapsed = elapsed;
    }

    public String serverMessage() {
        return serverMessage;
    }

    public Duration elapsed() {
        return elapsed;
    }
}
