package com.ensemblslicer.runner;

/**
 * How a run ended, as recorded in the run history and mapped to a process exit code.
 */
public enum RunOutcome {
    COMPLETED(0),
    INVALID_REQUEST(1),
    FAILED(2),
    TIMED_OUT(3),
    ENVIRONMENT_ERROR(4),
    FORM_ERROR(5),
    ARTIFACT_NOT_FOUND(6),
    /** A fault outside the error taxonomy, such as a crashed page or a bug. */
    UNEXPECTED_ERROR(7);

    private final int exitCode;

    RunOutcome(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }

    public static RunOutcome of(Throwable error) {
        if (error == null) return COMPLETED;
        if (error instanceof JobFailedException) return FAILED;
        if (error instanceof JobTimedOutException) return TIMED_OUT;
        if (error instanceof FormInteractionException) return FORM_ERROR;
        if (error instanceof ArtifactNotFoundException) return ARTIFACT_NOT_FOUND;
        if (error instanceof EnvironmentException) return ENVIRONMENT_ERROR;
        if (error instanceof IllegalArgumentException) return INVALID_REQUEST;
        return UNEXPECTED_ERROR;
    }
}
