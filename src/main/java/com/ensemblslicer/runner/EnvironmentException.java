package com.ensemblslicer.runner;

/**
 * The browser, its driver, or the download directory is unavailable.
 */
public class EnvironmentException extends SlicerException {
    public EnvironmentException(String message) {
        super(message);
    }

    public EnvironmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
