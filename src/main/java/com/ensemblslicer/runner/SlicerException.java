package com.ensemblslicer.runner;

/**
 * Base type for every failure surfaced by a Data Slicer run. None of these are retried internally.
 */
public class SlicerException extends RuntimeException {
    public SlicerException(String message) {
        super(message);
    }

    public SlicerException(String message, Throwable cause) {
        super(message, cause);
    }
}
