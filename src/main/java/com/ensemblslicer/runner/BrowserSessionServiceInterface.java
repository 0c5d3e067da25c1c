package com.ensemblslicer.runner;

/**
 * Interface for the browser session lifecycle (launch with a download directory, teardown).
 */
public interface BrowserSessionServiceInterface {
    /**
     * Launches a browser configured to save downloads into the session's directory without prompting.
     * @param config Launch settings
     * @return Open session, exclusively owned by the caller
     * @throws EnvironmentException if the browser or its driver cannot be started, or the directory is missing
     */
    BrowserSession open(SessionConfig config);

    /**
     * Releases the browser process. Safe to call more than once.
     * @param session Session to close; null is ignored
     */
    void close(BrowserSession session);
}
