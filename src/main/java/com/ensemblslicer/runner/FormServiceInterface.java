package com.ensemblslicer.runner;

/**
 * Interface for populating and submitting the Data Slicer form.
 */
public interface FormServiceInterface {
    /**
     * Navigates to the form, sets every field the request applies to, then clicks run.
     * @param session Open browser session
     * @param request Validated job parameters
     * @throws FormInteractionException naming the field that never became ready or rejected its value
     */
    void fillAndSubmit(BrowserSession session, JobRequest request);
}
