package com.ensemblslicer.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fills the Data Slicer form from a {@link JobRequest} and submits it.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Opens the target URL and dismisses the consent banner when one is shown.</li>
 *   <li>Sets each field once, in page order, after waiting for the control to become visible.</li>
 *   <li>Enumerated fields are chosen by option label or radio value, never typed.</li>
 *   <li>After each interaction waits for the loading overlay to clear; the form reloads parts of itself asynchronously.</li>
 *   <li>Clicks run only once every field has been set.</li>
 * </ul>
 *
 * @author Data Slicer Runner Team
 * @since 1.0
 */
public class FormService implements FormServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(FormService.class);

    private final SlicerConfig config;

    public FormService(SlicerConfig config) {
        this.config = config == null ? SlicerConfig.defaults() : config;
    }

    @Override
    public void fillAndSubmit(BrowserSession session, JobRequest request) {
        PageDriver driver = session.driver();

        logger.info("Opening website ensembl data slicer...");
        try {
            driver.navigate(config.targetUrl());
        } catch (RuntimeException e) {
            throw new FormInteractionException("page", "could not open " + config.targetUrl() + ": " + e.getMessage(), e);
        }
        settle(driver);
        logger.info("Page title: {}", driver.title());

        dismissConsentBanner(driver);

        logger.info("Setting job name...");
        fill(driver, FormFieldRegistry.JOB_NAME, request.jobName());

        logger.info("Setting file format...");
        select(driver, FormFieldRegistry.FILE_FORMAT, List.of(request.fileFormat().label()));

        logger.info("Setting region lookup...");
        fill(driver, FormFieldRegistry.REGION, request.region().toString());

        logger.info("Setting {} file URL...", request.fileFormat().label());
        fill(driver, request.fileFormat().sourceField(), request.sourceUrl());

        logger.info("Setting filters ({})...", request.filterMode().formValue());
        clickControl(driver, FormFieldRegistry.FILTER, FormFieldRegistry.filterSelector(request.filterMode()));

        if (request.filterMode() == FilterMode.POPULATIONS) {
            logger.info("Setting sample-population mapping file URL...");
            fill(driver, FormFieldRegistry.MAPPING_URL, request.mappingUrl());
            // leaving the URL input makes the form fetch the panel and rebuild the population list
            click(driver, FormFieldRegistry.MASTHEAD);
            logger.info("Setting population...");
            select(driver, FormFieldRegistry.POPULATIONS, request.populations());
        } else if (request.filterMode() == FilterMode.INDIVIDUALS) {
            logger.info("Setting individuals...");
            fill(driver, FormFieldRegistry.INDIVIDUALS, String.join(",", request.individuals()));
        }

        logger.info("Running...");
        click(driver, FormFieldRegistry.RUN_BUTTON);
    }

    private void fill(PageDriver driver, String fieldName, String value) {
        String selector = awaitReady(driver, fieldName, FormFieldRegistry.getField(fieldName).selector);
        try {
            driver.fill(selector, value);
        } catch (RuntimeException e) {
            throw new FormInteractionException(fieldName, "could not set value: " + e.getMessage(), e);
        }
        settle(driver);
    }

    private void select(PageDriver driver, String fieldName, List<String> labels) {
        String selector = awaitReady(driver, fieldName, FormFieldRegistry.getField(fieldName).selector);
        try {
            driver.selectOptions(selector, labels);
        } catch (RuntimeException e) {
            throw new FormInteractionException(fieldName, "could not select " + labels + ": " + e.getMessage(), e);
        }
        settle(driver);
    }

    private void click(PageDriver driver, String fieldName) {
        clickControl(driver, fieldName, FormFieldRegistry.getField(fieldName).selector);
    }

    private void clickControl(PageDriver driver, String fieldName, String selector) {
        awaitReady(driver, fieldName, selector);
        try {
            driver.click(selector);
        } catch (RuntimeException e) {
            throw new FormInteractionException(fieldName, "could not click: " + e.getMessage(), e);
        }
        settle(driver);
    }

    private String awaitReady(PageDriver driver, String fieldName, String selector) {
        if (!driver.waitForVisible(selector, config.fieldWait())) {
            throw new FormInteractionException(fieldName,
                "not ready after " + Utils.formatDuration(config.fieldWait()) + " (selector " + selector + ")");
        }
        return selector;
    }

    private void dismissConsentBanner(PageDriver driver) {
        if (driver.waitForVisible(FormFieldRegistry.GDPR_AGREE, config.settleWait())) {
            logger.info("Closing agreement...");
            try {
                driver.click(FormFieldRegistry.GDPR_AGREE);
                settle(driver);
            } catch (RuntimeException e) {
                logger.warn("Could not dismiss consent banner: {}", e.getMessage());
            }
        } else {
            logger.debug("No consent banner shown.");
        }
    }

    /**
     * Non-fatal wait for the loading overlay to clear.
     */
    private void settle(PageDriver driver) {
        if (!driver.waitForHidden(FormFieldRegistry.SPINNER, config.settleWait())) {
            logger.debug("Loading overlay still visible after {}", Utils.formatDuration(config.settleWait()));
        }
    }
}
