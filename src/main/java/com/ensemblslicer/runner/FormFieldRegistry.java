package com.ensemblslicer.runner;

import java.util.List;

/**
 * Central registry of the Data Slicer page elements, keyed by logical field name.
 * <p>
 * Input ids follow the form's generated {@code BgjfIUsr_N} scheme. When the page markup changes, update the
 * selectors here and every consumer picks them up.
 */
public final class FormFieldRegistry {
    private FormFieldRegistry() {}

    public static final String JOB_NAME = "jobName";
    public static final String FILE_FORMAT = "fileFormat";
    public static final String REGION = "region";
    public static final String ALIGNMENT_URL = "alignmentUrl";
    public static final String GENOTYPE_URL = "genotypeUrl";
    public static final String FILTER = "filter";
    public static final String INDIVIDUALS = "individuals";
    public static final String MAPPING_URL = "mappingUrl";
    public static final String MASTHEAD = "masthead";
    public static final String POPULATIONS = "populations";
    public static final String RUN_BUTTON = "runButton";

    /** Loading overlay shown while the form fetches remote data. */
    public static final String SPINNER = "div.overlay-spinner.spinner";
    public static final String GDPR_AGREE = "a#gdpr-agree";
    public static final String VIEW_RESULTS = "a:text-is('[View results]')";
    public static final String DOWNLOAD_RESULTS = "a:text-is('Download results file')";
    public static final String JOB_ERROR = "._ticket_table .job-status-failed, div.error:visible, a:text-is('[View error]')";

    private static final List<FormField> FIELDS = List.of(
        new FormField(JOB_NAME, "input#BgjfIUsr_1"),
        new FormField(FILE_FORMAT, "select#BgjfIUsr_5"),
        new FormField(REGION, "input#BgjfIUsr_6"),
        new FormField(ALIGNMENT_URL, "input#BgjfIUsr_8"),
        new FormField(GENOTYPE_URL, "input#BgjfIUsr_10"),
        new FormField(FILTER, "input[type='radio'][value='%s']"),
        new FormField(INDIVIDUALS, "textarea#BgjfIUsr_14, input#BgjfIUsr_14"),
        new FormField(MAPPING_URL, "input#BgjfIUsr_12"),
        new FormField(MASTHEAD, "div#masthead"),
        new FormField(POPULATIONS, "select#BgjfIUsr_16"),
        new FormField(RUN_BUTTON, "input.run_button.fbutton")
    );

    /**
     * Returns the FormField for a given field name.
     * @throws IllegalArgumentException if the name is not registered
     */
    public static FormField getField(String name) {
        for (FormField f : FIELDS) if (f.fieldName.equals(name)) return f;
        throw new IllegalArgumentException("Unknown form field: " + name);
    }

    /**
     * Selector for the filter radio button carrying the given form value.
     */
    public static String filterSelector(FilterMode mode) {
        return String.format(getField(FILTER).selector, mode.formValue());
    }
}
