package com.ensemblslicer.runner;

/**
 * A logical Data Slicer form control and the selector that locates it.
 */
public class FormField {
    public final String fieldName;
    public final String selector;

    public FormField(String fieldName, String selector) {
        this.fieldName = fieldName;
        this.selector = selector;
    }

    @Override
    public String toString() {
        return fieldName + " (" + selector + ")";
    }
}
