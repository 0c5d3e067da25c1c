package com.ensemblslicer.runner;

/**
 * A form control never became ready, or rejected its value.
 */
public class FormInteractionException extends SlicerException {
    private final String fieldName;

    public FormInteractionException(String fieldName, String message) {
        super("Form field '" + fieldName + "': " + message);
        this.fieldName = fieldName;
    }

    public FormInteractionException(String fieldName, String message, Throwable cause) {
        super("Form field '" + fieldName + "': " + message, cause);
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }
}
