package com.ensemblslicer.runner;

/**
 * Sample filters offered by the form; the form value is the value attribute of the matching radio button.
 */
public enum FilterMode {
    NONE("null"),
    INDIVIDUALS("individuals"),
    POPULATIONS("populations");

    private final String formValue;

    FilterMode(String formValue) {
        this.formValue = formValue;
    }

    public String formValue() {
        return formValue;
    }

    public static FilterMode fromFormValue(String text) {
        if (text != null) {
            String t = text.trim();
            for (FilterMode m : values()) {
                if (m.formValue.equalsIgnoreCase(t) || m.name().equalsIgnoreCase(t)) return m;
            }
        }
        throw new IllegalArgumentException("Unsupported filter '" + text + "' (expected null, individuals, or populations)");
    }
}
