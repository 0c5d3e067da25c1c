package com.ensemblslicer.runner;

import java.util.List;
import java.util.Locale;

/**
 * Output formats offered by the Data Slicer form. The label is the visible option text of the format select.
 */
public enum FileFormat {
    VCF("VCF", "genotypeUrl", List.of(".vcf.gz", ".vcf", ".gz")),
    BAM("BAM", "alignmentUrl", List.of(".bam", ".bai"));

    private final String label;
    private final String sourceField;
    private final List<String> extensions;

    FileFormat(String label, String sourceField, List<String> extensions) {
        this.label = label;
        this.sourceField = sourceField;
        this.extensions = extensions;
    }

    public String label() {
        return label;
    }

    /**
     * Logical form field that receives the source file URL for this format.
     */
    public String sourceField() {
        return sourceField;
    }

    public boolean matchesExtension(String filename) {
        if (filename == null) return false;
        String lower = filename.toLowerCase(Locale.ROOT);
        for (String ext : extensions) {
            if (lower.endsWith(ext)) return true;
        }
        return false;
    }

    public static FileFormat fromLabel(String text) {
        if (text != null) {
            for (FileFormat f : values()) {
                if (f.label.equalsIgnoreCase(text.trim())) return f;
            }
        }
        throw new IllegalArgumentException("Unsupported file format '" + text + "' (expected BAM or VCF)");
    }
}
