package com.ensemblslicer.runner;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Genomic region in {@code chrom:start-end} form, 1-based and inclusive.
 */
public record Region(String chromosome, long start, long end) {
    private static final Pattern REGION_PATTERN = Pattern.compile("^\\s*([A-Za-z0-9_.]+):(\\d+)-(\\d+)\\s*$");

    public Region {
        if (chromosome == null || chromosome.isBlank()) {
            throw new IllegalArgumentException("Region chromosome cannot be blank");
        }
        if (start < 1) {
            throw new IllegalArgumentException("Region start must be >= 1 but was " + start);
        }
        if (start > end) {
            throw new IllegalArgumentException("Region start " + start + " is after end " + end);
        }
    }

    /**
     * Parses a region lookup string such as {@code 3:146142335-146301179}.
     * @param text region text
     * @return parsed Region
     * @throws IllegalArgumentException if the text is not {@code chrom:start-end} or start &gt; end
     */
    public static Region parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Region cannot be null");
        }
        Matcher m = REGION_PATTERN.matcher(text);
        if (!m.matches()) {
            throw new IllegalArgumentException("Region '" + text + "' does not match chrom:start-end");
        }
        try {
            return new Region(m.group(1), Long.parseLong(m.group(2)), Long.parseLong(m.group(3)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Region '" + text + "' has an out of range coordinate", e);
        }
    }

    @Override
    public String toString() {
        return chromosome + ":" + start + "-" + end;
    }
}
