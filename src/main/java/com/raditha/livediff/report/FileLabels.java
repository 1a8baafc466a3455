package com.raditha.livediff.report;

import java.nio.file.Path;

/**
 * Short names for the two sides of a comparison.
 */
public final class FileLabels {

    private FileLabels() {
    }

    /**
     * File name without its last extension, with {@code prefix} removed when it leads the name.
     * {@code debug_master.txt} becomes {@code master}.
     */
    public static String fileLabel(Path path, String prefix) {
        Path fileName = path.getFileName();
        String stem = fileName == null ? path.toString() : fileName.toString();
        int dot = stem.lastIndexOf('.');
        if (dot > 0) {
            stem = stem.substring(0, dot);
        }
        if (prefix != null && !prefix.isEmpty() && stem.startsWith(prefix)) {
            stem = stem.substring(prefix.length());
        }
        return stem;
    }

    /**
     * The section's own annotation when it has one, the file label otherwise.
     */
    public static String sectionLabel(String description, String fileLabel) {
        if (description != null && !description.isBlank()) {
            return description.strip();
        }
        return fileLabel;
    }

    /**
     * {@code "<left> - <right>"}, as shown next to a function name.
     */
    public static String comparisonHeader(String leftDescription, String leftFileLabel,
            String rightDescription, String rightFileLabel) {
        return sectionLabel(leftDescription, leftFileLabel) + " - " + sectionLabel(rightDescription, rightFileLabel);
    }
}
