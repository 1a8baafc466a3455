package com.raditha.livediff.cli;

/**
 * How the comparison is written to standard output.
 */
public enum OutputFormat {
    /**
     * Human-readable report grouped by function and block. The default.
     */
    TEXT,

    /**
     * The comparison report as JSON.
     */
    JSON,

    /**
     * Unified diff of both dumps in canonical form.
     */
    UNIFIED;

    /**
     * Convert a string value to OutputFormat enum.
     *
     * @param value the string value to convert (case-insensitive)
     * @return the corresponding OutputFormat
     * @throws IllegalArgumentException if the value is not a valid format
     */
    public static OutputFormat fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("OutputFormat value cannot be null");
        }

        return switch (value.toLowerCase()) {
            case "text" -> TEXT;
            case "json" -> JSON;
            case "unified" -> UNIFIED;
            default -> throw new IllegalArgumentException(
                    "Invalid output format: " + value + ". Must be: text, json, or unified");
        };
    }

    public String toCliString() {
        return name().toLowerCase();
    }
}
