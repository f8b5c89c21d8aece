package org.puneet.sortbench.report;

import java.util.Locale;

/**
 * Output formats supported for the final report.
 */
public enum ReportFormat {
    TEXT,
    CSV;

    /**
     * Parses a format name case-insensitively.
     *
     * @param value format name such as {@code text} or {@code csv}
     * @return the matching format
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ReportFormat parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Report format cannot be null or empty");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown report format: " + value, e);
        }
    }

    /**
     * Creates the renderer for this format.
     *
     * @return a new renderer
     */
    public ReportRenderer createRenderer() {
        return switch (this) {
            case TEXT -> new TextReportRenderer();
            case CSV -> new CsvReportRenderer();
        };
    }
}
