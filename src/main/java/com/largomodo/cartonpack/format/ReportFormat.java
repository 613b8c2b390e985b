package com.largomodo.cartonpack.format;

/**
 * Output formats for rendering a packing result.
 */
public enum ReportFormat {
    TEXT,   // Human-readable table
    CSV;    // One line per plan entry, for spreadsheets and scripts

    /**
     * Returns the formatter that renders this format.
     */
    public ReportFormatter formatter() {
        return switch (this) {
            case TEXT -> new TextReportFormatter();
            case CSV -> new CsvReportFormatter();
        };
    }
}
