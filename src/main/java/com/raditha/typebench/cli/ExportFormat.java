package com.raditha.typebench.cli;

import java.util.Locale;

/**
 * Which summary files the CLI writes.
 */
public enum ExportFormat {
    CSV,
    JSON,
    /** CSV and JSON */
    BOTH;

    /**
     * Case-insensitive conversion from the command line.
     *
     * @throws IllegalArgumentException if the value is not csv, json or both
     */
    public static ExportFormat fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Export format cannot be null");
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "csv" -> CSV;
            case "json" -> JSON;
            case "both" -> BOTH;
            default -> throw new IllegalArgumentException(
                    "Export format must be 'csv', 'json', or 'both', got: " + value);
        };
    }

    public boolean writesCsv() {
        return this == CSV || this == BOTH;
    }

    public boolean writesJson() {
        return this == JSON || this == BOTH;
    }
}
