package com.formshift.core.report;

import java.util.Locale;

public enum ReportFormat {

    MARKDOWN("md"),
    JSON("json"),
    CSV("csv");

    private final String extension;

    ReportFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /** Accepts the enum name or the file extension, case-insensitive. */
    public static ReportFormat fromString(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (ReportFormat format : values()) {
            if (format.extension.equals(v) || format.name().toLowerCase(Locale.ROOT).equals(v)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown report format: " + value + " (expected md, json or csv)");
    }

    /** Format implied by a file name's extension, Markdown when there is none. */
    public static ReportFormat forFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return MARKDOWN;
        }
        try {
            return fromString(fileName.substring(dot + 1));
        } catch (IllegalArgumentException e) {
            return MARKDOWN;
        }
    }
}
