package com.example.magazinetoc.model;

import java.util.Locale;

public enum ReportFormat {
    TEXT,
    STRUCTURED;

    public static ReportFormat fromOption(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "text":
            case "plain":
                return TEXT;
            case "structured":
            case "json":
                return STRUCTURED;
            default:
                throw new IllegalArgumentException("Unsupported format '" + value + "' (expected text|structured)");
        }
    }
}
