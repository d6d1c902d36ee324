package com.example.magazinetoc.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Editorial layouts the extractor knows how to parse.
 */
public enum Brand {
    NEW_YORKER("newyorker", "The New Yorker"),
    ATLANTIC("atlantic", "The Atlantic"),
    HARPERS("harpers", "Harper's Magazine"),
    UNKNOWN("unknown", "Unknown");

    public static final String AUTO = "auto";

    private final String code;
    private final String displayName;

    Brand(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves a {@code --brand} value. {@code auto} (or blank) yields empty, meaning "detect".
     *
     * @throws IllegalArgumentException for values that name no supported brand
     */
    public static Optional<Brand> fromOption(String value) {
        if (value == null || value.isBlank() || AUTO.equalsIgnoreCase(value.trim())) {
            return Optional.empty();
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (Brand b : values()) {
            if (b != UNKNOWN && b.code.equals(v)) {
                return Optional.of(b);
            }
        }
        throw new IllegalArgumentException("Unsupported brand '" + value + "' (expected auto|newyorker|atlantic|harpers)");
    }
}
