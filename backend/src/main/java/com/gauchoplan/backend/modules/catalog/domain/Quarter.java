package com.gauchoplan.backend.modules.catalog.domain;

import java.util.Locale;

/**
 * Academic quarter. Declared in calendar order within a year.
 */
public enum Quarter {
    WINTER("Winter"),
    SPRING("Spring"),
    SUMMER("Summer"),
    FALL("Fall");

    private final String displayName;

    Quarter(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Parses user or catalog input such as {@code " winter "} or {@code "WINTER"}.
     *
     * @throws IllegalArgumentException when the value names no quarter
     */
    public static Quarter parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Quarter must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Quarter quarter : values()) {
            if (quarter.name().equals(normalized)) {
                return quarter;
            }
        }
        throw new IllegalArgumentException("Unknown quarter: " + value);
    }

    /**
     * Reads a quarter stored by any writer of the catalog. The first word decides, so
     * {@code "Fall Quarter"} and {@code "FALL 2025"} are both {@link #FALL}.
     *
     * @throws IllegalArgumentException when the first word names no quarter
     */
    public static Quarter fromStoredValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Quarter must not be blank");
        }
        String firstWord = value.trim().split("\\s+", 2)[0];
        try {
            return parse(firstWord);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown quarter: " + value, ex);
        }
    }

    @Override
    public String toString() {
        return displayName;
    }
}
