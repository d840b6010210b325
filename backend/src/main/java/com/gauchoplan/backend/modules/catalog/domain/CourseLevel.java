package com.gauchoplan.backend.modules.catalog.domain;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public enum CourseLevel {
    LOWER("Lower"),
    UPPER("Upper"),
    GRAD("Grad");

    private static final Pattern COURSE_NUMBER = Pattern.compile("\\b(\\d{1,3})[A-Z]{0,3}\\s*$");

    private final String displayName;

    CourseLevel(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static CourseLevel parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Course level must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("GRADUATE")) {
            return GRAD;
        }
        for (CourseLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown course level: " + value);
    }

    /**
     * Reads a level stored by any writer of the catalog. Besides the exact names, values that
     * start with one of them ("Upper Division", "Graduate") are accepted.
     */
    public static Optional<CourseLevel> fromStoredValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (CourseLevel level : values()) {
            if (normalized.startsWith(level.name())) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    /**
     * Derives the level from the trailing course number: 1-99 lower division, 100-199 upper
     * division, 200 and above graduate. {@code "PSTAT 120A"} is upper division.
     */
    public static Optional<CourseLevel> fromCourseCode(String courseCode) {
        if (courseCode == null) {
            return Optional.empty();
        }
        Matcher matcher = COURSE_NUMBER.matcher(CourseCodes.normalize(courseCode));
        if (!matcher.find()) {
            return Optional.empty();
        }
        int number = Integer.parseInt(matcher.group(1));
        if (number <= 0) {
            return Optional.empty();
        }
        if (number < 100) {
            return Optional.of(LOWER);
        }
        if (number < 200) {
            return Optional.of(UPPER);
        }
        return Optional.of(GRAD);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
