package com.gauchoplan.backend.modules.catalog.domain;

import java.util.Locale;

/**
 * Canonical spelling of course codes and majors before they are stored or looked up.
 */
public final class CourseCodes {

    private CourseCodes() {
    }

    /**
     * {@code "pstat  120a "} becomes {@code "PSTAT 120A"}.
     */
    public static String normalize(String courseCode) {
        if (courseCode == null) {
            return null;
        }
        return courseCode.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    }

    public static String normalizeMajor(String major) {
        if (major == null) {
            return null;
        }
        return major.trim().replaceAll("\\s+", " ");
    }
}
