package com.gauchoplan.backend.modules.catalog.domain;

import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A quarter of an optional academic year. Offerings and plan entries are both keyed by term.
 */
public record Term(Quarter quarter, String year) implements Comparable<Term> {

    private static final Pattern YEAR_PATTERN = Pattern.compile("\\d{4}");

    /**
     * Chronological order; terms without a year sort after dated ones.
     */
    public static final Comparator<Term> CHRONOLOGICAL = Comparator
            .comparing(Term::year, Comparator.nullsLast(Comparator.<String>naturalOrder()))
            .thenComparing(Term::quarter);

    public Term {
        Objects.requireNonNull(quarter, "quarter is required");
        if (year != null) {
            year = year.trim();
            if (year.isEmpty()) {
                year = null;
            } else if (!YEAR_PATTERN.matcher(year).matches()) {
                throw new IllegalArgumentException("Year must have four digits: " + year);
            }
        }
    }

    public static Term of(String quarter, String year) {
        return new Term(Quarter.parse(quarter), year);
    }

    @Override
    public int compareTo(Term other) {
        return CHRONOLOGICAL.compare(this, other);
    }

    @Override
    public String toString() {
        return year == null ? quarter.getDisplayName() : quarter.getDisplayName() + " " + year;
    }
}
