package com.gauchoplan.backend.modules.catalog.application;

import com.gauchoplan.backend.modules.catalog.domain.Term;

/**
 * Offering counts of one major and term, grouped by enrollment status.
 */
public record TermStatusSummary(String major, Term term, int open, int mixed, int full, int other) {

    public int total() {
        return open + mixed + full + other;
    }
}
