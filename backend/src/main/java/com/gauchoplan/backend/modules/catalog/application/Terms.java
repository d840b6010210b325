package com.gauchoplan.backend.modules.catalog.application;

import com.gauchoplan.backend.global.error.ProblemException;
import com.gauchoplan.backend.modules.catalog.domain.Term;

/**
 * Turns raw quarter/year input into a {@link Term}, reporting bad input as a problem.
 */
public final class Terms {

    public static final String INVALID_TERM = "term.invalid";

    private Terms() {
    }

    public static Term parse(String quarter, String year) {
        try {
            return Term.of(quarter, year);
        } catch (IllegalArgumentException ex) {
            throw ProblemException.invalid(INVALID_TERM, ex.getMessage());
        }
    }
}
