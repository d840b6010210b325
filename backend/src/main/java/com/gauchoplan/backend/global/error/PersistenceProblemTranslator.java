package com.gauchoplan.backend.global.error;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;

/**
 * Maps integrity violations raised by the schema to problems, keyed by constraint name.
 */
public final class PersistenceProblemTranslator {

    private static final Logger log = LoggerFactory.getLogger(PersistenceProblemTranslator.class);

    public static final String COURSE_KEY_INDEX = "idx_courses_major_code";
    public static final String OFFERING_COURSE_FK = "fk_offerings_course";

    private static final Map<String, ProblemException> KNOWN_CONSTRAINTS = Map.of(
            COURSE_KEY_INDEX, ProblemException.conflict(
                    "catalog.course_already_exists", "A course with this major and course code already exists."),
            OFFERING_COURSE_FK, ProblemException.notFound(
                    "catalog.course_not_found", "The offering references a course that does not exist.")
    );

    private PersistenceProblemTranslator() {
    }

    /**
     * Returns the problem for a known constraint, or rethrows the original exception.
     */
    public static ProblemException translate(DataIntegrityViolationException ex) {
        String constraint = violatedConstraint(ex);
        if (constraint == null) {
            throw ex;
        }
        ProblemException template = KNOWN_CONSTRAINTS.get(constraint);
        log.warn("Integrity violation on {} translated to {}", constraint, template.getCode());
        return new ProblemException(template.getKind(), template.getCode(), template.getDetailMessage(), ex);
    }

    static String violatedConstraint(DataIntegrityViolationException ex) {
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root.getMessage();
        if (message == null) {
            return null;
        }
        for (String constraint : KNOWN_CONSTRAINTS.keySet()) {
            if (message.contains(constraint)) {
                return constraint;
            }
        }
        return null;
    }
}
