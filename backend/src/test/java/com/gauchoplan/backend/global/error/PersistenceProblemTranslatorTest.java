package com.gauchoplan.backend.global.error;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.sql.SQLException;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

class PersistenceProblemTranslatorTest {

    @Test
    void uniqueKeyViolationBecomesConflict() {
        DataIntegrityViolationException violation = violation(
                "ERROR: duplicate key value violates unique constraint \"idx_courses_major_code\"");

        ProblemException problem = PersistenceProblemTranslator.translate(violation);

        assertThat(problem.getKind()).isEqualTo(ProblemKind.CONFLICT);
        assertThat(problem.getCode()).isEqualTo("catalog.course_already_exists");
        assertThat(problem.getCause()).isSameAs(violation);
    }

    @Test
    void orphanOfferingBecomesNotFound() {
        ProblemException problem = PersistenceProblemTranslator.translate(violation(
                "ERROR: insert or update on table \"offerings\" violates foreign key constraint \"fk_offerings_course\""));

        assertThat(problem.getKind()).isEqualTo(ProblemKind.NOT_FOUND);
        assertThat(problem.getCode()).isEqualTo("catalog.course_not_found");
    }

    @Test
    void unknownConstraintIsRethrown() {
        DataIntegrityViolationException violation = violation(
                "ERROR: null value in column \"title\" of relation \"courses\" violates not-null constraint");

        assertThat(PersistenceProblemTranslator.violatedConstraint(violation)).isNull();
        assertThatThrownBy(() -> PersistenceProblemTranslator.translate(violation)).isSameAs(violation);
    }

    private static DataIntegrityViolationException violation(String sqlMessage) {
        return new DataIntegrityViolationException("could not execute statement", new SQLException(sqlMessage));
    }
}
