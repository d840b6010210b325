package com.gauchoplan.backend.modules.planner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import jakarta.validation.ConstraintViolationException;

import com.gauchoplan.backend.global.error.ProblemException;
import com.gauchoplan.backend.global.error.ProblemKind;
import com.gauchoplan.backend.modules.catalog.domain.Quarter;
import com.gauchoplan.backend.modules.planner.application.PlanEntryView;
import com.gauchoplan.backend.modules.planner.application.PlannerService;
import com.gauchoplan.backend.modules.planner.application.PlannerService.PlanEntryCommand;
import com.gauchoplan.backend.modules.planner.application.PlannerService.PlanEntryUpdate;
import com.gauchoplan.backend.modules.planner.application.TermPlanView;
import com.gauchoplan.backend.modules.planner.domain.PlanLoad;
import com.gauchoplan.backend.support.AbstractPostgresIntegrationTest;
import com.gauchoplan.backend.support.TestCatalogFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

@SpringBootTest
class PlannerServiceIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String ALICE = "alice@ucsb.edu";
    private static final String BOB = "bob@ucsb.edu";

    @Autowired
    private PlannerService plannerService;

    @Autowired
    private TestCatalogFactory catalogFactory;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    void entryForCourseMissingFromCatalogIsAccepted() {
        PlanEntryView entry = plannerService.addEntry(
                new PlanEntryCommand(ALICE, "Winter", "2026", "ghost 101", 4, "Elective"));

        assertThat(entry.id()).isNotNull();
        assertThat(entry.courseCode()).isEqualTo("GHOST 101");
        assertThat(entry.catalogued()).isFalse();
        assertThat(entry.createdAt()).isNotNull();
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM user_plans", Integer.class)).isEqualTo(1);
    }

    @Test
    void catalogueFlagFollowsTheCatalog() {
        PlanEntryView entry = plannerService.addEntry(
                new PlanEntryCommand(ALICE, "Winter", "2026", "PSTAT 120A", 4, "Major"));
        assertThat(entry.catalogued()).isFalse();

        catalogFactory.ensureStatsCourse("PSTAT 120A", "PROB & STATISTICS");

        assertThat(plannerService.listEntries(ALICE))
                .singleElement()
                .satisfies(view -> assertThat(view.catalogued()).isTrue());
    }

    @Test
    void termPlanTotalsUnitsAndClassifiesLoad() {
        plannerService.addEntry(new PlanEntryCommand(ALICE, "Winter", "2026", "PSTAT 120A", 4, "Major"));
        plannerService.addEntry(new PlanEntryCommand(ALICE, "Winter", "2026", "PSTAT 126", 4, "Major"));
        plannerService.addEntry(new PlanEntryCommand(ALICE, "Winter", "2026", "WRIT 2", 4, "GE"));
        plannerService.addEntry(new PlanEntryCommand(ALICE, "Winter", "2026", "PHYS 6AL", null, "GE"));
        plannerService.addEntry(new PlanEntryCommand(ALICE, "Spring", "2026", "PSTAT 120B", 4, "Major"));
        plannerService.addEntry(new PlanEntryCommand(BOB, "Winter", "2026", "PSTAT 120A", 4, "Major"));

        TermPlanView plan = plannerService.getTermPlan(ALICE, "winter", "2026");

        assertThat(plan.entries()).extracting(PlanEntryView::courseCode)
                .containsExactly("PSTAT 120A", "PSTAT 126", "WRIT 2", "PHYS 6AL");
        assertThat(plan.totalUnits()).isEqualTo(12);
        assertThat(plan.load()).isEqualTo(PlanLoad.LIGHT);
    }

    @Test
    void entriesAreListedInCalendarOrder() {
        plannerService.addEntry(new PlanEntryCommand(ALICE, "Fall", "2026", "PSTAT 160A", 4, "Major"));
        plannerService.addEntry(new PlanEntryCommand(ALICE, "Spring", "2026", "PSTAT 120B", 4, "Major"));
        plannerService.addEntry(new PlanEntryCommand(ALICE, "Winter", "2026", "PSTAT 120A", 4, "Major"));
        plannerService.addEntry(new PlanEntryCommand(ALICE, "Fall", "2025", "PSTAT 10", 5, "Major"));

        List<PlanEntryView> entries = plannerService.listEntries(ALICE);

        assertThat(entries).extracting(PlanEntryView::courseCode)
                .containsExactly("PSTAT 10", "PSTAT 120A", "PSTAT 120B", "PSTAT 160A");
    }

    @Test
    void onlyTheOwnerCanMoveOrRemoveAnEntry() {
        PlanEntryView entry = plannerService.addEntry(
                new PlanEntryCommand(ALICE, "Winter", "2026", "PSTAT 120A", 4, "Major"));

        assertThatThrownBy(() -> plannerService.removeEntry(BOB, entry.id()))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(ProblemKind.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo(PlannerService.ENTRY_NOT_FOUND);
                });

        PlanEntryView moved = plannerService.updateEntry(ALICE, entry.id(),
                new PlanEntryUpdate("Spring", "2026", null, 4, "Major"));
        assertThat(moved.term().quarter()).isEqualTo(Quarter.SPRING);
        assertThat(moved.courseCode()).isEqualTo("PSTAT 120A");
        assertThat(jdbcTemplate.queryForObject(
                "SELECT quarter FROM user_plans WHERE id = ?", String.class, entry.id())).isEqualTo("Spring");

        plannerService.removeEntry(ALICE, entry.id());
        assertThat(plannerService.listEntries(ALICE)).isEmpty();
    }

    @Test
    void negativeUnitsAreRejected() {
        assertThatThrownBy(() -> plannerService.addEntry(
                new PlanEntryCommand(ALICE, "Winter", "2026", "PSTAT 120A", -4, "Major")))
                .isInstanceOf(ConstraintViolationException.class);
    }

    @Test
    void unitsAbovePerCourseLimitAreRejected() {
        assertThatThrownBy(() -> plannerService.addEntry(
                new PlanEntryCommand(ALICE, "Winter", "2026", "PSTAT 197A", Integer.MAX_VALUE, "Major")))
                .isInstanceOf(ConstraintViolationException.class);

        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM user_plans", Integer.class);
        assertThat(count).isZero();
    }
}
