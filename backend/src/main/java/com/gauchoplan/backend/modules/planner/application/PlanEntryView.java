package com.gauchoplan.backend.modules.planner.application;

import java.time.OffsetDateTime;

import com.gauchoplan.backend.modules.catalog.domain.Term;
import com.gauchoplan.backend.modules.planner.domain.UserPlanEntry;

/**
 * A plan entry as shown to its owner. {@code catalogued} tells whether the copied course code
 * currently matches any catalog course.
 */
public record PlanEntryView(
        Long id,
        String userId,
        Term term,
        String courseCode,
        Integer units,
        String type,
        OffsetDateTime createdAt,
        boolean catalogued
) {

    public static PlanEntryView from(UserPlanEntry entry, boolean catalogued) {
        return new PlanEntryView(
                entry.getId(),
                entry.getUserId(),
                entry.getTerm(),
                entry.getCourseCode(),
                entry.getUnits(),
                entry.getEntryType(),
                entry.getCreatedAt(),
                catalogued
        );
    }
}
