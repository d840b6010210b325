package com.gauchoplan.backend.modules.planner.application;

import java.util.List;

import com.gauchoplan.backend.modules.catalog.domain.Term;
import com.gauchoplan.backend.modules.planner.domain.PlanLoad;

public record TermPlanView(String userId, Term term, List<PlanEntryView> entries, int totalUnits, PlanLoad load) {
}
