package com.gauchoplan.backend.modules.catalog.application;

import java.util.List;

/**
 * A course with every offering it has, in chronological order. The list is empty for courses
 * that were never scheduled.
 */
public record CatalogEntryView(CourseView course, List<OfferingView> offerings) {
}
