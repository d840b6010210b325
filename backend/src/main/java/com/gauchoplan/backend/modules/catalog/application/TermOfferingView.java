package com.gauchoplan.backend.modules.catalog.application;

public record TermOfferingView(CourseView course, OfferingView offering) {
}
