package com.gauchoplan.backend.support;

import com.gauchoplan.backend.modules.catalog.application.CatalogService;
import com.gauchoplan.backend.modules.catalog.application.CatalogService.CourseCommand;
import com.gauchoplan.backend.modules.catalog.application.CatalogService.OfferingCommand;
import com.gauchoplan.backend.modules.catalog.application.CourseView;
import com.gauchoplan.backend.modules.catalog.application.OfferingView;

import org.springframework.stereotype.Component;

@Component
public class TestCatalogFactory {

    public static final String STATS_MAJOR = "Statistics & Data Science";

    private final CatalogService catalogService;

    public TestCatalogFactory(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    public CourseView ensureCourse(String major, String courseCode, String title, String units) {
        return catalogService.upsertCourse(new CourseCommand(
                major, courseCode, title, units, null, null, null, null, null));
    }

    public CourseView ensureStatsCourse(String courseCode, String title) {
        return ensureCourse(STATS_MAJOR, courseCode, title, "4.0");
    }

    public OfferingView offer(CourseView course, String quarter, String year, String status) {
        return catalogService.addOffering(course.id(),
                new OfferingCommand(quarter, year, status, null, null, null, null));
    }
}
