package com.gauchoplan.backend.modules.catalog.application;

import com.gauchoplan.backend.modules.catalog.domain.Course;
import com.gauchoplan.backend.modules.catalog.domain.CourseLevel;

public record CourseView(
        Long id,
        String major,
        String courseCode,
        String title,
        String units,
        CourseLevel level,
        String description,
        String prerequisites,
        String additionalInfo,
        String catalogUrl
) {

    public static CourseView from(Course course) {
        return new CourseView(
                course.getId(),
                course.getMajor(),
                course.getCourseCode(),
                course.getTitle(),
                course.getUnits(),
                course.getLevel(),
                course.getDescription(),
                course.getPrerequisites(),
                course.getAdditionalInfo(),
                course.getCatalogUrl()
        );
    }
}
