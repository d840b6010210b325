package com.gauchoplan.backend.modules.catalog.application;

import com.gauchoplan.backend.modules.catalog.domain.Offering;
import com.gauchoplan.backend.modules.catalog.domain.Term;

public record OfferingView(
        Long id,
        Long courseId,
        Term term,
        String status,
        String notes,
        String instructorName,
        String instructorEmail,
        String meetingPattern
) {

    public static OfferingView from(Offering offering) {
        return new OfferingView(
                offering.getId(),
                offering.getCourse().getId(),
                offering.getTerm(),
                offering.getStatus(),
                offering.getNotes(),
                offering.getInstructorName(),
                offering.getInstructorEmail(),
                offering.getMeetingPattern()
        );
    }
}
