package com.gauchoplan.backend.modules.planner.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;

import com.gauchoplan.backend.modules.catalog.domain.Quarter;
import com.gauchoplan.backend.modules.planner.domain.UserPlanEntry;

public interface UserPlanRepository extends JpaRepository<UserPlanEntry, Long> {

    Optional<UserPlanEntry> findByIdAndUserId(Long id, String userId);

    List<UserPlanEntry> findByUserId(String userId);

    List<UserPlanEntry> findByUserIdAndAcademicYearAndQuarterOrderByCreatedAtAscIdAsc(
            String userId,
            String academicYear,
            Quarter quarter
    );

    List<UserPlanEntry> findByUserIdAndAcademicYearIsNullAndQuarterOrderByCreatedAtAscIdAsc(
            String userId,
            Quarter quarter
    );
}
