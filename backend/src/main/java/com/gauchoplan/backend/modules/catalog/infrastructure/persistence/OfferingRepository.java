package com.gauchoplan.backend.modules.catalog.infrastructure.persistence;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.gauchoplan.backend.modules.catalog.domain.Offering;
import com.gauchoplan.backend.modules.catalog.domain.Quarter;

public interface OfferingRepository extends JpaRepository<Offering, Long> {

    List<Offering> findByCourseIdAndAcademicYearAndQuarter(Long courseId, String academicYear, Quarter quarter);

    List<Offering> findByCourseIdAndAcademicYearIsNullAndQuarter(Long courseId, Quarter quarter);

    @Query("""
            select o
              from Offering o
              join fetch o.course c
             where c.major = :major
               and o.quarter = :quarter
               and o.academicYear = :year
             order by c.courseCode, o.id
            """)
    List<Offering> findTermOfferings(
            @Param("major") String major,
            @Param("quarter") Quarter quarter,
            @Param("year") String year
    );

    @Query("""
            select o
              from Offering o
              join fetch o.course c
             where c.major = :major
               and o.quarter = :quarter
             order by c.courseCode, o.academicYear, o.id
            """)
    List<Offering> findTermOfferingsAnyYear(@Param("major") String major, @Param("quarter") Quarter quarter);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            delete from Offering o
             where o.quarter = :quarter
               and o.academicYear = :year
               and o.course.id in (select c.id from Course c where c.major = :major)
            """)
    int deleteTermOfferings(
            @Param("major") String major,
            @Param("quarter") Quarter quarter,
            @Param("year") String year
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            delete from Offering o
             where o.quarter = :quarter
               and o.academicYear is null
               and o.course.id in (select c.id from Course c where c.major = :major)
            """)
    int deleteUndatedTermOfferings(@Param("major") String major, @Param("quarter") Quarter quarter);
}
