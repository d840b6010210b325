package com.gauchoplan.backend.modules.catalog.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.gauchoplan.backend.modules.catalog.domain.Course;

public interface CourseRepository extends JpaRepository<Course, Long> {

    Optional<Course> findByMajorAndCourseCode(String major, String courseCode);

    /**
     * Inserts a bare (major, course_code) row unless one exists. Waits for a concurrent insert of
     * the same key to finish instead of failing on the unique index.
     *
     * @return 1 when this call inserted the row, 0 otherwise
     */
    @Modifying(flushAutomatically = true)
    @Query(value = """
            INSERT INTO courses (major, course_code, title)
            VALUES (:major, :courseCode, :title)
            ON CONFLICT (major, course_code) DO NOTHING
            """, nativeQuery = true)
    int insertKeyIfAbsent(
            @Param("major") String major,
            @Param("courseCode") String courseCode,
            @Param("title") String title
    );

    @Query("select distinct c.courseCode from Course c where c.courseCode in :codes")
    List<String> findExistingCourseCodes(@Param("codes") Collection<String> codes);

    List<Course> findByMajorAndCourseCodeIn(String major, Collection<String> courseCodes);

    @Query("select distinct c.major from Course c order by c.major")
    List<String> findDistinctMajors();

    @Query("""
            select distinct c
              from Course c
              left join fetch c.offerings o
             where c.major = :major
             order by c.courseCode
            """)
    List<Course> findByMajorWithOfferings(@Param("major") String major);
}
