package com.gauchoplan.backend.modules.planner.domain;

import java.time.OffsetDateTime;

import com.gauchoplan.backend.modules.catalog.domain.Quarter;
import com.gauchoplan.backend.modules.catalog.domain.QuarterConverter;
import com.gauchoplan.backend.modules.catalog.domain.Term;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

/**
 * One course a user placed into one term of their plan. The course code is a copy, not a
 * reference to the catalog, and the user id is whatever identity string the caller supplies.
 */
@Entity
@EntityListeners(AuditingEntityListener.class)
@Table(
        name = "user_plans",
        indexes = @Index(name = "idx_user_plans_user_term", columnList = "user_id, year, quarter")
)
public class UserPlanEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, columnDefinition = "text")
    private String userId;

    @Convert(converter = QuarterConverter.class)
    @Column(name = "quarter", nullable = false, columnDefinition = "text")
    private Quarter quarter;

    @Column(name = "year", columnDefinition = "text")
    private String academicYear;

    @Column(name = "course_code", nullable = false, columnDefinition = "text")
    private String courseCode;

    @Column(name = "units")
    private Integer units;

    @Column(name = "type", columnDefinition = "text")
    private String entryType;

    @CreatedDate
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    public Long getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public Quarter getQuarter() {
        return quarter;
    }

    public String getAcademicYear() {
        return academicYear;
    }

    public Term getTerm() {
        return new Term(quarter, academicYear);
    }

    public void setTerm(Term term) {
        this.quarter = term.quarter();
        this.academicYear = term.year();
    }

    public String getCourseCode() {
        return courseCode;
    }

    public void setCourseCode(String courseCode) {
        this.courseCode = courseCode;
    }

    public Integer getUnits() {
        return units;
    }

    public void setUnits(Integer units) {
        this.units = units;
    }

    public String getEntryType() {
        return entryType;
    }

    public void setEntryType(String entryType) {
        this.entryType = entryType;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
