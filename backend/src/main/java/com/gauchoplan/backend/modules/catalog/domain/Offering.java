package com.gauchoplan.backend.modules.catalog.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.ForeignKey;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

@Entity
@Table(
        name = "offerings",
        indexes = @Index(name = "idx_offerings_course_qtr", columnList = "course_id, year, quarter")
)
public class Offering {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "course_id", nullable = false, foreignKey = @ForeignKey(name = "fk_offerings_course"))
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Course course;

    @Convert(converter = QuarterConverter.class)
    @Column(name = "quarter", nullable = false, columnDefinition = "text")
    private Quarter quarter;

    @Column(name = "year", columnDefinition = "text")
    private String academicYear;

    @Column(name = "status", columnDefinition = "text")
    private String status;

    @Column(name = "notes", columnDefinition = "text")
    private String notes;

    @Column(name = "instructor_name", columnDefinition = "text")
    private String instructorName;

    @Column(name = "instructor_email", columnDefinition = "text")
    private String instructorEmail;

    @Column(name = "meeting_pattern", columnDefinition = "text")
    private String meetingPattern;

    public Long getId() {
        return id;
    }

    public Course getCourse() {
        return course;
    }

    public void setCourse(Course course) {
        this.course = course;
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

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public String getInstructorName() {
        return instructorName;
    }

    public void setInstructorName(String instructorName) {
        this.instructorName = instructorName;
    }

    public String getInstructorEmail() {
        return instructorEmail;
    }

    public void setInstructorEmail(String instructorEmail) {
        this.instructorEmail = instructorEmail;
    }

    public String getMeetingPattern() {
        return meetingPattern;
    }

    public void setMeetingPattern(String meetingPattern) {
        this.meetingPattern = meetingPattern;
    }
}
