package com.gauchoplan.backend.modules.catalog.domain;

import java.util.ArrayList;
import java.util.List;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

@Entity
@Table(
        name = "courses",
        uniqueConstraints = @UniqueConstraint(name = "idx_courses_major_code", columnNames = {"major", "course_code"})
)
public class Course {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "major", nullable = false, columnDefinition = "text")
    private String major;

    @Column(name = "course_code", nullable = false, columnDefinition = "text")
    private String courseCode;

    @Column(name = "title", nullable = false, columnDefinition = "text")
    private String title;

    @Column(name = "units", columnDefinition = "text")
    private String units;

    @Convert(converter = CourseLevelConverter.class)
    @Column(name = "level", columnDefinition = "text")
    private CourseLevel level;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Column(name = "prerequisites", columnDefinition = "text")
    private String prerequisites;

    @Column(name = "additional_info", columnDefinition = "text")
    private String additionalInfo;

    @Column(name = "catalog_url", columnDefinition = "text")
    private String catalogUrl;

    // rows are removed by ON DELETE CASCADE, not by the persistence context
    @OneToMany(mappedBy = "course", fetch = FetchType.LAZY)
    private List<Offering> offerings = new ArrayList<>();

    public Long getId() {
        return id;
    }

    public String getMajor() {
        return major;
    }

    public void setMajor(String major) {
        this.major = major;
    }

    public String getCourseCode() {
        return courseCode;
    }

    public void setCourseCode(String courseCode) {
        this.courseCode = courseCode;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getUnits() {
        return units;
    }

    public void setUnits(String units) {
        this.units = units;
    }

    public CourseLevel getLevel() {
        return level;
    }

    public void setLevel(CourseLevel level) {
        this.level = level;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getPrerequisites() {
        return prerequisites;
    }

    public void setPrerequisites(String prerequisites) {
        this.prerequisites = prerequisites;
    }

    public String getAdditionalInfo() {
        return additionalInfo;
    }

    public void setAdditionalInfo(String additionalInfo) {
        this.additionalInfo = additionalInfo;
    }

    public String getCatalogUrl() {
        return catalogUrl;
    }

    public void setCatalogUrl(String catalogUrl) {
        this.catalogUrl = catalogUrl;
    }

    public List<Offering> getOfferings() {
        return offerings;
    }
}
