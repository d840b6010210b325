package com.gauchoplan.backend.modules.catalog.application;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import com.gauchoplan.backend.global.error.PersistenceProblemTranslator;
import com.gauchoplan.backend.global.error.ProblemException;
import com.gauchoplan.backend.modules.catalog.domain.Course;
import com.gauchoplan.backend.modules.catalog.domain.CourseCodes;
import com.gauchoplan.backend.modules.catalog.domain.CourseLevel;
import com.gauchoplan.backend.modules.catalog.domain.Offering;
import com.gauchoplan.backend.modules.catalog.domain.Term;
import com.gauchoplan.backend.modules.catalog.infrastructure.persistence.CourseRepository;
import com.gauchoplan.backend.modules.catalog.infrastructure.persistence.OfferingRepository;

/**
 * Catalog maintenance: courses of each major and the quarters in which they are offered.
 */
@Service
@Validated
@Transactional
public class CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    public static final String COURSE_NOT_FOUND = "catalog.course_not_found";
    public static final String COURSE_ALREADY_EXISTS = "catalog.course_already_exists";
    public static final String OFFERING_NOT_FOUND = "catalog.offering_not_found";
    public static final String INVALID_LEVEL = "catalog.invalid_level";

    private static final String YEAR_REGEX = "^\\s*(\\d{4})?\\s*$";

    private final CourseRepository courseRepository;
    private final OfferingRepository offeringRepository;

    public CatalogService(CourseRepository courseRepository, OfferingRepository offeringRepository) {
        this.courseRepository = courseRepository;
        this.offeringRepository = offeringRepository;
    }

    /**
     * Inserts a new course; a second course with the same major and code is a conflict.
     */
    public CourseView registerCourse(@Valid @NotNull CourseCommand command) {
        String major = CourseCodes.normalizeMajor(command.major());
        String courseCode = CourseCodes.normalize(command.courseCode());
        if (courseRepository.findByMajorAndCourseCode(major, courseCode).isPresent()) {
            throw ProblemException.conflict(COURSE_ALREADY_EXISTS,
                    "Course " + courseCode + " is already registered for " + major + ".");
        }
        Course course = new Course();
        course.setMajor(major);
        course.setCourseCode(courseCode);
        applyCatalogFields(course, command);
        Course saved = saveCourse(course);
        log.info("Registered course id={} major='{}' code='{}'", saved.getId(), major, courseCode);
        return CourseView.from(saved);
    }

    /**
     * Inserts the course or refreshes the catalog fields of the existing (major, code) row.
     * Concurrent upserts of the same key all succeed; the last one to commit wins.
     */
    public CourseView upsertCourse(@Valid @NotNull CourseCommand command) {
        String major = CourseCodes.normalizeMajor(command.major());
        String courseCode = CourseCodes.normalize(command.courseCode());
        boolean inserted = courseRepository.insertKeyIfAbsent(major, courseCode, command.title().trim()) == 1;
        Course course = courseRepository.findByMajorAndCourseCode(major, courseCode)
                .orElseThrow(() -> new IllegalStateException(
                        "Course " + courseCode + " of " + major + " vanished during upsert"));
        applyCatalogFields(course, command);
        Course saved = saveCourse(course);
        log.info("Upserted course id={} major='{}' code='{}' insert={}",
                saved.getId(), major, courseCode, inserted);
        return CourseView.from(saved);
    }

    @Transactional(readOnly = true)
    public CourseView getCourse(Long courseId) {
        return CourseView.from(loadCourse(courseId));
    }

    @Transactional(readOnly = true)
    public Optional<CourseView> findCourse(String major, String courseCode) {
        if (!StringUtils.hasText(major) || !StringUtils.hasText(courseCode)) {
            return Optional.empty();
        }
        Optional<CourseView> found = courseRepository
                .findByMajorAndCourseCode(CourseCodes.normalizeMajor(major), CourseCodes.normalize(courseCode))
                .map(CourseView::from);
        log.debug("findCourse major='{}' code='{}' found={}", major, courseCode, found.isPresent());
        return found;
    }

    @Transactional(readOnly = true)
    public List<String> listMajors() {
        return courseRepository.findDistinctMajors();
    }

    @Transactional(readOnly = true)
    public List<CatalogEntryView> listCoursesByMajor(String major) {
        List<Course> courses = courseRepository.findByMajorWithOfferings(CourseCodes.normalizeMajor(major));
        log.debug("listCoursesByMajor major='{}' courses={}", major, courses.size());
        return courses.stream()
                .map(course -> new CatalogEntryView(
                        CourseView.from(course),
                        course.getOfferings().stream()
                                .sorted(Comparator.comparing(Offering::getTerm).thenComparing(Offering::getId))
                                .map(OfferingView::from)
                                .toList()))
                .toList();
    }

    /**
     * Deletes the course. The schema removes its offerings with it.
     */
    public void deleteCourse(Long courseId) {
        Course course = loadCourse(courseId);
        courseRepository.delete(course);
        courseRepository.flush();
        log.info("Deleted course id={} major='{}' code='{}' with its offerings",
                courseId, course.getMajor(), course.getCourseCode());
    }

    public OfferingView addOffering(Long courseId, @Valid @NotNull OfferingCommand command) {
        Course course = loadCourse(courseId);
        Term term = Terms.parse(command.quarter(), command.year());
        Offering offering = new Offering();
        offering.setCourse(course);
        offering.setTerm(term);
        applyOfferingFields(offering, command.status(), command.notes(), command.instructorName(),
                command.instructorEmail(), command.meetingPattern());
        Offering saved;
        try {
            saved = offeringRepository.saveAndFlush(offering);
        } catch (DataIntegrityViolationException ex) {
            throw PersistenceProblemTranslator.translate(ex);
        }
        log.info("Added offering id={} course='{}' term='{}' status='{}'",
                saved.getId(), course.getCourseCode(), term, saved.getStatus());
        return OfferingView.from(saved);
    }

    public OfferingView updateOfferingStatus(Long offeringId, String status, String notes) {
        Offering offering = offeringRepository.findById(offeringId)
                .orElseThrow(() -> ProblemException.notFound(OFFERING_NOT_FOUND,
                        "Offering " + offeringId + " does not exist."));
        offering.setStatus(trimToNull(status));
        offering.setNotes(trimToNull(notes));
        log.info("Updated offering id={} status='{}'", offeringId, offering.getStatus());
        return OfferingView.from(offering);
    }

    public void deleteOffering(Long offeringId) {
        Offering offering = offeringRepository.findById(offeringId)
                .orElseThrow(() -> ProblemException.notFound(OFFERING_NOT_FOUND,
                        "Offering " + offeringId + " does not exist."));
        offeringRepository.delete(offering);
        log.info("Deleted offering id={}", offeringId);
    }

    /**
     * Offerings of one course in one term, answered from the (course_id, year, quarter) index.
     */
    @Transactional(readOnly = true)
    public List<OfferingView> listOfferings(Long courseId, String quarter, String year) {
        if (!courseRepository.existsById(courseId)) {
            throw ProblemException.notFound(COURSE_NOT_FOUND, "Course " + courseId + " does not exist.");
        }
        Term term = Terms.parse(quarter, year);
        List<Offering> offerings = term.year() == null
                ? offeringRepository.findByCourseIdAndAcademicYearIsNullAndQuarter(courseId, term.quarter())
                : offeringRepository.findByCourseIdAndAcademicYearAndQuarter(courseId, term.year(), term.quarter());
        return offerings.stream()
                .sorted(Comparator.comparing(Offering::getId))
                .map(OfferingView::from)
                .toList();
    }

    /**
     * Courses of a major scheduled in the given quarter. Without a year, every year of that
     * quarter matches.
     */
    @Transactional(readOnly = true)
    public List<TermOfferingView> listTermOfferings(String major, String quarter, String year) {
        Term term = Terms.parse(quarter, year);
        String normalizedMajor = CourseCodes.normalizeMajor(major);
        List<Offering> offerings = term.year() == null
                ? offeringRepository.findTermOfferingsAnyYear(normalizedMajor, term.quarter())
                : offeringRepository.findTermOfferings(normalizedMajor, term.quarter(), term.year());
        log.debug("listTermOfferings major='{}' term='{}' results={}", major, term, offerings.size());
        return offerings.stream()
                .map(offering -> new TermOfferingView(CourseView.from(offering.getCourse()), OfferingView.from(offering)))
                .toList();
    }

    /**
     * Replaces every offering of the major in the term with the given entries. Unknown course
     * codes abort the refresh before anything is deleted.
     *
     * @return number of offerings inserted
     */
    public int replaceTermOfferings(
            String major,
            String quarter,
            String year,
            @NotNull List<@Valid @NotNull TermOfferingEntry> entries
    ) {
        Term term = Terms.parse(quarter, year);
        String normalizedMajor = CourseCodes.normalizeMajor(major);
        Set<String> requestedCodes = entries.stream()
                .map(entry -> CourseCodes.normalize(entry.courseCode()))
                .collect(Collectors.toCollection(TreeSet::new));

        Map<String, Long> courseIdsByCode = requestedCodes.isEmpty()
                ? Map.of()
                : courseRepository.findByMajorAndCourseCodeIn(normalizedMajor, requestedCodes).stream()
                        .collect(Collectors.toMap(Course::getCourseCode, Course::getId));
        Set<String> unknownCodes = new TreeSet<>(requestedCodes);
        unknownCodes.removeAll(courseIdsByCode.keySet());
        if (!unknownCodes.isEmpty()) {
            throw ProblemException.notFound(COURSE_NOT_FOUND,
                    "Unknown course codes for " + normalizedMajor + ": " + String.join(", ", unknownCodes));
        }

        int removed = term.year() == null
                ? offeringRepository.deleteUndatedTermOfferings(normalizedMajor, term.quarter())
                : offeringRepository.deleteTermOfferings(normalizedMajor, term.quarter(), term.year());

        List<Offering> replacements = entries.stream()
                .map(entry -> {
                    Offering offering = new Offering();
                    offering.setCourse(courseRepository.getReferenceById(
                            courseIdsByCode.get(CourseCodes.normalize(entry.courseCode()))));
                    offering.setTerm(term);
                    applyOfferingFields(offering, entry.status(), entry.notes(), entry.instructorName(),
                            entry.instructorEmail(), entry.meetingPattern());
                    return offering;
                })
                .toList();
        offeringRepository.saveAll(replacements);
        offeringRepository.flush();
        log.info("Replaced offerings major='{}' term='{}' removed={} inserted={}",
                normalizedMajor, term, removed, replacements.size());
        return replacements.size();
    }

    @Transactional(readOnly = true)
    public TermStatusSummary summarizeTerm(String major, String quarter, String year) {
        Term term = Terms.parse(quarter, year);
        List<TermOfferingView> offerings = listTermOfferings(major, quarter, year);
        Map<String, Long> counts = offerings.stream()
                .collect(Collectors.groupingBy(view -> statusBucket(view.offering().status()),
                        Collectors.counting()));
        return new TermStatusSummary(
                CourseCodes.normalizeMajor(major),
                term,
                counts.getOrDefault("open", 0L).intValue(),
                counts.getOrDefault("mixed", 0L).intValue(),
                counts.getOrDefault("full", 0L).intValue(),
                counts.getOrDefault("other", 0L).intValue()
        );
    }

    private Course loadCourse(Long courseId) {
        return courseRepository.findById(courseId)
                .orElseThrow(() -> ProblemException.notFound(COURSE_NOT_FOUND,
                        "Course " + courseId + " does not exist."));
    }

    private Course saveCourse(Course course) {
        try {
            return courseRepository.saveAndFlush(course);
        } catch (DataIntegrityViolationException ex) {
            throw PersistenceProblemTranslator.translate(ex);
        }
    }

    private void applyCatalogFields(Course course, CourseCommand command) {
        course.setTitle(command.title().trim());
        course.setUnits(trimToNull(command.units()));
        course.setLevel(resolveLevel(command.level(), course.getCourseCode()));
        course.setDescription(trimToNull(command.description()));
        course.setPrerequisites(trimToNull(command.prerequisites()));
        course.setAdditionalInfo(trimToNull(command.additionalInfo()));
        course.setCatalogUrl(trimToNull(command.catalogUrl()));
    }

    private static void applyOfferingFields(
            Offering offering,
            String status,
            String notes,
            String instructorName,
            String instructorEmail,
            String meetingPattern
    ) {
        offering.setStatus(trimToNull(status));
        offering.setNotes(trimToNull(notes));
        offering.setInstructorName(trimToNull(instructorName));
        offering.setInstructorEmail(trimToNull(instructorEmail));
        offering.setMeetingPattern(trimToNull(meetingPattern));
    }

    private static CourseLevel resolveLevel(String level, String courseCode) {
        if (!StringUtils.hasText(level)) {
            return CourseLevel.fromCourseCode(courseCode).orElse(null);
        }
        try {
            return CourseLevel.parse(level);
        } catch (IllegalArgumentException ex) {
            throw ProblemException.invalid(INVALID_LEVEL, ex.getMessage());
        }
    }

    static String statusBucket(String status) {
        if (!StringUtils.hasText(status)) {
            return "other";
        }
        String normalized = status.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "open", "mixed", "full" -> normalized;
            default -> "other";
        };
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    public record CourseCommand(
            @NotBlank @Size(max = 200) String major,
            @NotBlank @Size(max = 40) String courseCode,
            @NotBlank String title,
            @Size(max = 40) String units,
            String level,
            String description,
            String prerequisites,
            String additionalInfo,
            String catalogUrl
    ) {
    }

    public record OfferingCommand(
            @NotBlank String quarter,
            @Pattern(regexp = YEAR_REGEX, message = "must be a four-digit year") String year,
            String status,
            String notes,
            String instructorName,
            @Email String instructorEmail,
            String meetingPattern
    ) {
    }

    public record TermOfferingEntry(
            @NotBlank String courseCode,
            String status,
            String notes,
            String instructorName,
            @Email String instructorEmail,
            String meetingPattern
    ) {
    }
}
