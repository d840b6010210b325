package com.gauchoplan.backend.modules.planner.application;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import com.gauchoplan.backend.global.error.ProblemException;
import com.gauchoplan.backend.modules.catalog.application.Terms;
import com.gauchoplan.backend.modules.catalog.domain.CourseCodes;
import com.gauchoplan.backend.modules.catalog.domain.Term;
import com.gauchoplan.backend.modules.catalog.infrastructure.persistence.CourseRepository;
import com.gauchoplan.backend.modules.planner.domain.PlanLoad;
import com.gauchoplan.backend.modules.planner.domain.UserPlanEntry;
import com.gauchoplan.backend.modules.planner.infrastructure.persistence.UserPlanRepository;

@Service
@Validated
@Transactional
public class PlannerService {

    private static final Logger log = LoggerFactory.getLogger(PlannerService.class);

    public static final String ENTRY_NOT_FOUND = "planner.entry_not_found";
    public static final String USER_REQUIRED = "planner.user_required";
    public static final int MAX_ENTRY_UNITS = 30;

    private static final Comparator<UserPlanEntry> PLAN_ORDER = Comparator
            .comparing(UserPlanEntry::getTerm)
            .thenComparing(UserPlanEntry::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(UserPlanEntry::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final UserPlanRepository userPlanRepository;
    private final CourseRepository courseRepository;
    private final int lightLoadUnits;
    private final int typicalLoadUnits;
    private final int heavyLoadUnits;

    public PlannerService(
            UserPlanRepository userPlanRepository,
            CourseRepository courseRepository,
            @Value("${app.planner.light-load-units:12}") int lightLoadUnits,
            @Value("${app.planner.typical-load-units:16}") int typicalLoadUnits,
            @Value("${app.planner.heavy-load-units:20}") int heavyLoadUnits
    ) {
        this.userPlanRepository = userPlanRepository;
        this.courseRepository = courseRepository;
        this.lightLoadUnits = lightLoadUnits;
        this.typicalLoadUnits = typicalLoadUnits;
        this.heavyLoadUnits = heavyLoadUnits;
    }

    /**
     * Adds a course to the user's plan. The code is not checked against the catalog.
     */
    public PlanEntryView addEntry(@Valid @NotNull PlanEntryCommand command) {
        Term term = Terms.parse(command.quarter(), command.year());
        UserPlanEntry entry = new UserPlanEntry();
        entry.setUserId(command.userId().trim());
        entry.setTerm(term);
        entry.setCourseCode(CourseCodes.normalize(command.courseCode()));
        entry.setUnits(command.units());
        entry.setEntryType(trimToNull(command.type()));
        UserPlanEntry saved = userPlanRepository.save(entry);
        log.info("Added plan entry id={} user='{}' term='{}' course='{}'",
                saved.getId(), saved.getUserId(), term, saved.getCourseCode());
        return toView(saved, catalogued(Set.of(saved.getCourseCode())));
    }

    /**
     * Moves or edits an entry. Only the owner may change it.
     */
    public PlanEntryView updateEntry(String userId, Long entryId, @Valid @NotNull PlanEntryUpdate update) {
        UserPlanEntry entry = loadOwnedEntry(userId, entryId);
        entry.setTerm(Terms.parse(update.quarter(), update.year()));
        if (StringUtils.hasText(update.courseCode())) {
            entry.setCourseCode(CourseCodes.normalize(update.courseCode()));
        }
        entry.setUnits(update.units());
        entry.setEntryType(trimToNull(update.type()));
        log.info("Updated plan entry id={} user='{}' term='{}'", entryId, entry.getUserId(), entry.getTerm());
        return toView(entry, catalogued(Set.of(entry.getCourseCode())));
    }

    public void removeEntry(String userId, Long entryId) {
        UserPlanEntry entry = loadOwnedEntry(userId, entryId);
        userPlanRepository.delete(entry);
        log.info("Removed plan entry id={} user='{}'", entryId, entry.getUserId());
    }

    @Transactional(readOnly = true)
    public List<PlanEntryView> listEntries(String userId) {
        String owner = requireUser(userId);
        List<UserPlanEntry> entries = userPlanRepository.findByUserId(owner).stream()
                .sorted(PLAN_ORDER)
                .toList();
        Set<String> known = catalogued(entries.stream().map(UserPlanEntry::getCourseCode).toList());
        return entries.stream()
                .map(entry -> toView(entry, known))
                .toList();
    }

    /**
     * Entries of one term with their unit total and load classification.
     */
    @Transactional(readOnly = true)
    public TermPlanView getTermPlan(String userId, String quarter, String year) {
        String owner = requireUser(userId);
        Term term = Terms.parse(quarter, year);
        List<UserPlanEntry> entries = term.year() == null
                ? userPlanRepository.findByUserIdAndAcademicYearIsNullAndQuarterOrderByCreatedAtAscIdAsc(
                        owner, term.quarter())
                : userPlanRepository.findByUserIdAndAcademicYearAndQuarterOrderByCreatedAtAscIdAsc(
                        owner, term.year(), term.quarter());
        Set<String> known = catalogued(entries.stream().map(UserPlanEntry::getCourseCode).toList());
        List<PlanEntryView> views = entries.stream()
                .map(entry -> toView(entry, known))
                .toList();
        int totalUnits = entries.stream()
                .map(UserPlanEntry::getUnits)
                .filter(Objects::nonNull)
                .reduce(0, Math::addExact);
        PlanLoad load = PlanLoad.classify(totalUnits, lightLoadUnits, typicalLoadUnits, heavyLoadUnits);
        log.debug("getTermPlan user='{}' term='{}' entries={} units={} load={}",
                owner, term, views.size(), totalUnits, load);
        return new TermPlanView(owner, term, views, totalUnits, load);
    }

    private UserPlanEntry loadOwnedEntry(String userId, Long entryId) {
        String owner = requireUser(userId);
        return userPlanRepository.findByIdAndUserId(entryId, owner)
                .orElseThrow(() -> ProblemException.notFound(ENTRY_NOT_FOUND,
                        "Plan entry " + entryId + " does not exist for this user."));
    }

    private Set<String> catalogued(Collection<String> courseCodes) {
        if (courseCodes.isEmpty()) {
            return Set.of();
        }
        return Set.copyOf(courseRepository.findExistingCourseCodes(Set.copyOf(courseCodes)));
    }

    private static PlanEntryView toView(UserPlanEntry entry, Set<String> cataloguedCodes) {
        return PlanEntryView.from(entry, cataloguedCodes.contains(entry.getCourseCode()));
    }

    private static String requireUser(String userId) {
        if (!StringUtils.hasText(userId)) {
            throw ProblemException.invalid(USER_REQUIRED, "A user id is required.");
        }
        return userId.trim();
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    public record PlanEntryCommand(
            @NotBlank @Size(max = 320) String userId,
            @NotBlank String quarter,
            String year,
            @NotBlank @Size(max = 40) String courseCode,
            @PositiveOrZero @Max(MAX_ENTRY_UNITS) Integer units,
            String type
    ) {
    }

    public record PlanEntryUpdate(
            @NotBlank String quarter,
            String year,
            String courseCode,
            @PositiveOrZero @Max(MAX_ENTRY_UNITS) Integer units,
            String type
    ) {
    }
}
