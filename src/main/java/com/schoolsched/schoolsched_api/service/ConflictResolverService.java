package com.schoolsched.schoolsched_api.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.schoolsched.schoolsched_api.dto.ConflictDetail;
import com.schoolsched.schoolsched_api.dto.ConflictDetail.Severity;
import com.schoolsched.schoolsched_api.dto.ConflictDetail.Type;
import com.schoolsched.schoolsched_api.exception.MalformedAvailabilityException;
import com.schoolsched.schoolsched_api.model.AvailabilitySlot;
import com.schoolsched.schoolsched_api.model.ConstraintType;
import com.schoolsched.schoolsched_api.model.ScheduleConstraint;
import com.schoolsched.schoolsched_api.model.ScheduleEntry;
import com.schoolsched.schoolsched_api.model.ScheduleKey;
import com.schoolsched.schoolsched_api.model.SchoolClass;
import com.schoolsched.schoolsched_api.model.SlotStatus;
import com.schoolsched.schoolsched_api.model.TeacherAvailability;
import com.schoolsched.schoolsched_api.model.WeekGrid;
import com.schoolsched.schoolsched_api.repository.ScheduleEntryRepository;
import com.schoolsched.schoolsched_api.solver.ConstraintRules;
import com.schoolsched.schoolsched_api.solver.RequirementSet;
import com.schoolsched.schoolsched_api.solver.ScheduleCell;
import com.schoolsched.schoolsched_api.solver.ScheduleGrid;

/**
 * Read-only diagnostics over the published grids of one class.
 */
@Service
public class ConflictResolverService {

    private static final Logger logger = LoggerFactory.getLogger(ConflictResolverService.class);

    private final ScheduleEntryRepository entryRepository;
    private final ScheduleContextLoader contextLoader;
    private final TeacherAvailabilityService availabilityService;

    public ConflictResolverService(ScheduleEntryRepository entryRepository, ScheduleContextLoader contextLoader,
                                   TeacherAvailabilityService availabilityService) {
        this.entryRepository = entryRepository;
        this.contextLoader = contextLoader;
        this.availabilityService = availabilityService;
    }

    public List<ConflictDetail> resolveConflicts(String classId) {
        SchoolClass schoolClass = contextLoader.requireClass(classId);
        String year = schoolClass.getAcademicYearId();
        List<ConflictDetail> conflicts = new ArrayList<>();
        if (schoolClass.getSessionType() == null) {
            logger.warn("Class {} has no session type; nothing to check", classId);
            return conflicts;
        }

        List<ScheduleEntry> entries = entryRepository.findAllByAcademicYearIdAndSessionTypeAndClassId(
                year, schoolClass.getSessionType(), classId);
        if (entries.isEmpty()) {
            logger.info("Class {} has no published cells", classId);
            return conflicts;
        }

        Map<String, List<ScheduleEntry>> bySection = entries.stream()
                .collect(Collectors.groupingBy(ScheduleEntry::getSection, TreeMap::new, Collectors.toList()));
        RequirementSet requirements = contextLoader.loadRequirements(schoolClass, null);
        ConstraintRules rules = contextLoader.loadRules(year, schoolClass.getSessionType());

        checkDoubleBooking(entries, conflicts);
        checkAvailability(entries, conflicts);
        for (Map.Entry<String, List<ScheduleEntry>> section : bySection.entrySet()) {
            ScheduleGrid grid = ScheduleGrid.fromEntries(classId, section.getKey(), section.getValue());
            checkEmptySlots(year, grid, conflicts);
            checkStrayAssignments(year, grid, requirements, conflicts);
            checkCellConstraints(year, grid, rules, conflicts);
            checkSpacing(year, grid, rules, conflicts);
        }

        conflicts.sort(Comparator.comparing(ConflictDetail::severity)
                .thenComparing(c -> c.section() != null ? c.section() : "", SchoolClass.SECTION_ORDER)
                .thenComparing(c -> c.day() != null ? c.day() : -1)
                .thenComparing(c -> c.period() != null ? c.period() : -1));
        logger.info("Conflict scan of class {}: {} finding(s) over {} cell(s)", classId, conflicts.size(), entries.size());
        return conflicts;
    }

    private void checkDoubleBooking(List<ScheduleEntry> entries, List<ConflictDetail> conflicts) {
        ScheduleEntry first = entries.get(0);
        List<String> teacherIds = entries.stream().map(ScheduleEntry::getTeacherId).distinct().collect(Collectors.toList());
        List<ScheduleEntry> teacherCells = entryRepository.findAllByAcademicYearIdAndSessionTypeAndTeacherIdIn(
                first.getAcademicYearId(), first.getSessionType(), teacherIds);

        Map<String, List<ScheduleEntry>> bySlot = new LinkedHashMap<>();
        for (ScheduleEntry cell : teacherCells) {
            bySlot.computeIfAbsent(cell.getTeacherId() + "@" + cell.getSlotIndex(), k -> new ArrayList<>()).add(cell);
        }
        for (ScheduleEntry entry : entries) {
            List<ScheduleEntry> sameSlot = bySlot.getOrDefault(entry.getTeacherId() + "@" + entry.getSlotIndex(), List.of());
            for (ScheduleEntry other : sameSlot) {
                if (other.getKey().equals(entry.getKey())) continue;
                // a clash between two sections of this class is reported from the lower section only
                if (sameClass(entry, other)
                        && SchoolClass.SECTION_ORDER.compare(entry.getSection(), other.getSection()) > 0) continue;
                conflicts.add(detail(Type.TEACHER_DOUBLE_BOOKED, Severity.ERROR, entry,
                        (entry.getTeacherName() != null ? entry.getTeacherName() : entry.getTeacherId())
                                + " also teaches class " + other.getClassId() + " section " + other.getSection()
                                + " on " + WeekGrid.label(entry.getDayOfWeek(), entry.getPeriodNumber())));
            }
        }
    }

    private static boolean sameClass(ScheduleEntry a, ScheduleEntry b) {
        return a.getAcademicYearId().equals(b.getAcademicYearId()) && a.getSessionType() == b.getSessionType()
                && a.getClassId().equals(b.getClassId());
    }

    private void checkAvailability(List<ScheduleEntry> entries, List<ConflictDetail> conflicts) {
        Set<String> teacherIds = entries.stream().map(ScheduleEntry::getTeacherId).collect(Collectors.toSet());
        Map<String, TeacherAvailability> availability = new LinkedHashMap<>();
        for (String teacherId : teacherIds) {
            try {
                availability.put(teacherId, availabilityService.load(teacherId));
            } catch (MalformedAvailabilityException e) {
                logger.warn("Availability of teacher {} is malformed: {}", teacherId, e.getMessage());
                ScheduleEntry sample = entries.stream().filter(en -> en.getTeacherId().equals(teacherId))
                        .findFirst().orElseThrow();
                conflicts.add(new ConflictDetail(Type.AVAILABILITY_MISMATCH, Severity.ERROR,
                        sample.getAcademicYearId(), sample.getClassId(), null, null, null, null, teacherId,
                        null, null, e.getMessage()));
            }
        }
        for (ScheduleEntry entry : entries) {
            TeacherAvailability teacherAvailability = availability.get(entry.getTeacherId());
            if (teacherAvailability == null) continue;
            AvailabilitySlot slot = teacherAvailability.slotAt(entry.getDayOfWeek(), entry.getPeriodNumber());
            if (slot.getStatus() == SlotStatus.ASSIGNED && slot.getAssignment() != null
                    && slot.getAssignment().belongsTo(entry.getKey())) {
                continue;
            }
            String actual = slot.getStatus() == SlotStatus.ASSIGNED
                    ? "assigned to " + TeacherAvailabilityService.describe(slot.getAssignment())
                    : slot.getStatus().name().toLowerCase();
            conflicts.add(detail(Type.AVAILABILITY_MISMATCH, Severity.ERROR, entry,
                    "Availability of " + (entry.getTeacherName() != null ? entry.getTeacherName() : entry.getTeacherId())
                            + " on " + WeekGrid.label(entry.getDayOfWeek(), entry.getPeriodNumber())
                            + " is " + actual + " instead of held by this schedule"));
        }
    }

    private void checkEmptySlots(String year, ScheduleGrid grid, List<ConflictDetail> conflicts) {
        for (Integer index : grid.emptySlotIndexes()) {
            int day = WeekGrid.dayOf(index);
            int period = WeekGrid.periodOf(index);
            conflicts.add(new ConflictDetail(Type.EMPTY_SLOT, Severity.ERROR, year, grid.getClassId(),
                    grid.getSection(), day, period, null, null, null, null,
                    "Section " + grid.getSection() + " has nothing scheduled on " + WeekGrid.label(day, period)));
        }
    }

    private void checkStrayAssignments(String year, ScheduleGrid grid, RequirementSet requirements,
                                       List<ConflictDetail> conflicts) {
        for (ScheduleCell cell : grid.getCells()) {
            if (requirements.find(grid.getSection(), cell.subjectId(), cell.teacherId()) == null) {
                conflicts.add(cellDetail(Type.STRAY_ASSIGNMENT, Severity.WARNING, year, cell, null,
                        cell.subjectName() + " taught by " + (cell.teacherName() != null ? cell.teacherName() : cell.teacherId())
                                + " on " + cell.label() + " no longer matches the assignments of section "
                                + grid.getSection()));
            }
        }
    }

    private void checkCellConstraints(String year, ScheduleGrid grid, ConstraintRules rules,
                                      List<ConflictDetail> conflicts) {
        for (ScheduleCell cell : grid.getCells()) {
            for (ScheduleConstraint forbidden : rules.applicable(ConstraintType.FORBIDDEN, grid.getClassId(),
                    cell.subjectId(), cell.teacherId())) {
                if (forbidden.coversSlot(cell.day(), cell.period())) {
                    conflicts.add(cellDetail(Type.CONSTRAINT_VIOLATION, severityOf(forbidden), year, cell, forbidden,
                            cell.subjectName() + " is placed on " + cell.label() + " which is forbidden by "
                                    + forbidden.describe()));
                }
            }
            List<ScheduleConstraint> required = rules.applicable(ConstraintType.REQUIRED, grid.getClassId(),
                    cell.subjectId(), cell.teacherId());
            if (!required.isEmpty() && required.stream().noneMatch(r -> r.coversSlot(cell.day(), cell.period()))) {
                ScheduleConstraint strongest = required.stream()
                        .max(Comparator.comparingInt(ScheduleConstraint::getPriorityLevel)).orElseThrow();
                conflicts.add(cellDetail(Type.CONSTRAINT_VIOLATION, severityOf(strongest), year, cell, strongest,
                        cell.subjectName() + " on " + cell.label() + " is outside the periods required by "
                                + strongest.describe()));
            }
        }
    }

    private void checkSpacing(String year, ScheduleGrid grid, ConstraintRules rules, List<ConflictDetail> conflicts) {
        for (int day = 0; day < WeekGrid.DAYS; day++) {
            int period = 0;
            while (period < WeekGrid.PERIODS_PER_DAY) {
                ScheduleCell start = grid.cellAt(day, period);
                if (start == null) {
                    period++;
                    continue;
                }
                int end = period;
                while (end + 1 < WeekGrid.PERIODS_PER_DAY && grid.holds(start.subjectId(), day, end + 1)) end++;
                int run = end - period + 1;
                for (ScheduleConstraint constraint : rules.applicable(ConstraintType.MAX_CONSECUTIVE,
                        grid.getClassId(), start.subjectId(), start.teacherId())) {
                    Integer limit = constraint.getMaxConsecutivePeriods();
                    if (limit != null && run > limit) {
                        conflicts.add(cellDetail(Type.CONSTRAINT_VIOLATION, severityOf(constraint), year, start,
                                constraint, start.subjectName() + " runs " + run + " consecutive periods from "
                                        + start.label() + ", limit is " + limit));
                    }
                }
                period = end + 1;
            }

            for (int period1 = 0; period1 < WeekGrid.PERIODS_PER_DAY; period1++) {
                ScheduleCell first = grid.cellAt(day, period1);
                if (first == null) continue;
                for (int period2 = period1 + 1; period2 < WeekGrid.PERIODS_PER_DAY; period2++) {
                    if (!grid.holds(first.subjectId(), day, period2)) continue;
                    int gap = period2 - period1 - 1;
                    for (ScheduleConstraint constraint : rules.applicable(ConstraintType.MIN_BREAK,
                            grid.getClassId(), first.subjectId(), first.teacherId())) {
                        Integer minimum = constraint.getMinBreakPeriods();
                        if (minimum != null && gap < minimum) {
                            conflicts.add(cellDetail(Type.CONSTRAINT_VIOLATION, severityOf(constraint), year, first,
                                    constraint, first.subjectName() + " repeats on " + WeekGrid.label(day, period2)
                                            + " only " + gap + " period(s) after " + first.label()
                                            + ", minimum break is " + minimum));
                        }
                    }
                    break;
                }
            }
        }
    }

    static Severity severityOf(ScheduleConstraint constraint) {
        return constraint.getPriorityLevel() >= 3 ? Severity.ERROR : Severity.WARNING;
    }

    private ConflictDetail detail(Type type, Severity severity, ScheduleEntry entry, String message) {
        ScheduleKey key = entry.getKey();
        return new ConflictDetail(type, severity, key.academicYearId(), key.classId(), key.section(),
                entry.getDayOfWeek(), entry.getPeriodNumber(), entry.getSubjectId(), entry.getTeacherId(),
                null, null, message);
    }

    private ConflictDetail cellDetail(Type type, Severity severity, String year, ScheduleCell cell,
                                      ScheduleConstraint constraint, String message) {
        return new ConflictDetail(type, severity, year, cell.classId(), cell.section(), cell.day(), cell.period(),
                cell.subjectId(), cell.teacherId(), constraint != null ? constraint.getId() : null,
                constraint != null ? constraint.getPriorityLevel() : null, message);
    }
}
