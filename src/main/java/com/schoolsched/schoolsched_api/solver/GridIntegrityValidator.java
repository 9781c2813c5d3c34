package com.schoolsched.schoolsched_api.solver;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.schoolsched.schoolsched_api.dto.IntegrityViolation;
import com.schoolsched.schoolsched_api.dto.IntegrityViolation.Kind;
import com.schoolsched.schoolsched_api.exception.IntegrityViolationException;
import com.schoolsched.schoolsched_api.model.WeekGrid;

/**
 * Last check before a batch becomes a preview. Runs on every generated batch.
 */
@Component
public class GridIntegrityValidator {

    private static final Logger logger = LoggerFactory.getLogger(GridIntegrityValidator.class);

    public List<IntegrityViolation> validate(ScheduleContext context, List<ScheduleGrid> batch) {
        List<IntegrityViolation> violations = new ArrayList<>();
        Map<String, ScheduleCell> teacherSlots = new HashMap<>();

        for (ScheduleGrid grid : batch) {
            for (int index : grid.emptySlotIndexes()) {
                int day = WeekGrid.dayOf(index);
                int period = WeekGrid.periodOf(index);
                violations.add(new IntegrityViolation(Kind.EMPTY_CELL, grid.getSection(), day, period, null, null,
                        "Section " + grid.getSection() + " has no lesson on " + WeekGrid.label(day, period)));
            }

            for (ScheduleCell cell : grid.getCells()) {
                if (!grid.getClassId().equals(cell.classId()) || !grid.getSection().equals(cell.section())) {
                    violations.add(violation(Kind.STRAY_ASSIGNMENT, grid, cell,
                            "Cell of class " + cell.classId() + " section " + cell.section()
                                    + " found in grid of section " + grid.getSection()));
                    continue;
                }
                if (context.requirements().find(grid.getSection(), cell.subjectId(), cell.teacherId()) == null) {
                    violations.add(violation(Kind.STRAY_ASSIGNMENT, grid, cell,
                            cell.subjectName() + " with teacher " + cell.teacherId() + " on " + cell.label()
                                    + " matches no requirement of section " + grid.getSection()));
                }
                if (cell.teacherId() != null) {
                    String key = cell.teacherId() + "@" + cell.slotIndex();
                    ScheduleCell previous = teacherSlots.putIfAbsent(key, cell);
                    if (previous != null) {
                        violations.add(violation(Kind.TEACHER_DOUBLE_BOOKED, grid, cell,
                                "Teacher " + cell.teacherId() + " is in sections " + previous.section() + " and "
                                        + cell.section() + " on " + cell.label()));
                    }
                    if (!context.availability().isFree(cell.teacherId(), cell.day(), cell.period())) {
                        violations.add(violation(Kind.AVAILABILITY_VIOLATION, grid, cell,
                                "Teacher " + cell.teacherId() + " is not free on " + cell.label()));
                    }
                }
            }

            for (SubjectRequirement requirement : context.requirements().forSection(grid.getSection())) {
                int placed = grid.countOf(requirement.subjectId());
                if (placed != requirement.weeklyHours()) {
                    violations.add(new IntegrityViolation(Kind.HOURS_MISMATCH, grid.getSection(), null, null,
                            requirement.subjectId(), requirement.teacherId(),
                            requirement.subjectName() + " has " + placed + " period(s) in section " + grid.getSection()
                                    + " but needs " + requirement.weeklyHours()));
                }
            }
        }
        return violations;
    }

    /**
     * @throws IntegrityViolationException listing every offending cell
     */
    public void requireValid(ScheduleContext context, List<ScheduleGrid> batch) {
        List<IntegrityViolation> violations = validate(context, batch);
        if (!violations.isEmpty()) {
            logger.error("!!! INTEGRITY VIOLATION in generated schedule for class {}: {} problem(s). Discarding {} grid(s). !!!",
                    context.classId(), violations.size(), batch.size());
            violations.forEach(v -> logger.error("!!! {} section={} day={} period={}: {}",
                    v.kind(), v.section(), v.day(), v.period(), v.message()));
            throw new IntegrityViolationException(violations);
        }
    }

    private static IntegrityViolation violation(Kind kind, ScheduleGrid grid, ScheduleCell cell, String message) {
        return new IntegrityViolation(kind, grid.getSection(), cell.day(), cell.period(),
                cell.subjectId(), cell.teacherId(), message);
    }
}
