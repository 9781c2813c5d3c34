package com.schoolsched.schoolsched_api.solver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.schoolsched.schoolsched_api.dto.FeasibilityReport;
import com.schoolsched.schoolsched_api.dto.ObstructionDetail;
import com.schoolsched.schoolsched_api.model.ConstraintType;
import com.schoolsched.schoolsched_api.model.ScheduleConstraint;
import com.schoolsched.schoolsched_api.model.WeekGrid;

/**
 * Pre-generation gate. Every check runs so the report lists all obstructions at once.
 *
 * <p>Checks are necessary conditions based on cell counts. A count-sufficient input can still be
 * combinatorially infeasible; the generator aborts in that case.
 */
@Component
public class FeasibilityValidator {

    private static final Logger logger = LoggerFactory.getLogger(FeasibilityValidator.class);

    public FeasibilityReport validate(ScheduleContext context) {
        RequirementSet requirements = context.requirements();
        List<ObstructionDetail> obstructions = new ArrayList<>();

        checkWeeklyTotals(requirements, obstructions);
        checkTeacherCapacity(context, obstructions);
        checkForbiddenConstraints(context, obstructions);
        checkAssignments(requirements, obstructions);
        checkUncoveredPeriods(context, obstructions);

        boolean feasible = obstructions.isEmpty();
        if (feasible) {
            logger.info("Feasibility passed for class {} ({}, year {}), sections {}", context.classId(),
                    context.sessionType().getValue(), context.academicYearId(), requirements.getTargetSections());
        } else {
            logger.warn("Feasibility failed for class {} with {} obstruction(s)", context.classId(), obstructions.size());
            obstructions.forEach(o -> logger.warn("  - {}: {}", o.type(), o.message()));
        }
        return new FeasibilityReport(context.academicYearId(), context.sessionType(), context.classId(),
                requirements.getTargetSections(), feasible, List.copyOf(obstructions));
    }

    private void checkWeeklyTotals(RequirementSet requirements, List<ObstructionDetail> obstructions) {
        for (String section : requirements.getTargetSections()) {
            int total = requirements.weeklyHoursFor(section);
            if (total != WeekGrid.SLOT_COUNT) {
                obstructions.add(ObstructionDetail.hoursMismatch(section, WeekGrid.SLOT_COUNT, total));
            }
        }
    }

    private void checkTeacherCapacity(ScheduleContext context, List<ObstructionDetail> obstructions) {
        RequirementSet requirements = context.requirements();
        AvailabilitySnapshot availability = context.availability();
        Map<String, Integer> demandByTeacher = new LinkedHashMap<>();
        Map<String, String> teacherNames = new LinkedHashMap<>();

        for (SubjectRequirement requirement : requirements.distinctRequirements()) {
            if (!requirement.isAssigned() || !requirements.isKnownTeacher(requirement.teacherId())) continue;
            int demand = requirements.demandFor(requirement);
            if (demand == 0) continue;
            demandByTeacher.merge(requirement.teacherId(), demand, Integer::sum);
            teacherNames.putIfAbsent(requirement.teacherId(), requirement.teacherLabel());

            int eligible = countCells(context, requirement, true);
            if (eligible < demand) {
                obstructions.add(ObstructionDetail.subjectShortfall(requirement.section(), requirement.subjectId(),
                        requirement.subjectName(), requirement.teacherId(), requirement.teacherLabel(), demand, eligible));
            }
        }

        demandByTeacher.forEach((teacherId, demand) -> {
            int free = availability.freeCount(teacherId);
            if (free < demand) {
                obstructions.add(ObstructionDetail.teacherShortfall(teacherId, teacherNames.get(teacherId), demand, free));
            }
        });
    }

    private void checkForbiddenConstraints(ScheduleContext context, List<ObstructionDetail> obstructions) {
        RequirementSet requirements = context.requirements();
        for (SubjectRequirement requirement : requirements.distinctRequirements()) {
            if (!requirement.isAssigned() || !requirements.isKnownTeacher(requirement.teacherId())) continue;
            int demand = requirements.demandFor(requirement);
            int eligible = countCells(context, requirement, true);
            int withoutForbidden = countCells(context, requirement, false);
            if (eligible >= demand || withoutForbidden == eligible) continue;

            List<ScheduleConstraint> forbidden = context.rules().applicable(ConstraintType.FORBIDDEN,
                    requirement.classId(), requirement.subjectId(), requirement.teacherId());
            for (ScheduleConstraint constraint : forbidden) {
                int removed = 0;
                for (int day = 0; day < WeekGrid.DAYS; day++) {
                    for (int period = 0; period < WeekGrid.PERIODS_PER_DAY; period++) {
                        if (constraint.coversSlot(day, period) && isOpen(context, requirement, day, period)) {
                            removed++;
                        }
                    }
                }
                if (removed > 0) {
                    obstructions.add(ObstructionDetail.forbiddenBlocks(requirement.section(), requirement.subjectId(),
                            requirement.subjectName(), requirement.teacherId(), requirement.teacherLabel(),
                            constraint.getId(), constraint.describe(), removed));
                }
            }
        }
    }

    private void checkAssignments(RequirementSet requirements, List<ObstructionDetail> obstructions) {
        for (SubjectRequirement requirement : requirements.distinctRequirements()) {
            if (!requirement.isAssigned()) {
                obstructions.add(ObstructionDetail.unassignedSubject(requirement.section(),
                        requirement.subjectId(), requirement.subjectName()));
            } else if (!requirements.isKnownTeacher(requirement.teacherId())) {
                obstructions.add(ObstructionDetail.unknownTeacher(requirement.section(),
                        requirement.subjectId(), requirement.subjectName(), requirement.teacherId()));
            }
        }
    }

    private void checkUncoveredPeriods(ScheduleContext context, List<ObstructionDetail> obstructions) {
        RequirementSet requirements = context.requirements();
        for (String section : requirements.getTargetSections()) {
            List<SubjectRequirement> staffed = new ArrayList<>();
            for (SubjectRequirement requirement : requirements.forSection(section)) {
                if (requirement.isAssigned() && requirements.isKnownTeacher(requirement.teacherId())
                        && requirement.weeklyHours() > 0) {
                    staffed.add(requirement);
                }
            }
            if (staffed.isEmpty()) continue;
            for (int day = 0; day < WeekGrid.DAYS; day++) {
                for (int period = 0; period < WeekGrid.PERIODS_PER_DAY; period++) {
                    boolean covered = false;
                    for (SubjectRequirement requirement : staffed) {
                        if (isOpen(context, requirement, day, period) && context.rules().isEligible(
                                requirement.classId(), requirement.subjectId(), requirement.teacherId(), day, period)) {
                            covered = true;
                            break;
                        }
                    }
                    if (!covered) {
                        obstructions.add(ObstructionDetail.uncoveredPeriod(section, day, period,
                                WeekGrid.label(day, period)));
                    }
                }
            }
        }
    }

    /** Teacher free and inside any REQUIRED window, ignoring FORBIDDEN rules. */
    private boolean isOpen(ScheduleContext context, SubjectRequirement requirement, int day, int period) {
        return context.availability().isFree(requirement.teacherId(), day, period)
                && context.rules().isWithinRequired(requirement.classId(), requirement.subjectId(),
                        requirement.teacherId(), day, period);
    }

    private int countCells(ScheduleContext context, SubjectRequirement requirement, boolean applyForbidden) {
        int count = 0;
        for (int day = 0; day < WeekGrid.DAYS; day++) {
            for (int period = 0; period < WeekGrid.PERIODS_PER_DAY; period++) {
                if (!isOpen(context, requirement, day, period)) continue;
                if (applyForbidden && context.rules().isForbidden(requirement.classId(), requirement.subjectId(),
                        requirement.teacherId(), day, period)) continue;
                count++;
            }
        }
        return count;
    }
}
