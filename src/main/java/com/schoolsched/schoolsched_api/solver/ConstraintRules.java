package com.schoolsched.schoolsched_api.solver;

import java.util.ArrayList;
import java.util.List;

import com.schoolsched.schoolsched_api.model.ConstraintType;
import com.schoolsched.schoolsched_api.model.ScheduleConstraint;
import com.schoolsched.schoolsched_api.model.SessionType;
import com.schoolsched.schoolsched_api.model.WeekGrid;

/**
 * Read-only view of the active constraints of one academic year and session.
 * FORBIDDEN and REQUIRED decide which cells are eligible; MAX_CONSECUTIVE and MIN_BREAK shape spacing.
 */
public class ConstraintRules {

    private final SessionType sessionType;
    private final List<ScheduleConstraint> constraints;

    public ConstraintRules(SessionType sessionType, List<ScheduleConstraint> constraints) {
        this.sessionType = sessionType;
        List<ScheduleConstraint> applicable = new ArrayList<>();
        for (ScheduleConstraint constraint : constraints) {
            if (constraint.isActive() && constraint.getConstraintType() != null
                    && (constraint.getSessionType() == null || constraint.getSessionType().covers(sessionType))) {
                applicable.add(constraint);
            }
        }
        this.constraints = List.copyOf(applicable);
    }

    public static ConstraintRules none(SessionType sessionType) {
        return new ConstraintRules(sessionType, List.of());
    }

    public List<ScheduleConstraint> all() {
        return constraints;
    }

    public List<ScheduleConstraint> applicable(ConstraintType type, String classId, String subjectId, String teacherId) {
        List<ScheduleConstraint> matching = new ArrayList<>();
        for (ScheduleConstraint constraint : constraints) {
            if (constraint.getConstraintType() == type
                    && constraint.appliesTo(classId, subjectId, teacherId, sessionType)) {
                matching.add(constraint);
            }
        }
        return matching;
    }

    public boolean isForbidden(String classId, String subjectId, String teacherId, int day, int period) {
        for (ScheduleConstraint constraint : applicable(ConstraintType.FORBIDDEN, classId, subjectId, teacherId)) {
            if (constraint.coversSlot(day, period)) return true;
        }
        return false;
    }

    public boolean isWithinRequired(String classId, String subjectId, String teacherId, int day, int period) {
        List<ScheduleConstraint> required = applicable(ConstraintType.REQUIRED, classId, subjectId, teacherId);
        if (required.isEmpty()) {
            return true;
        }
        for (ScheduleConstraint constraint : required) {
            if (constraint.coversSlot(day, period)) return true;
        }
        return false;
    }

    public boolean isEligible(String classId, String subjectId, String teacherId, int day, int period) {
        return isWithinRequired(classId, subjectId, teacherId, day, period)
                && !isForbidden(classId, subjectId, teacherId, day, period);
    }

    /** Tightest MAX_CONSECUTIVE limit, or null when none applies. */
    public Integer maxConsecutiveFor(String classId, String subjectId, String teacherId) {
        Integer limit = null;
        for (ScheduleConstraint constraint : applicable(ConstraintType.MAX_CONSECUTIVE, classId, subjectId, teacherId)) {
            Integer value = constraint.getMaxConsecutivePeriods();
            if (value != null && (limit == null || value < limit)) limit = value;
        }
        return limit;
    }

    /** Widest MIN_BREAK gap, or null when none applies. */
    public Integer minBreakFor(String classId, String subjectId, String teacherId) {
        Integer gap = null;
        for (ScheduleConstraint constraint : applicable(ConstraintType.MIN_BREAK, classId, subjectId, teacherId)) {
            Integer value = constraint.getMinBreakPeriods();
            if (value != null && (gap == null || value > gap)) gap = value;
        }
        return gap;
    }

    /**
     * Whether putting the subject at (day, period) would exceed a consecutive limit or
     * sit closer than the minimum break to another occurrence on the same day.
     */
    public boolean breaksSpacing(ScheduleGrid grid, String subjectId, String teacherId, int day, int period) {
        Integer maxRun = maxConsecutiveFor(grid.getClassId(), subjectId, teacherId);
        if (maxRun != null && runLengthWith(grid, subjectId, day, period) > maxRun) {
            return true;
        }
        Integer minBreak = minBreakFor(grid.getClassId(), subjectId, teacherId);
        if (minBreak != null) {
            for (int other = 0; other < WeekGrid.PERIODS_PER_DAY; other++) {
                if (other != period && grid.holds(subjectId, day, other)
                        && Math.abs(other - period) - 1 < minBreak) {
                    return true;
                }
            }
        }
        return false;
    }

    static int runLengthWith(ScheduleGrid grid, String subjectId, int day, int period) {
        int run = 1;
        for (int p = period - 1; grid.holds(subjectId, day, p); p--) run++;
        for (int p = period + 1; grid.holds(subjectId, day, p); p++) run++;
        return run;
    }
}
