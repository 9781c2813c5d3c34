package com.schoolsched.schoolsched_api.solver;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.schoolsched.schoolsched_api.exception.GenerationException;
import com.schoolsched.schoolsched_api.model.WeekGrid;

/**
 * Deterministic greedy distribution of subject periods over the week.
 *
 * <p>Subjects are placed hardest first (descending hours owed, then subject id). Each occurrence
 * takes the cell that keeps spacing rules, then sits on the day with the fewest periods of that
 * subject so far, then has the lowest period index. A missing placement aborts the whole run.
 */
@Component
public class SlotDistributionGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SlotDistributionGenerator.class);

    static final Comparator<SubjectRequirement> PLACEMENT_ORDER = Comparator
            .comparingInt(SubjectRequirement::weeklyHoursOwed).reversed()
            .thenComparing(SubjectRequirement::subjectId);

    /**
     * Fills one grid per target section. Sections share one working copy of availability, so a
     * teacher used in section 1 is not offered again at the same time in section 2. The snapshot
     * in the context is never modified.
     *
     * @throws GenerationException when an occurrence has no candidate cell
     */
    public List<ScheduleGrid> generate(ScheduleContext context) {
        AvailabilitySnapshot working = context.availability().copy();
        RequirementSet requirements = context.requirements();
        List<ScheduleGrid> grids = new ArrayList<>();

        for (String section : requirements.getTargetSections()) {
            grids.add(fillSection(context, section, working));
        }
        logger.info("Generated {} grid(s) for class {}", grids.size(), context.classId());
        return grids;
    }

    private ScheduleGrid fillSection(ScheduleContext context, String section, AvailabilitySnapshot working) {
        ScheduleGrid grid = new ScheduleGrid(context.classId(), section);
        List<SubjectRequirement> ordered = new ArrayList<>(context.requirements().forSection(section));
        ordered.sort(PLACEMENT_ORDER);

        for (SubjectRequirement requirement : ordered) {
            for (int occurrence = 1; occurrence <= requirement.weeklyHours(); occurrence++) {
                int[] slot = requirement.isAssigned() ? pickCell(context, grid, requirement, working) : null;
                if (slot == null) {
                    int missing = requirement.weeklyHours() - occurrence + 1;
                    logger.error("!!! No cell for {} ({}) in class {} section {}: occurrence {} of {}, {} hour(s) missing. Discarding run.",
                            requirement.subjectName(), requirement.teacherLabel(), context.classId(), section,
                            occurrence, requirement.weeklyHours(), missing);
                    throw new GenerationException(section, requirement.subjectId(), requirement.subjectName(),
                            requirement.teacherId(), requirement.teacherLabel(), occurrence, missing);
                }
                int day = slot[0];
                int period = slot[1];
                grid.place(new ScheduleCell(context.classId(), section, day, period, requirement.subjectId(),
                        requirement.subjectName(), requirement.teacherId(), requirement.teacherName()));
                working.consume(requirement.teacherId(), day, period);
            }
        }
        logger.debug("Section {} of class {}: {} of {} cells filled", section, context.classId(),
                grid.getFilledCount(), WeekGrid.SLOT_COUNT);
        return grid;
    }

    private int[] pickCell(ScheduleContext context, ScheduleGrid grid, SubjectRequirement requirement,
                           AvailabilitySnapshot working) {
        int[] best = null;
        boolean bestBreaksSpacing = true;
        int bestDayCount = Integer.MAX_VALUE;

        for (int day = 0; day < WeekGrid.DAYS; day++) {
            int dayCount = grid.countOnDay(requirement.subjectId(), day);
            for (int period = 0; period < WeekGrid.PERIODS_PER_DAY; period++) {
                if (!grid.isEmpty(day, period)
                        || !working.isFree(requirement.teacherId(), day, period)
                        || !context.rules().isEligible(grid.getClassId(), requirement.subjectId(),
                                requirement.teacherId(), day, period)) {
                    continue;
                }
                boolean breaksSpacing = context.rules().breaksSpacing(grid, requirement.subjectId(),
                        requirement.teacherId(), day, period);
                if (best == null || isBetter(breaksSpacing, dayCount, period, day,
                        bestBreaksSpacing, bestDayCount, best[1], best[0])) {
                    best = new int[] {day, period};
                    bestBreaksSpacing = breaksSpacing;
                    bestDayCount = dayCount;
                }
            }
        }
        return best;
    }

    private static boolean isBetter(boolean breaksSpacing, int dayCount, int period, int day,
                                    boolean bestBreaksSpacing, int bestDayCount, int bestPeriod, int bestDay) {
        if (breaksSpacing != bestBreaksSpacing) return !breaksSpacing;
        if (dayCount != bestDayCount) return dayCount < bestDayCount;
        if (period != bestPeriod) return period < bestPeriod;
        return day < bestDay;
    }
}
