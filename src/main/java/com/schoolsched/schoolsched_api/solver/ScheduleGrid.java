package com.schoolsched.schoolsched_api.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.schoolsched.schoolsched_api.model.ScheduleEntry;
import com.schoolsched.schoolsched_api.model.WeekGrid;

/**
 * The 30 cells of one class/section, indexed by {@code day * 6 + period}.
 * A grid is complete when no slot is null.
 */
public class ScheduleGrid {

    private final String classId;
    private final String section;
    private final ScheduleCell[] cells = new ScheduleCell[WeekGrid.SLOT_COUNT];

    public ScheduleGrid(String classId, String section) {
        this.classId = classId;
        this.section = section;
    }

    public static ScheduleGrid fromEntries(String classId, String section, List<ScheduleEntry> entries) {
        ScheduleGrid grid = new ScheduleGrid(classId, section);
        for (ScheduleEntry entry : entries) {
            grid.cells[entry.getSlotIndex()] = new ScheduleCell(classId, section, entry.getDayOfWeek(),
                    entry.getPeriodNumber(), entry.getSubjectId(), entry.getSubjectName(),
                    entry.getTeacherId(), entry.getTeacherName());
        }
        return grid;
    }

    public String getClassId() { return classId; }
    public String getSection() { return section; }

    public boolean isEmpty(int day, int period) {
        return cells[WeekGrid.index(day, period)] == null;
    }

    public ScheduleCell cellAt(int day, int period) {
        return cells[WeekGrid.index(day, period)];
    }

    public void place(ScheduleCell cell) {
        Objects.requireNonNull(cell, "cell");
        int index = cell.slotIndex();
        if (cells[index] != null) {
            throw new IllegalStateException("Section " + section + " already has " + cells[index].subjectName()
                    + " on " + cell.label());
        }
        cells[index] = cell;
    }

    /** Non-null cells ordered by day, then period. */
    public List<ScheduleCell> getCells() {
        List<ScheduleCell> filled = new ArrayList<>();
        for (ScheduleCell cell : cells) {
            if (cell != null) filled.add(cell);
        }
        return filled;
    }

    public int getFilledCount() {
        int count = 0;
        for (ScheduleCell cell : cells) {
            if (cell != null) count++;
        }
        return count;
    }

    public boolean isComplete() {
        return getFilledCount() == WeekGrid.SLOT_COUNT;
    }

    public List<Integer> emptySlotIndexes() {
        List<Integer> empty = new ArrayList<>();
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] == null) empty.add(i);
        }
        return empty;
    }

    public int countOnDay(String subjectId, int day) {
        int count = 0;
        for (int period = 0; period < WeekGrid.PERIODS_PER_DAY; period++) {
            ScheduleCell cell = cellAt(day, period);
            if (cell != null && cell.subjectId().equals(subjectId)) count++;
        }
        return count;
    }

    public int countOf(String subjectId) {
        int count = 0;
        for (ScheduleCell cell : cells) {
            if (cell != null && cell.subjectId().equals(subjectId)) count++;
        }
        return count;
    }

    /** True when (day, period) holds the subject. */
    public boolean holds(String subjectId, int day, int period) {
        if (!WeekGrid.isValidDay(day) || !WeekGrid.isValidPeriod(period)) {
            return false;
        }
        ScheduleCell cell = cellAt(day, period);
        return cell != null && cell.subjectId().equals(subjectId);
    }
}
