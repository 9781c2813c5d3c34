package com.schoolsched.schoolsched_api.solver;

import com.schoolsched.schoolsched_api.model.WeekGrid;

/**
 * (day, period) of one class/section taught by one teacher.
 */
public record ScheduleCell(
        String classId,
        String section,
        int day,
        int period,
        String subjectId,
        String subjectName,
        String teacherId,
        String teacherName) {

    public int slotIndex() {
        return WeekGrid.index(day, period);
    }

    public String label() {
        return WeekGrid.label(day, period);
    }
}
