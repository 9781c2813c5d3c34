package com.schoolsched.schoolsched_api.solver;

/**
 * Periods a teacher owes a subject of a class. Derived on every request, never stored.
 *
 * <p>{@code weeklyHours} is what every single section grid needs. When {@code section} is null the
 * requirement spans all sections and {@code weeklyHoursOwed} is {@code weeklyHours * sectionCount};
 * otherwise both values are equal.
 */
public record SubjectRequirement(
        String classId,
        String subjectId,
        String subjectName,
        String teacherId,
        String teacherName,
        String section,
        int weeklyHours,
        int weeklyHoursOwed) {

    public boolean isAssigned() {
        return teacherId != null;
    }

    public boolean spansAllSections() {
        return section == null;
    }

    public String teacherLabel() {
        if (teacherName != null) return teacherName;
        return teacherId != null ? teacherId : "unassigned";
    }
}
