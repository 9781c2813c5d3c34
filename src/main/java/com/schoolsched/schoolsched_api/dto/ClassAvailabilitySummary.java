package com.schoolsched.schoolsched_api.dto;

import java.util.List;

/**
 * Free periods of every teacher a class depends on, set against the periods a generation run would need.
 */
public record ClassAvailabilitySummary(
        String classId,
        String className,
        String section,
        boolean allSufficient,
        List<TeacherSufficiency> teachers,
        List<String> unassignedSubjects) {

    public record TeacherSufficiency(
            String teacherId,
            String teacherName,
            List<String> subjects,
            int requiredPeriods,
            int freePeriods,
            boolean sufficient,
            String message) {
    }
}
