package com.schoolsched.schoolsched_api.dto;

import java.util.List;
import java.util.Map;

import com.schoolsched.schoolsched_api.model.SessionType;

public record ScheduleStatistics(
        String academicYearId,
        SessionType sessionType,
        String classId,
        List<String> sections,
        int totalPeriods,
        int filledPeriods,
        List<TeacherLoad> teacherUtilization,
        List<SubjectLoad> subjectDistribution,
        Map<String, Integer> dailyDistribution) {

    /** {@code utilization} is the share of one teacher's 30-period week, in percent. */
    public record TeacherLoad(String teacherId, String teacherName, int periods, double utilization) {
    }

    public record SubjectLoad(String subjectId, String subjectName, int periods) {
    }
}
