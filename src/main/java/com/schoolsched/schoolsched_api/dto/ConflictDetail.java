package com.schoolsched.schoolsched_api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConflictDetail(
        Type type,
        Severity severity,
        String academicYearId,
        String classId,
        String section,
        Integer day,
        Integer period,
        String subjectId,
        String teacherId,
        String constraintId,
        Integer priorityLevel,
        String message) {

    public enum Type {
        TEACHER_DOUBLE_BOOKED,
        EMPTY_SLOT,
        AVAILABILITY_MISMATCH,
        STRAY_ASSIGNMENT,
        CONSTRAINT_VIOLATION
    }

    public enum Severity {
        ERROR,
        WARNING
    }
}
