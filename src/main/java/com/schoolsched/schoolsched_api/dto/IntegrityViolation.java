package com.schoolsched.schoolsched_api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntegrityViolation(
        Kind kind,
        String section,
        Integer day,
        Integer period,
        String subjectId,
        String teacherId,
        String message) {

    public enum Kind {
        EMPTY_CELL,
        TEACHER_DOUBLE_BOOKED,
        STRAY_ASSIGNMENT,
        HOURS_MISMATCH,
        AVAILABILITY_VIOLATION
    }
}
