package com.schoolsched.schoolsched_api.dto;

import java.util.List;

import com.schoolsched.schoolsched_api.model.SessionType;

public record FeasibilityReport(
        String academicYearId,
        SessionType sessionType,
        String classId,
        List<String> sections,
        boolean feasible,
        List<ObstructionDetail> obstructions) {
}
