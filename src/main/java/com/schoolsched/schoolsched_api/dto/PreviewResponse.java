package com.schoolsched.schoolsched_api.dto;

import java.time.Instant;
import java.util.List;

import com.schoolsched.schoolsched_api.model.SessionType;
import com.schoolsched.schoolsched_api.service.GenerationState;
import com.schoolsched.schoolsched_api.solver.ScheduleCell;

public record PreviewResponse(
        String previewToken,
        GenerationState state,
        String academicYearId,
        SessionType sessionType,
        String classId,
        String className,
        int cellCount,
        List<SectionGrid> grids,
        Instant expiresAt) {

    public record SectionGrid(String section, int filledCount, List<ScheduleCell> cells) {
    }
}
