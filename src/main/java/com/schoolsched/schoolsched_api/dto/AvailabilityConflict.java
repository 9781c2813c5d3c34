package com.schoolsched.schoolsched_api.dto;

import com.schoolsched.schoolsched_api.model.SlotStatus;

/**
 * A cell the preview wants to consume that is no longer free at publish time.
 */
public record AvailabilityConflict(
        String teacherId,
        String teacherName,
        int day,
        int period,
        SlotStatus currentStatus,
        String heldBy,
        String message) {
}
