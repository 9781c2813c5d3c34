package com.schoolsched.schoolsched_api.dto;

import java.util.List;

import com.schoolsched.schoolsched_api.model.AvailabilitySlot;

public record AvailabilityView(String teacherId, String teacherName, int freeCount, int assignedCount,
                               List<AvailabilitySlot> slots) {
}
