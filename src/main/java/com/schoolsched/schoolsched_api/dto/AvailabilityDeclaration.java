package com.schoolsched.schoolsched_api.dto;

import java.util.List;

/**
 * Teacher self-declaration of the free-time grid: one entry per (day, period), 30 in total.
 */
public record AvailabilityDeclaration(List<SlotFlag> slots) {

    public record SlotFlag(int day, int period, boolean free) {
    }
}
