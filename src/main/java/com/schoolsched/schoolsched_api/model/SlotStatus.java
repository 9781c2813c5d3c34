package com.schoolsched.schoolsched_api.model;

public enum SlotStatus {
    /** Declared free and not yet consumed by a published schedule. */
    FREE,
    /** Consumed by a published schedule. */
    ASSIGNED,
    /** Declared busy by the teacher. */
    UNAVAILABLE
}
