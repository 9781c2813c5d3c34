package com.schoolsched.schoolsched_api.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Morning/evening cohort partition of the school day.
 * BOTH is only meaningful for constraints that apply to either cohort.
 */
public enum SessionType {
    MORNING,
    EVENING,
    BOTH;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SessionType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Session type is required.");
        }
        try {
            return SessionType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown session type: " + value + ". Use morning, evening or both.");
        }
    }

    public boolean covers(SessionType other) {
        return this == BOTH || this == other;
    }

    /**
     * Classes and schedules always belong to exactly one cohort.
     */
    public SessionType requireConcrete() {
        if (this == BOTH) {
            throw new IllegalArgumentException("A schedule belongs to either the morning or the evening session, not both.");
        }
        return this;
    }
}
