package com.schoolsched.schoolsched_api.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;

public enum ConstraintType {
    FORBIDDEN,
    REQUIRED,
    MAX_CONSECUTIVE,
    MIN_BREAK;

    /**
     * Accepts "maxConsecutive", "max_consecutive" and "MAX_CONSECUTIVE" alike.
     */
    @JsonCreator
    public static ConstraintType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Constraint type is required.");
        }
        String normalized = value.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        try {
            return ConstraintType.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown constraint type: " + value);
        }
    }

    public boolean limitsCells() {
        return this == FORBIDDEN || this == REQUIRED;
    }
}
