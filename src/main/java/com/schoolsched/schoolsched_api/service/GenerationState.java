package com.schoolsched.schoolsched_api.service;

/**
 * Lifecycle of one generation request.
 */
public enum GenerationState {
    REQUESTED,
    VALIDATING,
    GENERATING,
    PREVIEW_READY,
    PUBLISHED,
    DISCARDED,
    FAILED;

    public boolean isTerminal() {
        return this == PUBLISHED || this == DISCARDED || this == FAILED;
    }
}
