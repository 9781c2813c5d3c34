package com.schoolsched.schoolsched_api.exception;

import java.util.List;

import com.schoolsched.schoolsched_api.dto.AvailabilityConflict;

/**
 * Cells needed by a publish were consumed or withdrawn after the preview was made.
 * The caller must generate a new preview.
 */
public class AvailabilityConflictException extends SchedulingException {

    private final List<AvailabilityConflict> conflicts;

    public AvailabilityConflictException(List<AvailabilityConflict> conflicts) {
        super("AVAILABILITY_CONFLICT", conflicts.size()
                + " teacher slot(s) are no longer free; regenerate the preview and try again");
        this.conflicts = List.copyOf(conflicts);
    }

    public AvailabilityConflictException(String message, Throwable cause) {
        super("AVAILABILITY_CONFLICT", message, cause);
        this.conflicts = List.of();
    }

    public List<AvailabilityConflict> getConflicts() {
        return conflicts;
    }

    @Override
    public Object getDetails() {
        return conflicts.isEmpty() ? null : conflicts;
    }
}
