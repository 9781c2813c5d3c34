package com.schoolsched.schoolsched_api.exception;

import java.util.List;

import com.schoolsched.schoolsched_api.dto.IntegrityViolation;

/**
 * A generated batch broke one of the grid guarantees. The whole batch is discarded.
 */
public class IntegrityViolationException extends SchedulingException {

    private final List<IntegrityViolation> violations;

    public IntegrityViolationException(List<IntegrityViolation> violations) {
        super("INTEGRITY_VIOLATION", "Generated schedule failed integrity validation with "
                + violations.size() + " violation(s)");
        this.violations = List.copyOf(violations);
    }

    public List<IntegrityViolation> getViolations() {
        return violations;
    }

    @Override
    public Object getDetails() {
        return violations;
    }
}
