package com.schoolsched.schoolsched_api.exception;

/**
 * A stored free-time grid does not have the 30-slot shape. It is never reinterpreted.
 */
public class MalformedAvailabilityException extends SchedulingException {

    private final String teacherId;

    public MalformedAvailabilityException(String teacherId, String reason) {
        super("MALFORMED_AVAILABILITY", "Availability of teacher " + teacherId + " is malformed: " + reason);
        this.teacherId = teacherId;
    }

    public String getTeacherId() {
        return teacherId;
    }
}
