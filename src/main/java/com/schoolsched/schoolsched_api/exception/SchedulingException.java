package com.schoolsched.schoolsched_api.exception;

/**
 * Base class of every timetable failure that is reported to the caller with an error code.
 */
public abstract class SchedulingException extends RuntimeException {

    private final String errorCode;

    protected SchedulingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected SchedulingException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /** Structured payload placed in the "details" field of the response. */
    public Object getDetails() {
        return null;
    }
}
