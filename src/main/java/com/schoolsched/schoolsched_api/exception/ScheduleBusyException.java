package com.schoolsched.schoolsched_api.exception;

public class ScheduleBusyException extends SchedulingException {

    public ScheduleBusyException(String lockKey) {
        super("SCHEDULE_BUSY", "Another schedule request is already running for " + lockKey + ". Try again shortly.");
    }
}
