package com.schoolsched.schoolsched_api.exception;

import com.schoolsched.schoolsched_api.model.ScheduleKey;

public class ScheduleNotFoundException extends SchedulingException {

    public ScheduleNotFoundException(ScheduleKey key) {
        super("SCHEDULE_NOT_FOUND", "No published schedule found for " + key);
    }
}
