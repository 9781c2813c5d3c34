package com.schoolsched.schoolsched_api.exception;

import java.util.Map;

import com.schoolsched.schoolsched_api.model.ScheduleKey;

public class NameConflictException extends SchedulingException {

    private final String requestedName;
    private final ScheduleKey key;
    private final String existingName;

    public NameConflictException(String requestedName, ScheduleKey key, String existingName, String message) {
        super("NAME_CONFLICT", message);
        this.requestedName = requestedName;
        this.key = key;
        this.existingName = existingName;
    }

    public String getRequestedName() { return requestedName; }
    public ScheduleKey getKey() { return key; }
    public String getExistingName() { return existingName; }

    @Override
    public Object getDetails() {
        return Map.of(
                "requestedName", requestedName != null ? requestedName : "",
                "existingName", existingName != null ? existingName : "",
                "section", key.section());
    }
}
