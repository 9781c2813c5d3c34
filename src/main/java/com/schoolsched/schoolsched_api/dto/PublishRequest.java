package com.schoolsched.schoolsched_api.dto;

/**
 * Publishes either a held preview or, when no token is given, a freshly regenerated grid.
 */
public record PublishRequest(String previewToken, String name, GenerateScheduleRequest request) {
}
