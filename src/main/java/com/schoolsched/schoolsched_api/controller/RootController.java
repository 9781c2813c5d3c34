package com.schoolsched.schoolsched_api.controller;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Root endpoint to provide API information
 */
@RestController
public class RootController {

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
            "service", "schoolsched-api",
            "status", "running",
            "version", "0.0.1",
            "endpoints", Map.of(
                "health", "/api/health",
                "schedules", "/api/schedules/validate, /api/schedules/preview, /api/schedules/publish",
                "availability", "/api/teachers/{teacherId}/availability",
                "constraints", "/api/schedule-constraints"
            ),
            "message", "SchoolSched API is running. Use /api/health for health check."
        ));
    }
}
