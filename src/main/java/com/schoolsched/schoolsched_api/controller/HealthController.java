package com.schoolsched.schoolsched_api.controller;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.schoolsched.schoolsched_api.config.MongoConnectionLogger;
import com.schoolsched.schoolsched_api.service.PreviewStore;

/**
 * Health check endpoint to diagnose connection issues
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private static final Logger logger = LoggerFactory.getLogger(HealthController.class);

    private final MongoTemplate mongoTemplate;
    private final PreviewStore previewStore;

    @Value("${spring.data.mongodb.uri:not-set}")
    private String mongoUri;

    @Value("${cors.allowed-origins:not-set}")
    private String corsOrigins;

    @Value("${schedule.mongo.transactions-enabled:true}")
    private boolean transactionsEnabled;

    public HealthController(MongoTemplate mongoTemplate, PreviewStore previewStore) {
        this.mongoTemplate = mongoTemplate;
        this.previewStore = previewStore;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "schoolsched-api");

        Map<String, Object> mongoStatus = new HashMap<>();
        try {
            String database = mongoTemplate.getDb().getName();
            mongoStatus.put("connected", true);
            mongoStatus.put("database", database);
            logger.info("MongoDB health check: Connected to database {}", database);
        } catch (Exception e) {
            mongoStatus.put("connected", false);
            mongoStatus.put("error", e.getMessage());
            logger.error("MongoDB health check failed: {}", e.getMessage(), e);
        }
        mongoStatus.put("uri", MongoConnectionLogger.maskUri(mongoUri) + " (masked)");
        mongoStatus.put("transactionsEnabled", transactionsEnabled);
        health.put("mongodb", mongoStatus);

        Map<String, Object> scheduling = new HashMap<>();
        scheduling.put("previewsHeld", previewStore.size());
        health.put("scheduling", scheduling);

        Map<String, Object> config = new HashMap<>();
        config.put("corsOrigins", corsOrigins);
        health.put("config", config);

        return ResponseEntity.ok(health);
    }
}
