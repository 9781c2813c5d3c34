package com.schoolsched.schoolsched_api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Validates JWT secret configuration on application startup
 */
@Component
public class JwtSecretValidator implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(JwtSecretValidator.class);

    static final int RECOMMENDED_LENGTH = 16;

    @Value("${jwt.secret:not-set}")
    private String jwtSecret;

    @Override
    public void run(String... args) {
        logger.info("=== JWT SECRET VALIDATION ===");
        if (!isConfigured(jwtSecret)) {
            logger.error("✗ JWT Secret is not configured!");
            logger.error("✗ Set the JWT_SECRET environment variable to the secret shared with the identity service.");
            logger.error("=== JWT SECRET VALIDATION: FAILED ===");
            return;
        }

        logger.info("JWT Secret length: {}, masked: {}", jwtSecret.length(), mask(jwtSecret));
        if (jwtSecret.length() < RECOMMENDED_LENGTH) {
            logger.warn("✗ JWT Secret is shorter than {} characters; tokens are easier to forge.", RECOMMENDED_LENGTH);
            logger.warn("=== JWT SECRET VALIDATION: WEAK ===");
            return;
        }
        logger.info("✓ JWT Secret is set; signing key is derived with SHA-256");
        logger.info("=== JWT SECRET VALIDATION: OK ===");
    }

    static boolean isConfigured(String secret) {
        return secret != null && !secret.isBlank() && !"not-set".equals(secret) && !"change-me".equals(secret);
    }

    static String mask(String secret) {
        return secret.length() > 10
                ? secret.substring(0, 5) + "..." + secret.substring(secret.length() - 5)
                : "****";
    }
}
