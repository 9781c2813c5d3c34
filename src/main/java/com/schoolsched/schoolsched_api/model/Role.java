package com.schoolsched.schoolsched_api.model;

/**
 * Roles carried in the "role" claim of the bearer token.
 * Spring Security matches them through hasRole(...) without the "ROLE_" prefix.
 */
public enum Role {
    ROLE_SCHEDULER,
    ROLE_ADMIN
}
