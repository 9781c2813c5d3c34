package com.schoolsched.schoolsched_api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Single result envelope returned by every endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, String message, String errorCode, Object details) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null, null, null);
    }

    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, data, message, null, null);
    }

    public static ApiResponse<Void> error(String errorCode, String message) {
        return new ApiResponse<>(false, null, message, errorCode, null);
    }

    public static ApiResponse<Void> error(String errorCode, String message, Object details) {
        return new ApiResponse<>(false, null, message, errorCode, details);
    }
}
