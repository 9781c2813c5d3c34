package com.schoolsched.schoolsched_api.exception;

import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import com.schoolsched.schoolsched_api.dto.ApiResponse;

/**
 * Global Exception Handler to catch exceptions from all controllers
 * and return them in the standard response envelope.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private ResponseEntity<Object> buildErrorResponse(String errorCode, String message, Object details,
                                                      HttpStatus status) {
        return ResponseEntity.status(status).body(ApiResponse.error(errorCode, message, details));
    }

    private ResponseEntity<Object> buildErrorResponse(SchedulingException ex, HttpStatus status) {
        return buildErrorResponse(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), status);
    }

    // --- 422 Unprocessable: the inputs cannot produce a timetable ---
    @ExceptionHandler(FeasibilityException.class)
    public ResponseEntity<Object> handleFeasibilityException(FeasibilityException ex, WebRequest request) {
        logger.warn("Feasibility check failed: {}", ex.getMessage());
        return buildErrorResponse(ex, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    // --- 500: generator or integrity guarantee broken ---
    @ExceptionHandler({ GenerationException.class, IntegrityViolationException.class })
    public ResponseEntity<Object> handleGenerationFailure(SchedulingException ex, WebRequest request) {
        logger.error("Schedule generation failed [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return buildErrorResponse(ex, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    // --- 409 Conflict ---
    @ExceptionHandler({ NameConflictException.class, AvailabilityConflictException.class, ScheduleBusyException.class })
    public ResponseEntity<Object> handleConflict(SchedulingException ex, WebRequest request) {
        logger.warn("Conflict [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return buildErrorResponse(ex, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(ScheduleNotFoundException.class)
    public ResponseEntity<Object> handleScheduleNotFound(ScheduleNotFoundException ex, WebRequest request) {
        logger.warn("Schedule not found: {}", ex.getMessage());
        return buildErrorResponse(ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(MalformedAvailabilityException.class)
    public ResponseEntity<Object> handleMalformedAvailability(MalformedAvailabilityException ex, WebRequest request) {
        logger.error("!!! Stored availability is malformed: {} !!!", ex.getMessage());
        return buildErrorResponse(ex, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    // --- 404 Not Found ---
    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Object> handleNoSuchElementException(NoSuchElementException ex, WebRequest request) {
        logger.warn("Resource not found: {}", ex.getMessage());
        return buildErrorResponse("NOT_FOUND", ex.getMessage(), null, HttpStatus.NOT_FOUND);
    }

    // --- 400 Bad Request ---
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Object> handleIllegalArgumentException(IllegalArgumentException ex, WebRequest request) {
        logger.warn("Bad request: {}", ex.getMessage());
        return buildErrorResponse("BAD_REQUEST", ex.getMessage(), null, HttpStatus.BAD_REQUEST);
    }

    // --- 401 Unauthorized ---
    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<Object> handleAuthenticationException(AuthenticationException ex, WebRequest request) {
        logger.warn("Authentication failed: {}", ex.getMessage());
        return buildErrorResponse("UNAUTHORIZED", ex.getMessage(), null, HttpStatus.UNAUTHORIZED);
    }

    // --- 403 Forbidden ---
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Object> handleAccessDeniedException(AccessDeniedException ex, WebRequest request) {
        logger.warn("Access denied: {}", ex.getMessage());
        return buildErrorResponse("FORBIDDEN", "You do not have permission to perform this action.", null,
                HttpStatus.FORBIDDEN);
    }

    // --- 500 Internal Server Error (Generic Fallback) ---
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleAllUncaughtException(Exception ex, WebRequest request) {
        logger.error("An unexpected internal server error occurred:", ex);
        return buildErrorResponse("INTERNAL_ERROR", "An unexpected internal error occurred. Please contact support.",
                null, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
