package com.slotplanner.slotplanner_api.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Global Exception Handler to catch exceptions from all controllers
 * and return standardized JSON error responses.
 */
@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private ResponseEntity<Object> buildErrorResponse(Exception ex, HttpStatus status) {
        logger.error("Exception caught by GlobalExceptionHandler: {}", ex.getMessage());
        return ResponseEntity.status(status).body(Map.of("message", ex.getMessage()));
    }

    // --- 400 Bad Request (planning input) ---
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Object> handleValidationException(ValidationException ex, WebRequest request) {
        logger.warn("Invalid planning input: {}", ex.getErrors());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("message", ex.getMessage(), "errors", ex.getErrors()));
    }

    // --- 404 Not Found ---
    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<Object> handleNoSuchElementException(NoSuchElementException ex, WebRequest request) {
        logger.warn("Resource not found: {}", ex.getMessage());
        return buildErrorResponse(ex, HttpStatus.NOT_FOUND);
    }

    // --- 400 Bad Request ---
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Object> handleIllegalArgumentException(IllegalArgumentException ex, WebRequest request) {
        logger.warn("Bad request: {}", ex.getMessage());
        return buildErrorResponse(ex, HttpStatus.BAD_REQUEST);
    }

    // --- 409 Conflict (job still running) ---
    @ExceptionHandler(JobInProgressException.class)
    public ResponseEntity<Object> handleJobInProgressException(JobInProgressException ex, WebRequest request) {
        logger.info("Conflict: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("message", ex.getMessage()));
    }

    // --- 500 Internal Server Error (solver fault) ---
    @ExceptionHandler(SolverFaultException.class)
    public ResponseEntity<Object> handleSolverFaultException(SolverFaultException ex, WebRequest request) {
        logger.error("!!! Solver fault:", ex);
        return buildErrorResponse(ex, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    // --- 500 Internal Server Error (Generic Fallback) ---
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleAllUncaughtException(Exception ex, WebRequest request) {
        logger.error("An unexpected internal server error occurred:", ex);
        return buildErrorResponse(new RuntimeException("An unexpected internal error occurred. Please contact support."),
                HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
