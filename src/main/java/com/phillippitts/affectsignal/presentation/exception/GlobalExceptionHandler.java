package com.phillippitts.affectsignal.presentation.exception;

import com.phillippitts.affectsignal.exception.DuplicateKeyException;
import com.phillippitts.affectsignal.exception.UnknownSessionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - question already has an expression (HTTP 409).
     */
    @ExceptionHandler(DuplicateKeyException.class)
    ResponseEntity<ApiError> handleDuplicate(DuplicateKeyException ex) {
        LOG.warn("Duplicate expression for question {}", ex.getQuestionId());
        return error(HttpStatus.CONFLICT, ex, "Expression already recorded", ex.getMessage());
    }

    /**
     * Session closed while the request was in flight (HTTP 409).
     */
    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiError> handleIllegalState(IllegalStateException ex) {
        LOG.warn("Rejected request: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex, "Request conflicts with session state", ex.getMessage());
    }

    @ExceptionHandler(UnknownSessionException.class)
    ResponseEntity<ApiError> handleUnknownSession(UnknownSessionException ex) {
        LOG.debug("Unknown session {}", ex.getSessionId());
        return error(HttpStatus.NOT_FOUND, ex, "Session not found", ex.getMessage());
    }

    /**
     * Client error - invalid or missing input (HTTP 400).
     */
    @ExceptionHandler({
            IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class,
            MultipartException.class
    })
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Invalid capture request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", ex.getMessage());
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
