package com.phillippitts.voiceanalysis.presentation.exception;

import com.phillippitts.voiceanalysis.exception.AnalysisNotFoundException;
import com.phillippitts.voiceanalysis.exception.FileStorageException;
import com.phillippitts.voiceanalysis.exception.RecordingSessionNotFoundException;
import com.phillippitts.voiceanalysis.exception.StorageException;
import com.phillippitts.voiceanalysis.exception.ValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - rejected input (HTTP 400).
     */
    @ExceptionHandler(ValidationException.class)
    ResponseEntity<ApiError> handleValidation(ValidationException ex) {
        LOG.warn("Validation failed: field={}, reason={}", ex.getField(), ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(),
                "Invalid request", ex.getMessage());
    }

    /**
     * Malformed request bodies, parameters and unknown enum names (HTTP 400).
     */
    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        String details = ex instanceof MethodArgumentNotValidException invalid
                ? invalid.getBindingResult().getFieldErrors().stream()
                    .map(error -> error.getField() + " " + error.getDefaultMessage())
                    .collect(Collectors.joining(", "))
                : ex.getMessage();
        LOG.warn("Bad request: {}", details);
        return respond(HttpStatus.BAD_REQUEST, "BadRequest", "Invalid request", details);
    }

    @ExceptionHandler({AnalysisNotFoundException.class, RecordingSessionNotFoundException.class})
    ResponseEntity<ApiError> handleNotFound(RuntimeException ex) {
        LOG.debug("Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(), "Resource not found", ex.getMessage());
    }

    /**
     * Recording transition not allowed from the current state (HTTP 409).
     */
    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiError> handleIllegalState(IllegalStateException ex) {
        LOG.warn("Illegal transition: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "IllegalTransition", "Operation not allowed in the current state",
                ex.getMessage());
    }

    /**
     * Store failure - retry possible (HTTP 503).
     */
    @ExceptionHandler(StorageException.class)
    ResponseEntity<ApiError> handleStorage(StorageException ex) {
        LOG.error("Storage failure: operation={}, analysisId={}", ex.getOperation(), ex.getAnalysisId(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Analysis store temporarily unavailable", "Please retry in a few seconds");
    }

    @ExceptionHandler(FileStorageException.class)
    ResponseEntity<ApiError> handleFileStorage(FileStorageException ex) {
        LOG.error("File storage failure: analysisId={}", ex.getAnalysisId(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getClass().getSimpleName(),
                "Audio file could not be stored", "Please retry; no analysis was created");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
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
