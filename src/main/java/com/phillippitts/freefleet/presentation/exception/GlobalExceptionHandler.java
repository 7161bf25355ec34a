package com.phillippitts.freefleet.presentation.exception;

import com.phillippitts.freefleet.exception.CircuitBreakerOpenException;
import com.phillippitts.freefleet.exception.FreeFleetException;
import com.phillippitts.freefleet.exception.NoActiveProvidersException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts fleet exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting internal details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Host configuration names no provider (HTTP 503) - nothing can be discovered until it is fixed.
     */
    @ExceptionHandler(NoActiveProvidersException.class)
    ResponseEntity<ApiError> handleNoActiveProviders(NoActiveProvidersException ex) {
        LOG.error("No active providers: config={}, errors={}", ex.getConfigPath(), ex.getErrors());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "No active providers",
                "Add at least one provider under 'providers' or 'categories' in " + ex.getConfigPath(),
                Instant.now()
            ));
    }

    /**
     * Provider temporarily isolated (HTTP 503).
     */
    @ExceptionHandler(CircuitBreakerOpenException.class)
    ResponseEntity<ApiError> handleBreakerOpen(CircuitBreakerOpenException ex) {
        LOG.warn("Circuit open: {}", ex.getBreakerName());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .header("Retry-After", String.valueOf(Math.max(1, ex.getRetryAfter().toSeconds())))
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Provider temporarily unavailable",
                "Please retry in " + Math.max(1, ex.getRetryAfter().toSeconds()) + " seconds",
                Instant.now()
            ));
    }

    /**
     * Upstream provider or race failure (HTTP 502).
     */
    @ExceptionHandler(FreeFleetException.class)
    ResponseEntity<ApiError> handleFleetFailure(FreeFleetException ex) {
        LOG.error("Fleet operation failed: {}", ex.getMessage(), ex);
        return ResponseEntity
            .status(HttpStatus.BAD_GATEWAY)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Upstream provider failure",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - invalid parameter (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex.getMessage(),
                Instant.now()
            ));
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
