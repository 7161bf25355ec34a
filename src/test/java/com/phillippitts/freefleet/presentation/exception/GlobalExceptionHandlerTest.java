package com.phillippitts.freefleet.presentation.exception;

import com.phillippitts.freefleet.exception.CircuitBreakerOpenException;
import com.phillippitts.freefleet.exception.FallbackExhaustedException;
import com.phillippitts.freefleet.exception.NoActiveProvidersException;
import com.phillippitts.freefleet.exception.ProviderFetchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void verifiesNoActiveProvidersReturns503WithActionableMessage() {
        NoActiveProvidersException ex = new NoActiveProvidersException(
                Path.of("/home/dev/.config/opencode/oh-my-opencode.json"), List.of("Failed to read"));

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleNoActiveProviders(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("NoActiveProvidersException");
        assertThat(response.getBody().message()).isEqualTo("No active providers");
        assertThat(response.getBody().details()).contains("oh-my-opencode.json");
    }

    @Test
    void verifiesOpenBreakerReturns503WithRetryAfter() {
        CircuitBreakerOpenException ex = new CircuitBreakerOpenException("groq", Duration.ofSeconds(42));

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleBreakerOpen(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getHeaders().getFirst("Retry-After")).isEqualTo("42");
    }

    @Test
    void verifiesRetryAfterIsAtLeastOneSecond() {
        CircuitBreakerOpenException ex = new CircuitBreakerOpenException("groq", Duration.ofMillis(200));

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleBreakerOpen(ex);

        assertThat(response.getHeaders().getFirst("Retry-After")).isEqualTo("1");
    }

    @Test
    void verifiesFleetFailureReturns502() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleFleetFailure(new ProviderFetchException("openrouter", 500, "Internal Server Error"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().details()).contains("openrouter API error: 500");
    }

    @Test
    void verifiesExhaustedFallbackIsUpstreamFailure() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleFleetFailure(new FallbackExhaustedException("race-1", List.of()));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
    }

    @Test
    void verifiesIllegalArgumentReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleBadRequest(new IllegalArgumentException("Unknown model category: poetry"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().details()).isEqualTo("Unknown model category: poetry");
    }

    @Test
    void verifiesUnexpectedErrorDoesNotLeakDetails() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("/secret/internal/state"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).doesNotContain("/secret/internal");
        assertThat(response.getBody().timestamp()).isNotNull();
    }
}
