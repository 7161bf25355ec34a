package com.phillippitts.freefleet.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Thresholds for the per-provider circuit breakers.
 */
@ConfigurationProperties(prefix = "fleet.circuit-breaker")
@Validated
public class CircuitBreakerProperties {

    /** Consecutive failures that open a breaker. */
    @Positive(message = "Failure threshold must be positive")
    private int failureThreshold = 3;

    /** Cooldown after the last failure before a half-open probe, in milliseconds. */
    @Positive(message = "Reset timeout must be positive")
    private long resetTimeoutMs = 30_000;

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public void setFailureThreshold(int failureThreshold) {
        this.failureThreshold = failureThreshold;
    }

    public long getResetTimeoutMs() {
        return resetTimeoutMs;
    }

    public void setResetTimeoutMs(long resetTimeoutMs) {
        this.resetTimeoutMs = resetTimeoutMs;
    }

    public Duration resetTimeout() {
        return Duration.ofMillis(resetTimeoutMs);
    }
}
