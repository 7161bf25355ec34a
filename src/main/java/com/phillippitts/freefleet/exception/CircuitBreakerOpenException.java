package com.phillippitts.freefleet.exception;

import java.time.Duration;

/**
 * Thrown without invoking the guarded operation while a circuit breaker is open.
 * Lets callers tell "provider is cooling down" apart from "provider call failed now".
 */
public class CircuitBreakerOpenException extends FreeFleetException {

    private final String breakerName;
    private final Duration retryAfter;

    public CircuitBreakerOpenException(String breakerName, Duration retryAfter) {
        super("Circuit breaker is OPEN (" + breakerName + "), retry in " + retryAfter.toMillis() + " ms");
        this.breakerName = breakerName;
        this.retryAfter = retryAfter;
    }

    public String getBreakerName() {
        return breakerName;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
