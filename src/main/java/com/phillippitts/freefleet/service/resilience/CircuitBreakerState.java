package com.phillippitts.freefleet.service.resilience;

/**
 * Circuit breaker states.
 */
public enum CircuitBreakerState {
    /** Calls pass through; consecutive failures are counted. */
    CLOSED,
    /** Calls are rejected until the reset timeout has elapsed since the last failure. */
    OPEN,
    /** One trial period after the cooldown; the next outcome closes or reopens the breaker. */
    HALF_OPEN
}
