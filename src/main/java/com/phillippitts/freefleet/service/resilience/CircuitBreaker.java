package com.phillippitts.freefleet.service.resilience;

import com.phillippitts.freefleet.exception.CircuitBreakerOpenException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Failure isolator around one provider's calls.
 *
 * <p>State transitions:
 * <ul>
 *   <li>CLOSED to OPEN when consecutive failures reach the threshold</li>
 *   <li>OPEN to HALF_OPEN on the first call after {@code resetTimeout} has elapsed since the last failure</li>
 *   <li>HALF_OPEN to CLOSED on success, back to OPEN on failure</li>
 * </ul>
 *
 * <p>An operation fails exactly when it throws. The lock is held only for state
 * bookkeeping, never while the operation runs.
 */
public class CircuitBreaker {

    private static final Logger LOG = LogManager.getLogger(CircuitBreaker.class);

    private final String name;
    private final int threshold;
    private final Duration resetTimeout;
    private final Clock clock;

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failures;
    private Instant lastFailureTime;

    public CircuitBreaker(String name, int threshold, Duration resetTimeout, Clock clock) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1, got: " + threshold);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.threshold = threshold;
        this.resetTimeout = Objects.requireNonNull(resetTimeout, "resetTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CircuitBreaker(String name) {
        this(name, 3, Duration.ofSeconds(30), Clock.systemUTC());
    }

    /**
     * Runs the operation unless the breaker is open.
     *
     * @throws CircuitBreakerOpenException without invoking the operation while OPEN and cooling down
     * @throws RuntimeException whatever the operation threw, after recording the failure
     */
    public <T> T execute(Supplier<T> operation) {
        beforeCall();
        T result;
        try {
            result = operation.get();
        } catch (RuntimeException e) {
            onFailure();
            throw e;
        }
        onSuccess();
        return result;
    }

    private synchronized void beforeCall() {
        if (state != CircuitBreakerState.OPEN) {
            return;
        }
        Duration sinceFailure = Duration.between(lastFailureTime, clock.instant());
        if (sinceFailure.compareTo(resetTimeout) >= 0) {
            state = CircuitBreakerState.HALF_OPEN;
            LOG.info("Circuit breaker '{}' half-open after {} ms cooldown", name, sinceFailure.toMillis());
            return;
        }
        throw new CircuitBreakerOpenException(name, resetTimeout.minus(sinceFailure));
    }

    private synchronized void onSuccess() {
        if (state != CircuitBreakerState.CLOSED) {
            LOG.info("Circuit breaker '{}' closed", name);
        }
        failures = 0;
        state = CircuitBreakerState.CLOSED;
    }

    private synchronized void onFailure() {
        failures++;
        lastFailureTime = clock.instant();
        if (state == CircuitBreakerState.HALF_OPEN || failures >= threshold) {
            if (state != CircuitBreakerState.OPEN) {
                LOG.warn("Circuit breaker '{}' opened after {} consecutive failures", name, failures);
            }
            state = CircuitBreakerState.OPEN;
        }
    }

    public synchronized CircuitBreakerState getState() {
        return state;
    }

    public synchronized int getFailures() {
        return failures;
    }

    public String getName() {
        return name;
    }
}
