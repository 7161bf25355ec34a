package com.phillippitts.freefleet.service.resilience;

import com.phillippitts.freefleet.config.properties.CircuitBreakerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * One breaker per provider id, kept for the life of the process so breaker state
 * carries over between discovery passes.
 */
@Component
public class CircuitBreakerRegistry {

    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final int threshold;
    private final Duration resetTimeout;
    private final Clock clock;

    @Autowired
    public CircuitBreakerRegistry(CircuitBreakerProperties properties) {
        this(properties.getFailureThreshold(), properties.resetTimeout(), Clock.systemUTC());
    }

    public CircuitBreakerRegistry(int threshold, Duration resetTimeout, Clock clock) {
        this.threshold = threshold;
        this.resetTimeout = Objects.requireNonNull(resetTimeout, "resetTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CircuitBreaker forProvider(String providerId) {
        return breakers.computeIfAbsent(providerId,
                id -> new CircuitBreaker(id, threshold, resetTimeout, clock));
    }

    /** Snapshot of every breaker created so far, sorted by provider id. */
    public Map<String, CircuitBreaker> all() {
        return new TreeMap<>(breakers);
    }
}
