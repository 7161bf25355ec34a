package com.phillippitts.freefleet.service.health;

import com.phillippitts.freefleet.service.resilience.CircuitBreaker;
import com.phillippitts.freefleet.service.resilience.CircuitBreakerRegistry;
import com.phillippitts.freefleet.service.resilience.CircuitBreakerState;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator over the per-provider circuit breakers.
 *
 * <ul>
 *   <li>UP: no breaker is open (also when no provider has been contacted yet)</li>
 *   <li>DEGRADED: some breakers are open</li>
 *   <li>DOWN: every breaker is open</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class FleetHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED");

    private final CircuitBreakerRegistry breakers;

    public FleetHealthIndicator(CircuitBreakerRegistry breakers) {
        this.breakers = breakers;
    }

    @Override
    public Health health() {
        Map<String, CircuitBreaker> all = breakers.all();
        Map<String, String> states = new LinkedHashMap<>();
        long open = 0;
        for (Map.Entry<String, CircuitBreaker> entry : all.entrySet()) {
            CircuitBreakerState state = entry.getValue().getState();
            states.put(entry.getKey(), state.name());
            if (state == CircuitBreakerState.OPEN) {
                open++;
            }
        }

        Health.Builder builder;
        if (open == 0) {
            builder = Health.up().withDetail("status", "All providers reachable");
        } else if (open < all.size()) {
            builder = Health.status(DEGRADED).withDetail("status", open + " of " + all.size() + " providers open");
        } else {
            builder = Health.down().withDetail("status", "Every provider circuit is open");
        }
        return builder.withDetail("providers", states).build();
    }
}
