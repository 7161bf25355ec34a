package com.phillippitts.freefleet.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for races and delegations.
 *
 * <p>All meters are exposed at /actuator/prometheus.
 */
@Component
public class FleetMetrics {

    private static final String METRIC_PREFIX = "freefleet";

    private final MeterRegistry registry;

    public FleetMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the latency of a winning candidate.
     *
     * @param provider provider of the winning model
     * @param latencyMs elapsed time since race start
     */
    public void recordRaceLatency(String provider, long latencyMs) {
        Timer.builder(METRIC_PREFIX + ".race.latency")
                .description("Time from race start to first successful candidate")
                .tag("provider", provider)
                .register(registry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    public void incrementDelegations() {
        Counter.builder(METRIC_PREFIX + ".delegations")
                .description("Number of delegated tasks")
                .register(registry)
                .increment();
    }

    public void incrementDelegationSuccess(String category) {
        Counter.builder(METRIC_PREFIX + ".delegation.success")
                .description("Number of delegations that produced a result")
                .tag("category", category)
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure reason (delegation-failed, no-candidates, ...)
     */
    public void incrementDelegationFailure(String category, String reason) {
        Counter.builder(METRIC_PREFIX + ".delegation.failure")
                .description("Number of delegations where every candidate failed")
                .tag("category", category)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementBreakerRejection(String provider) {
        Counter.builder(METRIC_PREFIX + ".breaker.rejections")
                .description("Calls rejected by an open circuit breaker")
                .tag("provider", provider)
                .register(registry)
                .increment();
    }
}
