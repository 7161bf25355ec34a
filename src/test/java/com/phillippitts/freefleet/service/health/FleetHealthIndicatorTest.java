package com.phillippitts.freefleet.service.health;

import com.phillippitts.freefleet.service.resilience.CircuitBreaker;
import com.phillippitts.freefleet.service.resilience.CircuitBreakerRegistry;
import com.phillippitts.freefleet.testutil.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FleetHealthIndicatorTest {

    private final CircuitBreakerRegistry registry =
            new CircuitBreakerRegistry(1, Duration.ofMinutes(1), new MutableClock(Instant.EPOCH));
    private final FleetHealthIndicator indicator = new FleetHealthIndicator(registry);

    private static void trip(CircuitBreaker breaker) {
        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new IllegalStateException("down");
        })).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldReportUpWhenNoProviderContacted() {
        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
    }

    @Test
    void shouldReportUpWhenAllBreakersClosed() {
        registry.forProvider("groq").execute(() -> "ok");
        registry.forProvider("openrouter").execute(() -> "ok");

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("providers", Map.of("groq", "CLOSED", "openrouter", "CLOSED"));
    }

    @Test
    void shouldReportDegradedWhenSomeBreakersOpen() {
        registry.forProvider("groq").execute(() -> "ok");
        trip(registry.forProvider("openrouter"));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("status", "1 of 2 providers open");
    }

    @Test
    void shouldReportDownWhenEveryBreakerOpen() {
        trip(registry.forProvider("groq"));
        trip(registry.forProvider("openrouter"));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    }
}
