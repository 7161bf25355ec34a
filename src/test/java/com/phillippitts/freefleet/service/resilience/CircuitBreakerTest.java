package com.phillippitts.freefleet.service.resilience;

import com.phillippitts.freefleet.exception.CircuitBreakerOpenException;
import com.phillippitts.freefleet.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        breaker = new CircuitBreaker("groq", 3, Duration.ofSeconds(30), clock);
    }

    private void failOnce() {
        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new IllegalStateException("upstream down");
        })).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldStayClosedBelowThreshold() {
        failOnce();
        failOnce();

        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getFailures()).isEqualTo(2);
    }

    @Test
    void shouldResetCounterOnSuccessWhileClosed() {
        failOnce();
        failOnce();

        assertThat(breaker.execute(() -> "ok")).isEqualTo("ok");

        assertThat(breaker.getFailures()).isZero();
        failOnce();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void shouldOpenAtThresholdAndRejectWithoutCalling() {
        failOnce();
        failOnce();
        failOnce();
        AtomicInteger calls = new AtomicInteger();

        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThatThrownBy(() -> breaker.execute(calls::incrementAndGet))
                .isInstanceOf(CircuitBreakerOpenException.class)
                .hasMessageContaining("groq");
        assertThat(calls.get()).isZero();
    }

    @Test
    void shouldReportRemainingCooldown() {
        failOnce();
        failOnce();
        failOnce();
        clock.advance(Duration.ofSeconds(10));

        assertThatThrownBy(() -> breaker.execute(() -> "x"))
                .isInstanceOfSatisfying(CircuitBreakerOpenException.class,
                        e -> assertThat(e.getRetryAfter()).isEqualTo(Duration.ofSeconds(20)));
    }

    @Test
    void shouldCloseAfterSuccessfulHalfOpenTrial() {
        failOnce();
        failOnce();
        failOnce();
        clock.advance(Duration.ofSeconds(30));

        assertThat(breaker.execute(() -> "recovered")).isEqualTo("recovered");

        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getFailures()).isZero();
    }

    @Test
    void shouldBeHalfOpenWhileTrialCallRuns() {
        failOnce();
        failOnce();
        failOnce();
        clock.advance(Duration.ofSeconds(30));
        AtomicReference<CircuitBreakerState> duringCall = new AtomicReference<>();

        breaker.execute(() -> {
            duringCall.set(breaker.getState());
            return "trial";
        });

        assertThat(duringCall.get()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void shouldReopenWhenHalfOpenTrialFails() {
        failOnce();
        failOnce();
        failOnce();
        clock.advance(Duration.ofSeconds(31));

        failOnce();

        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        clock.advance(Duration.ofSeconds(29));
        assertThatThrownBy(() -> breaker.execute(() -> "x")).isInstanceOf(CircuitBreakerOpenException.class);
    }

    @Test
    void shouldRejectInvalidThreshold() {
        assertThatThrownBy(() -> new CircuitBreaker("bad", 0, Duration.ofSeconds(1), clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
