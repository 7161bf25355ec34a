package com.phillippitts.freefleet.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Racer timeouts.
 */
@ConfigurationProperties(prefix = "fleet.racer")
@Validated
public class RacerProperties {

    /** Upper bound for a single candidate execution, in milliseconds. */
    @Positive(message = "Candidate timeout must be positive")
    private long timeoutMs = 30_000;

    /** How long a finished race waits for cancelled losers to stop, in milliseconds. */
    @Min(0)
    private long cancellationGraceMs = 2_000;

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public long getCancellationGraceMs() {
        return cancellationGraceMs;
    }

    public void setCancellationGraceMs(long cancellationGraceMs) {
        this.cancellationGraceMs = cancellationGraceMs;
    }
}
