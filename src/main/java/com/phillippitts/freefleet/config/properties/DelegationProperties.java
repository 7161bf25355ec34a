package com.phillippitts.freefleet.config.properties;

import com.phillippitts.freefleet.domain.DelegationConfig;
import com.phillippitts.freefleet.domain.FleetMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Delegation settings: fleet mode, race width and fallback depth.
 */
@ConfigurationProperties(prefix = "fleet.delegation")
@Validated
public class DelegationProperties {

    @NotNull
    private FleetMode mode = FleetMode.BALANCED;

    /** Candidates raced concurrently in balanced and SOTA modes. */
    @Positive(message = "Race count must be positive")
    private int raceCount = 5;

    /** Retry waves after a fully failed race; -1 keeps going until the fallback list is exhausted. */
    @Min(value = -1, message = "Fallback depth must be -1 (unlimited) or greater")
    private int fallbackDepth = 3;

    /** Auto-delegate without explicit commands. */
    private boolean transparentMode = false;

    public FleetMode getMode() {
        return mode;
    }

    public void setMode(FleetMode mode) {
        this.mode = mode;
    }

    public int getRaceCount() {
        return raceCount;
    }

    public void setRaceCount(int raceCount) {
        this.raceCount = raceCount;
    }

    public int getFallbackDepth() {
        return fallbackDepth;
    }

    public void setFallbackDepth(int fallbackDepth) {
        this.fallbackDepth = fallbackDepth;
    }

    public boolean isTransparentMode() {
        return transparentMode;
    }

    public void setTransparentMode(boolean transparentMode) {
        this.transparentMode = transparentMode;
    }

    public DelegationConfig toConfig() {
        return new DelegationConfig(mode, raceCount, fallbackDepth, transparentMode);
    }
}
