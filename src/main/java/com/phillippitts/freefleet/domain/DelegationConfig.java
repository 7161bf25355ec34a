package com.phillippitts.freefleet.domain;

import java.util.Objects;

/**
 * Immutable snapshot of delegation settings.
 *
 * @param mode            fleet mode
 * @param raceCount       candidates raced concurrently in balanced/SOTA modes
 * @param fallbackDepth   retry waves after a fully failed race; {@code -1} is unlimited
 * @param transparentMode whether the host auto-delegates without explicit commands
 */
public record DelegationConfig(FleetMode mode, int raceCount, int fallbackDepth, boolean transparentMode) {

    public static final int UNLIMITED_DEPTH = -1;

    public DelegationConfig {
        Objects.requireNonNull(mode, "mode");
        if (raceCount < 1) {
            throw new IllegalArgumentException("raceCount must be at least 1, got: " + raceCount);
        }
        if (fallbackDepth < UNLIMITED_DEPTH) {
            throw new IllegalArgumentException("fallbackDepth must be -1 or greater, got: " + fallbackDepth);
        }
    }

    public static DelegationConfig defaults() {
        return new DelegationConfig(FleetMode.BALANCED, 5, 3, false);
    }

    public DelegationConfig withMode(FleetMode newMode) {
        return new DelegationConfig(newMode, raceCount, fallbackDepth, transparentMode);
    }

    public DelegationConfig withRaceCount(int newRaceCount) {
        return new DelegationConfig(mode, newRaceCount, fallbackDepth, transparentMode);
    }

    public DelegationConfig withFallbackDepth(int newDepth) {
        return new DelegationConfig(mode, raceCount, newDepth, transparentMode);
    }
}
