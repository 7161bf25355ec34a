package com.phillippitts.freefleet.domain;

/**
 * Categorical verdict on a model's cost status.
 */
public enum CostTier {
    CONFIRMED_FREE,
    CONFIRMED_PAID,
    FREEMIUM_LIMITED,
    UNKNOWN;

    /** Whether a model in this tier may be flagged as free. */
    public boolean allowsFree() {
        return this == CONFIRMED_FREE || this == FREEMIUM_LIMITED;
    }
}
