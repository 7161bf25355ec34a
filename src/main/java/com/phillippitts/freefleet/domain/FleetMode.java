package com.phillippitts.freefleet.domain;

/**
 * Policy governing how many and which candidates are raced.
 */
public enum FleetMode {
    /** Every free model of the category, all raced at once. */
    ULTRA_FREE("ultra_free"),
    /** Top {@code raceCount} ranked models. */
    BALANCED("balanced"),
    /** Elite-family models only, capped at {@code raceCount}. */
    SOTA_ONLY("SOTA_only");

    private final String key;

    FleetMode(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static FleetMode fromKey(String key) {
        for (FleetMode mode : values()) {
            if (mode.key.equalsIgnoreCase(key) || mode.name().equalsIgnoreCase(key)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown fleet mode: " + key);
    }
}
