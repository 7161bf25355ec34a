package com.phillippitts.freefleet.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when every candidate of a race failed, timed out or was cancelled.
 * Carries one failure reason per candidate, in candidate order.
 */
public class RaceExhaustedException extends FreeFleetException {

    private final String raceId;
    private final Map<String, String> failures;
    private final boolean cancelled;

    public RaceExhaustedException(String raceId, Map<String, String> failures, boolean cancelled) {
        super(buildMessage(raceId, failures, cancelled));
        this.raceId = raceId;
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        this.cancelled = cancelled;
    }

    public String getRaceId() {
        return raceId;
    }

    /** Candidate id to failure reason. */
    public Map<String, String> getFailures() {
        return failures;
    }

    /** True when the race ended because it was cancelled externally. */
    public boolean isCancelled() {
        return cancelled;
    }

    private static String buildMessage(String raceId, Map<String, String> failures, boolean cancelled) {
        StringBuilder sb = new StringBuilder();
        if (cancelled) {
            sb.append("Race '").append(raceId).append("' was cancelled; ");
        }
        sb.append("All ").append(failures.size()).append(" models failed:");
        failures.forEach((model, reason) ->
                sb.append('\n').append("Model ").append(model).append(" failed: ").append(reason));
        return sb.toString();
    }
}
