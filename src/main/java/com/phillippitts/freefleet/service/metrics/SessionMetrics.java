package com.phillippitts.freefleet.service.metrics;

import java.time.Instant;
import java.util.Map;

/**
 * Savings estimate for the current session.
 *
 * @param tokensSaved    {@code max(0, delegationCount * 2000 - tokens used)}
 * @param costSaved      {@code tokensSaved * $3 / 1M}
 * @param modelBreakdown usage per model id
 */
public record SessionMetrics(
        String sessionId,
        Instant startTime,
        long delegationCount,
        long tokensSaved,
        double costSaved,
        Map<String, ModelUsage> modelBreakdown
) {
    public SessionMetrics {
        modelBreakdown = Map.copyOf(modelBreakdown);
    }
}
