package com.phillippitts.freefleet.service.metrics;

import org.json.JSONObject;

import java.time.Instant;

/**
 * Accumulated usage of one model.
 */
public record ModelUsage(
        String modelId,
        long totalCalls,
        long successCount,
        long failureCount,
        double avgLatencyMs,
        long totalTokensUsed,
        Instant lastUsed
) {

    static ModelUsage empty(String modelId) {
        return new ModelUsage(modelId, 0, 0, 0, 0.0, 0, null);
    }

    /** The latency average divides by total calls, failures included. */
    ModelUsage withSuccess(long latencyMs, long tokens, Instant at) {
        long calls = totalCalls + 1;
        double avg = (avgLatencyMs * (calls - 1) + latencyMs) / calls;
        return new ModelUsage(modelId, calls, successCount + 1, failureCount, avg, totalTokensUsed + tokens, at);
    }

    ModelUsage withFailure(Instant at) {
        return new ModelUsage(modelId, totalCalls + 1, successCount, failureCount + 1, avgLatencyMs,
                totalTokensUsed, at);
    }

    public double successRate() {
        return totalCalls == 0 ? 0.0 : (double) successCount / totalCalls;
    }

    JSONObject toJson() {
        JSONObject obj = new JSONObject()
                .put("modelId", modelId)
                .put("totalCalls", totalCalls)
                .put("successCount", successCount)
                .put("failureCount", failureCount)
                .put("avgLatencyMs", avgLatencyMs)
                .put("totalTokensUsed", totalTokensUsed);
        if (lastUsed != null) {
            obj.put("lastUsed", lastUsed.toString());
        }
        return obj;
    }

    static ModelUsage fromJson(String modelId, JSONObject obj) {
        String last = obj.optString("lastUsed", "");
        return new ModelUsage(
                obj.optString("modelId", modelId),
                obj.optLong("totalCalls", 0),
                obj.optLong("successCount", 0),
                obj.optLong("failureCount", 0),
                obj.optDouble("avgLatencyMs", 0.0),
                obj.optLong("totalTokensUsed", 0),
                last.isBlank() ? null : Instant.parse(last)
        );
    }
}
