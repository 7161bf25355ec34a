package com.phillippitts.freefleet.service.metrics;

import com.phillippitts.freefleet.exception.PersistenceException;
import com.phillippitts.freefleet.service.persistence.JsonFileStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-model usage history persisted to {@code fleet-metrics.json}.
 *
 * <p>Model history is loaded at startup; the delegation counter and session start are
 * per process.
 */
@Component
public class UsageMetricsStore {

    private static final Logger LOG = LogManager.getLogger(UsageMetricsStore.class);

    static final String FILE_NAME = "fleet-metrics.json";
    static final long ESTIMATED_PAID_TOKENS_PER_DELEGATION = 2000;
    static final double PAID_RATE_PER_TOKEN = 3.0 / 1_000_000;

    private final JsonFileStore store;
    private final Clock clock;
    private final ConcurrentMap<String, ModelUsage> models = new ConcurrentHashMap<>();

    private volatile Instant sessionStart;
    private long delegationCount;

    @Autowired
    public UsageMetricsStore(JsonFileStore store) {
        this(store, Clock.systemUTC());
    }

    public UsageMetricsStore(JsonFileStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
        this.sessionStart = clock.instant();
        load();
    }

    public void recordSuccess(String modelId, long latencyMs, long tokensUsed) {
        Instant now = clock.instant();
        models.compute(modelId, (id, existing) ->
                (existing == null ? ModelUsage.empty(id) : existing).withSuccess(latencyMs, tokensUsed, now));
        save();
    }

    public void recordFailure(String modelId) {
        Instant now = clock.instant();
        models.compute(modelId, (id, existing) ->
                (existing == null ? ModelUsage.empty(id) : existing).withFailure(now));
        save();
    }

    public void incrementDelegationCount() {
        synchronized (this) {
            delegationCount++;
        }
        save();
    }

    public Optional<ModelUsage> modelUsage(String modelId) {
        return Optional.ofNullable(models.get(modelId));
    }

    public Map<String, ModelUsage> allModelUsage() {
        return new TreeMap<>(models);
    }

    public synchronized SessionMetrics sessionMetrics() {
        long tokensUsed = models.values().stream().mapToLong(ModelUsage::totalTokensUsed).sum();
        long tokensSaved = Math.max(0, delegationCount * ESTIMATED_PAID_TOKENS_PER_DELEGATION - tokensUsed);
        return new SessionMetrics(
                "session-" + sessionStart.toEpochMilli(),
                sessionStart,
                delegationCount,
                tokensSaved,
                tokensSaved * PAID_RATE_PER_TOKEN,
                allModelUsage());
    }

    /** Starts a new session; model history is kept. */
    public synchronized void resetSession() {
        sessionStart = clock.instant();
        delegationCount = 0;
    }

    public void resetAll() {
        synchronized (this) {
            models.clear();
            sessionStart = clock.instant();
            delegationCount = 0;
        }
        save();
    }

    private void load() {
        store.readObject(FILE_NAME).ifPresent(root -> {
            JSONObject saved = root.optJSONObject("models");
            if (saved == null) {
                return;
            }
            for (String id : saved.keySet()) {
                try {
                    models.put(id, ModelUsage.fromJson(id, saved.getJSONObject(id)));
                } catch (JSONException | DateTimeParseException e) {
                    LOG.warn("Skipping unreadable usage entry for {}: {}", id, e.getMessage());
                }
            }
            LOG.info("Loaded historical metrics for {} models", models.size());
        });
    }

    private void save() {
        SessionMetrics session = sessionMetrics();
        JSONObject modelsJson = new JSONObject();
        session.modelBreakdown().forEach((id, usage) -> modelsJson.put(id, usage.toJson()));
        JSONObject root = new JSONObject()
                .put("session", new JSONObject()
                        .put("sessionId", session.sessionId())
                        .put("startTime", session.startTime().toString())
                        .put("delegationCount", session.delegationCount())
                        .put("tokensSaved", session.tokensSaved())
                        .put("costSaved", session.costSaved()))
                .put("models", modelsJson)
                .put("lastUpdated", clock.instant().toString());
        try {
            store.writeObject(FILE_NAME, root);
        } catch (PersistenceException e) {
            LOG.warn("Failed to save metrics to disk: {}", e.getMessage());
        }
    }
}
