package com.phillippitts.freefleet.service.persistence;

import com.phillippitts.freefleet.exception.PersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Append-only audit trail stored as JSON lines in {@code audit.log}.
 *
 * <p>Recording never throws; write failures are logged and dropped.
 */
@Component
public class AuditLog {

    private static final Logger LOG = LogManager.getLogger(AuditLog.class);

    static final String FILE_NAME = "audit.log";
    static final int DEFAULT_LIMIT = 100;

    private final JsonFileStore store;

    public AuditLog(JsonFileStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public void record(AuditEvent event) {
        try {
            store.appendLine(FILE_NAME, event.toJsonLine());
        } catch (PersistenceException e) {
            LOG.warn("Failed to write audit event {}: {}", event.type(), e.getMessage());
        }
    }

    public void modelBlocked(String component, String modelId, List<String> reasons) {
        record(AuditEvent.of(AuditEvent.Type.MODEL_BLOCKED, AuditEvent.Severity.HIGH, component,
                Map.of("modelId", modelId, "reasons", List.copyOf(reasons))));
    }

    public void fallbackActivated(String component, String raceId, int attempt, List<String> candidates) {
        record(AuditEvent.of(AuditEvent.Type.FALLBACK_ACTIVATED, AuditEvent.Severity.MEDIUM, component,
                Map.of("raceId", raceId, "attempt", attempt, "candidates", List.copyOf(candidates))));
    }

    public void cacheStaleUsed(String component, String source, String error) {
        record(AuditEvent.of(AuditEvent.Type.CACHE_STALE_USED, AuditEvent.Severity.LOW, component,
                Map.of("source", source, "error", String.valueOf(error))));
    }

    public void scraperFailed(String component, String providerId, String error) {
        record(AuditEvent.of(AuditEvent.Type.SCRAPER_FAILED, AuditEvent.Severity.MEDIUM, component,
                Map.of("providerId", providerId, "error", String.valueOf(error))));
    }

    /**
     * Most recent events, newest first.
     *
     * @param type  only events of this type, or {@code null} for all
     * @param limit maximum number of events returned
     */
    public List<AuditEvent> recent(AuditEvent.Type type, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<String> lines = store.readLines(FILE_NAME);
        List<AuditEvent> result = new ArrayList<>();
        for (int i = lines.size() - 1; i >= 0 && result.size() < limit; i--) {
            AuditEvent event = parse(lines.get(i));
            if (event != null && (type == null || event.type() == type)) {
                result.add(event);
            }
        }
        return Collections.unmodifiableList(result);
    }

    public List<AuditEvent> blockedModels(int limit) {
        return recent(AuditEvent.Type.MODEL_BLOCKED, limit);
    }

    /**
     * Counts over the most recent {@value #DEFAULT_LIMIT} events.
     */
    public AuditStats stats() {
        Map<String, Integer> byType = new TreeMap<>();
        Map<String, Integer> bySeverity = new TreeMap<>();
        Map<String, Integer> byComponent = new TreeMap<>();
        List<AuditEvent> events = recent(null, DEFAULT_LIMIT);
        for (AuditEvent e : events) {
            byType.merge(e.type().name(), 1, Integer::sum);
            bySeverity.merge(e.severity().name(), 1, Integer::sum);
            byComponent.merge(e.component(), 1, Integer::sum);
        }
        return new AuditStats(events.size(), byType, bySeverity, byComponent);
    }

    private static AuditEvent parse(String line) {
        try {
            return AuditEvent.fromJson(new JSONObject(line));
        } catch (JSONException | IllegalArgumentException | DateTimeParseException e) {
            LOG.debug("Skipping malformed audit line: {}", e.getMessage());
            return null;
        }
    }

    public record AuditStats(
            int total,
            Map<String, Integer> byType,
            Map<String, Integer> bySeverity,
            Map<String, Integer> byComponent
    ) {
        public AuditStats {
            byType = Map.copyOf(byType);
            bySeverity = Map.copyOf(bySeverity);
            byComponent = Map.copyOf(byComponent);
        }
    }
}
