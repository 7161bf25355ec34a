package com.phillippitts.freefleet.service.persistence;

import org.json.JSONObject;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One line of the audit log.
 *
 * @param timestamp when the event happened
 * @param type      event kind
 * @param severity  how much attention the event deserves
 * @param component component that raised it (e.g. {@code scout}, {@code oracle})
 * @param details   free-form details
 */
public record AuditEvent(
        Instant timestamp,
        Type type,
        Severity severity,
        String component,
        Map<String, Object> details
) {

    public enum Type {
        MODEL_BLOCKED,
        FALLBACK_ACTIVATED,
        CACHE_STALE_USED,
        SCRAPER_FAILED;

        String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        static Type fromKey(String key) {
            return valueOf(key.toUpperCase(Locale.ROOT));
        }
    }

    public enum Severity {
        LOW, MEDIUM, HIGH, CRITICAL;

        String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        static Severity fromKey(String key) {
            return valueOf(key.toUpperCase(Locale.ROOT));
        }
    }

    public AuditEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        timestamp = timestamp == null ? Instant.now() : timestamp;
        component = component == null ? "unknown" : component;
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static AuditEvent of(Type type, Severity severity, String component, Map<String, Object> details) {
        return new AuditEvent(Instant.now(), type, severity, component, details);
    }

    public String toJsonLine() {
        return new JSONObject()
                .put("timestamp", timestamp.toString())
                .put("type", type.key())
                .put("severity", severity.key())
                .put("component", component)
                .put("details", new JSONObject(details))
                .toString();
    }

    public static AuditEvent fromJson(JSONObject obj) {
        JSONObject rawDetails = obj.optJSONObject("details");
        Map<String, Object> details = new LinkedHashMap<>();
        if (rawDetails != null) {
            // plain maps and lists, so callers never see org.json types
            rawDetails.toMap().forEach((key, value) -> {
                if (value != null) {
                    details.put(key, value);
                }
            });
        }
        return new AuditEvent(
                Instant.parse(obj.getString("timestamp")),
                Type.fromKey(obj.getString("type")),
                Severity.fromKey(obj.getString("severity")),
                obj.optString("component", "unknown"),
                details
        );
    }
}
