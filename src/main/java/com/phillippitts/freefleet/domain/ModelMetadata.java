package com.phillippitts.freefleet.domain;

import org.json.JSONObject;

import java.time.Instant;
import java.util.Objects;

/**
 * Oracle verdict on whether a model is free and how certain that is.
 *
 * @param id           bare model id the verdict was computed for
 * @param provider     source that produced the verdict (e.g. {@code models.dev}, {@code community-list})
 * @param name         display name
 * @param isFree       free verdict
 * @param tier         cost tier
 * @param confidence   certainty in [0, 1]
 * @param reason       human-readable explanation
 * @param lastVerified when the verdict was produced; null for raw adapter data
 * @param pricing      cost markers behind the verdict
 */
public record ModelMetadata(
        String id,
        String provider,
        String name,
        boolean isFree,
        CostTier tier,
        double confidence,
        String reason,
        Instant lastVerified,
        Pricing pricing
) {
    public ModelMetadata {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(tier, "tier");
        provider = provider == null ? "unknown" : provider;
        name = name == null ? id : name;
        reason = reason == null ? "" : reason;
        pricing = pricing == null ? Pricing.FREE : pricing;
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    public ModelMetadata withVerdict(boolean free, CostTier newTier, double newConfidence,
                                     String newReason, Instant verifiedAt) {
        return new ModelMetadata(id, provider, name, free, newTier, newConfidence, newReason, verifiedAt, pricing);
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject()
                .put("id", id)
                .put("provider", provider)
                .put("name", name)
                .put("isFree", isFree)
                .put("tier", tier.name())
                .put("confidence", confidence)
                .put("reason", reason)
                .put("pricing", pricing.toJson());
        if (lastVerified != null) {
            obj.put("lastVerified", lastVerified.toString());
        }
        return obj;
    }

    public static ModelMetadata fromJson(JSONObject obj) {
        String verified = obj.optString("lastVerified", "");
        return new ModelMetadata(
                obj.getString("id"),
                obj.optString("provider", "unknown"),
                obj.optString("name", obj.getString("id")),
                obj.optBoolean("isFree", false),
                CostTier.valueOf(obj.optString("tier", CostTier.UNKNOWN.name())),
                obj.optDouble("confidence", 0.0),
                obj.optString("reason", ""),
                verified.isBlank() ? null : Instant.parse(verified),
                Pricing.fromJson(obj.optJSONObject("pricing")).orZero()
        );
    }
}
