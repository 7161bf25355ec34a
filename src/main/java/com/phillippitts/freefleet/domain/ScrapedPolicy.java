package com.phillippitts.freefleet.domain;

import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Free-tier policy for one provider as derived by a policy scraper.
 *
 * @param providerId      provider the policy applies to
 * @param updatedAt       when the policy was scraped
 * @param freeTierActive  whether the provider currently advertises a free tier
 * @param freeModels      model ids inferred to be on the free tier
 */
public record ScrapedPolicy(
        String providerId,
        Instant updatedAt,
        boolean freeTierActive,
        List<String> freeModels
) {
    public ScrapedPolicy {
        Objects.requireNonNull(providerId, "providerId");
        updatedAt = updatedAt == null ? Instant.now() : updatedAt;
        freeModels = freeModels == null ? List.of() : List.copyOf(freeModels);
    }

    /** True when the free tier is active and lists the model id (case-insensitive). */
    public boolean confirmsFree(String modelId) {
        if (!freeTierActive || modelId == null) {
            return false;
        }
        String id = modelId.toLowerCase(Locale.ROOT);
        return freeModels.stream().anyMatch(m -> m.toLowerCase(Locale.ROOT).equals(id));
    }

    public JSONObject toJson() {
        return new JSONObject()
                .put("providerId", providerId)
                .put("updatedAt", updatedAt.toString())
                .put("isFreeTierActive", freeTierActive)
                .put("freeModels", new JSONArray(freeModels));
    }

    public static ScrapedPolicy fromJson(JSONObject obj) {
        List<String> models = new ArrayList<>();
        JSONArray arr = obj.optJSONArray("freeModels");
        if (arr != null) {
            for (int i = 0; i < arr.length(); i++) {
                String m = arr.optString(i, "");
                if (!m.isBlank()) {
                    models.add(m);
                }
            }
        }
        String updated = obj.optString("updatedAt", "");
        return new ScrapedPolicy(
                obj.getString("providerId"),
                updated.isBlank() ? null : Instant.parse(updated),
                obj.optBoolean("isFreeTierActive", false),
                models
        );
    }
}
