package com.phillippitts.freefleet.service.provider;

import com.phillippitts.freefleet.domain.Pricing;
import org.json.JSONObject;

/**
 * OpenRouter catalog entry.
 *
 * @param maxOutputTokens {@code top_provider.max_completion_tokens}, when reported
 */
public record OpenRouterModel(
        String id,
        String name,
        String description,
        Integer contextLength,
        Integer maxOutputTokens,
        Pricing pricing
) implements ProviderModel {

    static OpenRouterModel fromJson(JSONObject obj) {
        JSONObject topProvider = obj.optJSONObject("top_provider");
        return new OpenRouterModel(
                obj.getString("id"),
                JsonFields.optString(obj, "name"),
                JsonFields.optString(obj, "description"),
                JsonFields.optInt(obj, "context_length"),
                topProvider == null ? null : JsonFields.optInt(topProvider, "max_completion_tokens"),
                Pricing.fromJson(obj.optJSONObject("pricing"))
        );
    }
}
