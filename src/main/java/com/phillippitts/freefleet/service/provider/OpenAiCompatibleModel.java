package com.phillippitts.freefleet.service.provider;

import com.phillippitts.freefleet.domain.Pricing;
import org.json.JSONObject;

/**
 * Entry of an OpenAI-style {@code /models} listing (Groq, Cerebras, DeepSeek and
 * unrecognized providers).
 *
 * @param ownedBy the {@code owned_by} field, may be null
 */
public record OpenAiCompatibleModel(
        String id,
        String name,
        String description,
        String ownedBy,
        Integer contextLength,
        Pricing pricing
) implements ProviderModel {

    static OpenAiCompatibleModel fromJson(JSONObject obj) {
        Integer context = JsonFields.optInt(obj, "context_length");
        if (context == null) {
            context = JsonFields.optInt(obj, "context_window");
        }
        if (context == null) {
            context = JsonFields.optInt(obj, "max_context_tokens");
        }
        return new OpenAiCompatibleModel(
                obj.getString("id"),
                JsonFields.optString(obj, "name"),
                JsonFields.optString(obj, "description"),
                JsonFields.optString(obj, "owned_by"),
                context,
                Pricing.fromJson(obj.optJSONObject("pricing"))
        );
    }
}
