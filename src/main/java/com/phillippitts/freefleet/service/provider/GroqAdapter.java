package com.phillippitts.freefleet.service.provider;

import com.phillippitts.freefleet.domain.CostTier;
import org.json.JSONObject;
import org.springframework.web.client.RestClient;

/**
 * Groq: every listed model is on the rate-limited free tier.
 */
public class GroqAdapter extends AbstractHttpProviderAdapter<OpenAiCompatibleModel> {

    public static final String MODELS_URL = "https://api.groq.com/openai/v1/models";

    public GroqAdapter(RestClient restClient, String apiKey) {
        super("groq", "Groq", restClient, MODELS_URL, apiKey);
    }

    @Override
    protected OpenAiCompatibleModel parseModel(JSONObject entry) {
        return OpenAiCompatibleModel.fromJson(entry);
    }

    @Override
    public boolean isFreeModel(OpenAiCompatibleModel model) {
        return true;
    }

    @Override
    protected CostTier freeTier() {
        return CostTier.FREEMIUM_LIMITED;
    }
}
