package com.phillippitts.freefleet.service.provider;

import org.json.JSONObject;
import org.springframework.web.client.RestClient;

/**
 * OpenRouter: free when both prompt and completion are priced at zero.
 */
public class OpenRouterAdapter extends AbstractHttpProviderAdapter<OpenRouterModel> {

    public static final String MODELS_URL = "https://openrouter.ai/api/v1/models";

    public OpenRouterAdapter(RestClient restClient, String apiKey) {
        super("openrouter", "OpenRouter", restClient, MODELS_URL, apiKey);
    }

    @Override
    protected OpenRouterModel parseModel(JSONObject entry) {
        return OpenRouterModel.fromJson(entry);
    }

    @Override
    public boolean isFreeModel(OpenRouterModel model) {
        return model.pricing().isFullyFree();
    }
}
