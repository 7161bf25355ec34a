package com.phillippitts.freefleet.service.provider;

import com.phillippitts.freefleet.domain.CostTier;
import org.json.JSONObject;
import org.springframework.web.client.RestClient;

/**
 * Cerebras: every listed model is on the rate-limited free tier. The catalog nests
 * models under {@code models} rather than {@code data}.
 */
public class CerebrasAdapter extends AbstractHttpProviderAdapter<OpenAiCompatibleModel> {

    public static final String MODELS_URL = "https://api.cerebras.ai/v1/models";

    public CerebrasAdapter(RestClient restClient, String apiKey) {
        super("cerebras", "Cerebras", restClient, MODELS_URL, apiKey);
    }

    @Override
    protected String arrayKey() {
        return "models";
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
