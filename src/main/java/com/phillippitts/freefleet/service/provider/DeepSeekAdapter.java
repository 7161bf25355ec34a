package com.phillippitts.freefleet.service.provider;

import com.phillippitts.freefleet.domain.CostTier;
import org.json.JSONObject;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Locale;

/**
 * DeepSeek: a known set of model families ships with a free token grant.
 */
public class DeepSeekAdapter extends AbstractHttpProviderAdapter<OpenAiCompatibleModel> {

    public static final String MODELS_URL = "https://api.deepseek.com/v1/models";

    static final List<String> FREE_GRANT_MODELS =
            List.of("deepseek-chat", "deepseek-coder", "deepseek-v3", "deepseek-v3.2");

    public DeepSeekAdapter(RestClient restClient, String apiKey) {
        super("deepseek", "DeepSeek", restClient, MODELS_URL, apiKey);
    }

    @Override
    protected OpenAiCompatibleModel parseModel(JSONObject entry) {
        return OpenAiCompatibleModel.fromJson(entry);
    }

    @Override
    public boolean isFreeModel(OpenAiCompatibleModel model) {
        String id = model.id().toLowerCase(Locale.ROOT);
        return FREE_GRANT_MODELS.stream().anyMatch(id::contains);
    }

    @Override
    protected CostTier freeTier() {
        return CostTier.FREEMIUM_LIMITED;
    }
}
