package com.phillippitts.freefleet.service.provider;

import org.json.JSONObject;
import org.springframework.web.client.RestClient;

import java.util.Locale;

/**
 * Fallback for providers without a specialized adapter. Calls {@code {baseUrl}/models}
 * and treats a model as free when its prompt or completion is priced at zero.
 *
 * <p>Without a configured base URL it guesses {@code https://api.<providerId>.com/v1}.
 */
public class GenericOpenAiAdapter extends AbstractHttpProviderAdapter<OpenAiCompatibleModel> {

    public GenericOpenAiAdapter(String providerId, RestClient restClient, ProviderConfig config) {
        super(providerId, providerId, restClient, resolveBaseUrl(providerId, config) + "/models",
                config == null ? null : config.apiKey());
    }

    static String resolveBaseUrl(String providerId, ProviderConfig config) {
        String baseUrl = config == null ? null : config.baseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "https://api." + providerId.toLowerCase(Locale.ROOT) + ".com/v1";
        }
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    protected OpenAiCompatibleModel parseModel(JSONObject entry) {
        return OpenAiCompatibleModel.fromJson(entry);
    }

    @Override
    public boolean isFreeModel(OpenAiCompatibleModel model) {
        return model.pricing().isFreePrompt() || model.pricing().isFreeCompletion();
    }
}
