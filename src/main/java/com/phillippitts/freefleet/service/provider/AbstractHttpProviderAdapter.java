package com.phillippitts.freefleet.service.provider;

import com.phillippitts.freefleet.exception.ProviderFetchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Objects;

/**
 * Adapter whose catalog is a JSON document with the models under one array key.
 */
public abstract class AbstractHttpProviderAdapter<M extends ProviderModel> extends AbstractProviderAdapter<M> {

    private static final Logger LOG = LogManager.getLogger(AbstractHttpProviderAdapter.class);

    private final RestClient restClient;
    private final String modelsUrl;
    private final String apiKey;

    protected AbstractHttpProviderAdapter(String providerId, String providerName,
                                          RestClient restClient, String modelsUrl, String apiKey) {
        super(providerId, providerName);
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.modelsUrl = Objects.requireNonNull(modelsUrl, "modelsUrl");
        this.apiKey = apiKey;
    }

    public String modelsUrl() {
        return modelsUrl;
    }

    /** Top-level key holding the model array. */
    protected String arrayKey() {
        return "data";
    }

    protected abstract M parseModel(JSONObject entry);

    @Override
    public List<M> fetchModels() {
        LOG.debug("{}: fetching models from {}", providerName(), modelsUrl);
        String body;
        try {
            body = restClient.get()
                    .uri(modelsUrl)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(h -> {
                        if (apiKey != null && !apiKey.isBlank()) {
                            h.set(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
                        }
                    })
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        throw new ProviderFetchException(providerId(),
                                response.getStatusCode().value(), response.getStatusText());
                    })
                    .body(String.class);
        } catch (ResourceAccessException e) {
            throw new ProviderFetchException(providerId(), e.getMessage(), e);
        }

        try {
            List<M> models = body == null ? List.of() : JsonFields.parseArray(body, arrayKey(), this::parseModel);
            LOG.info("{}: found {} models", providerName(), models.size());
            return models;
        } catch (JSONException e) {
            throw new ProviderFetchException(providerId(), "malformed catalog: " + e.getMessage(), e);
        }
    }
}
