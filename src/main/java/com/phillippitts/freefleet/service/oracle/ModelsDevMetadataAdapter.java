package com.phillippitts.freefleet.service.oracle;

import com.phillippitts.freefleet.config.properties.OracleProperties;
import com.phillippitts.freefleet.domain.CostTier;
import com.phillippitts.freefleet.domain.ModelMetadata;
import com.phillippitts.freefleet.domain.Pricing;
import com.phillippitts.freefleet.exception.ProviderFetchException;
import com.phillippitts.freefleet.service.persistence.AuditLog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * models.dev catalog client.
 *
 * <p>The whole catalog is fetched at once and reused for {@code fleet.oracle.models-dev-cache-ttl-minutes}.
 * When a refresh fails and an older catalog exists, the older catalog is served and a
 * {@code CACHE_STALE_USED} audit event is written.
 */
@Component
public class ModelsDevMetadataAdapter implements MetadataAdapter {

    private static final Logger LOG = LogManager.getLogger(ModelsDevMetadataAdapter.class);

    static final String PROVIDER_ID = "models.dev";

    private final RestClient restClient;
    private final String url;
    private final Duration cacheTtl;
    private final AuditLog auditLog;
    private final Clock clock;

    private volatile Catalog catalog;

    @Autowired
    public ModelsDevMetadataAdapter(RestClient.Builder restClientBuilder, OracleProperties properties,
                                    AuditLog auditLog) {
        this(restClientBuilder.build(), properties.getModelsDevUrl(),
                Duration.ofMinutes(properties.getModelsDevCacheTtlMinutes()), auditLog, Clock.systemUTC());
    }

    public ModelsDevMetadataAdapter(RestClient restClient, String url, Duration cacheTtl,
                                    AuditLog auditLog, Clock clock) {
        this.restClient = restClient;
        this.url = url;
        this.cacheTtl = cacheTtl;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public String providerName() {
        return "Models.dev";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Optional<ModelMetadata> fetchModelMetadata(String modelId) {
        return Optional.ofNullable(catalog().get(modelId)).map(this::toMetadata);
    }

    @Override
    public List<ModelMetadata> fetchModelsMetadata(Collection<String> modelIds) {
        Map<String, JSONObject> all = catalog();
        List<ModelMetadata> result = new ArrayList<>();
        if (modelIds == null) {
            all.values().forEach(m -> result.add(toMetadata(m)));
            return result;
        }
        for (String id : modelIds) {
            JSONObject entry = all.get(id);
            if (entry != null) {
                result.add(toMetadata(entry));
            }
        }
        return result;
    }

    private ModelMetadata toMetadata(JSONObject model) {
        Pricing pricing = Pricing.fromJson(model.optJSONObject("pricing"));
        boolean free = pricing.isFreePrompt() || pricing.isFreeCompletion();
        String id = model.getString("id");
        String reason = free
                ? "Confirmed free via Models.dev (prompt=" + pricing.prompt() + ", completion=" + pricing.completion() + ")"
                : "Uncertain pricing - SDK may differ";
        return new ModelMetadata(
                id,
                PROVIDER_ID,
                model.optString("name", id),
                free,
                free ? CostTier.CONFIRMED_FREE : CostTier.CONFIRMED_PAID,
                free ? 1.0 : 0.7,
                reason,
                clock.instant(),
                pricing.orZero()
        );
    }

    private Map<String, JSONObject> catalog() {
        Catalog current = catalog;
        Instant now = clock.instant();
        if (current != null && Duration.between(current.fetchedAt(), now).compareTo(cacheTtl) < 0) {
            return current.models();
        }
        try {
            Catalog fresh = new Catalog(download(), now);
            catalog = fresh;
            return fresh.models();
        } catch (ProviderFetchException e) {
            if (current != null) {
                LOG.warn("Models.dev unavailable, using catalog from {}: {}", current.fetchedAt(), e.getMessage());
                auditLog.cacheStaleUsed("oracle", PROVIDER_ID, e.getMessage());
                return current.models();
            }
            throw e;
        }
    }

    private Map<String, JSONObject> download() {
        String body;
        try {
            body = restClient.get().uri(url).accept(MediaType.APPLICATION_JSON).retrieve().body(String.class);
        } catch (RestClientException e) {
            throw new ProviderFetchException(PROVIDER_ID, e.getMessage(), e);
        }
        try {
            JSONArray data = new JSONObject(body == null ? "{}" : body).optJSONArray("data");
            Map<String, JSONObject> models = new LinkedHashMap<>();
            if (data != null) {
                for (int i = 0; i < data.length(); i++) {
                    JSONObject entry = data.optJSONObject(i);
                    if (entry != null && entry.has("id")) {
                        models.putIfAbsent(entry.getString("id"), entry);
                    }
                }
            }
            LOG.info("Models.dev: found {} models", models.size());
            return models;
        } catch (JSONException e) {
            throw new ProviderFetchException(PROVIDER_ID, "malformed catalog: " + e.getMessage(), e);
        }
    }

    private record Catalog(Map<String, JSONObject> models, Instant fetchedAt) {
    }
}
