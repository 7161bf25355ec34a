package com.phillippitts.freefleet.service.scraper;

import com.phillippitts.freefleet.domain.Pricing;
import com.phillippitts.freefleet.domain.ScrapedPolicy;
import com.phillippitts.freefleet.service.persistence.AuditLog;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives OpenRouter's free list from its public catalog: models whose prompt and
 * completion are both priced "0".
 */
@Component
public class OpenRouterPolicyScraper extends AbstractPolicyScraper {

    static final String POLICY_URL = "https://openrouter.ai/docs/models";
    static final String CATALOG_URL = "https://openrouter.ai/api/v1/models";
    static final List<String> FALLBACK_MODELS =
            List.of("google/gemma-2-9b-it:free", "mistralai/mistral-7b-instruct:free");

    private final RestClient restClient;

    @Autowired
    public OpenRouterPolicyScraper(RestClient.Builder restClientBuilder, AuditLog auditLog) {
        this(restClientBuilder.build(), auditLog);
    }

    OpenRouterPolicyScraper(RestClient restClient, AuditLog auditLog) {
        super("openrouter", POLICY_URL, auditLog);
        this.restClient = restClient;
    }

    @Override
    protected ScrapedPolicy doScrape() {
        String body = restClient.get().uri(CATALOG_URL).retrieve().body(String.class);
        JSONArray data = new JSONObject(body).getJSONArray("data");
        List<String> free = new ArrayList<>();
        for (int i = 0; i < data.length(); i++) {
            JSONObject model = data.getJSONObject(i);
            Pricing pricing = Pricing.fromJson(model.optJSONObject("pricing"));
            if ("0".equals(pricing.prompt()) && "0".equals(pricing.completion())) {
                free.add(model.getString("id"));
            }
        }
        return new ScrapedPolicy(providerId(), Instant.now(), !free.isEmpty(), free);
    }

    @Override
    protected List<String> fallbackFreeModels() {
        return FALLBACK_MODELS;
    }
}
