package com.phillippitts.freefleet.service.oracle;

import com.phillippitts.freefleet.config.properties.OracleProperties;
import com.phillippitts.freefleet.exception.ProviderFetchException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;

/**
 * Downloads the community allow-list.
 */
@Component
public class CommunityAllowListClient {

    static final String SOURCE = "community-list";

    private final RestClient restClient;
    private final String url;

    @Autowired
    public CommunityAllowListClient(RestClient.Builder restClientBuilder, OracleProperties properties) {
        this(restClientBuilder.build(), properties.getCommunityListUrl());
    }

    public CommunityAllowListClient(RestClient restClient, String url) {
        this.restClient = restClient;
        this.url = url;
    }

    /**
     * @throws ProviderFetchException when the document is unreachable or has no {@code models} array
     */
    public CommunityDefinitions fetch() {
        String body;
        try {
            body = restClient.get().uri(url).accept(MediaType.APPLICATION_JSON).retrieve().body(String.class);
        } catch (RestClientException e) {
            throw new ProviderFetchException(SOURCE, e.getMessage(), e);
        }
        try {
            JSONObject root = new JSONObject(body == null ? "{}" : body);
            JSONArray arr = root.optJSONArray("models");
            if (arr == null) {
                throw new ProviderFetchException(SOURCE, "Invalid format: expected models array", null);
            }
            List<String> models = new ArrayList<>(arr.length());
            for (int i = 0; i < arr.length(); i++) {
                String id = arr.optString(i, "");
                if (!id.isBlank()) {
                    models.add(id);
                }
            }
            return new CommunityDefinitions(root.optString("version", null),
                    root.optString("lastUpdated", null), models);
        } catch (JSONException e) {
            throw new ProviderFetchException(SOURCE, "malformed document: " + e.getMessage(), e);
        }
    }
}
