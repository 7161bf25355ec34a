package com.phillippitts.freefleet.service.scout;

import com.phillippitts.freefleet.service.provider.ProviderConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the host's JSON configuration and the authentication bridge file.
 *
 * <p>Providers are taken from the keys of {@code providers} and from every
 * {@code categories.*.model} and {@code categories.*.fallback[]} entry, where the
 * provider is the text before the first {@code /}.
 */
@Component
public class HostConfigReader {

    private static final Logger LOG = LogManager.getLogger(HostConfigReader.class);

    public HostConfig read(Path configPath) {
        String content;
        try {
            content = Files.readString(configPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return failed("Failed to read OpenCode config at " + configPath + ": " + e.getMessage());
        }

        JSONObject root;
        try {
            root = new JSONObject(content);
        } catch (JSONException e) {
            return failed("Failed to parse OpenCode config at " + configPath + ": " + e.getMessage());
        }

        Map<String, ProviderConfig> configs = new HashMap<>();
        Set<String> ids = new LinkedHashSet<>();

        JSONObject providers = root.optJSONObject("providers");
        if (providers != null) {
            for (String id : providers.keySet()) {
                JSONObject p = providers.optJSONObject(id);
                configs.put(id, p == null ? ProviderConfig.EMPTY
                        : new ProviderConfig(p.optString("apiKey", null), p.optString("baseUrl", null)));
                ids.add(id);
            }
        }

        JSONObject categories = root.optJSONObject("categories");
        if (categories != null) {
            for (String name : categories.keySet()) {
                JSONObject category = categories.optJSONObject(name);
                if (category == null) {
                    continue;
                }
                addProvider(ids, category.optString("model", ""));
                JSONArray fallback = category.optJSONArray("fallback");
                if (fallback != null) {
                    for (int i = 0; i < fallback.length(); i++) {
                        addProvider(ids, fallback.optString(i, ""));
                    }
                }
            }
        }

        LOG.debug("Host config {} references providers {}", configPath, ids);
        return new HostConfig(configs, new ArrayList<>(ids), List.of());
    }

    /**
     * Number of accounts listed in the authentication bridge file; 0 when it is missing
     * or unreadable.
     */
    public int countAuthenticatedAccounts(Path accountsPath) {
        try {
            JSONObject root = new JSONObject(Files.readString(accountsPath, StandardCharsets.UTF_8));
            JSONArray accounts = root.optJSONArray("accounts");
            return accounts == null ? 0 : accounts.length();
        } catch (IOException | JSONException e) {
            LOG.debug("Could not read authentication accounts at {} (may not be configured): {}",
                    accountsPath, e.getMessage());
            return 0;
        }
    }

    private static void addProvider(Set<String> ids, String qualifiedModel) {
        int slash = qualifiedModel.indexOf('/');
        if (slash > 0) {
            ids.add(qualifiedModel.substring(0, slash));
        }
    }

    private static HostConfig failed(String error) {
        LOG.warn(error);
        return new HostConfig(Map.of(), List.of(), List.of(error));
    }
}
