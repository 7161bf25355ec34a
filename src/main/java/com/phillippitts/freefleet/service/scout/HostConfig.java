package com.phillippitts.freefleet.service.scout;

import com.phillippitts.freefleet.service.provider.ProviderConfig;

import java.util.List;
import java.util.Map;

/**
 * What Scout reads from the host configuration.
 *
 * @param providerConfigs connection settings from the {@code providers} section
 * @param providerIds     every referenced provider id, deduplicated, in first-seen order
 * @param errors          problems encountered while reading; empty on success
 */
public record HostConfig(Map<String, ProviderConfig> providerConfigs, List<String> providerIds, List<String> errors) {

    public HostConfig {
        providerConfigs = Map.copyOf(providerConfigs);
        providerIds = List.copyOf(providerIds);
        errors = List.copyOf(errors);
    }

    public ProviderConfig configFor(String providerId) {
        return providerConfigs.getOrDefault(providerId, ProviderConfig.EMPTY);
    }
}
