package com.phillippitts.freefleet.service.scout;

import com.phillippitts.freefleet.service.provider.ProviderAdapter;

import java.util.List;
import java.util.Map;

/**
 * Providers found in the host configuration and the adapter built for each.
 */
public record ActiveProviders(List<String> providers, Map<String, ProviderAdapter<?>> adapters, List<String> errors) {

    public ActiveProviders {
        providers = List.copyOf(providers);
        adapters = Map.copyOf(adapters);
        errors = List.copyOf(errors);
    }
}
