package com.phillippitts.freefleet.service.provider;

/**
 * Per-provider connection settings from the host configuration.
 *
 * @param apiKey  bearer token, may be null
 * @param baseUrl OpenAI-compatible base URL ending in the API version, may be null
 */
public record ProviderConfig(String apiKey, String baseUrl) {

    public static final ProviderConfig EMPTY = new ProviderConfig(null, null);
}
