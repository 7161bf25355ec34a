package com.phillippitts.freefleet.service.provider;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Creates provider adapters by provider id. Unknown ids get a {@link GenericOpenAiAdapter}.
 */
@Component
public class ProviderAdapterRegistry {

    private static final Logger LOG = LogManager.getLogger(ProviderAdapterRegistry.class);

    private final RestClient restClient;
    private final Map<String, BiFunction<RestClient, ProviderConfig, ProviderAdapter<?>>> factories;

    public ProviderAdapterRegistry(RestClient.Builder restClientBuilder) {
        this.restClient = restClientBuilder.build();
        this.factories = Map.of(
                "openrouter", (client, cfg) -> new OpenRouterAdapter(client, cfg.apiKey()),
                "groq", (client, cfg) -> new GroqAdapter(client, cfg.apiKey()),
                "cerebras", (client, cfg) -> new CerebrasAdapter(client, cfg.apiKey()),
                "deepseek", (client, cfg) -> new DeepSeekAdapter(client, cfg.apiKey()),
                "google", (client, cfg) -> StaticCatalogAdapter.google(),
                "modelscope", (client, cfg) -> StaticCatalogAdapter.modelScope(),
                "huggingface", (client, cfg) -> StaticCatalogAdapter.huggingFace()
        );
    }

    public ProviderAdapter<?> create(String providerId, ProviderConfig config) {
        Objects.requireNonNull(providerId, "providerId");
        ProviderConfig cfg = config == null ? ProviderConfig.EMPTY : config;
        var factory = factories.get(providerId.toLowerCase(Locale.ROOT));
        if (factory == null) {
            LOG.warn("No adapter found for provider '{}', using generic OpenAI-compatible adapter", providerId);
            return new GenericOpenAiAdapter(providerId, restClient, cfg);
        }
        return factory.apply(restClient, cfg);
    }

    public boolean hasSpecializedAdapter(String providerId) {
        return factories.containsKey(providerId.toLowerCase(Locale.ROOT));
    }

    public Set<String> specializedProviders() {
        return factories.keySet();
    }
}
