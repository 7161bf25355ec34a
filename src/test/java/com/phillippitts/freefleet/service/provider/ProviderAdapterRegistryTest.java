package com.phillippitts.freefleet.service.provider;

import com.phillippitts.freefleet.domain.CostTier;
import com.phillippitts.freefleet.domain.FreeModel;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderAdapterRegistryTest {

    private final ProviderAdapterRegistry registry = new ProviderAdapterRegistry(RestClient.builder());

    @Test
    void shouldCreateSpecializedAdapters() {
        assertThat(registry.create("openrouter", ProviderConfig.EMPTY)).isInstanceOf(OpenRouterAdapter.class);
        assertThat(registry.create("Groq", null)).isInstanceOf(GroqAdapter.class);
        assertThat(registry.create("cerebras", ProviderConfig.EMPTY)).isInstanceOf(CerebrasAdapter.class);
        assertThat(registry.create("deepseek", ProviderConfig.EMPTY)).isInstanceOf(DeepSeekAdapter.class);
        assertThat(registry.create("google", ProviderConfig.EMPTY)).isInstanceOf(StaticCatalogAdapter.class);
    }

    @Test
    void shouldFallBackToGenericAdapterForUnknownProvider() {
        ProviderAdapter<?> adapter = registry.create("fireworks", ProviderConfig.EMPTY);

        assertThat(adapter).isInstanceOf(GenericOpenAiAdapter.class);
        assertThat(adapter.providerId()).isEqualTo("fireworks");
        assertThat(registry.hasSpecializedAdapter("fireworks")).isFalse();
        assertThat(registry.specializedProviders()).contains("openrouter", "groq", "modelscope", "huggingface");
    }

    @Test
    void shouldServeCuratedCatalogWithoutNetwork() {
        List<FreeModel> models = StaticCatalogAdapter.google().fetchNormalized();

        assertThat(models).extracting(FreeModel::id).containsExactly("gemini-1.5-flash", "gemini-1.5-flash-8b");
        assertThat(models).allSatisfy(m -> {
            assertThat(m.isFree()).isTrue();
            assertThat(m.tier()).isEqualTo(CostTier.CONFIRMED_FREE);
            assertThat(m.provider()).isEqualTo("google");
        });
    }

    @Test
    void shouldMarkDeepSeekGrantModelsAsFreemium() {
        DeepSeekAdapter adapter = new DeepSeekAdapter(RestClient.builder().build(), null);

        FreeModel chat = adapter.normalizeModel(
                new OpenAiCompatibleModel("deepseek-chat", null, null, "deepseek", null, null));
        FreeModel other = adapter.normalizeModel(
                new OpenAiCompatibleModel("deepseek-experimental", null, null, "deepseek", null, null));

        assertThat(chat.isFree()).isTrue();
        assertThat(chat.tier()).isEqualTo(CostTier.FREEMIUM_LIMITED);
        assertThat(chat.confidence()).isEqualTo(0.8);
        assertThat(other.isFree()).isFalse();
        assertThat(other.tier()).isEqualTo(CostTier.UNKNOWN);
    }
}
