package com.phillippitts.freefleet.service.scout;

import com.phillippitts.freefleet.config.properties.ScoutProperties;
import com.phillippitts.freefleet.domain.CostTier;
import com.phillippitts.freefleet.domain.FreeModel;
import com.phillippitts.freefleet.domain.ModelCategory;
import com.phillippitts.freefleet.domain.ModelMetadata;
import com.phillippitts.freefleet.domain.Pricing;
import com.phillippitts.freefleet.domain.ScoutResult;
import com.phillippitts.freefleet.exception.NoActiveProvidersException;
import com.phillippitts.freefleet.exception.ProviderFetchException;
import com.phillippitts.freefleet.service.metrics.FleetMetrics;
import com.phillippitts.freefleet.service.oracle.MetadataOracle;
import com.phillippitts.freefleet.service.persistence.AuditEvent;
import com.phillippitts.freefleet.service.persistence.AuditLog;
import com.phillippitts.freefleet.service.persistence.JsonFileStore;
import com.phillippitts.freefleet.service.provider.OpenAiCompatibleModel;
import com.phillippitts.freefleet.service.provider.ProviderAdapter;
import com.phillippitts.freefleet.service.provider.ProviderAdapterRegistry;
import com.phillippitts.freefleet.service.resilience.CircuitBreakerRegistry;
import com.phillippitts.freefleet.service.validation.UltraFreeValidator;
import com.phillippitts.freefleet.testutil.MutableClock;
import com.phillippitts.freefleet.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.phillippitts.freefleet.testutil.TestModels.free;
import static com.phillippitts.freefleet.testutil.TestModels.withTier;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ScoutTest {

    private static final String HOST_CONFIG = """
            {
              "providers": {"groq": {"apiKey": "gsk-test"}},
              "categories": {
                "coding": {"model": "openrouter/qwen/qwen3-coder:free", "fallback": ["google/gemini-1.5-flash"]},
                "writing": {"model": "groq/llama3-8b-8192"}
              }
            }
            """;

    @TempDir
    Path tempDir;

    private ScoutProperties properties;
    private ProviderAdapterRegistry adapterRegistry;
    private MetadataOracle oracle;
    private AuditLog auditLog;
    private ProviderAdapter<?> groq;
    private ProviderAdapter<?> openrouter;
    private ProviderAdapter<?> google;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(tempDir.resolve("host.json"), HOST_CONFIG);
        properties = new ScoutProperties();
        properties.setHostConfigPath(tempDir.resolve("host.json").toString());
        properties.setAccountsPath(tempDir.resolve("accounts.json").toString());

        auditLog = new AuditLog(new JsonFileStore(tempDir.resolve("state")));
        oracle = mock(MetadataOracle.class);
        adapterRegistry = mock(ProviderAdapterRegistry.class);

        groq = adapter(
                free("groq", "llama3-8b-8192", ModelCategory.WRITING),
                free("groq", "deepseek-r1-distill-llama-70b", ModelCategory.REASONING),
                withTier("groq", "paid-model", CostTier.CONFIRMED_PAID, 0.7));
        openrouter = adapter(free("openrouter", "qwen/qwen3-coder:free", ModelCategory.CODING));
        google = adapter(free("google", "gemini-1.5-flash", ModelCategory.SPEED));
        doReturn(groq).when(adapterRegistry).create(eq("groq"), any());
        doReturn(openrouter).when(adapterRegistry).create(eq("openrouter"), any());
        doReturn(google).when(adapterRegistry).create(eq("google"), any());
    }

    private Scout scout() {
        return new Scout(properties, new HostConfigReader(), adapterRegistry,
                new CircuitBreakerRegistry(3, Duration.ofMinutes(1), new MutableClock(Instant.EPOCH)),
                oracle, new UltraFreeValidator(auditLog), auditLog,
                new FleetMetrics(new SimpleMeterRegistry()), new SyncExecutor());
    }

    private static ProviderAdapter<OpenAiCompatibleModel> adapter(FreeModel... models) {
        ProviderAdapter<OpenAiCompatibleModel> adapter = mock();
        when(adapter.fetchNormalized()).thenReturn(List.of(models));
        return adapter;
    }

    @Test
    void shouldDetectProvidersFromConfigAndCategories() {
        ActiveProviders active = scout().detectActiveProviders();

        assertThat(active.providers()).containsExactly("groq", "openrouter", "google");
        assertThat(active.adapters()).containsOnlyKeys("groq", "openrouter", "google");
        assertThat(active.errors()).isEmpty();
    }

    @Test
    void shouldDiscoverAndCategorizeFreeModels() {
        Map<ModelCategory, ScoutResult> results = scout().discover();

        assertThat(results).containsOnlyKeys(ModelCategory.values());
        assertThat(results.get(ModelCategory.CODING).rankedModels()).extracting(FreeModel::qualifiedId)
                .containsExactly("openrouter/qwen/qwen3-coder:free");
        assertThat(results.get(ModelCategory.CODING).eliteModels()).hasSize(1);
        assertThat(results.get(ModelCategory.REASONING).models()).extracting(FreeModel::id)
                .containsExactly("deepseek-r1-distill-llama-70b");
        assertThat(results.get(ModelCategory.SPEED).models()).extracting(FreeModel::id)
                .containsExactlyInAnyOrder("deepseek-r1-distill-llama-70b", "gemini-1.5-flash");
        assertThat(results.values()).flatExtracting(ScoutResult::models).extracting(FreeModel::id)
                .doesNotContain("paid-model");
    }

    @Test
    void shouldIgnoreProviderThatFailsToFetch() {
        when(google.fetchNormalized()).thenThrow(new ProviderFetchException("google", 503, "Service Unavailable"));

        Map<ModelCategory, ScoutResult> results = scout().discover();

        assertThat(results.get(ModelCategory.SPEED).models()).extracting(FreeModel::provider)
                .containsOnly("groq");
        assertThat(results.get(ModelCategory.CODING).models()).hasSize(1);
    }

    @Test
    void shouldBlockAccountProvidersWhenAccountsExist() throws IOException {
        Files.writeString(tempDir.resolve("accounts.json"), "{\"accounts\": [{\"email\": \"someone@example.com\"}]}");

        Map<ModelCategory, ScoutResult> results = scout().discover();

        assertThat(results.get(ModelCategory.SPEED).models()).extracting(FreeModel::provider)
                .doesNotContain("google");
        assertThat(auditLog.blockedModels(10)).singleElement()
                .satisfies(e -> assertThat(e.details()).containsEntry("modelId", "google/gemini-1.5-flash"));
    }

    @Test
    void shouldNotBlockWhenAuthenticatedProvidersAllowed() throws IOException {
        Files.writeString(tempDir.resolve("accounts.json"), "{\"accounts\": [{}]}");
        properties.setAllowAuthenticatedProviders(true);

        assertThat(scout().buildBlocklist().isEmpty()).isTrue();
    }

    @Test
    void shouldFailWhenHostConfigMissing() {
        properties.setHostConfigPath(tempDir.resolve("missing.json").toString());

        assertThatThrownBy(() -> scout().discover())
                .isInstanceOf(NoActiveProvidersException.class)
                .hasMessageContaining("Failed to read OpenCode config");
    }

    @Test
    void shouldKeepOnlyCorroboratedModelsInStrictMode() {
        properties.setStrictValidation(true);
        when(oracle.fetchModelMetadata(any(), any())).thenReturn(verdict("other", false, CostTier.UNKNOWN, 0.0));
        when(oracle.fetchModelMetadata("qwen/qwen3-coder:free", "openrouter"))
                .thenReturn(verdict("qwen/qwen3-coder:free", true, CostTier.CONFIRMED_FREE, 1.0));
        doReturn(adapter(withTier("groq", "llama3-8b-8192", CostTier.FREEMIUM_LIMITED, 0.8)))
                .when(adapterRegistry).create(eq("groq"), any());
        doReturn(adapter(withTier("google", "gemini-1.5-flash", CostTier.FREEMIUM_LIMITED, 0.8)))
                .when(adapterRegistry).create(eq("google"), any());

        Map<ModelCategory, ScoutResult> results = scout().discover();

        assertThat(results.values()).flatExtracting(ScoutResult::models).extracting(FreeModel::id)
                .containsExactly("qwen/qwen3-coder:free");
        assertThat(auditLog.recent(AuditEvent.Type.MODEL_BLOCKED, 10)).hasSize(2);
    }

    @Test
    void shouldReuseLastResults() {
        Scout scout = scout();
        scout.discover();

        scout.results(ModelCategory.CODING);
        scout.results(ModelCategory.WRITING);

        verify(openrouter, times(1)).fetchNormalized();
    }

    private static ModelMetadata verdict(String id, boolean free, CostTier tier, double confidence) {
        return new ModelMetadata(id, "test", id, free, tier, confidence, "test verdict", Instant.now(), Pricing.FREE);
    }
}
