package com.phillippitts.freefleet.service.oracle;

import com.phillippitts.freefleet.config.properties.OracleProperties;
import com.phillippitts.freefleet.domain.CostTier;
import com.phillippitts.freefleet.domain.ModelMetadata;
import com.phillippitts.freefleet.domain.Pricing;
import com.phillippitts.freefleet.domain.ScrapedPolicy;
import com.phillippitts.freefleet.exception.ProviderFetchException;
import com.phillippitts.freefleet.service.persistence.AuditLog;
import com.phillippitts.freefleet.service.persistence.JsonFileStore;
import com.phillippitts.freefleet.service.scraper.PolicyRegistry;
import com.phillippitts.freefleet.service.scraper.PolicyScraper;
import com.phillippitts.freefleet.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MetadataOracleTest {

    @TempDir
    Path tempDir;

    private JsonFileStore store;
    private ConfirmedFreeAllowList allowList;
    private MetadataAdapter adapter;
    private PolicyScraper groqScraper;
    private PolicyRegistry policyRegistry;
    private CommunityAllowListClient communityClient;
    private OracleProperties properties;

    @BeforeEach
    void setUp() {
        store = new JsonFileStore(tempDir);
        allowList = new ConfirmedFreeAllowList(List.of());
        adapter = mock(MetadataAdapter.class);
        when(adapter.providerId()).thenReturn("models.dev");
        when(adapter.isAvailable()).thenReturn(true);
        when(adapter.fetchModelMetadata(anyString())).thenReturn(Optional.empty());

        groqScraper = mock(PolicyScraper.class);
        when(groqScraper.providerId()).thenReturn("groq");
        when(groqScraper.scrape()).thenReturn(
                new ScrapedPolicy("groq", Instant.now(), true, List.of("llama3-8b-8192")));
        AuditLog auditLog = new AuditLog(store);
        policyRegistry = new PolicyRegistry(List.of(groqScraper), store, auditLog, new SyncExecutor());

        communityClient = mock(CommunityAllowListClient.class);
        properties = new OracleProperties();
        properties.setCommunityListEnabled(false);
        properties.setScrapeOnStartup(false);
    }

    private MetadataOracle oracle() {
        return new MetadataOracle(allowList, new MetadataCache(store), policyRegistry, List.of(adapter),
                communityClient, properties, new SyncExecutor());
    }

    @Test
    void shouldConfirmExactAllowListEntry() {
        ModelMetadata verdict = oracle().fetchModelMetadata("google/gemini-1.5-flash");

        assertThat(verdict.isFree()).isTrue();
        assertThat(verdict.tier()).isEqualTo(CostTier.CONFIRMED_FREE);
        assertThat(verdict.confidence()).isEqualTo(1.0);
        assertThat(verdict.provider()).isEqualTo("community-list");
        verify(adapter, never()).fetchModelMetadata(anyString());
    }

    @Test
    void shouldConfirmProviderQualifiedAllowListEntry() {
        ModelMetadata verdict = oracle().fetchModelMetadata("qwen/qwen3-coder:free", "openrouter");

        assertThat(verdict.tier()).isEqualTo(CostTier.CONFIRMED_FREE);
        assertThat(verdict.reason()).contains("via openrouter");
    }

    @Test
    void shouldConfirmOpenRouterListingForOtherProvider() {
        ModelMetadata verdict = oracle().fetchModelMetadata("deepseek/deepseek-v3.2", "chutes");

        assertThat(verdict.tier()).isEqualTo(CostTier.CONFIRMED_FREE);
        assertThat(verdict.reason()).contains("via chutes");
    }

    @Test
    void shouldConfirmThroughScrapedPolicy() {
        policyRegistry.scrapeAll().join();

        ModelMetadata verdict = oracle().fetchModelMetadata("llama3-8b-8192", "groq");

        assertThat(verdict.tier()).isEqualTo(CostTier.CONFIRMED_FREE);
        assertThat(verdict.reason()).isEqualTo("Confirmed free by groq policy scraper");
    }

    @Test
    void shouldConfirmWhenAdapterReportsFree() {
        when(adapter.fetchModelMetadata("mistral-tiny")).thenReturn(Optional.of(adapterData("mistral-tiny", true)));

        ModelMetadata verdict = oracle().fetchModelMetadata("mistral-tiny", "mistral");

        assertThat(verdict.tier()).isEqualTo(CostTier.CONFIRMED_FREE);
        assertThat(verdict.confidence()).isEqualTo(1.0);
        assertThat(verdict.reason()).isEqualTo("Confirmed free by models.dev");
        assertThat(verdict.lastVerified()).isNotNull();
    }

    @Test
    void shouldReportPaidWhenAdapterHasDataButNotFree() {
        when(adapter.fetchModelMetadata("gpt-4o")).thenReturn(Optional.of(adapterData("gpt-4o", false)));

        ModelMetadata verdict = oracle().fetchModelMetadata("gpt-4o", "openai");

        assertThat(verdict.isFree()).isFalse();
        assertThat(verdict.tier()).isEqualTo(CostTier.CONFIRMED_PAID);
        assertThat(verdict.confidence()).isEqualTo(0.7);
        assertThat(verdict.reason()).contains("sources: models.dev");
    }

    @Test
    void shouldReturnUnknownWhenEveryAdapterFails() {
        when(adapter.fetchModelMetadata("mystery")).thenThrow(new ProviderFetchException("models.dev", "down", null));

        ModelMetadata verdict = oracle().fetchModelMetadata("mystery", "somewhere");

        assertThat(verdict.tier()).isEqualTo(CostTier.UNKNOWN);
        assertThat(verdict.confidence()).isEqualTo(0.0);
        assertThat(verdict.reason()).isEqualTo(MetadataOracle.NO_SOURCE_REASON);
    }

    @Test
    void shouldServeCachedVerdictAcrossRestarts() {
        when(adapter.fetchModelMetadata("gpt-4o")).thenReturn(Optional.of(adapterData("gpt-4o", false)));
        oracle().fetchModelMetadata("gpt-4o", "openai");

        ModelMetadata again = oracle().fetchModelMetadata("gpt-4o", "openai");

        assertThat(again.tier()).isEqualTo(CostTier.CONFIRMED_PAID);
        verify(adapter, times(1)).fetchModelMetadata("gpt-4o");
    }

    @Test
    void shouldRecomputeAfterForget() {
        MetadataOracle oracle = oracle();
        oracle.fetchModelMetadata("mystery");

        assertThat(oracle.forget("mystery")).isTrue();
        oracle.fetchModelMetadata("mystery");

        verify(adapter, times(2)).fetchModelMetadata("mystery");
    }

    @Test
    void shouldMergeCommunityListInBackground() {
        properties.setCommunityListEnabled(true);
        when(communityClient.fetch()).thenReturn(
                new CommunityDefinitions("2", "2026-10-01", List.of("groq/new-free-model", "google/gemini-1.5-flash")));
        MetadataOracle oracle = oracle();

        oracle.startBackgroundRefresh();
        oracle.backgroundRefresh().join();

        assertThat(oracle.confirmedFreeModels()).contains("groq/new-free-model");
    }

    @Test
    void shouldKeepLocalListWhenCommunityFetchFails() {
        properties.setCommunityListEnabled(true);
        when(communityClient.fetch()).thenThrow(new ProviderFetchException("community-list", "404", null));
        MetadataOracle oracle = oracle();
        int before = allowList.size();

        oracle.startBackgroundRefresh();
        oracle.backgroundRefresh().join();

        assertThat(allowList.size()).isEqualTo(before);
    }

    private static ModelMetadata adapterData(String id, boolean free) {
        return new ModelMetadata(id, "models.dev", id, free,
                free ? CostTier.CONFIRMED_FREE : CostTier.CONFIRMED_PAID, free ? 1.0 : 0.7,
                "adapter data", null, free ? Pricing.FREE : new Pricing("0.5", "1.5", "0"));
    }
}
