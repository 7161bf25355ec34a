package com.phillippitts.freefleet.service.oracle;

import com.phillippitts.freefleet.config.properties.OracleProperties;
import com.phillippitts.freefleet.domain.CostTier;
import com.phillippitts.freefleet.domain.ModelMetadata;
import com.phillippitts.freefleet.domain.Pricing;
import com.phillippitts.freefleet.domain.ScrapedPolicy;
import com.phillippitts.freefleet.service.scraper.PolicyRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Decides whether a model is free and how certain that is.
 *
 * <p>Lookup order for {@code (modelId, providerId)}:
 * <ol>
 *   <li>cached verdict for the bare model id, returned as stored</li>
 *   <li>exact allow-list match, then {@code providerId/modelId}, then
 *       {@code openrouter/modelId} for other providers: {@code CONFIRMED_FREE}, 1.0</li>
 *   <li>the provider's scraped policy, consulted alongside every available metadata adapter
 *       queried concurrently with a per-adapter timeout</li>
 * </ol>
 * Merge: a confirming policy wins, then any adapter reporting free (1.0), then any adapter
 * data ({@code CONFIRMED_PAID}, 0.7), else {@code UNKNOWN}, 0.0. Every computed verdict is
 * cached before it is returned.
 *
 * <p>On startup two background refreshes run on the io executor: the community allow-list
 * merge and one pass of every policy scraper. Neither blocks readiness and failures are
 * only logged.
 */
@Service
public class MetadataOracle {

    private static final Logger LOG = LogManager.getLogger(MetadataOracle.class);

    static final String COMMUNITY_SOURCE = "community-list";
    static final String NO_SOURCE_REASON = "No source found";

    private final ConfirmedFreeAllowList allowList;
    private final MetadataCache cache;
    private final PolicyRegistry policyRegistry;
    private final List<MetadataAdapter> adapters;
    private final CommunityAllowListClient communityClient;
    private final OracleProperties properties;
    private final Executor executor;

    private volatile CompletableFuture<Void> backgroundRefresh = CompletableFuture.completedFuture(null);

    public MetadataOracle(ConfirmedFreeAllowList allowList,
                          MetadataCache cache,
                          PolicyRegistry policyRegistry,
                          List<MetadataAdapter> adapters,
                          CommunityAllowListClient communityClient,
                          OracleProperties properties,
                          @Qualifier("fleetIoExecutor") Executor executor) {
        this.allowList = Objects.requireNonNull(allowList, "allowList");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.policyRegistry = Objects.requireNonNull(policyRegistry, "policyRegistry");
        this.adapters = List.copyOf(adapters);
        this.communityClient = Objects.requireNonNull(communityClient, "communityClient");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @PostConstruct
    public void startBackgroundRefresh() {
        List<CompletableFuture<?>> tasks = new ArrayList<>();
        if (properties.isCommunityListEnabled()) {
            tasks.add(CompletableFuture.supplyAsync(communityClient::fetch, executor)
                    .orTimeout(properties.getRemoteTimeoutMs(), TimeUnit.MILLISECONDS)
                    .thenAccept(this::mergeCommunityDefinitions)
                    .exceptionally(e -> {
                        LOG.warn("Could not fetch community allow-list, continuing with local list: {}",
                                rootMessage(e));
                        return null;
                    }));
        }
        if (properties.isScrapeOnStartup()) {
            tasks.add(policyRegistry.scrapeAll()
                    .exceptionally(e -> {
                        LOG.warn("Policy scrape failed: {}", rootMessage(e));
                        return null;
                    }));
        }
        backgroundRefresh = CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new));
    }

    @PreDestroy
    public void stopBackgroundRefresh() {
        if (!backgroundRefresh.isDone()) {
            LOG.info("Cancelling background oracle refresh");
            backgroundRefresh.cancel(true);
        }
    }

    /** Completes when the startup refreshes have settled. */
    public CompletableFuture<Void> backgroundRefresh() {
        return backgroundRefresh;
    }

    void mergeCommunityDefinitions(CommunityDefinitions definitions) {
        int added = allowList.addAll(definitions.models());
        LOG.info("Fetched {} community models, added {} new (version {}, updated {})",
                definitions.models().size(), added, definitions.version(), definitions.lastUpdated());
    }

    public ModelMetadata fetchModelMetadata(String modelId) {
        return fetchModelMetadata(modelId, null);
    }

    /**
     * Verdict for one model.
     *
     * @param modelId    bare model id as the provider reports it
     * @param providerId provider the model came from, may be null
     */
    public ModelMetadata fetchModelMetadata(String modelId, String providerId) {
        Objects.requireNonNull(modelId, "modelId");

        Optional<ModelMetadata> cached = cache.get(modelId);
        if (cached.isPresent()) {
            LOG.debug("Oracle cache hit for {}", modelId);
            return cached.get();
        }

        ModelMetadata verdict = allowListVerdict(modelId, providerId)
                .orElseGet(() -> resolve(modelId, providerId));
        cache.put(modelId, verdict);
        return verdict;
    }

    public List<ModelMetadata> fetchModelsMetadata(List<String> modelIds) {
        LOG.info("Fetching metadata for {} models", modelIds.size());
        return modelIds.stream().map(this::fetchModelMetadata).toList();
    }

    private Optional<ModelMetadata> allowListVerdict(String modelId, String providerId) {
        if (allowList.contains(modelId)) {
            return Optional.of(confirmed(modelId, COMMUNITY_SOURCE));
        }
        if (providerId != null) {
            if (allowList.contains(providerId + "/" + modelId)) {
                return Optional.of(confirmed(modelId, providerId));
            }
            if (!"openrouter".equals(providerId) && allowList.contains("openrouter/" + modelId)) {
                return Optional.of(confirmed(modelId, providerId));
            }
        }
        return Optional.empty();
    }

    private ModelMetadata resolve(String modelId, String providerId) {
        Optional<ScrapedPolicy> policy = policyRegistry.getPolicy(providerId);
        List<ModelMetadata> found = queryAdapters(modelId);
        Instant now = Instant.now();

        if (policy.isPresent() && policy.get().confirmsFree(modelId)) {
            return new ModelMetadata(modelId, providerId, modelId, true, CostTier.CONFIRMED_FREE, 1.0,
                    "Confirmed free by " + providerId + " policy scraper", now, Pricing.FREE);
        }

        List<ModelMetadata> free = found.stream().filter(ModelMetadata::isFree).toList();
        if (!free.isEmpty()) {
            return free.get(0).withVerdict(true, CostTier.CONFIRMED_FREE, 1.0,
                    "Confirmed free by " + sources(free), now);
        }
        if (!found.isEmpty()) {
            return found.get(0).withVerdict(false, CostTier.CONFIRMED_PAID, 0.7,
                    "Metadata found but not confirmed free (sources: " + sources(found) + ")", now);
        }
        return new ModelMetadata(modelId, "unknown", modelId, false, CostTier.UNKNOWN, 0.0,
                NO_SOURCE_REASON, now, Pricing.FREE);
    }

    private List<ModelMetadata> queryAdapters(String modelId) {
        Duration timeout = properties.adapterTimeout();
        List<CompletableFuture<Optional<ModelMetadata>>> queries = adapters.stream()
                .filter(MetadataAdapter::isAvailable)
                .map(adapter -> CompletableFuture
                        .supplyAsync(() -> adapter.fetchModelMetadata(modelId), executor)
                        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                        .exceptionally(e -> {
                            LOG.warn("Metadata adapter {} failed for {}: {}",
                                    adapter.providerId(), modelId, rootMessage(e));
                            return Optional.empty();
                        }))
                .toList();

        List<ModelMetadata> found = new ArrayList<>();
        for (CompletableFuture<Optional<ModelMetadata>> q : queries) {
            q.join().ifPresent(found::add);
        }
        return found;
    }

    private static String sources(List<ModelMetadata> metadata) {
        return metadata.stream().map(ModelMetadata::provider).distinct().collect(Collectors.joining(", "));
    }

    private static ModelMetadata confirmed(String modelId, String via) {
        return new ModelMetadata(modelId, COMMUNITY_SOURCE, modelId, true, CostTier.CONFIRMED_FREE, 1.0,
                "Confirmed free by Community List (via " + via + ")", Instant.now(), Pricing.FREE);
    }

    public List<String> availableAdapters() {
        return adapters.stream().filter(MetadataAdapter::isAvailable).map(MetadataAdapter::providerId).toList();
    }

    public Set<String> confirmedFreeModels() {
        return allowList.snapshot();
    }

    public void addConfirmedFreeModel(String qualifiedId) {
        allowList.add(qualifiedId);
    }

    public void removeConfirmedFreeModel(String qualifiedId) {
        allowList.remove(qualifiedId);
    }

    /** Drops the cached verdict so the next lookup recomputes it. */
    public boolean forget(String modelId) {
        return cache.forget(modelId);
    }

    public void clearCache() {
        cache.clear();
    }

    private static String rootMessage(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }
}
