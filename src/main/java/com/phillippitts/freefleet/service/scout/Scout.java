package com.phillippitts.freefleet.service.scout;

import com.phillippitts.freefleet.config.properties.ScoutProperties;
import com.phillippitts.freefleet.domain.CostTier;
import com.phillippitts.freefleet.domain.FreeModel;
import com.phillippitts.freefleet.domain.ModelCategory;
import com.phillippitts.freefleet.domain.ModelMetadata;
import com.phillippitts.freefleet.domain.ScoutResult;
import com.phillippitts.freefleet.exception.CircuitBreakerOpenException;
import com.phillippitts.freefleet.exception.NoActiveProvidersException;
import com.phillippitts.freefleet.service.metrics.FleetMetrics;
import com.phillippitts.freefleet.service.oracle.MetadataOracle;
import com.phillippitts.freefleet.service.persistence.AuditLog;
import com.phillippitts.freefleet.service.provider.ProviderAdapter;
import com.phillippitts.freefleet.service.provider.ProviderAdapterRegistry;
import com.phillippitts.freefleet.service.resilience.CircuitBreakerRegistry;
import com.phillippitts.freefleet.service.validation.UltraFreeValidator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Discovers free models across every provider the host has configured, then ranks and
 * categorizes them.
 *
 * <p>A discovery pass:
 * <ol>
 *   <li>builds the blocklist from the authentication bridge file</li>
 *   <li>reads the active providers and builds one adapter per provider</li>
 *   <li>fetches every catalog concurrently through the provider's circuit breaker; a
 *       failing provider contributes nothing</li>
 *   <li>drops blocked and non-free models; in strict mode reconciles the rest with the
 *       oracle and drops models that fail the ultra-free checks</li>
 *   <li>places each model in every category it matches and ranks each category</li>
 * </ol>
 *
 * <p>The last result is kept so callers can reuse it without another network pass.
 */
@Service
public class Scout {

    private static final Logger LOG = LogManager.getLogger(Scout.class);

    private final ScoutProperties properties;
    private final HostConfigReader hostConfigReader;
    private final ProviderAdapterRegistry adapterRegistry;
    private final CircuitBreakerRegistry breakers;
    private final MetadataOracle oracle;
    private final UltraFreeValidator validator;
    private final AuditLog auditLog;
    private final FleetMetrics metrics;
    private final Executor executor;

    private volatile Map<ModelCategory, ScoutResult> lastResults;

    public Scout(ScoutProperties properties,
                 HostConfigReader hostConfigReader,
                 ProviderAdapterRegistry adapterRegistry,
                 CircuitBreakerRegistry breakers,
                 MetadataOracle oracle,
                 UltraFreeValidator validator,
                 AuditLog auditLog,
                 FleetMetrics metrics,
                 @Qualifier("fleetIoExecutor") Executor executor) {
        this.properties = properties;
        this.hostConfigReader = hostConfigReader;
        this.adapterRegistry = adapterRegistry;
        this.breakers = breakers;
        this.oracle = oracle;
        this.validator = validator;
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Blocklist for the current host state. Account-bound providers are blocked while the
     * authentication bridge lists at least one account, unless explicitly allowed.
     */
    public Blocklist buildBlocklist() {
        if (properties.isAllowAuthenticatedProviders()) {
            return Blocklist.EMPTY;
        }
        int accounts = hostConfigReader.countAuthenticatedAccounts(properties.accounts());
        if (accounts == 0) {
            return Blocklist.EMPTY;
        }
        Blocklist blocklist = new Blocklist(properties.getAuthenticatedProviderIds());
        LOG.warn("Found {} authenticated accounts, blocking {}", accounts, blocklist.tokens());
        return blocklist;
    }

    public ActiveProviders detectActiveProviders() {
        HostConfig config = hostConfigReader.read(properties.hostConfig());
        Map<String, ProviderAdapter<?>> adapters = new LinkedHashMap<>();
        for (String id : config.providerIds()) {
            adapters.put(id, adapterRegistry.create(id, config.configFor(id)));
        }
        LOG.info("Active providers: {}", config.providerIds());
        return new ActiveProviders(config.providerIds(), adapters, config.errors());
    }

    /**
     * Runs a full discovery pass.
     *
     * @throws NoActiveProvidersException when the host configuration names no provider
     */
    public Map<ModelCategory, ScoutResult> discover() {
        LOG.info("Starting model discovery");
        Blocklist blocklist = buildBlocklist();
        ActiveProviders active = detectActiveProviders();
        if (active.providers().isEmpty()) {
            throw new NoActiveProvidersException(properties.hostConfig(), active.errors());
        }

        List<FreeModel> fetched = fetchAll(active);
        List<FreeModel> free = new ArrayList<>();
        for (FreeModel model : fetched) {
            if (blocklist.blocks(model)) {
                auditLog.modelBlocked("scout", model.qualifiedId(), List.of("blocklisted_provider"));
                continue;
            }
            if (model.isFree()) {
                free.add(model);
            }
        }
        if (properties.isStrictValidation()) {
            free = applyStrictValidation(free);
        }
        LOG.info("Discovery kept {} free models of {} fetched", free.size(), fetched.size());

        Map<ModelCategory, ScoutResult> results = categorize(free);
        lastResults = results;
        return results;
    }

    /** Last discovery result, running a pass when none exists yet. */
    public Map<ModelCategory, ScoutResult> results() {
        Map<ModelCategory, ScoutResult> current = lastResults;
        return current != null ? current : discover();
    }

    public ScoutResult results(ModelCategory category) {
        return results().getOrDefault(category, ScoutResult.empty(category));
    }

    private List<FreeModel> fetchAll(ActiveProviders active) {
        List<CompletableFuture<List<FreeModel>>> fetches = new ArrayList<>();
        for (Map.Entry<String, ProviderAdapter<?>> entry : active.adapters().entrySet()) {
            String providerId = entry.getKey();
            ProviderAdapter<?> adapter = entry.getValue();
            fetches.add(CompletableFuture
                    .supplyAsync(() -> breakers.forProvider(providerId).execute(adapter::fetchNormalized), executor)
                    .exceptionally(e -> {
                        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                        if (cause instanceof CircuitBreakerOpenException) {
                            metrics.incrementBreakerRejection(providerId);
                        }
                        LOG.warn("Provider {} contributed no models: {}", providerId, cause.getMessage());
                        return List.of();
                    }));
        }
        List<FreeModel> all = new ArrayList<>();
        for (CompletableFuture<List<FreeModel>> f : fetches) {
            all.addAll(f.join());
        }
        return all;
    }

    private List<FreeModel> applyStrictValidation(List<FreeModel> models) {
        List<FreeModel> safe = new ArrayList<>();
        for (FreeModel model : models) {
            FreeModel reconciled = model;
            ModelMetadata verdict = oracle.fetchModelMetadata(model.id(), model.provider());
            if (verdict.isFree() && verdict.confidence() >= 1.0) {
                reconciled = model.withVerdict(CostTier.CONFIRMED_FREE, 1.0);
            }
            if (validator.validate(reconciled).safe()) {
                safe.add(reconciled);
            }
        }
        return safe;
    }

    static Map<ModelCategory, ScoutResult> categorize(List<FreeModel> models) {
        Map<ModelCategory, List<FreeModel>> byCategory = new EnumMap<>(ModelCategory.class);
        for (ModelCategory category : ModelCategory.values()) {
            byCategory.put(category, new ArrayList<>());
        }
        for (FreeModel model : models) {
            for (ModelCategory category : ModelCategory.allFor(model.id())) {
                byCategory.get(category).add(model);
            }
        }

        Map<ModelCategory, ScoutResult> results = new EnumMap<>(ModelCategory.class);
        byCategory.forEach((category, members) -> {
            List<FreeModel> ranked = ModelRanker.rank(members, category);
            List<FreeModel> elite = ranked.stream().filter(m -> category.isEliteFamily(m.id())).toList();
            results.put(category, new ScoutResult(category, members, ranked, elite));
        });
        return results;
    }

    public void printSummary(Map<ModelCategory, ScoutResult> results) {
        StringBuilder sb = new StringBuilder("Free fleet discovery results");
        results.forEach((category, result) -> {
            List<FreeModel> top = result.rankedModels().subList(0, Math.min(5, result.rankedModels().size()));
            sb.append(System.lineSeparator()).append("  ").append(category.key().toUpperCase(Locale.ROOT))
                    .append(" (top ").append(top.size()).append("):");
            for (int i = 0; i < top.size(); i++) {
                FreeModel m = top.get(i);
                sb.append(System.lineSeparator()).append("    ").append(i + 1).append(". ").append(m.qualifiedId());
                if (result.eliteModels().contains(m)) {
                    sb.append(" [elite]");
                }
            }
        });
        LOG.info(sb.toString());
    }
}
