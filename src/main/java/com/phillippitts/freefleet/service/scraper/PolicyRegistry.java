package com.phillippitts.freefleet.service.scraper;

import com.phillippitts.freefleet.domain.ScrapedPolicy;
import com.phillippitts.freefleet.exception.PersistenceException;
import com.phillippitts.freefleet.service.persistence.AuditLog;
import com.phillippitts.freefleet.service.persistence.JsonFileStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

/**
 * Holds the latest scraped policy per provider, persisted to {@code provider-policies.json}.
 *
 * <p>{@link #scrapeAll()} runs every registered scraper concurrently with all-settled
 * semantics: a scraper that throws keeps that provider's previous policy and does not
 * affect the others.
 */
@Component
public class PolicyRegistry {

    private static final Logger LOG = LogManager.getLogger(PolicyRegistry.class);

    static final String FILE_NAME = "provider-policies.json";

    private final List<PolicyScraper> scrapers;
    private final JsonFileStore store;
    private final AuditLog auditLog;
    private final Executor executor;
    private final ConcurrentMap<String, ScrapedPolicy> policies = new ConcurrentHashMap<>();

    public PolicyRegistry(List<PolicyScraper> scrapers,
                          JsonFileStore store,
                          AuditLog auditLog,
                          @Qualifier("fleetIoExecutor") Executor executor) {
        this.scrapers = List.copyOf(scrapers);
        this.store = store;
        this.auditLog = auditLog;
        this.executor = executor;
        load();
    }

    public Optional<ScrapedPolicy> getPolicy(String providerId) {
        return providerId == null ? Optional.empty() : Optional.ofNullable(policies.get(providerId));
    }

    public Map<String, ScrapedPolicy> policies() {
        return new TreeMap<>(policies);
    }

    public List<PolicyScraper> scrapers() {
        return scrapers;
    }

    /**
     * Runs every scraper and persists the merged result. The returned future completes
     * normally once all scrapers have settled.
     */
    public CompletableFuture<Void> scrapeAll() {
        CompletableFuture<?>[] runs = scrapers.stream()
                .map(scraper -> CompletableFuture.supplyAsync(scraper::scrape, executor)
                        .handle((policy, error) -> {
                            if (error != null) {
                                LOG.warn("Scraper for {} failed: {}", scraper.providerId(), error.getMessage());
                                auditLog.scraperFailed("policy-registry", scraper.providerId(), error.getMessage());
                            } else if (policy != null) {
                                policies.put(policy.providerId(), policy);
                            }
                            return null;
                        }))
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(runs).thenRun(this::save);
    }

    private void load() {
        store.readObject(FILE_NAME).ifPresent(root -> {
            for (String providerId : root.keySet()) {
                try {
                    policies.put(providerId, ScrapedPolicy.fromJson(root.getJSONObject(providerId)));
                } catch (JSONException | IllegalArgumentException | DateTimeParseException e) {
                    LOG.warn("Ignoring unreadable cached policy for {}: {}", providerId, e.getMessage());
                }
            }
            LOG.info("Loaded {} cached provider policies", policies.size());
        });
    }

    private void save() {
        JSONObject root = new JSONObject();
        policies.forEach((id, policy) -> root.put(id, policy.toJson()));
        try {
            store.writeObject(FILE_NAME, root);
        } catch (PersistenceException e) {
            LOG.warn("Failed to persist provider policies: {}", e.getMessage());
        }
    }
}
