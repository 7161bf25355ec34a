package com.phillippitts.freefleet.service.scraper;

import com.phillippitts.freefleet.domain.ScrapedPolicy;
import com.phillippitts.freefleet.service.persistence.AuditLog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Template for scrapers that read a live source and fall back to a known free list.
 */
public abstract class AbstractPolicyScraper implements PolicyScraper {

    private static final Logger LOG = LogManager.getLogger(AbstractPolicyScraper.class);

    private final String providerId;
    private final String policyUrl;
    private final AuditLog auditLog;

    protected AbstractPolicyScraper(String providerId, String policyUrl, AuditLog auditLog) {
        this.providerId = Objects.requireNonNull(providerId, "providerId");
        this.policyUrl = Objects.requireNonNull(policyUrl, "policyUrl");
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public String policyUrl() {
        return policyUrl;
    }

    @Override
    public final ScrapedPolicy scrape() {
        try {
            ScrapedPolicy policy = doScrape();
            LOG.debug("{} policy scraped: freeTierActive={}, {} free models",
                    providerId, policy.freeTierActive(), policy.freeModels().size());
            return policy;
        } catch (RuntimeException e) {
            LOG.warn("{} policy scrape failed, using built-in list: {}", providerId, e.getMessage());
            auditLog.scraperFailed("policy-scraper", providerId, e.getMessage());
            return new ScrapedPolicy(providerId, Instant.now(), true, fallbackFreeModels());
        }
    }

    /** Reads the live source; any runtime exception selects the fallback list. */
    protected abstract ScrapedPolicy doScrape();

    protected abstract List<String> fallbackFreeModels();
}
