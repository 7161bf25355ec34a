package com.phillippitts.freefleet.service.scraper;

import com.phillippitts.freefleet.domain.ScrapedPolicy;
import com.phillippitts.freefleet.service.persistence.AuditLog;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Cerebras publishes no machine-readable pricing; the free list is maintained here.
 */
@Component
public class CerebrasPolicyScraper extends AbstractPolicyScraper {

    static final List<String> FREE_MODELS = List.of("llama3.1-8b", "llama3.1-70b");

    public CerebrasPolicyScraper(AuditLog auditLog) {
        super("cerebras", "https://cerebras.ai/pricing", auditLog);
    }

    @Override
    protected ScrapedPolicy doScrape() {
        return new ScrapedPolicy(providerId(), Instant.now(), true, FREE_MODELS);
    }

    @Override
    protected List<String> fallbackFreeModels() {
        return FREE_MODELS;
    }
}
