package com.phillippitts.freefleet.service.scraper;

import com.phillippitts.freefleet.domain.ScrapedPolicy;

/**
 * Derives one provider's free-tier policy from a public source.
 *
 * <p>{@link #scrape()} never throws: when the source is unavailable it returns a
 * built-in fallback policy.
 */
public interface PolicyScraper {

    String providerId();

    /** Public page or endpoint the policy is read from. */
    String policyUrl();

    ScrapedPolicy scrape();
}
