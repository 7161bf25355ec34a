package com.phillippitts.freefleet.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Metadata oracle sources and timeouts.
 */
@ConfigurationProperties(prefix = "fleet.oracle")
@Validated
public class OracleProperties {

    /** Remote community allow-list document. */
    @NotBlank
    private String communityListUrl =
            "https://raw.githubusercontent.com/phorde/opencode-free-fleet/main/resources/community-models.json";

    /** Merge the community allow-list in the background at startup. */
    private boolean communityListEnabled = true;

    /** Run every policy scraper once in the background at startup. */
    private boolean scrapeOnStartup = true;

    /** Bound on each metadata adapter query, in milliseconds. */
    @Positive
    private long adapterTimeoutMs = 5_000;

    /** Bound on the community allow-list fetch, in milliseconds. */
    @Positive
    private long remoteTimeoutMs = 5_000;

    @NotBlank
    private String modelsDevUrl = "https://models.dev/api/v1/models";

    /** How long the models.dev catalog is reused before refetching, in minutes. */
    @Positive
    private long modelsDevCacheTtlMinutes = 60;

    /** Extra fully-qualified model ids added to the curated allow-list. */
    private List<String> additionalFreeModels = new ArrayList<>();

    public String getCommunityListUrl() {
        return communityListUrl;
    }

    public void setCommunityListUrl(String communityListUrl) {
        this.communityListUrl = communityListUrl;
    }

    public boolean isCommunityListEnabled() {
        return communityListEnabled;
    }

    public void setCommunityListEnabled(boolean communityListEnabled) {
        this.communityListEnabled = communityListEnabled;
    }

    public boolean isScrapeOnStartup() {
        return scrapeOnStartup;
    }

    public void setScrapeOnStartup(boolean scrapeOnStartup) {
        this.scrapeOnStartup = scrapeOnStartup;
    }

    public long getAdapterTimeoutMs() {
        return adapterTimeoutMs;
    }

    public void setAdapterTimeoutMs(long adapterTimeoutMs) {
        this.adapterTimeoutMs = adapterTimeoutMs;
    }

    public long getRemoteTimeoutMs() {
        return remoteTimeoutMs;
    }

    public void setRemoteTimeoutMs(long remoteTimeoutMs) {
        this.remoteTimeoutMs = remoteTimeoutMs;
    }

    public String getModelsDevUrl() {
        return modelsDevUrl;
    }

    public void setModelsDevUrl(String modelsDevUrl) {
        this.modelsDevUrl = modelsDevUrl;
    }

    public long getModelsDevCacheTtlMinutes() {
        return modelsDevCacheTtlMinutes;
    }

    public void setModelsDevCacheTtlMinutes(long modelsDevCacheTtlMinutes) {
        this.modelsDevCacheTtlMinutes = modelsDevCacheTtlMinutes;
    }

    public List<String> getAdditionalFreeModels() {
        return additionalFreeModels;
    }

    public void setAdditionalFreeModels(List<String> additionalFreeModels) {
        this.additionalFreeModels = additionalFreeModels;
    }

    public Duration adapterTimeout() {
        return Duration.ofMillis(adapterTimeoutMs);
    }

    public Duration remoteTimeout() {
        return Duration.ofMillis(remoteTimeoutMs);
    }
}
