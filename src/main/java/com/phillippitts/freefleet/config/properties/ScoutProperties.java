package com.phillippitts.freefleet.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Where Scout finds the host configuration and how it treats authenticated providers.
 */
@ConfigurationProperties(prefix = "fleet.scout")
@Validated
public class ScoutProperties {

    private static final String HOST_CONFIG_DIR = System.getProperty("user.home") + "/.config/opencode";

    /** Host configuration listing providers and category model chains. */
    @NotBlank
    private String hostConfigPath = HOST_CONFIG_DIR + "/oh-my-opencode.json";

    /** Authentication bridge file; any account in it puts the authenticated providers on the blocklist. */
    @NotBlank
    private String accountsPath = HOST_CONFIG_DIR + "/antigravity-accounts.json";

    /** Route through account-bound providers even when credentials exist. */
    private boolean allowAuthenticatedProviders = false;

    /** Provider ids blocked while account credentials exist. */
    private List<String> authenticatedProviderIds = new ArrayList<>(List.of("google", "gemini"));

    /** Reconcile every free model with the oracle and drop models that fail the ultra-free checks. */
    private boolean strictValidation = false;

    public String getHostConfigPath() {
        return hostConfigPath;
    }

    public void setHostConfigPath(String hostConfigPath) {
        this.hostConfigPath = hostConfigPath;
    }

    public String getAccountsPath() {
        return accountsPath;
    }

    public void setAccountsPath(String accountsPath) {
        this.accountsPath = accountsPath;
    }

    public boolean isAllowAuthenticatedProviders() {
        return allowAuthenticatedProviders;
    }

    public void setAllowAuthenticatedProviders(boolean allowAuthenticatedProviders) {
        this.allowAuthenticatedProviders = allowAuthenticatedProviders;
    }

    public List<String> getAuthenticatedProviderIds() {
        return authenticatedProviderIds;
    }

    public void setAuthenticatedProviderIds(List<String> authenticatedProviderIds) {
        this.authenticatedProviderIds = authenticatedProviderIds;
    }

    public boolean isStrictValidation() {
        return strictValidation;
    }

    public void setStrictValidation(boolean strictValidation) {
        this.strictValidation = strictValidation;
    }

    public Path hostConfig() {
        return Path.of(hostConfigPath);
    }

    public Path accounts() {
        return Path.of(accountsPath);
    }
}
