package com.phillippitts.freefleet.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Location of the JSON cache, policy, metrics and audit files.
 */
@ConfigurationProperties(prefix = "fleet.persistence")
@Validated
public class PersistenceProperties {

    @NotBlank
    private String cacheDir = System.getProperty("user.home") + "/.config/opencode/cache";

    public String getCacheDir() {
        return cacheDir;
    }

    public void setCacheDir(String cacheDir) {
        this.cacheDir = cacheDir;
    }

    public Path cacheDirectory() {
        return Path.of(cacheDir);
    }
}
