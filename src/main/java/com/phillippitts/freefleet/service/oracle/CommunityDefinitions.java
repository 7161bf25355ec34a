package com.phillippitts.freefleet.service.oracle;

import java.util.List;

/**
 * Remote community allow-list document: {@code {version, lastUpdated, models: [...]}}.
 */
public record CommunityDefinitions(String version, String lastUpdated, List<String> models) {

    public CommunityDefinitions {
        models = models == null ? List.of() : List.copyOf(models);
    }
}
