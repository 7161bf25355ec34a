package com.phillippitts.freefleet.service.selection;

import java.util.List;

/**
 * Candidates for one race: the primary wave and the ranked remainder used for fallback waves.
 * Ids are {@code provider/modelId}.
 */
public record ModelSelection(List<String> primary, List<String> fallback) {

    public ModelSelection {
        primary = List.copyOf(primary);
        fallback = List.copyOf(fallback);
    }

    public boolean isEmpty() {
        return primary.isEmpty() && fallback.isEmpty();
    }
}
