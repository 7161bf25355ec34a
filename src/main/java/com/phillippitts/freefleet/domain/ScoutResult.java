package com.phillippitts.freefleet.domain;

import java.util.List;
import java.util.Objects;

/**
 * Discovery output for one category.
 *
 * @param category     the category
 * @param models       every free model placed in the category, in discovery order
 * @param rankedModels the same models ordered by benchmark ranking
 * @param eliteModels  ranked models whose id matches the category's elite families
 */
public record ScoutResult(
        ModelCategory category,
        List<FreeModel> models,
        List<FreeModel> rankedModels,
        List<FreeModel> eliteModels
) {
    public ScoutResult {
        Objects.requireNonNull(category, "category");
        models = models == null ? List.of() : List.copyOf(models);
        rankedModels = rankedModels == null ? List.of() : List.copyOf(rankedModels);
        eliteModels = eliteModels == null ? List.of() : List.copyOf(eliteModels);
    }

    public static ScoutResult empty(ModelCategory category) {
        return new ScoutResult(category, List.of(), List.of(), List.of());
    }
}
