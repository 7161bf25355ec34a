package com.phillippitts.freefleet.service.selection;

import com.phillippitts.freefleet.config.properties.DelegationProperties;
import com.phillippitts.freefleet.domain.DelegationConfig;
import com.phillippitts.freefleet.domain.FreeModel;
import com.phillippitts.freefleet.domain.ModelCategory;
import com.phillippitts.freefleet.service.scout.Scout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns Scout's ranking into race candidates according to the fleet mode.
 *
 * <ul>
 *   <li>{@code ultra_free}: every free ranked model</li>
 *   <li>{@code SOTA_only}: elite models only, at most {@code raceCount}</li>
 *   <li>{@code balanced}: the top {@code raceCount}</li>
 * </ul>
 */
@Service
public class ModelSelector {

    private static final Logger LOG = LogManager.getLogger(ModelSelector.class);

    private final Scout scout;
    private volatile DelegationConfig config;

    @Autowired
    public ModelSelector(Scout scout, DelegationProperties properties) {
        this(scout, properties.toConfig());
    }

    public ModelSelector(Scout scout, DelegationConfig config) {
        this.scout = Objects.requireNonNull(scout, "scout");
        this.config = Objects.requireNonNull(config, "config");
    }

    public List<String> selectModels(ModelCategory category) {
        return filterByMode(freeRanked(category));
    }

    /**
     * First {@code raceCount} free ranked models as the primary wave and the rest as
     * fallback, whatever the mode.
     */
    public ModelSelection selectWithFallback(ModelCategory category) {
        List<FreeModel> free = freeRanked(category);
        int raceCount = config.raceCount();
        List<String> primary = free.stream().limit(raceCount).map(FreeModel::qualifiedId).toList();
        List<String> fallback = free.stream().skip(raceCount).map(FreeModel::qualifiedId).toList();
        LOG.debug("{}: {} primary, {} fallback candidates", category.key(), primary.size(), fallback.size());
        return new ModelSelection(primary, fallback);
    }

    public List<String> selectModelsByProvider(ModelCategory category, Collection<String> providers) {
        Set<String> wanted = providers.stream()
                .map(p -> p.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        List<FreeModel> filtered = freeRanked(category).stream()
                .filter(m -> wanted.contains(m.provider().toLowerCase(Locale.ROOT)))
                .toList();
        return filterByMode(filtered);
    }

    /** Applies the fleet mode to an already ranked list. */
    public List<String> filterByMode(List<FreeModel> ranked) {
        Stream<FreeModel> candidates = switch (config.mode()) {
            case ULTRA_FREE -> ranked.stream();
            case SOTA_ONLY -> ranked.stream().filter(FreeModel::isElite).limit(config.raceCount());
            case BALANCED -> ranked.stream().limit(config.raceCount());
        };
        return candidates.map(FreeModel::qualifiedId).toList();
    }

    private List<FreeModel> freeRanked(ModelCategory category) {
        return scout.results(category).rankedModels().stream()
                .filter(FreeModel::isFree)
                .toList();
    }

    public DelegationConfig getConfig() {
        return config;
    }

    public void updateConfig(DelegationConfig newConfig) {
        this.config = Objects.requireNonNull(newConfig, "config");
        LOG.info("Selector config updated: mode={}, raceCount={}", newConfig.mode().key(), newConfig.raceCount());
    }
}
