package com.phillippitts.freefleet.service.provider;

import com.phillippitts.freefleet.domain.CostTier;
import com.phillippitts.freefleet.domain.FreeModel;
import com.phillippitts.freefleet.domain.ModelCategory;

import java.util.Objects;

/**
 * Shared normalization for provider adapters.
 *
 * <p>Subclasses supply the fetch and the free rule. Normalization assigns the primary
 * category from the id keywords, marks elite family membership within that category,
 * and derives tier and confidence:
 * <ul>
 *   <li>free by the provider's rule: {@link #freeTier()} with {@link #freeConfidence()}</li>
 *   <li>not free but priced: {@link CostTier#CONFIRMED_PAID}, 0.7</li>
 *   <li>not free and no pricing reported: {@link CostTier#UNKNOWN}, 0.0</li>
 * </ul>
 */
public abstract class AbstractProviderAdapter<M extends ProviderModel> implements ProviderAdapter<M> {

    static final double PAID_CONFIDENCE = 0.7;
    static final double FREEMIUM_CONFIDENCE = 0.8;

    private final String providerId;
    private final String providerName;

    protected AbstractProviderAdapter(String providerId, String providerName) {
        this.providerId = Objects.requireNonNull(providerId, "providerId");
        this.providerName = Objects.requireNonNull(providerName, "providerName");
    }

    @Override
    public String providerId() {
        return providerId;
    }

    @Override
    public String providerName() {
        return providerName;
    }

    /**
     * Tier given to models the free rule accepts. Providers whose rule is an assumption
     * rather than reported pricing override this with {@link CostTier#FREEMIUM_LIMITED}.
     */
    protected CostTier freeTier() {
        return CostTier.CONFIRMED_FREE;
    }

    protected double freeConfidence() {
        return freeTier() == CostTier.CONFIRMED_FREE ? 1.0 : FREEMIUM_CONFIDENCE;
    }

    @Override
    public FreeModel normalizeModel(M model) {
        boolean free = isFreeModel(model);
        ModelCategory category = ModelCategory.primaryFor(model.id());

        CostTier tier;
        double confidence;
        if (free) {
            tier = freeTier();
            confidence = freeConfidence();
        } else if (model.pricing() != null && model.pricing().isReported()) {
            tier = CostTier.CONFIRMED_PAID;
            confidence = PAID_CONFIDENCE;
        } else {
            tier = CostTier.UNKNOWN;
            confidence = 0.0;
        }

        return new FreeModel(
                model.id(),
                providerId,
                displayName(model),
                model.description(),
                model.contextLength(),
                model.maxOutputTokens(),
                model.pricing() == null ? null : model.pricing().orZero(),
                free,
                category.isEliteFamily(model.id()),
                category,
                confidence,
                tier
        );
    }

    private static String displayName(ProviderModel model) {
        if (model.name() != null && !model.name().isBlank()) {
            return model.name();
        }
        int slash = model.id().indexOf('/');
        return slash >= 0 ? model.id().substring(slash + 1) : model.id();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + providerId + "]";
    }
}
