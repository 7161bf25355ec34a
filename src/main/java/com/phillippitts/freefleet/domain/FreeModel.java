package com.phillippitts.freefleet.domain;

import java.util.Objects;

/**
 * Provider-agnostic record of one (provider, model id) pair produced by a provider
 * adapter's normalization step during a discovery pass.
 *
 * <p>Instances are immutable and live only for one discovery pass.
 *
 * @param id              provider-native model id (e.g. {@code qwen/qwen3-coder:free})
 * @param provider        provider id (e.g. {@code openrouter})
 * @param name            display name
 * @param description     optional description, may be null
 * @param contextLength   optional context window in tokens, may be null
 * @param maxOutputTokens optional output limit in tokens, may be null
 * @param pricing         cost markers as reported by the provider
 * @param isFree          whether the provider's own rule deems the model free
 * @param isElite         whether the id belongs to an elite family of {@code category}
 * @param category        primary functional category
 * @param confidence      certainty of the free classification in [0, 1]
 * @param tier            cost tier; never {@link CostTier#CONFIRMED_PAID} or
 *                        {@link CostTier#UNKNOWN} when {@code isFree}
 */
public record FreeModel(
        String id,
        String provider,
        String name,
        String description,
        Integer contextLength,
        Integer maxOutputTokens,
        Pricing pricing,
        boolean isFree,
        boolean isElite,
        ModelCategory category,
        double confidence,
        CostTier tier
) {
    public FreeModel {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(tier, "tier");
        pricing = pricing == null ? Pricing.UNREPORTED : pricing;
        name = name == null || name.isBlank() ? id : name;
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        if (isFree && !tier.allowsFree()) {
            throw new IllegalArgumentException("Free model " + provider + "/" + id + " cannot have tier " + tier);
        }
    }

    /** Candidate identifier used by the selector and racer: {@code provider/id}. */
    public String qualifiedId() {
        return provider + "/" + id;
    }

    /** Copy with a new tier and confidence, keeping the free flag consistent with the tier. */
    public FreeModel withVerdict(CostTier newTier, double newConfidence) {
        return new FreeModel(id, provider, name, description, contextLength, maxOutputTokens, pricing,
                isFree && newTier.allowsFree(), isElite, category, newConfidence, newTier);
    }
}
