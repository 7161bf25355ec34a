package com.phillippitts.freefleet.service.provider;

import com.phillippitts.freefleet.domain.Pricing;

/**
 * Hand-maintained catalog entry for providers whose listing needs an interactive login.
 */
public record CuratedModel(
        String id,
        String name,
        String description,
        Integer contextLength,
        Pricing pricing
) implements ProviderModel {

    static CuratedModel free(String id, String name, String description, int contextLength) {
        return new CuratedModel(id, name, description, contextLength, Pricing.FREE);
    }
}
