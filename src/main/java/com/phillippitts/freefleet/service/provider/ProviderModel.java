package com.phillippitts.freefleet.service.provider;

import com.phillippitts.freefleet.domain.Pricing;

/**
 * Raw catalog entry as one provider reports it, before normalization.
 *
 * <p>Each provider family has its own record type; this interface exposes the fields
 * normalization needs. Optional fields are {@code null} when the provider omits them.
 */
public interface ProviderModel {

    String id();

    String name();

    String description();

    Integer contextLength();

    Pricing pricing();

    default Integer maxOutputTokens() {
        return null;
    }
}
