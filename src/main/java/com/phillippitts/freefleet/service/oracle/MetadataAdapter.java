package com.phillippitts.freefleet.service.oracle;

import com.phillippitts.freefleet.domain.ModelMetadata;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * External metadata source consulted by the oracle.
 */
public interface MetadataAdapter {

    String providerId();

    String providerName();

    /**
     * Metadata for one model.
     *
     * @return empty when the source does not know the model
     * @throws com.phillippitts.freefleet.exception.ProviderFetchException when the source is unreachable
     */
    Optional<ModelMetadata> fetchModelMetadata(String modelId);

    /**
     * Metadata for several models; {@code null} returns everything the source knows.
     */
    List<ModelMetadata> fetchModelsMetadata(Collection<String> modelIds);

    boolean isAvailable();
}
