package com.phillippitts.freefleet.service.provider;

import com.phillippitts.freefleet.domain.FreeModel;
import com.phillippitts.freefleet.exception.ProviderFetchException;

import java.util.List;

/**
 * Fetches and normalizes one provider's model catalog.
 *
 * <p>Implementations are stateless apart from their HTTP client and safe to call from
 * several threads. Calls are guarded by the provider's circuit breaker at the call site.
 *
 * @param <M> the provider's raw catalog entry type
 */
public interface ProviderAdapter<M extends ProviderModel> {

    String providerId();

    String providerName();

    /**
     * Fetches the raw catalog.
     *
     * @throws ProviderFetchException on transport errors and non-2xx responses
     */
    List<M> fetchModels();

    /** Provider-specific free rule. */
    boolean isFreeModel(M model);

    FreeModel normalizeModel(M model);

    /** Fetches and normalizes in one step. */
    default List<FreeModel> fetchNormalized() {
        return fetchModels().stream().map(this::normalizeModel).toList();
    }
}
