package com.phillippitts.freefleet.service.race;

import java.util.List;

/**
 * Notified before each wave of {@link FreeModelRacer#raceWithFallback}. Attempt 1 is the
 * primary wave.
 */
@FunctionalInterface
public interface FallbackListener {

    FallbackListener NOOP = (attempt, candidateIds) -> { };

    void onFallback(int attempt, List<String> candidateIds);
}
