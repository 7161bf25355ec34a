package com.phillippitts.freefleet.service.race;

import java.util.Objects;

/**
 * Winner of a race.
 *
 * @param candidateId winning model id
 * @param result      the winner's result
 * @param elapsedMs   milliseconds from race start until the winner completed
 */
public record RaceResult<T>(String candidateId, T result, long elapsedMs) {

    public RaceResult {
        Objects.requireNonNull(candidateId, "candidateId");
        if (elapsedMs < 0) {
            throw new IllegalArgumentException("elapsedMs must be >= 0");
        }
    }
}
