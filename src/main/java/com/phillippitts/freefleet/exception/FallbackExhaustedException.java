package com.phillippitts.freefleet.exception;

import java.util.List;

/**
 * Thrown when the primary race and every fallback wave failed.
 */
public class FallbackExhaustedException extends FreeFleetException {

    private final List<RaceExhaustedException> waveFailures;

    public FallbackExhaustedException(String raceId, List<RaceExhaustedException> waveFailures) {
        super("Race '" + raceId + "': all " + waveFailures.size() + " attempts exhausted",
                waveFailures.isEmpty() ? null : waveFailures.get(waveFailures.size() - 1));
        this.waveFailures = List.copyOf(waveFailures);
    }

    public List<RaceExhaustedException> getWaveFailures() {
        return waveFailures;
    }

    public int getAttempts() {
        return waveFailures.size();
    }
}
