package com.phillippitts.freefleet.service.race;

/**
 * Registry entry for an active race. One handle spans every wave of a fallback race so
 * that cancelling it also prevents further waves.
 */
final class RaceHandle {

    private final String raceId;
    private RaceWave<?> current;
    private boolean cancelled;

    RaceHandle(String raceId) {
        this.raceId = raceId;
    }

    String raceId() {
        return raceId;
    }

    synchronized boolean isCancelled() {
        return cancelled;
    }

    /**
     * @return false if the race was cancelled and the wave must not start
     */
    synchronized boolean attach(RaceWave<?> wave) {
        if (cancelled) {
            return false;
        }
        current = wave;
        return true;
    }

    synchronized void detach(RaceWave<?> wave) {
        if (current == wave) {
            current = null;
        }
    }

    void cancel(String reason) {
        RaceWave<?> wave;
        synchronized (this) {
            cancelled = true;
            wave = current;
        }
        if (wave != null) {
            wave.cancelAll(reason);
        }
    }
}
