package com.phillippitts.freefleet.service.race;

/**
 * Observes candidate lifecycle events. Exceptions thrown by a listener are logged and ignored.
 */
@FunctionalInterface
public interface RaceProgressListener {

    RaceProgressListener NOOP = (candidateId, status, error) -> { };

    enum Status { STARTED, COMPLETED, FAILED }

    /**
     * @param error the failure cause for {@link Status#FAILED}, otherwise {@code null}
     */
    void onProgress(String candidateId, Status status, Throwable error);
}
