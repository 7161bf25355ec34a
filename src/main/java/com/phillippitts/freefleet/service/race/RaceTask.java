package com.phillippitts.freefleet.service.race;

/**
 * Work executed against one candidate model.
 *
 * <p>Implementations should poll {@link CancellationSignal#isCancelled()} or react to thread
 * interruption so that losing candidates stop promptly.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface RaceTask<T> {

    /**
     * @param candidateId fully-qualified model id ({@code provider/model})
     * @param signal      set when this candidate times out, loses or its race is cancelled
     * @return the candidate's result; any thrown exception counts as a failure
     */
    T run(String candidateId, CancellationSignal signal) throws Exception;
}
