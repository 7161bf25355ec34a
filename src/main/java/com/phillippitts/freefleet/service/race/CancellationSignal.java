package com.phillippitts.freefleet.service.race;

import java.util.concurrent.CancellationException;

/**
 * Cancellation flag owned by a single candidate execution.
 */
public final class CancellationSignal {

    private volatile String reason;

    public boolean isCancelled() {
        return reason != null;
    }

    /** Why the candidate was cancelled, or {@code null} while it is still live. */
    public String reason() {
        return reason;
    }

    /**
     * @throws CancellationException if the candidate has been cancelled
     */
    public void throwIfCancelled() {
        String r = reason;
        if (r != null) {
            throw new CancellationException(r);
        }
    }

    boolean cancel(String why) {
        synchronized (this) {
            if (reason != null) {
                return false;
            }
            reason = why;
            return true;
        }
    }
}
