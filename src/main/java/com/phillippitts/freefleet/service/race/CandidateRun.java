package com.phillippitts.freefleet.service.race;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one candidate inside one wave.
 *
 * <p>{@code settled} flips exactly once, on whichever of completion, failure, timeout or
 * cancellation happens first. The runner thread is only interrupted while it is attached.
 */
final class CandidateRun {

    private final String candidateId;
    private final CancellationSignal signal = new CancellationSignal();
    private final AtomicBoolean settled = new AtomicBoolean();
    private final CountDownLatch stopped = new CountDownLatch(1);

    private Thread runner;
    private boolean started;
    private volatile ScheduledFuture<?> timeout;

    CandidateRun(String candidateId) {
        this.candidateId = candidateId;
    }

    String candidateId() {
        return candidateId;
    }

    CancellationSignal signal() {
        return signal;
    }

    boolean settle() {
        return settled.compareAndSet(false, true);
    }

    boolean isSettled() {
        return settled.get();
    }

    void timeout(ScheduledFuture<?> future) {
        this.timeout = future;
    }

    void cancelTimeout() {
        ScheduledFuture<?> t = timeout;
        if (t != null) {
            t.cancel(false);
        }
    }

    /**
     * Binds the current thread as runner.
     *
     * @return false if the candidate was cancelled before it got a thread
     */
    synchronized boolean attach(Thread thread) {
        if (signal.isCancelled() || settled.get()) {
            return false;
        }
        runner = thread;
        started = true;
        return true;
    }

    void detach() {
        synchronized (this) {
            runner = null;
        }
        // An interrupt aimed at this candidate must not leak into the next pooled task
        Thread.interrupted();
        stopped.countDown();
    }

    /**
     * Sets the signal and interrupts the runner if one is attached.
     *
     * @return false if the candidate was already cancelled
     */
    boolean cancel(String reason) {
        if (!signal.cancel(reason)) {
            return false;
        }
        cancelTimeout();
        synchronized (this) {
            if (runner != null) {
                runner.interrupt();
            }
        }
        return true;
    }

    /**
     * Waits for the runner to return. A candidate that never started counts as stopped.
     */
    boolean awaitStopped(long timeoutMs) throws InterruptedException {
        synchronized (this) {
            if (!started) {
                return true;
            }
        }
        return stopped.await(Math.max(0, timeoutMs), TimeUnit.MILLISECONDS);
    }
}
