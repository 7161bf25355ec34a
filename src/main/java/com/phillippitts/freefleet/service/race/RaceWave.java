package com.phillippitts.freefleet.service.race;

import com.phillippitts.freefleet.exception.FreeFleetException;
import com.phillippitts.freefleet.exception.RaceExhaustedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One concurrent round of candidates. The first success completes the wave; when every
 * candidate has failed the wave completes with {@link RaceExhaustedException}.
 */
final class RaceWave<T> {

    private static final Logger LOG = LogManager.getLogger(RaceWave.class);

    static final String MDC_RACE_ID = "raceId";
    static final String MDC_CANDIDATE = "candidate";

    private final String raceId;
    private final Map<String, CandidateRun> runs = new LinkedHashMap<>();
    private final Map<String, String> failures = new ConcurrentHashMap<>();
    private final AtomicInteger remaining;
    private final AtomicBoolean won = new AtomicBoolean();
    private final CompletableFuture<RaceResult<T>> outcome = new CompletableFuture<>();
    private final RaceProgressListener listener;
    private final long raceStartNanos;
    private volatile boolean cancelled;

    RaceWave(String raceId, List<String> candidates, RaceProgressListener listener, long raceStartNanos) {
        this.raceId = raceId;
        for (String candidate : candidates) {
            runs.put(candidate, new CandidateRun(candidate));
        }
        this.remaining = new AtomicInteger(runs.size());
        this.listener = listener != null ? listener : RaceProgressListener.NOOP;
        this.raceStartNanos = raceStartNanos;
    }

    List<String> candidateIds() {
        return List.copyOf(runs.keySet());
    }

    void start(RaceTask<T> task, Executor executor, ScheduledExecutorService scheduler, long timeoutMs) {
        for (CandidateRun run : runs.values()) {
            if (run.isSettled() || won.get()) {
                continue;
            }
            try {
                executor.execute(() -> execute(run, task, scheduler, timeoutMs));
            } catch (RejectedExecutionException e) {
                fail(run, "Rejected by executor: " + e.getMessage(), e);
            }
        }
    }

    RaceResult<T> await() {
        try {
            return outcome.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll("Caller interrupted");
            if (outcome.isDone() && !outcome.isCompletedExceptionally()) {
                return outcome.getNow(null);
            }
            throw new RaceExhaustedException(raceId, orderedFailures(), true);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RaceExhaustedException exhausted) {
                throw exhausted;
            }
            throw new FreeFleetException("Race '" + raceId + "' failed", e.getCause());
        }
    }

    /**
     * Cancels every candidate except the winner and waits up to {@code graceMs} in total for
     * their runners to return.
     */
    void stopLosers(String winnerId, long graceMs) {
        String reason = "Lost race to " + winnerId;
        runs.values().stream()
                .filter(run -> !run.candidateId().equals(winnerId))
                .forEach(run -> {
                    fail(run, reason, new CancellationException(reason));
                    run.cancel(reason);
                });

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(graceMs);
        for (CandidateRun run : runs.values()) {
            if (run.candidateId().equals(winnerId)) {
                continue;
            }
            long left = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            try {
                if (!run.awaitStopped(left)) {
                    LOG.warn("Race '{}': {} did not stop within {} ms of cancellation",
                            raceId, run.candidateId(), graceMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    void cancelAll(String reason) {
        cancelled = true;
        for (CandidateRun run : runs.values()) {
            fail(run, reason, new CancellationException(reason));
            run.cancel(reason);
        }
    }

    private void execute(CandidateRun run, RaceTask<T> task, ScheduledExecutorService scheduler, long timeoutMs) {
        if (!run.attach(Thread.currentThread())) {
            return;
        }
        String id = run.candidateId();
        ThreadContext.put(MDC_RACE_ID, raceId);
        ThreadContext.put(MDC_CANDIDATE, id);
        try {
            // the timeout counts from the moment the candidate actually runs
            run.timeout(scheduler.schedule(() -> timeOut(run, timeoutMs), timeoutMs, TimeUnit.MILLISECONDS));
            if (run.isSettled()) {
                run.cancelTimeout();
                return;
            }
            notify(id, RaceProgressListener.Status.STARTED, null);
            T result = task.run(id, run.signal());
            succeed(run, result);
        } catch (InterruptedException e) {
            String why = run.signal().reason();
            fail(run, why != null ? why : "Interrupted", e);
        } catch (Exception e) {
            fail(run, describe(e), e);
        } finally {
            run.detach();
            ThreadContext.remove(MDC_CANDIDATE);
        }
    }

    private void succeed(CandidateRun run, T result) {
        if (!run.settle()) {
            LOG.debug("Race '{}': {} returned after it was settled ({})",
                    raceId, run.candidateId(), run.signal().reason());
            return;
        }
        run.cancelTimeout();
        if (!won.compareAndSet(false, true)) {
            return;
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - raceStartNanos);
        notify(run.candidateId(), RaceProgressListener.Status.COMPLETED, null);
        outcome.complete(new RaceResult<>(run.candidateId(), result, elapsedMs));
    }

    private void fail(CandidateRun run, String reason, Throwable cause) {
        if (!run.settle()) {
            return;
        }
        run.cancelTimeout();
        failures.put(run.candidateId(), reason);
        if (!won.get()) {
            LOG.info("Race '{}': {} failed - {}", raceId, run.candidateId(), reason);
        }
        notify(run.candidateId(), RaceProgressListener.Status.FAILED, cause);
        if (remaining.decrementAndGet() == 0) {
            outcome.completeExceptionally(new RaceExhaustedException(raceId, orderedFailures(), cancelled));
        }
    }

    private void timeOut(CandidateRun run, long timeoutMs) {
        String reason = "Timed out after " + timeoutMs + " ms";
        fail(run, reason, new TimeoutException(reason));
        run.cancel(reason);
    }

    private Map<String, String> orderedFailures() {
        Map<String, String> ordered = new LinkedHashMap<>();
        for (String id : runs.keySet()) {
            String reason = failures.get(id);
            if (reason != null) {
                ordered.put(id, reason);
            }
        }
        return ordered;
    }

    private void notify(String candidateId, RaceProgressListener.Status status, Throwable error) {
        try {
            listener.onProgress(candidateId, status, error);
        } catch (RuntimeException e) {
            LOG.warn("Progress listener threw for {} ({}): {}", candidateId, status, e.getMessage());
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
