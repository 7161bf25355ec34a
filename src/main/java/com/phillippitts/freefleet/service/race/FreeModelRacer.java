package com.phillippitts.freefleet.service.race;

import com.phillippitts.freefleet.config.properties.DelegationProperties;
import com.phillippitts.freefleet.config.properties.RacerProperties;
import com.phillippitts.freefleet.domain.DelegationConfig;
import com.phillippitts.freefleet.exception.FallbackExhaustedException;
import com.phillippitts.freefleet.exception.RaceExhaustedException;
import com.phillippitts.freefleet.service.persistence.AuditLog;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Races candidate models concurrently; the first successful candidate wins.
 *
 * <p><b>Thread model:</b> every candidate runs on {@code raceExecutor} and gets its own
 * {@link CancellationSignal}. Per-candidate timeouts are scheduled on
 * {@code raceTimeoutScheduler} and cancel only that candidate. The calling thread blocks
 * until a winner is known or every candidate has failed. Once a winner is known the losers
 * are cancelled (signal plus interrupt) and awaited for at most the configured grace period.
 *
 * <p><b>Fallback:</b> {@link #raceWithFallback} races the primary list first and then
 * successive slices of the fallback list, one wave at a time, up to {@code fallbackDepth}
 * retry waves ({@value DelegationConfig#UNLIMITED_DEPTH} for no limit).
 *
 * <p>Races are registered by id while running so they can be cancelled from another thread.
 */
@Service
public class FreeModelRacer {

    private static final Logger LOG = LogManager.getLogger(FreeModelRacer.class);
    private static final String COMPONENT = "racer";

    private final Executor executor;
    private final ScheduledExecutorService scheduler;
    private final AuditLog auditLog;
    private final long cancellationGraceMs;
    private final Map<String, RaceHandle> activeRaces = new ConcurrentHashMap<>();
    private final AtomicLong raceSequence = new AtomicLong();

    private volatile long timeoutMs;
    private volatile int fallbackDepth;

    @Autowired
    public FreeModelRacer(RacerProperties racerProperties,
                          DelegationProperties delegationProperties,
                          @Qualifier("raceExecutor") Executor executor,
                          @Qualifier("raceTimeoutScheduler") ScheduledExecutorService scheduler,
                          AuditLog auditLog) {
        this(executor, scheduler, auditLog,
                racerProperties.getTimeoutMs(),
                racerProperties.getCancellationGraceMs(),
                delegationProperties.getFallbackDepth());
    }

    public FreeModelRacer(Executor executor,
                          ScheduledExecutorService scheduler,
                          AuditLog auditLog,
                          long timeoutMs,
                          long cancellationGraceMs,
                          int fallbackDepth) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
        setTimeoutMs(timeoutMs);
        this.cancellationGraceMs = Math.max(0, cancellationGraceMs);
        this.fallbackDepth = validDepth(fallbackDepth);
    }

    public <T> RaceResult<T> race(List<String> candidates, RaceTask<T> task) {
        return race(candidates, task, null, RaceProgressListener.NOOP);
    }

    /**
     * Runs every candidate concurrently and returns the first success.
     *
     * @param raceId   registry id; generated when {@code null}
     * @param listener progress observer, may be {@code null}
     * @throws IllegalArgumentException if {@code candidates} is empty or repeats an id
     * @throws IllegalStateException    if a race with the same id is already active
     * @throws RaceExhaustedException   if every candidate failed, timed out or was cancelled
     */
    public <T> RaceResult<T> race(List<String> candidates,
                                  RaceTask<T> task,
                                  String raceId,
                                  RaceProgressListener listener) {
        requireCandidates(candidates);
        Objects.requireNonNull(task, "task");
        RaceHandle handle = register(raceId != null ? raceId : nextRaceId("race"));
        String previousRaceId = ThreadContext.get(RaceWave.MDC_RACE_ID);
        ThreadContext.put(RaceWave.MDC_RACE_ID, handle.raceId());
        try {
            return runWave(handle, candidates, task, listener, System.nanoTime());
        } finally {
            restoreRaceId(previousRaceId);
            activeRaces.remove(handle.raceId(), handle);
        }
    }

    public <T> RaceResult<T> raceWithFallback(List<String> primary, List<String> fallback, RaceTask<T> task) {
        return raceWithFallback(primary, fallback, task, null, RaceProgressListener.NOOP, FallbackListener.NOOP);
    }

    /**
     * Races {@code primary}; on total failure races successive slices of {@code fallback}
     * (slice size = primary size) until a candidate wins, the fallback list runs out or
     * {@code fallbackDepth} retry waves have been spent. Every wave, the primary included,
     * is announced to {@code fallbackListener}; retry waves are also audited.
     *
     * @throws IllegalArgumentException   if {@code primary} is empty or an id appears twice
     *                                    across primary and fallback
     * @throws FallbackExhaustedException if every wave failed or the race was cancelled
     */
    public <T> RaceResult<T> raceWithFallback(List<String> primary,
                                              List<String> fallback,
                                              RaceTask<T> task,
                                              String raceId,
                                              RaceProgressListener listener,
                                              FallbackListener fallbackListener) {
        requireCandidates(primary);
        Objects.requireNonNull(task, "task");
        List<String> reserve = fallback != null ? List.copyOf(fallback) : List.of();
        List<String> everyCandidate = new ArrayList<>(primary);
        everyCandidate.addAll(reserve);
        requireDistinct(everyCandidate);
        FallbackListener onFallback = fallbackListener != null ? fallbackListener : FallbackListener.NOOP;
        int depth = fallbackDepth;
        int sliceSize = Math.max(1, primary.size());

        RaceHandle handle = register(raceId != null ? raceId : nextRaceId("fallback"));
        String id = handle.raceId();
        String previousRaceId = ThreadContext.get(RaceWave.MDC_RACE_ID);
        ThreadContext.put(RaceWave.MDC_RACE_ID, id);
        long startNanos = System.nanoTime();
        List<RaceExhaustedException> waveFailures = new ArrayList<>();
        try {
            List<String> wave = List.copyOf(primary);
            int attempt = 1;
            int offset = 0;
            while (true) {
                announce(onFallback, attempt, wave);
                if (attempt > 1) {
                    LOG.warn("Race '{}': fallback attempt {} with {} models", id, attempt, wave.size());
                    auditLog.fallbackActivated(COMPONENT, id, attempt, wave);
                }
                try {
                    return runWave(handle, wave, task, listener, startNanos);
                } catch (RaceExhaustedException e) {
                    waveFailures.add(e);
                    if (e.isCancelled() || handle.isCancelled()) {
                        break;
                    }
                    boolean depthSpent = depth != DelegationConfig.UNLIMITED_DEPTH && attempt - 1 >= depth;
                    if (depthSpent || offset >= reserve.size()) {
                        break;
                    }
                    int end = Math.min(offset + sliceSize, reserve.size());
                    wave = reserve.subList(offset, end);
                    offset = end;
                    attempt++;
                }
            }
        } finally {
            restoreRaceId(previousRaceId);
            activeRaces.remove(id, handle);
        }
        LOG.warn("Race '{}': all {} attempts exhausted", id, waveFailures.size());
        throw new FallbackExhaustedException(id, waveFailures);
    }

    /**
     * Races a category's configured model together with its fallbacks in a single wave.
     * A model listed more than once is raced once.
     */
    public <T> RaceResult<T> raceFromCategory(String model, List<String> fallback, RaceTask<T> task) {
        Set<String> all = new LinkedHashSet<>();
        if (model != null && !model.isBlank()) {
            all.add(model);
        }
        if (fallback != null) {
            all.addAll(fallback);
        }
        return race(List.copyOf(all), task);
    }

    /**
     * Cancels every outstanding candidate of the race. The race resolves as a total failure
     * and starts no further waves.
     *
     * @return false if no race with that id is active
     */
    public boolean cancelRace(String raceId) {
        if (raceId == null) {
            return false;
        }
        RaceHandle handle = activeRaces.remove(raceId);
        if (handle == null) {
            return false;
        }
        handle.cancel("Race '" + raceId + "' cancelled");
        LOG.info("Cancelled race '{}'", raceId);
        return true;
    }

    /**
     * @return number of races cancelled
     */
    @PreDestroy
    public int cancelAllRaces() {
        int count = 0;
        for (String raceId : List.copyOf(activeRaces.keySet())) {
            if (cancelRace(raceId)) {
                count++;
            }
        }
        return count;
    }

    public int activeRaceCount() {
        return activeRaces.size();
    }

    public boolean isRaceActive(String raceId) {
        return raceId != null && activeRaces.containsKey(raceId);
    }

    /** Applies the delegation settings the racer cares about (fallback depth). */
    public void updateConfig(DelegationConfig config) {
        this.fallbackDepth = validDepth(config.fallbackDepth());
    }

    public void setTimeoutMs(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public int getFallbackDepth() {
        return fallbackDepth;
    }

    private <T> RaceResult<T> runWave(RaceHandle handle,
                                      List<String> candidates,
                                      RaceTask<T> task,
                                      RaceProgressListener listener,
                                      long startNanos) {
        RaceWave<T> wave = new RaceWave<>(handle.raceId(), candidates, listener, startNanos);
        if (!handle.attach(wave)) {
            Map<String, String> cancelled = new LinkedHashMap<>();
            wave.candidateIds().forEach(c -> cancelled.put(c, "Race cancelled before start"));
            throw new RaceExhaustedException(handle.raceId(), cancelled, true);
        }
        try {
            LOG.info("Race '{}': {} candidates {}", handle.raceId(), candidates.size(), candidates);
            wave.start(task, executor, scheduler, timeoutMs);
            RaceResult<T> winner = wave.await();
            LOG.info("Race '{}': winner is {} ({} ms)", handle.raceId(), winner.candidateId(), winner.elapsedMs());
            wave.stopLosers(winner.candidateId(), cancellationGraceMs);
            return winner;
        } finally {
            handle.detach(wave);
        }
    }

    private RaceHandle register(String raceId) {
        RaceHandle handle = new RaceHandle(raceId);
        if (activeRaces.putIfAbsent(raceId, handle) != null) {
            throw new IllegalStateException("Race '" + raceId + "' is already active");
        }
        return handle;
    }

    private String nextRaceId(String prefix) {
        return prefix + "-" + System.currentTimeMillis() + "-" + raceSequence.incrementAndGet();
    }

    private static void announce(FallbackListener listener, int attempt, List<String> wave) {
        try {
            listener.onFallback(attempt, wave);
        } catch (RuntimeException e) {
            LOG.warn("Fallback listener threw on attempt {}: {}", attempt, e.getMessage());
        }
    }

    private static void restoreRaceId(String previous) {
        if (previous != null) {
            ThreadContext.put(RaceWave.MDC_RACE_ID, previous);
        } else {
            ThreadContext.remove(RaceWave.MDC_RACE_ID);
        }
    }

    private static void requireCandidates(List<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("No models provided for race");
        }
        requireDistinct(candidates);
    }

    private static void requireDistinct(List<String> candidates) {
        Set<String> seen = new HashSet<>();
        for (String candidate : candidates) {
            if (!seen.add(candidate)) {
                throw new IllegalArgumentException("Duplicate candidate '" + candidate + "' in race");
            }
        }
    }

    private static int validDepth(int depth) {
        if (depth < DelegationConfig.UNLIMITED_DEPTH) {
            throw new IllegalArgumentException("fallbackDepth must be >= -1");
        }
        return depth;
    }
}
