package com.phillippitts.freefleet.service.delegation;

import com.phillippitts.freefleet.domain.DelegationConfig;
import com.phillippitts.freefleet.domain.ModelCategory;
import com.phillippitts.freefleet.domain.TaskType;
import com.phillippitts.freefleet.exception.FreeFleetException;
import com.phillippitts.freefleet.service.metrics.FleetMetrics;
import com.phillippitts.freefleet.service.metrics.SessionMetrics;
import com.phillippitts.freefleet.service.metrics.UsageMetricsStore;
import com.phillippitts.freefleet.service.race.FallbackListener;
import com.phillippitts.freefleet.service.race.FreeModelRacer;
import com.phillippitts.freefleet.service.race.RaceProgressListener;
import com.phillippitts.freefleet.service.race.RaceResult;
import com.phillippitts.freefleet.service.race.RaceTask;
import com.phillippitts.freefleet.service.selection.ModelSelection;
import com.phillippitts.freefleet.service.selection.ModelSelector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for delegating a prompt to the free fleet.
 *
 * <p>Pipeline: classify the prompt, map the task type to a category, select primary and
 * fallback candidates, race them with the caller's task and record usage for the winner.
 * A failed delegation is counted and rethrown unchanged.
 */
@Service
public class Delegator {

    private static final Logger LOG = LogManager.getLogger(Delegator.class);

    static final double TOKENS_PER_WORD = 1.3;
    static final String FAILURE_REASON = "delegation-failed";

    private final TaskTypeDetector detector;
    private final ModelSelector selector;
    private final FreeModelRacer racer;
    private final FleetMetrics fleetMetrics;
    private final UsageMetricsStore usageMetrics;
    private final AtomicLong delegationSequence = new AtomicLong();

    private volatile DelegationConfig config;

    public Delegator(TaskTypeDetector detector,
                     ModelSelector selector,
                     FreeModelRacer racer,
                     FleetMetrics fleetMetrics,
                     UsageMetricsStore usageMetrics) {
        this.detector = Objects.requireNonNull(detector, "detector");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.racer = Objects.requireNonNull(racer, "racer");
        this.fleetMetrics = Objects.requireNonNull(fleetMetrics, "fleetMetrics");
        this.usageMetrics = Objects.requireNonNull(usageMetrics, "usageMetrics");
        this.config = selector.getConfig();
    }

    public <T> DelegationResult<T> delegate(String prompt, RaceTask<T> task) {
        return delegate(prompt, task, DelegationOptions.NONE);
    }

    /**
     * @param task executed once per raced candidate with the candidate's model id
     * @throws com.phillippitts.freefleet.exception.FallbackExhaustedException if every wave failed
     * @throws FreeFleetException if no free model is available for the category
     */
    public <T> DelegationResult<T> delegate(String prompt, RaceTask<T> task, DelegationOptions options) {
        Objects.requireNonNull(task, "task");
        DelegationOptions opts = options != null ? options : DelegationOptions.NONE;
        long t0 = System.nanoTime();

        TaskType taskType = opts.forceTaskType() != null ? opts.forceTaskType() : detector.detect(prompt);
        ModelCategory category = opts.forceCategory() != null
                ? opts.forceCategory()
                : detector.taskTypeToCategory(taskType);
        LOG.info("Task type '{}' -> category '{}'", taskType, category.key());

        try {
            ModelSelection selection = selector.selectWithFallback(category);
            if (selection.primary().isEmpty()) {
                throw new FreeFleetException("No free models available for category '" + category.key() + "'");
            }
            LOG.info("Racing {} models ({} fallback)", selection.primary().size(), selection.fallback().size());

            RaceResult<T> winner = racer.raceWithFallback(
                    selection.primary(),
                    selection.fallback(),
                    task,
                    nextRaceId(),
                    candidateFailureRecorder(),
                    fallbackLogger());

            long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
            recordSuccess(winner, category, latencyMs, estimateTokens(prompt));
            return new DelegationResult<>(taskType, category, winner.candidateId(), winner.result(),
                    latencyMs, selection.primary().size());
        } catch (RuntimeException e) {
            fleetMetrics.incrementDelegationFailure(category.key(), FAILURE_REASON);
            LOG.warn("Delegation failed for category '{}': {}", category.key(), e.getMessage());
            throw e;
        }
    }

    public DelegationConfig config() {
        return config;
    }

    /** Replaces the delegation settings and pushes them to the selector and racer. */
    public void updateConfig(DelegationConfig newConfig) {
        this.config = Objects.requireNonNull(newConfig, "newConfig");
        selector.updateConfig(newConfig);
        racer.updateConfig(newConfig);
        LOG.info("Delegation config updated: {}", newConfig);
    }

    public SessionMetrics sessionMetrics() {
        return usageMetrics.sessionMetrics();
    }

    public TaskTypeDetector detector() {
        return detector;
    }

    /** Rough token count: {@code ceil(words * 1.3)}. */
    static long estimateTokens(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            return 0;
        }
        int words = prompt.trim().split("\\s+").length;
        return (long) Math.ceil(words * TOKENS_PER_WORD);
    }

    private void recordSuccess(RaceResult<?> winner, ModelCategory category, long latencyMs, long tokens) {
        String modelId = winner.candidateId();
        fleetMetrics.recordRaceLatency(providerOf(modelId), winner.elapsedMs());
        fleetMetrics.incrementDelegations();
        fleetMetrics.incrementDelegationSuccess(category.key());
        usageMetrics.recordSuccess(modelId, latencyMs, tokens);
        usageMetrics.incrementDelegationCount();
    }

    // Cancelled losers are not failures of the model
    private RaceProgressListener candidateFailureRecorder() {
        return (candidateId, status, error) -> {
            if (status == RaceProgressListener.Status.FAILED && !(error instanceof CancellationException)) {
                usageMetrics.recordFailure(candidateId);
            }
        };
    }

    private static FallbackListener fallbackLogger() {
        return (attempt, models) -> {
            if (attempt > 1) {
                LOG.warn("Fallback attempt {} with {} models", attempt, models.size());
            }
        };
    }

    // unique per delegation, several can start in the same millisecond
    private String nextRaceId() {
        return "delegate-" + System.currentTimeMillis() + "-" + delegationSequence.incrementAndGet();
    }

    private static String providerOf(String modelId) {
        int slash = modelId.indexOf('/');
        return slash > 0 ? modelId.substring(0, slash) : modelId;
    }
}
