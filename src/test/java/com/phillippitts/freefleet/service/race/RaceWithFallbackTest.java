package com.phillippitts.freefleet.service.race;

import com.phillippitts.freefleet.domain.DelegationConfig;
import com.phillippitts.freefleet.exception.FallbackExhaustedException;
import com.phillippitts.freefleet.service.persistence.AuditEvent;
import com.phillippitts.freefleet.service.persistence.AuditLog;
import com.phillippitts.freefleet.service.persistence.JsonFileStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class RaceWithFallbackTest {

    private static final RaceTask<String> ALWAYS_FAILS = (id, signal) -> {
        throw new IllegalStateException("unavailable");
    };

    @TempDir
    Path tempDir;

    private ExecutorService executor;
    private ScheduledExecutorService scheduler;
    private AuditLog auditLog;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        auditLog = new AuditLog(new JsonFileStore(tempDir));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        scheduler.shutdownNow();
    }

    private FreeModelRacer racerWithDepth(int depth) {
        return new FreeModelRacer(executor, scheduler, auditLog, 2_000, 500, depth);
    }

    @Test
    void shouldReturnPrimaryWinnerWithoutFallback() {
        List<Integer> attempts = new CopyOnWriteArrayList<>();

        RaceResult<String> result = racerWithDepth(3).raceWithFallback(
                List.of("a/one", "b/two"), List.of("c/three"), (id, signal) -> id,
                null, null, (attempt, ids) -> attempts.add(attempt));

        assertThat(result.candidateId()).isIn("a/one", "b/two");
        assertThat(attempts).containsExactly(1);
        assertThat(auditLog.recent(AuditEvent.Type.FALLBACK_ACTIVATED, 10)).isEmpty();
    }

    @Test
    void shouldRaceNextSliceWhenPrimaryFails() {
        List<List<String>> waves = new CopyOnWriteArrayList<>();

        RaceResult<String> result = racerWithDepth(3).raceWithFallback(
                List.of("a/one", "b/two"), List.of("c/three", "d/four", "e/five"),
                (id, signal) -> {
                    if (!id.equals("d/four")) {
                        throw new IllegalStateException("down");
                    }
                    return "ok";
                },
                "wave-race", null, (attempt, ids) -> waves.add(ids));

        assertThat(result.candidateId()).isEqualTo("d/four");
        assertThat(waves).containsExactly(List.of("a/one", "b/two"), List.of("c/three", "d/four"));

        List<AuditEvent> audited = auditLog.recent(AuditEvent.Type.FALLBACK_ACTIVATED, 10);
        assertThat(audited).hasSize(1);
        assertThat(audited.get(0).component()).isEqualTo("racer");
        assertThat(audited.get(0).details()).containsEntry("raceId", "wave-race");
    }

    @Test
    void shouldExhaustEveryFallbackSliceWhenDepthIsUnlimited() {
        List<List<String>> waves = new CopyOnWriteArrayList<>();

        assertThatThrownBy(() -> racerWithDepth(DelegationConfig.UNLIMITED_DEPTH).raceWithFallback(
                List.of("a/1", "a/2"), List.of("b/1", "b/2", "b/3"), ALWAYS_FAILS,
                null, null, (attempt, ids) -> waves.add(ids)))
                .isInstanceOf(FallbackExhaustedException.class)
                .hasMessageContaining("attempts exhausted")
                .satisfies(e -> assertThat(((FallbackExhaustedException) e).getAttempts()).isEqualTo(3));

        assertThat(waves).containsExactly(List.of("a/1", "a/2"), List.of("b/1", "b/2"), List.of("b/3"));
    }

    @Test
    void shouldStopAfterConfiguredFallbackDepth() {
        List<Integer> attempts = new CopyOnWriteArrayList<>();

        assertThatThrownBy(() -> racerWithDepth(1).raceWithFallback(
                List.of("a/1"), List.of("b/1", "b/2", "b/3"), ALWAYS_FAILS,
                null, null, (attempt, ids) -> attempts.add(attempt)))
                .isInstanceOf(FallbackExhaustedException.class);

        assertThat(attempts).containsExactly(1, 2);
    }

    @Test
    void shouldRaceOnlyPrimaryWhenDepthIsZero() {
        List<String> invoked = new CopyOnWriteArrayList<>();

        assertThatThrownBy(() -> racerWithDepth(0).raceWithFallback(
                List.of("a/1"), List.of("b/1"), (id, signal) -> {
                    invoked.add(id);
                    throw new IllegalStateException("down");
                }))
                .isInstanceOf(FallbackExhaustedException.class)
                .satisfies(e -> assertThat(((FallbackExhaustedException) e).getAttempts()).isEqualTo(1));

        assertThat(invoked).containsExactly("a/1");
    }

    @Test
    void shouldFollowDepthUpdatedThroughConfig() {
        FreeModelRacer racer = racerWithDepth(0);
        racer.updateConfig(DelegationConfig.defaults().withFallbackDepth(2));
        List<Integer> attempts = new ArrayList<>();

        assertThatThrownBy(() -> racer.raceWithFallback(
                List.of("a/1"), List.of("b/1", "b/2", "b/3"), ALWAYS_FAILS,
                null, null, (attempt, ids) -> attempts.add(attempt)))
                .isInstanceOf(FallbackExhaustedException.class);

        assertThat(racer.getFallbackDepth()).isEqualTo(2);
        assertThat(attempts).containsExactly(1, 2, 3);
    }

    @Test
    void shouldNotStartFurtherWavesOnceCancelled() {
        FreeModelRacer racer = racerWithDepth(DelegationConfig.UNLIMITED_DEPTH);
        CountDownLatch started = new CountDownLatch(1);
        List<String> invoked = new CopyOnWriteArrayList<>();

        CompletableFuture<RaceResult<String>> race = CompletableFuture.supplyAsync(() ->
                racer.raceWithFallback(List.of("a/1"), List.of("b/1", "b/2"), (id, signal) -> {
                    invoked.add(id);
                    started.countDown();
                    Thread.sleep(10_000);
                    return "never";
                }, "cancel-waves", null, null), executor);

        await().atMost(Duration.ofSeconds(2)).until(() -> started.getCount() == 0);
        assertThat(racer.cancelRace("cancel-waves")).isTrue();

        assertThatThrownBy(race::get)
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(FallbackExhaustedException.class);
        assertThat(invoked).containsExactly("a/1");
        assertThat(racer.isRaceActive("cancel-waves")).isFalse();
    }

    @Test
    void shouldRejectEmptyPrimary() {
        assertThatThrownBy(() -> racerWithDepth(3).raceWithFallback(List.of(), List.of("b/1"), ALWAYS_FAILS))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectCandidateRepeatedInFallback() {
        assertThatThrownBy(() -> racerWithDepth(3).raceWithFallback(List.of("a/1"), List.of("b/1", "a/1"), ALWAYS_FAILS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate candidate 'a/1'");
    }
}
