package com.phillippitts.freefleet.config;

import com.phillippitts.freefleet.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateRaceExecutorFromDefaults() {
        ThreadPoolTaskExecutor executor = config.raceExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(16);
            assertThat(executor.getMaxPoolSize()).isEqualTo(256);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("race-");
            assertThat(executor.getThreadPoolExecutor().getQueue()).isInstanceOf(SynchronousQueue.class);
            assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                    .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldCreateIoExecutorFromDefaults() {
        ThreadPoolTaskExecutor executor = config.fleetIoExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(8);
            assertThat(executor.getMaxPoolSize()).isEqualTo(16);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("fleet-io-");
            assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                    .isInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldPropagateThreadContextToWorkers() throws InterruptedException {
        ThreadPoolTaskExecutor executor = config.raceExecutor();
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> threadName = new AtomicReference<>();
        try {
            ThreadContext.put("raceId", "race-42");
            executor.execute(() -> {
                seen.set(ThreadContext.get("raceId"));
                threadName.set(Thread.currentThread().getName());
                latch.countDown();
            });

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(seen.get()).isEqualTo("race-42");
            assertThat(threadName.get()).startsWith("race-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldRestoreWorkerContextAfterTask() {
        ThreadContext.put("raceId", "submitter");
        AtomicReference<String> inside = new AtomicReference<>();
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator()
                .decorate(() -> inside.set(ThreadContext.get("raceId")));

        ThreadContext.clearAll();
        ThreadContext.put("candidate", "worker-own");
        decorated.run();

        assertThat(inside.get()).isEqualTo("submitter");
        assertThat(ThreadContext.get("raceId")).isNull();
        assertThat(ThreadContext.get("candidate")).isEqualTo("worker-own");
    }

    @Test
    void shouldRunScheduledTimeoutsOnDaemonThread() throws Exception {
        ScheduledExecutorService scheduler = config.raceTimeoutScheduler();
        try {
            Thread thread = scheduler.schedule(Thread::currentThread, 1, TimeUnit.MILLISECONDS).get(5, TimeUnit.SECONDS);

            assertThat(thread.isDaemon()).isTrue();
            assertThat(thread.getName()).startsWith("race-timeout-");
        } finally {
            scheduler.shutdownNow();
        }
    }
}
