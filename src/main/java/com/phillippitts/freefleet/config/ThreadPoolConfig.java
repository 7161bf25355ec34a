package com.phillippitts.freefleet.config;

import com.phillippitts.freefleet.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools used by the fleet.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} under {@code threadpool.race.*}
 * and {@code threadpool.io.*}. Both executors copy the Log4j2 ThreadContext (MDC) from the
 * submitting thread so race and request ids survive the hop to worker threads.
 *
 * <p>The race pool hands candidates directly to a thread (queue capacity 0) and aborts when
 * no thread is left, so every candidate of a wave starts at once or fails right away. The io
 * pool queues work and falls back to {@link ThreadPoolExecutor.CallerRunsPolicy}.
 */
@Configuration
@EnableScheduling
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor that runs one task per race candidate.
     *
     * @return configured executor for candidate executions
     */
    @Bean(name = "raceExecutor")
    public ThreadPoolTaskExecutor raceExecutor() {
        return buildExecutor(threadPoolProperties.getRace(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Executor for provider fetches, metadata adapter fan-out, policy scrapers and
     * background refreshes.
     *
     * @return configured executor for network-bound fleet work
     */
    @Bean(name = "fleetIoExecutor")
    public ThreadPoolTaskExecutor fleetIoExecutor() {
        return buildExecutor(threadPoolProperties.getIo(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Single-threaded scheduler that fires per-candidate race timeouts.
     */
    @Bean(name = "raceTimeoutScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService raceTimeoutScheduler() {
        CustomizableThreadFactory factory = new CustomizableThreadFactory("race-timeout-");
        factory.setDaemon(true);
        return Executors.newSingleThreadScheduledExecutor(factory);
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props,
                                                        RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
