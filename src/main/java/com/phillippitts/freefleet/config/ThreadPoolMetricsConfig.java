package com.phillippitts.freefleet.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes race pool gauges via Micrometer.
 *
 * <ul>
 *   <li>fleet.race.pool.size - current number of threads</li>
 *   <li>fleet.race.pool.active - candidates currently executing</li>
 *   <li>fleet.race.pool.queued - candidates waiting for a thread</li>
 *   <li>fleet.race.pool.completed - cumulative completed candidate tasks</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> raceExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("raceExecutor") ObjectProvider<ThreadPoolTaskExecutor> raceExecutorProvider) {
        this.raceExecutorProvider = raceExecutorProvider;
    }

    @Bean
    public MeterBinder raceExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = raceExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("fleet.race.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the race pool")
                    .register(registry);
            Gauge.builder("fleet.race.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Candidates currently executing")
                    .register(registry);
            Gauge.builder("fleet.race.pool.queued", executor, e -> e.getQueue().size())
                    .description("Candidates waiting for a race thread")
                    .register(registry);
            Gauge.builder("fleet.race.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed candidate tasks")
                    .register(registry);

            LOG.info("Race pool metrics registered: fleet.race.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = raceExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Race pool: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
