package com.phillippitts.interviewengine.config;

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
 * Exposes capability pool metrics via Micrometer:
 * <ul>
 *   <li>capability.pool.size - current number of threads</li>
 *   <li>capability.pool.active - threads running a capability call</li>
 *   <li>capability.pool.queued - calls waiting in the queue</li>
 *   <li>capability.pool.completed - cumulative completed calls</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> capabilityExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("capabilityExecutor") ObjectProvider<ThreadPoolTaskExecutor> capabilityExecutorProvider) {
        this.capabilityExecutorProvider = capabilityExecutorProvider;
    }

    @Bean
    public MeterBinder capabilityExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = capabilityExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("capability.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the capability pool")
                    .register(registry);

            Gauge.builder("capability.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads running capability calls")
                    .register(registry);

            Gauge.builder("capability.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of capability calls waiting in the queue")
                    .register(registry);

            Gauge.builder("capability.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed capability calls")
                    .register(registry);

            LOG.info("Capability pool metrics registered: capability.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = capabilityExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Capability pool health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
