package com.phillippitts.affectsignal.config;

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
 * Exposes the inference executor through Micrometer gauges ({@code inference.pool.size},
 * {@code .active}, {@code .queued}, {@code .completed}) and logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> inferenceExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("inferenceExecutor") ObjectProvider<ThreadPoolTaskExecutor> inferenceExecutorProvider) {
        this.inferenceExecutorProvider = inferenceExecutorProvider;
    }

    @Bean
    public MeterBinder inferenceExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = inferenceExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("inference.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the inference pool")
                    .register(registry);

            Gauge.builder("inference.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively submitting inference jobs")
                    .register(registry);

            Gauge.builder("inference.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of submissions waiting in the queue")
                    .register(registry);

            Gauge.builder("inference.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed submissions")
                    .register(registry);

            LOG.info("Inference thread pool metrics registered: inference.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = inferenceExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Inference Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
