package com.phillippitts.affectsignal.config;

import com.phillippitts.affectsignal.config.properties.ThreadPoolProperties;
import com.phillippitts.affectsignal.util.MdcPropagation;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for inference work.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.*}).
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for job submissions.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue
     * are full the submitting thread runs the submission itself, which slows down callers
     * instead of dropping captures.
     *
     * <p>MDC propagation: the Log4j2 ThreadContext of the submitting thread is copied to the
     * worker so request ids survive the hop.
     *
     * @return configured executor for inference submissions
     */
    @Bean(name = "inferenceExecutor")
    public ThreadPoolTaskExecutor inferenceExecutor() {
        ThreadPoolProperties.InferencePoolProperties props = threadPoolProperties.getInference();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(MdcPropagation::wrap);
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler for status checks, fetch retries and deadlines. Initialized by the container.
     *
     * @return scheduler backing the inference job client
     */
    @Bean(name = "inferenceScheduler")
    public ThreadPoolTaskScheduler inferenceScheduler() {
        ThreadPoolProperties.SchedulerProperties props = threadPoolProperties.getScheduler();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
