package com.phillippitts.affectsignal.config;

import com.phillippitts.affectsignal.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void executorUsesConfiguredDefaults() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).inferenceExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(2);
        assertThat(executor.getMaxPoolSize()).isEqualTo(8);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("inference-pool-");
        assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                .isInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class);
    }

    @Test
    void executorRunsConcurrentTasks() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).inferenceExecutor();
        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completed = new AtomicInteger();

        for (int i = 0; i < taskCount; i++) {
            executor.execute(() -> {
                completed.incrementAndGet();
                latch.countDown();
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(completed.get()).isEqualTo(taskCount);
    }

    @Test
    void executorPropagatesThreadContext() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).inferenceExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch latch = new CountDownLatch(1);

        ThreadContext.put("sessionId", "s-77");
        executor.execute(() -> {
            seen.set(ThreadContext.get("sessionId"));
            latch.countDown();
        });

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("s-77");
    }

    @Test
    void schedulerHonoursProperties() {
        ThreadPoolProperties props = new ThreadPoolProperties();
        props.getScheduler().setPoolSize(3);

        ThreadPoolTaskScheduler scheduler = new ThreadPoolConfig(props).inferenceScheduler();

        assertThat(scheduler.getPoolSize()).isEqualTo(3);
        assertThat(scheduler.getThreadNamePrefix()).isEqualTo("inference-tick-");
    }
}
