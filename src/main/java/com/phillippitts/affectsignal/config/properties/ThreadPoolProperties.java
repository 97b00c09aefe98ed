package com.phillippitts.affectsignal.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.Valid;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Sizing of the inference submission pool and the polling scheduler.
 *
 * <p>Submissions block on one HTTP request each; status checks and fetch retries are short
 * scheduled tasks, so the scheduler can stay small.
 */
@Validated
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    @Valid
    private InferencePoolProperties inference = new InferencePoolProperties();

    @Valid
    private SchedulerProperties scheduler = new SchedulerProperties();

    public InferencePoolProperties getInference() {
        return inference;
    }

    public void setInference(InferencePoolProperties inference) {
        this.inference = inference;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Submission executor configuration.
     */
    public static class InferencePoolProperties {
        @Min(1)
        private int corePoolSize = 2;
        @Min(1)
        private int maxPoolSize = 8;
        @Min(0)
        private int queueCapacity = 50;
        @Min(0)
        private int keepAliveSeconds = 60;
        @NotBlank
        private String threadNamePrefix = "inference-pool-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Polling scheduler configuration.
     */
    public static class SchedulerProperties {
        @Min(1)
        private int poolSize = 2;
        @NotBlank
        private String threadNamePrefix = "inference-tick-";

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
