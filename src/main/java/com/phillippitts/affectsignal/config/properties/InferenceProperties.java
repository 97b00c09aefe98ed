package com.phillippitts.affectsignal.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Connection and timing settings for the remote inference service.
 *
 * <p>Defaults follow the upstream job lifecycle: one status check per second for at most 30
 * checks, three prediction fetches two seconds apart, all inside a 30 second deadline.
 */
@Validated
@ConfigurationProperties(prefix = "affect.inference")
public class InferenceProperties {

    /** Base URL of the batch inference API; job paths are resolved against it. */
    @NotBlank(message = "Inference base URL must be set")
    private String baseUrl = "https://api.hume.ai/v0/batch";

    /** API key. When blank, every submission is rejected and all questions use synthetic vectors. */
    private String apiKey = "";

    @NotBlank
    private String apiKeyHeader = "X-Hume-Api-Key";

    @Positive
    private int connectTimeoutMs = 5000;

    @Positive
    private int readTimeoutMs = 10000;

    @Positive(message = "Poll interval must be positive")
    private long pollIntervalMs = 1000;

    @Positive(message = "Max poll attempts must be positive")
    private int maxPollAttempts = 30;

    /** Wall-clock budget for polling and fetching one job. */
    @Positive(message = "Deadline must be positive")
    private long deadlineMs = 30000;

    @Positive(message = "Fetch attempts must be positive")
    private int fetchAttempts = 3;

    /** Settle delay between a COMPLETED status and the first predictions fetch. */
    @Min(0)
    private long fetchInitialDelayMs = 1000;

    @Min(0)
    private long fetchRetryPauseMs = 2000;

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public Duration deadline() {
        return Duration.ofMillis(deadlineMs);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getApiKeyHeader() {
        return apiKeyHeader;
    }

    public void setApiKeyHeader(String apiKeyHeader) {
        this.apiKeyHeader = apiKeyHeader;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(int readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public int getMaxPollAttempts() {
        return maxPollAttempts;
    }

    public void setMaxPollAttempts(int maxPollAttempts) {
        this.maxPollAttempts = maxPollAttempts;
    }

    public long getDeadlineMs() {
        return deadlineMs;
    }

    public void setDeadlineMs(long deadlineMs) {
        this.deadlineMs = deadlineMs;
    }

    public int getFetchAttempts() {
        return fetchAttempts;
    }

    public void setFetchAttempts(int fetchAttempts) {
        this.fetchAttempts = fetchAttempts;
    }

    public long getFetchInitialDelayMs() {
        return fetchInitialDelayMs;
    }

    public void setFetchInitialDelayMs(long fetchInitialDelayMs) {
        this.fetchInitialDelayMs = fetchInitialDelayMs;
    }

    public long getFetchRetryPauseMs() {
        return fetchRetryPauseMs;
    }

    public void setFetchRetryPauseMs(long fetchRetryPauseMs) {
        this.fetchRetryPauseMs = fetchRetryPauseMs;
    }
}
