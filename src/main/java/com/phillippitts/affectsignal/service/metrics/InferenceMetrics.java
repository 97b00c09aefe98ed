package com.phillippitts.affectsignal.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for inference jobs and recorded expressions.
 *
 * <p>Exposed at /actuator/prometheus:
 * <ul>
 *   <li>{@code affectsignal.inference.latency}: submission to resolution, tagged by outcome</li>
 *   <li>{@code affectsignal.inference.outcome}: resolutions per outcome</li>
 *   <li>{@code affectsignal.expression.recorded}: stored expressions per source</li>
 *   <li>{@code affectsignal.capture.duplicate}: dropped duplicate triggers</li>
 * </ul>
 */
@Component
public class InferenceMetrics {

    private static final String INFERENCE_PREFIX = "affectsignal.inference";
    private static final String EXPRESSION_PREFIX = "affectsignal.expression";

    private final MeterRegistry registry;

    public InferenceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome resolution tag (completed, empty, failed, timed_out, submission_failed)
     * @param durationMs time from trigger to resolution
     */
    public void recordLatency(String outcome, long durationMs) {
        Timer.builder(INFERENCE_PREFIX + ".latency")
                .description("Time from capture trigger to inference resolution")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void incrementOutcome(String outcome) {
        Counter.builder(INFERENCE_PREFIX + ".outcome")
                .description("Number of inference resolutions by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * @param source expression source (real, synthetic)
     */
    public void incrementRecorded(String source) {
        Counter.builder(EXPRESSION_PREFIX + ".recorded")
                .description("Number of expressions written to session stores")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void incrementDuplicate() {
        Counter.builder("affectsignal.capture.duplicate")
                .description("Number of capture triggers dropped as duplicates")
                .register(registry)
                .increment();
    }
}
