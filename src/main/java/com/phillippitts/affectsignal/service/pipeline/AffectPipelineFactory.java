package com.phillippitts.affectsignal.service.pipeline;

import com.phillippitts.affectsignal.config.properties.InferenceProperties;
import com.phillippitts.affectsignal.service.aggregate.EmotionAggregator;
import com.phillippitts.affectsignal.service.inference.InferenceJobClient;
import com.phillippitts.affectsignal.service.normalize.LabelNormalizer;
import com.phillippitts.affectsignal.service.store.InMemoryExpressionStore;
import com.phillippitts.affectsignal.service.synthesis.FallbackSynthesizer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Builds one {@link AffectPipeline} per session around the shared, stateless collaborators.
 * Each pipeline gets its own store.
 */
@Component
public class AffectPipelineFactory {

    private final InferenceJobClient client;
    private final Executor executor;
    private final LabelNormalizer normalizer;
    private final FallbackSynthesizer synthesizer;
    private final EmotionAggregator aggregator;
    private final ApplicationEventPublisher publisher;
    private final InferenceMetricsPublisher metrics;
    private final Duration deadline;

    @Autowired
    public AffectPipelineFactory(InferenceJobClient client,
                                 @Qualifier("inferenceExecutor") Executor executor,
                                 LabelNormalizer normalizer,
                                 FallbackSynthesizer synthesizer,
                                 EmotionAggregator aggregator,
                                 ApplicationEventPublisher publisher,
                                 InferenceMetricsPublisher metrics,
                                 InferenceProperties props) {
        this(client, executor, normalizer, synthesizer, aggregator, publisher, metrics, props.deadline());
    }

    public AffectPipelineFactory(InferenceJobClient client,
                                 Executor executor,
                                 LabelNormalizer normalizer,
                                 FallbackSynthesizer synthesizer,
                                 EmotionAggregator aggregator,
                                 ApplicationEventPublisher publisher,
                                 InferenceMetricsPublisher metrics,
                                 Duration deadline) {
        this.client = Objects.requireNonNull(client, "client");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = metrics != null ? metrics : InferenceMetricsPublisher.NOOP;
        this.deadline = Objects.requireNonNull(deadline, "deadline");
    }

    public AffectPipeline create(String sessionId) {
        return new AffectPipeline(sessionId, client, executor, normalizer, synthesizer,
                new InMemoryExpressionStore(), aggregator, publisher, metrics, deadline);
    }
}
