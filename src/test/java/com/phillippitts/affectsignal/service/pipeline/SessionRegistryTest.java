package com.phillippitts.affectsignal.service.pipeline;

import com.phillippitts.affectsignal.exception.UnknownSessionException;
import com.phillippitts.affectsignal.service.aggregate.EmotionAggregator;
import com.phillippitts.affectsignal.service.aggregate.ExpressionAssessor;
import com.phillippitts.affectsignal.service.inference.InferenceJobClient;
import com.phillippitts.affectsignal.service.normalize.LabelNormalizer;
import com.phillippitts.affectsignal.service.synthesis.FallbackSynthesizer;
import com.phillippitts.affectsignal.testutil.EventCapturingPublisher;
import com.phillippitts.affectsignal.testutil.SyncExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class SessionRegistryTest {

    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        LabelNormalizer normalizer = LabelNormalizer.withDefaults();
        AffectPipelineFactory factory = new AffectPipelineFactory(
                mock(InferenceJobClient.class),
                new SyncExecutor(),
                normalizer,
                new FallbackSynthesizer(),
                new EmotionAggregator(new ExpressionAssessor(normalizer)),
                new EventCapturingPublisher(),
                null,
                Duration.ofSeconds(1));
        registry = new SessionRegistry(factory);
    }

    @Test
    void openIsIdempotent() {
        AffectPipeline first = registry.open("s1");

        assertThat(registry.open("s1")).isSameAs(first);
        assertThat(registry.openCount()).isEqualTo(1);
        assertThat(first.sessionId()).isEqualTo("s1");
    }

    @Test
    void sessionsHaveSeparateStores() {
        assertThat(registry.open("s1").store()).isNotSameAs(registry.open("s2").store());
    }

    @Test
    void getUnknownSessionThrows() {
        assertThatThrownBy(() -> registry.get("missing"))
                .isInstanceOf(UnknownSessionException.class)
                .hasMessageContaining("missing");
        assertThat(registry.find("missing")).isEmpty();
    }

    @Test
    void closeDiscardsPipeline() {
        AffectPipeline pipeline = registry.open("s1");

        assertThat(registry.close("s1")).isTrue();
        assertThat(pipeline.isClosed()).isTrue();
        assertThat(registry.find("s1")).isEmpty();
        assertThat(registry.close("s1")).isFalse();
    }

    @Test
    void reopeningClosedSessionStartsFresh() {
        AffectPipeline first = registry.open("s1");
        registry.close("s1");

        assertThat(registry.open("s1")).isNotSameAs(first);
    }

    @Test
    void closeAllClosesEverySession() {
        AffectPipeline a = registry.open("a");
        AffectPipeline b = registry.open("b");

        registry.closeAll();

        assertThat(a.isClosed()).isTrue();
        assertThat(b.isClosed()).isTrue();
        assertThat(registry.openCount()).isZero();
    }

    @Test
    void blankSessionIdIsRejected() {
        assertThatThrownBy(() -> registry.open(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
