package com.phillippitts.affectsignal.service.aggregate;

import com.phillippitts.affectsignal.domain.EmotionScore;
import com.phillippitts.affectsignal.domain.EmotionVector;
import com.phillippitts.affectsignal.domain.ExpressionSource;
import com.phillippitts.affectsignal.domain.QuestionExpression;
import com.phillippitts.affectsignal.service.normalize.LabelNormalizer;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ExpressionAssessorTest {

    private final ExpressionAssessor assessor = new ExpressionAssessor(LabelNormalizer.withDefaults());

    private static QuestionExpression expr(EmotionScore... scores) {
        return new QuestionExpression("q1", "technical", 0, 0, EmotionVector.of(scores),
                ExpressionSource.REAL, Instant.EPOCH);
    }

    @Test
    void dominantConfidenceIsConfident() {
        ExpressionAssessment a = assessor.assess(expr(EmotionScore.of("Confidence", 0.5), EmotionScore.of("Joy", 0.2)));

        assertThat(a.dominantLabel()).isEqualTo("Confidence");
        assertThat(a.confident()).isTrue();
        assertThat(a.nervous()).isFalse();
        assertThat(a.struggling()).isFalse();
    }

    @Test
    void highScoringNonConfidenceIsStillConfident() {
        ExpressionAssessment a = assessor.assess(expr(EmotionScore.of("Joy", 0.65)));

        assertThat(a.confident()).isTrue();
    }

    @Test
    void lowDominantScoreIsNervousAndStruggling() {
        ExpressionAssessment a = assessor.assess(expr(EmotionScore.of("Calmness", 0.25)));

        assertThat(a.confident()).isFalse();
        assertThat(a.nervous()).isTrue();
        assertThat(a.struggling()).isTrue();
    }

    @Test
    void confusionDominantIsStruggling() {
        ExpressionAssessment a = assessor.assess(expr(EmotionScore.of("Confusion", 0.5), EmotionScore.of("Joy", 0.1)));

        assertThat(a.struggling()).isTrue();
        assertThat(a.nervous()).isFalse();
    }

    @Test
    void compositeConfidenceWeightsCategories() {
        EmotionVector v = EmotionVector.of(
                EmotionScore.of("Confidence", 0.8),
                EmotionScore.of("Joy", 0.4),
                EmotionScore.of("Calmness", 0.5),
                EmotionScore.of("Excitement", 1.0));

        assertThat(ExpressionAssessor.compositeConfidence(v)).isCloseTo(0.4 + 0.1 + 0.1 + 0.05, within(1e-9));
        assertThat(ExpressionAssessor.compositeConfidence(EmotionVector.of(EmotionScore.of("Nervous", 0.9)))).isZero();
    }
}
