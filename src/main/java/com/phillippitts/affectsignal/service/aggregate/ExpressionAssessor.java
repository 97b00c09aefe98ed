package com.phillippitts.affectsignal.service.aggregate;

import com.phillippitts.affectsignal.domain.EmotionCategory;
import com.phillippitts.affectsignal.domain.EmotionScore;
import com.phillippitts.affectsignal.domain.EmotionVector;
import com.phillippitts.affectsignal.domain.QuestionExpression;
import com.phillippitts.affectsignal.service.normalize.LabelNormalizer;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Set;

/**
 * Derives confident / nervous / struggling flags and a composite confidence from one expression.
 */
@Component
public class ExpressionAssessor {

    static final double CONFIDENT_ABOVE = 0.6;
    static final double NERVOUS_BELOW = 0.4;
    static final double STRUGGLING_BELOW = 0.3;

    private static final Set<String> STRUGGLE_LABELS = Set.of("Confusion", "Frustration");

    private final LabelNormalizer normalizer;

    public ExpressionAssessor(LabelNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    public ExpressionAssessment assess(QuestionExpression expression) {
        Objects.requireNonNull(expression, "expression");
        EmotionVector vector = expression.vector();
        // stored vectors are never empty
        EmotionScore dominant = normalizer.dominant(vector).orElseThrow();
        String label = dominant.label();
        double score = dominant.score();
        return new ExpressionAssessment(
                expression.questionId(),
                label,
                score,
                EmotionCategory.CONFIDENCE.equals(label) || score > CONFIDENT_ABOVE,
                EmotionCategory.NERVOUS.equals(label) || score < NERVOUS_BELOW,
                STRUGGLE_LABELS.contains(label) || score < STRUGGLING_BELOW,
                compositeConfidence(vector));
    }

    /**
     * {@code 0.5*Confidence + 0.25*Joy + 0.2*Calmness + 0.05*Excitement}, absent categories as 0.
     */
    static double compositeConfidence(EmotionVector vector) {
        double value = 0.5 * vector.scoreOf(EmotionCategory.CONFIDENCE).orElse(0.0)
                + 0.25 * vector.scoreOf(EmotionCategory.JOY).orElse(0.0)
                + 0.2 * vector.scoreOf(EmotionCategory.CALMNESS).orElse(0.0)
                + 0.05 * vector.scoreOf(EmotionCategory.EXCITEMENT).orElse(0.0);
        return Math.min(1.0, Math.max(0.0, value));
    }
}
