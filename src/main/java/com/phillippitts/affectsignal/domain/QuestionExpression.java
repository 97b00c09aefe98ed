package com.phillippitts.affectsignal.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable record of the affect vector resolved for one question.
 *
 * <p>The vector is never empty: empty real results are replaced by a synthetic vector before
 * an expression is built, so every stored expression yields statistics.
 *
 * @param questionId question identifier (store key)
 * @param roundId round the question belongs to
 * @param ordinal position of the question within its round
 * @param sequence session-wide capture-trigger order, used for reporting order
 * @param vector normalized emotion vector (non-empty)
 * @param source whether the vector is real or synthetic
 * @param capturedAt when the capture was triggered
 */
public record QuestionExpression(
        String questionId,
        String roundId,
        int ordinal,
        long sequence,
        EmotionVector vector,
        ExpressionSource source,
        Instant capturedAt
) {

    public QuestionExpression {
        Objects.requireNonNull(questionId, "questionId");
        Objects.requireNonNull(roundId, "roundId");
        Objects.requireNonNull(vector, "vector");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(capturedAt, "capturedAt");
        if (vector.isEmpty()) {
            throw new IllegalArgumentException("expression vector must not be empty for question " + questionId);
        }
    }

    public static QuestionExpression of(CaptureKey key,
                                        long sequence,
                                        EmotionVector vector,
                                        ExpressionSource source,
                                        Instant capturedAt) {
        return new QuestionExpression(key.questionId(), key.roundId(), key.ordinal(),
                sequence, vector, source, capturedAt);
    }

    public boolean isReal() {
        return source == ExpressionSource.REAL;
    }
}
