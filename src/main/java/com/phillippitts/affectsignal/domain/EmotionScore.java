package com.phillippitts.affectsignal.domain;

import java.util.Objects;

/**
 * One detector output: a label and its score.
 *
 * <p>Scores are clamped into [0.0, 1.0] on construction regardless of where they came from.
 * Labels are not restricted to the canonical categories.
 *
 * @param label emotion label (never blank)
 * @param score score between 0.0 and 1.0
 */
public record EmotionScore(String label, double score) {

    /**
     * @throws NullPointerException if label is null
     * @throws IllegalArgumentException if label is blank or score is NaN
     */
    public EmotionScore {
        Objects.requireNonNull(label, "label");
        if (label.isBlank()) {
            throw new IllegalArgumentException("label must not be blank");
        }
        if (Double.isNaN(score)) {
            throw new IllegalArgumentException("score must be a number for label " + label);
        }
        score = Math.min(1.0, Math.max(0.0, score));
    }

    public static EmotionScore of(String label, double score) {
        return new EmotionScore(label, score);
    }

    /**
     * Returns a copy of this score under a different label.
     */
    public EmotionScore withLabel(String newLabel) {
        return new EmotionScore(newLabel, score);
    }
}
