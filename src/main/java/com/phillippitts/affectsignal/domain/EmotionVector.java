package com.phillippitts.affectsignal.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Ordered, immutable sequence of {@link EmotionScore}.
 *
 * <p>An empty vector is a valid "nothing detected" outcome. Scores are independent detector
 * outputs and are not required to sum to 1.
 *
 * @param scores scores in upstream order
 */
public record EmotionVector(List<EmotionScore> scores) {

    private static final EmotionVector EMPTY = new EmotionVector(List.of());

    public EmotionVector {
        scores = scores == null ? List.of() : List.copyOf(scores);
    }

    public static EmotionVector empty() {
        return EMPTY;
    }

    public static EmotionVector of(EmotionScore... scores) {
        return new EmotionVector(List.of(scores));
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }

    public int size() {
        return scores.size();
    }

    /**
     * Returns the score of the first entry carrying the given label.
     *
     * @param label label to look up (exact match)
     * @return the score, or empty if the label is absent
     */
    public OptionalDouble scoreOf(String label) {
        for (EmotionScore s : scores) {
            if (s.label().equals(label)) {
                return OptionalDouble.of(s.score());
            }
        }
        return OptionalDouble.empty();
    }

    public List<String> labels() {
        List<String> labels = new ArrayList<>(scores.size());
        for (EmotionScore s : scores) {
            labels.add(s.label());
        }
        return labels;
    }
}
