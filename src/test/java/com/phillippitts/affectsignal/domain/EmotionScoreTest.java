package com.phillippitts.affectsignal.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmotionScoreTest {

    @Test
    void clampsScoresIntoUnitRange() {
        assertThat(EmotionScore.of("Joy", 1.7).score()).isEqualTo(1.0);
        assertThat(EmotionScore.of("Joy", -0.2).score()).isEqualTo(0.0);
        assertThat(EmotionScore.of("Joy", 0.42).score()).isEqualTo(0.42);
    }

    @Test
    void rejectsNaNAndBlankLabels() {
        assertThatThrownBy(() -> EmotionScore.of("Joy", Double.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EmotionScore.of(" ", 0.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EmotionScore.of(null, 0.5)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void withLabelKeepsScore() {
        EmotionScore relabeled = EmotionScore.of("Pride", 0.6).withLabel("Confidence");

        assertThat(relabeled).isEqualTo(EmotionScore.of("Confidence", 0.6));
    }
}
