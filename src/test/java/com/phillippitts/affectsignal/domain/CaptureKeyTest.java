package com.phillippitts.affectsignal.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaptureKeyTest {

    @Test
    void seedTextOrdersQuestionRoundOrdinal() {
        assertThat(new CaptureKey("technical", "q1", 0).seedText()).isEqualTo("q1|technical|0");
    }

    @Test
    void rejectsBlankIdsAndNegativeOrdinal() {
        assertThatThrownBy(() -> new CaptureKey("", "q1", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CaptureKey("technical", " ", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CaptureKey("technical", "q1", -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CaptureKey(null, "q1", 0)).isInstanceOf(NullPointerException.class);
    }
}
