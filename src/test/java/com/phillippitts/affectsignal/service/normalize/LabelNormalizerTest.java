package com.phillippitts.affectsignal.service.normalize;

import com.phillippitts.affectsignal.config.properties.NormalizerProperties;
import com.phillippitts.affectsignal.domain.EmotionScore;
import com.phillippitts.affectsignal.domain.EmotionVector;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LabelNormalizerTest {

    private final LabelNormalizer normalizer = LabelNormalizer.withDefaults();

    @Test
    void mapsSynonymsCaseInsensitively() {
        assertThat(normalizer.canonicalLabel("Neutral")).isEqualTo("Calmness");
        assertThat(normalizer.canonicalLabel("ANXIETY")).isEqualTo("Nervous");
        assertThat(normalizer.canonicalLabel("Doubt")).isEqualTo("Nervous");
        assertThat(normalizer.canonicalLabel("satisfaction")).isEqualTo("Joy");
        assertThat(normalizer.canonicalLabel("Surprise")).isEqualTo("Excitement");
        assertThat(normalizer.canonicalLabel("Pride")).isEqualTo("Confidence");
        assertThat(normalizer.canonicalLabel("joy")).isEqualTo("Joy");
    }

    @Test
    void unmappedLabelsPassThrough() {
        assertThat(normalizer.canonicalLabel("Confusion")).isEqualTo("Confusion");
    }

    @Test
    void mergesLabelsLandingOnSameCategoryKeepingMax() {
        EmotionVector raw = EmotionVector.of(
                EmotionScore.of("Anxiety", 0.2),
                EmotionScore.of("Joy", 0.5),
                EmotionScore.of("Fear", 0.6),
                EmotionScore.of("Doubt", 0.1));

        EmotionVector normalized = normalizer.normalize(raw);

        assertThat(normalized.labels()).containsExactly("Nervous", "Joy");
        assertThat(normalized.scoreOf("Nervous")).hasValue(0.6);
    }

    @Test
    void emptyVectorStaysEmpty() {
        assertThat(normalizer.normalize(EmotionVector.empty()).isEmpty()).isTrue();
    }

    @Test
    void dominantPrefersFirstOnTies() {
        EmotionVector v = EmotionVector.of(
                EmotionScore.of("Calmness", 0.7),
                EmotionScore.of("Joy", 0.7),
                EmotionScore.of("Nervous", 0.1));

        assertThat(normalizer.dominant(v)).hasValueSatisfying(s -> assertThat(s.label()).isEqualTo("Calmness"));
        assertThat(normalizer.dominant(EmotionVector.empty())).isEmpty();
    }

    @Test
    void configuredSynonymsExtendTable() {
        NormalizerProperties props = new NormalizerProperties();
        props.setSynonyms(Map.of("Determination", "Confidence", "blank", " "));

        LabelNormalizer configured = new LabelNormalizer(props);

        assertThat(configured.canonicalLabel("determination")).isEqualTo("Confidence");
        assertThat(configured.canonicalLabel("blank")).isEqualTo("blank");
        assertThat(configured.canonicalLabel("fear")).isEqualTo("Nervous");
    }
}
