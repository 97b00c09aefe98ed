package com.phillippitts.affectsignal.service.synthesis;

import com.phillippitts.affectsignal.domain.CaptureKey;
import com.phillippitts.affectsignal.domain.EmotionCategory;
import com.phillippitts.affectsignal.domain.EmotionScore;
import com.phillippitts.affectsignal.domain.EmotionVector;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Generates a plausible canonical vector when no real inference result is available.
 *
 * <p>The output is a pure function of the {@link CaptureKey}: the key's seed text
 * ({@code questionId|roundId|ordinal}) is hashed with a 32-bit djb2 rolling hash, reduced to a
 * seed in [0, 1), and every category score is a bounded linear function of that seed. Each
 * category shifts the seed by its own fixed offset, so the categories do not rise and fall
 * together. No randomness source and no clock is consulted.
 *
 * <p>Thread-safe: stateless.
 */
@Component
public class FallbackSynthesizer {

    private static final int HASH_START = 5381;
    private static final int SEED_BUCKETS = 1000;

    private static final List<CategoryCurve> CURVES = List.of(
            new CategoryCurve(EmotionCategory.CONFIDENCE, 0.65, 0.30, 0.00, 0.10, false),
            new CategoryCurve(EmotionCategory.JOY, 0.40, 0.30, 0.37, 0.0, false),
            new CategoryCurve(EmotionCategory.CALMNESS, 0.35, 0.20, 0.61, 0.0, false),
            new CategoryCurve(EmotionCategory.NERVOUS, 0.20, 0.40, 0.00, 0.0, true),
            new CategoryCurve(EmotionCategory.EXCITEMENT, 0.25, 0.40, 0.83, 0.0, false)
    );

    /**
     * Synthesizes the canonical vector for a capture key.
     *
     * @param key capture key
     * @return vector with the five canonical categories, in canonical order
     * @throws NullPointerException if key is null
     */
    public EmotionVector synthesize(CaptureKey key) {
        Objects.requireNonNull(key, "key");
        double seed = seedOf(key.seedText());
        List<EmotionScore> scores = new ArrayList<>(CURVES.size());
        for (CategoryCurve curve : CURVES) {
            scores.add(new EmotionScore(curve.category(), curve.valueAt(seed)));
        }
        return new EmotionVector(scores);
    }

    /**
     * Reduces text to a seed in [0, 1) with three decimal digits of resolution.
     */
    static double seedOf(String text) {
        return (hash(text) % SEED_BUCKETS) / (double) SEED_BUCKETS;
    }

    /**
     * djb2: {@code h = h * 33 + c} over UTF-16 code units, wrapping at 32 bits, then the
     * absolute value. Widened to long so {@code Integer.MIN_VALUE} stays positive.
     */
    static long hash(String text) {
        int h = HASH_START;
        for (int i = 0; i < text.length(); i++) {
            h = ((h << 5) + h) + text.charAt(i);
        }
        return Math.abs((long) h);
    }

    /**
     * One category's response to the seed: {@code base + (phase - 0.5) * amplitude}, where
     * {@code phase} is the seed shifted by {@code offset} and wrapped into [0, 1). Folded curves
     * use {@code |phase - 0.5|} and so peak at both ends of the seed range.
     */
    private record CategoryCurve(String category,
                                 double base,
                                 double amplitude,
                                 double offset,
                                 double floor,
                                 boolean folded) {

        double valueAt(double seed) {
            double shifted = seed + offset;
            double phase = shifted - Math.floor(shifted);
            double swing = folded ? Math.abs(phase - 0.5) : phase - 0.5;
            double value = base + swing * amplitude;
            return Math.min(1.0, Math.max(floor, value));
        }
    }
}
