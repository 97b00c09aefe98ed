package com.phillippitts.affectsignal.service.normalize;

import com.phillippitts.affectsignal.config.properties.NormalizerProperties;
import com.phillippitts.affectsignal.domain.EmotionCategory;
import com.phillippitts.affectsignal.domain.EmotionScore;
import com.phillippitts.affectsignal.domain.EmotionVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reconciles upstream emotion labels with the canonical taxonomy.
 *
 * <p>Built-in synonyms:
 * <ul>
 *   <li>neutral → Calmness</li>
 *   <li>anxiety, fear, doubt → Nervous</li>
 *   <li>happiness, satisfaction → Joy</li>
 *   <li>excitement, surprise → Excitement</li>
 *   <li>confidence, pride → Confidence</li>
 * </ul>
 * Matching is case-insensitive and canonical names map to themselves. Labels with no mapping
 * pass through unchanged.
 *
 * <p>When several upstream labels land on the same category, they merge into one entry at the
 * position of the first, keeping the highest score.
 *
 * <p>Thread-safe: the synonym table is immutable after construction.
 */
@Component
public class LabelNormalizer {

    private static final Logger LOG = LogManager.getLogger(LabelNormalizer.class);

    private static final Map<String, String> BUILT_IN = builtInSynonyms();

    private final Map<String, String> synonyms;

    public LabelNormalizer(NormalizerProperties properties) {
        Map<String, String> table = new HashMap<>(BUILT_IN);
        for (Map.Entry<String, String> e : properties.getSynonyms().entrySet()) {
            if (e.getKey() == null || e.getKey().isBlank() || e.getValue() == null || e.getValue().isBlank()) {
                LOG.warn("Ignoring blank synonym mapping: {} -> {}", e.getKey(), e.getValue());
                continue;
            }
            table.put(key(e.getKey()), e.getValue().trim());
        }
        this.synonyms = Collections.unmodifiableMap(table);
        if (!properties.getSynonyms().isEmpty()) {
            LOG.info("Label normalizer loaded {} configured synonyms", properties.getSynonyms().size());
        }
    }

    /**
     * Creates a normalizer with only the built-in synonym table.
     */
    public static LabelNormalizer withDefaults() {
        return new LabelNormalizer(new NormalizerProperties());
    }

    /**
     * Maps a single upstream label to its canonical category, or returns it unchanged.
     *
     * @param label upstream label
     * @return canonical category name, or the original label if unmapped
     */
    public String canonicalLabel(String label) {
        if (label == null) {
            return null;
        }
        String mapped = synonyms.get(key(label));
        return mapped != null ? mapped : label;
    }

    /**
     * Normalizes every label of a vector, merging entries that map to the same category.
     *
     * @param vector upstream vector (may be empty)
     * @return normalized vector, same order as the first occurrence of each label
     */
    public EmotionVector normalize(EmotionVector vector) {
        if (vector == null || vector.isEmpty()) {
            return EmotionVector.empty();
        }
        Map<String, EmotionScore> merged = new LinkedHashMap<>();
        for (EmotionScore s : vector.scores()) {
            String label = canonicalLabel(s.label());
            EmotionScore existing = merged.get(label);
            if (existing == null || s.score() > existing.score()) {
                // put() on an existing key keeps the original insertion position
                merged.put(label, s.withLabel(label));
            }
        }
        return new EmotionVector(new ArrayList<>(merged.values()));
    }

    /**
     * Returns the entry with the highest score. Ties go to the entry that appears first.
     *
     * @param vector vector to inspect
     * @return dominant entry, or empty for an empty vector
     */
    public Optional<EmotionScore> dominant(EmotionVector vector) {
        if (vector == null || vector.isEmpty()) {
            return Optional.empty();
        }
        EmotionScore best = null;
        for (EmotionScore s : vector.scores()) {
            if (best == null || s.score() > best.score()) {
                best = s;
            }
        }
        return Optional.of(best);
    }

    private static String key(String label) {
        return label.trim().toLowerCase(Locale.ROOT);
    }

    private static Map<String, String> builtInSynonyms() {
        Map<String, String> m = new HashMap<>();
        for (String canonical : EmotionCategory.CANONICAL) {
            m.put(key(canonical), canonical);
        }
        m.put("neutral", EmotionCategory.CALMNESS);
        for (String s : List.of("anxiety", "fear", "doubt")) {
            m.put(s, EmotionCategory.NERVOUS);
        }
        for (String s : List.of("happiness", "satisfaction")) {
            m.put(s, EmotionCategory.JOY);
        }
        for (String s : List.of("excitement", "surprise")) {
            m.put(s, EmotionCategory.EXCITEMENT);
        }
        for (String s : List.of("confidence", "pride")) {
            m.put(s, EmotionCategory.CONFIDENCE);
        }
        return Collections.unmodifiableMap(m);
    }
}
