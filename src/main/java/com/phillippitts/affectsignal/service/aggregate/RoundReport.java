package com.phillippitts.affectsignal.service.aggregate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Statistics over a set of expressions: one round, or the whole session.
 *
 * @param roundId round identifier, or {@link #OVERALL} for the session-wide report
 * @param categoryAverages average score per category; canonical categories first, in canonical order
 * @param dominantCategory category with the highest average; null when there were no expressions
 * @param tier rating from the Confidence average
 * @param questionCount number of expressions aggregated
 * @param realCount expressions resolved from a real inference result
 * @param syntheticCount expressions produced by the fallback synthesizer
 */
public record RoundReport(
        String roundId,
        Map<String, Double> categoryAverages,
        String dominantCategory,
        PerformanceTier tier,
        int questionCount,
        int realCount,
        int syntheticCount
) {

    public static final String OVERALL = "overall";

    public RoundReport {
        Objects.requireNonNull(roundId, "roundId");
        Objects.requireNonNull(tier, "tier");
        categoryAverages = categoryAverages == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(categoryAverages));
    }

    public double averageOf(String category) {
        return categoryAverages.getOrDefault(category, 0.0);
    }

    public boolean isEmpty() {
        return questionCount == 0;
    }
}
