package com.phillippitts.affectsignal.domain;

import java.util.List;

/**
 * Canonical affect categories used for aggregation and reporting.
 *
 * <p>The taxonomy is open: vectors may carry other labels, which pass through untouched.
 * These constants are the categories every report always includes, in this order.
 */
public final class EmotionCategory {

    public static final String CONFIDENCE = "Confidence";
    public static final String JOY = "Joy";
    public static final String CALMNESS = "Calmness";
    public static final String NERVOUS = "Nervous";
    public static final String EXCITEMENT = "Excitement";

    /** Canonical categories in report order. */
    public static final List<String> CANONICAL = List.of(CONFIDENCE, JOY, CALMNESS, NERVOUS, EXCITEMENT);

    private EmotionCategory() {
        // Constants holder - prevent instantiation
    }

    public static boolean isCanonical(String label) {
        return CANONICAL.contains(label);
    }
}
