package com.phillippitts.affectsignal.service.aggregate;

/**
 * Coarse rating derived from the average Confidence score.
 */
public enum PerformanceTier {
    EXCELLENT("Excellent", 0.7),
    GOOD("Good", 0.5),
    FAIR("Fair", 0.3),
    NEEDS_IMPROVEMENT("Needs Improvement", Double.NEGATIVE_INFINITY);

    private final String label;
    private final double threshold;

    PerformanceTier(String label, double threshold) {
        this.label = label;
        this.threshold = threshold;
    }

    public String label() {
        return label;
    }

    /**
     * @param confidence average Confidence score
     * @return first tier whose lower bound (inclusive) is met
     */
    public static PerformanceTier fromConfidence(double confidence) {
        for (PerformanceTier tier : values()) {
            if (confidence >= tier.threshold) {
                return tier;
            }
        }
        return NEEDS_IMPROVEMENT;
    }
}
