package com.phillippitts.affectsignal.service.aggregate;

/**
 * Per-question reading of a stored vector.
 *
 * @param questionId question identifier
 * @param dominantLabel label of the highest-scoring entry
 * @param dominantScore its score
 * @param confident dominant is Confidence or dominant score above 0.6
 * @param nervous dominant is Nervous or dominant score below 0.4
 * @param struggling dominant is Confusion or Frustration or dominant score below 0.3
 * @param compositeConfidence weighted blend of Confidence, Joy, Calmness and Excitement, in [0, 1]
 */
public record ExpressionAssessment(
        String questionId,
        String dominantLabel,
        double dominantScore,
        boolean confident,
        boolean nervous,
        boolean struggling,
        double compositeConfidence
) {
}
