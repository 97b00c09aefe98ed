package com.phillippitts.affectsignal.service.aggregate;

import java.util.List;
import java.util.Objects;

/**
 * Per-round and session-wide statistics plus per-question assessments.
 *
 * @param rounds one report per round, ordered by first capture
 * @param overall statistics over every expression of the session (not an average of rounds)
 * @param assessments one assessment per expression, in capture order
 * @param confidentCount questions assessed as confident
 * @param nervousCount questions assessed as nervous
 * @param strugglingCount questions assessed as struggling
 */
public record SessionReport(
        List<RoundReport> rounds,
        RoundReport overall,
        List<ExpressionAssessment> assessments,
        int confidentCount,
        int nervousCount,
        int strugglingCount
) {

    public SessionReport {
        Objects.requireNonNull(overall, "overall");
        rounds = rounds == null ? List.of() : List.copyOf(rounds);
        assessments = assessments == null ? List.of() : List.copyOf(assessments);
    }
}
