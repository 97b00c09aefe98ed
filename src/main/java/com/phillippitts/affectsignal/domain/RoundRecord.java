package com.phillippitts.affectsignal.domain;

import java.util.List;
import java.util.Objects;

/**
 * Expressions of one round, in capture order.
 *
 * @param roundId round identifier
 * @param expressions expressions sharing {@code roundId}, ordered by capture trigger
 */
public record RoundRecord(String roundId, List<QuestionExpression> expressions) {

    public RoundRecord {
        Objects.requireNonNull(roundId, "roundId");
        expressions = expressions == null ? List.of() : List.copyOf(expressions);
        for (QuestionExpression e : expressions) {
            if (!roundId.equals(e.roundId())) {
                throw new IllegalArgumentException(
                        "expression " + e.questionId() + " belongs to round " + e.roundId() + ", not " + roundId);
            }
        }
    }

    public static RoundRecord empty(String roundId) {
        return new RoundRecord(roundId, List.of());
    }

    public int size() {
        return expressions.size();
    }

    public boolean isEmpty() {
        return expressions.isEmpty();
    }
}
