package com.phillippitts.affectsignal.service.pipeline.event;

import com.phillippitts.affectsignal.domain.QuestionExpression;
import com.phillippitts.affectsignal.service.inference.Resolution;

import java.time.Instant;
import java.util.Objects;

/**
 * Published after an expression has been written to a session's store.
 *
 * @param sessionId owning session
 * @param expression the stored expression
 * @param outcome how the inference attempt ended; any outcome other than COMPLETED means the
 *                expression is synthetic
 * @param recordedAt when the write happened
 */
public record ExpressionRecordedEvent(String sessionId,
                                      QuestionExpression expression,
                                      Resolution.Outcome outcome,
                                      Instant recordedAt) {

    public ExpressionRecordedEvent {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(recordedAt, "recordedAt");
    }
}
