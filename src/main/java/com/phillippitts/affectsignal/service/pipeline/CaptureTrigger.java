package com.phillippitts.affectsignal.service.pipeline;

import com.phillippitts.affectsignal.domain.QuestionExpression;

import java.util.concurrent.CompletableFuture;

/**
 * Result of triggering a capture.
 *
 * @param questionId question the trigger was for
 * @param duplicate true if the question was already triggered and no new job was started
 * @param expression caller's copy of the future of the stored expression; on duplicates it follows
 *                   the first trigger's result
 */
public record CaptureTrigger(String questionId,
                             boolean duplicate,
                             CompletableFuture<QuestionExpression> expression) {
}
