package com.phillippitts.affectsignal.exception;

/**
 * Thrown when an expression is written for a question that already has one.
 *
 * <p>Writes are one-shot. This signals a caller-side protocol violation (capturing twice for
 * the same question) and is the only pipeline error that propagates to callers.
 */
public class DuplicateKeyException extends AffectSignalException {

    private final String questionId;

    public DuplicateKeyException(String questionId) {
        super("Expression already recorded for question: " + questionId);
        this.questionId = questionId;
    }

    public String getQuestionId() {
        return questionId;
    }
}
