package com.phillippitts.affectsignal.domain;

import java.util.Objects;

/**
 * Identifies one capture: which round, which question, and the question's position in the round.
 *
 * @param roundId round identifier (e.g. "technical", "core", "hr")
 * @param questionId question identifier, unique within a session
 * @param ordinal zero-based position of the question within its round
 */
public record CaptureKey(String roundId, String questionId, int ordinal) {

    public CaptureKey {
        Objects.requireNonNull(roundId, "roundId");
        Objects.requireNonNull(questionId, "questionId");
        if (roundId.isBlank()) {
            throw new IllegalArgumentException("roundId must not be blank");
        }
        if (questionId.isBlank()) {
            throw new IllegalArgumentException("questionId must not be blank");
        }
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must be >= 0, got: " + ordinal);
        }
    }

    /**
     * Stable text form used to seed synthetic vectors: {@code questionId|roundId|ordinal}.
     */
    public String seedText() {
        return questionId + "|" + roundId + "|" + ordinal;
    }
}
