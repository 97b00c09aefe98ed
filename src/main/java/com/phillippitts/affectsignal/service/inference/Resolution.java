package com.phillippitts.affectsignal.service.inference;

import com.phillippitts.affectsignal.domain.EmotionVector;
import com.phillippitts.affectsignal.exception.AffectSignalException;

import java.util.Locale;
import java.util.Objects;

/**
 * Terminal outcome of resolving one image through the inference service.
 *
 * <p>Only {@link Outcome#COMPLETED} carries a usable vector. {@code EMPTY} (no face detected),
 * {@code FAILED} and {@code TIMED_OUT} are handled identically by callers: they fall back to a
 * synthetic vector.
 *
 * @param outcome terminal outcome
 * @param vector raw (not yet normalized) vector; empty unless outcome is COMPLETED
 * @param jobId job identifier, or null if submission never produced one
 * @param pollAttempts number of status checks performed
 * @param elapsedMs time since submission in milliseconds
 * @param cause diagnostic cause for FAILED, TIMED_OUT and schema-driven EMPTY outcomes (nullable)
 */
public record Resolution(
        Outcome outcome,
        EmotionVector vector,
        String jobId,
        int pollAttempts,
        long elapsedMs,
        AffectSignalException cause
) {

    public enum Outcome { COMPLETED, EMPTY, FAILED, TIMED_OUT }

    public Resolution {
        Objects.requireNonNull(outcome, "outcome");
        vector = vector == null ? EmotionVector.empty() : vector;
        if (outcome == Outcome.COMPLETED && vector.isEmpty()) {
            throw new IllegalArgumentException("COMPLETED resolution requires a non-empty vector");
        }
    }

    public static Resolution completed(EmotionVector vector, String jobId, int pollAttempts, long elapsedMs) {
        return new Resolution(Outcome.COMPLETED, vector, jobId, pollAttempts, elapsedMs, null);
    }

    public static Resolution empty(String jobId, int pollAttempts, long elapsedMs, AffectSignalException cause) {
        return new Resolution(Outcome.EMPTY, EmotionVector.empty(), jobId, pollAttempts, elapsedMs, cause);
    }

    public static Resolution failed(String jobId, int pollAttempts, long elapsedMs, AffectSignalException cause) {
        return new Resolution(Outcome.FAILED, EmotionVector.empty(), jobId, pollAttempts, elapsedMs, cause);
    }

    public static Resolution timedOut(String jobId, int pollAttempts, long elapsedMs, AffectSignalException cause) {
        return new Resolution(Outcome.TIMED_OUT, EmotionVector.empty(), jobId, pollAttempts, elapsedMs, cause);
    }

    /**
     * @return true if the vector should be recorded as a real expression
     */
    public boolean hasSignal() {
        return outcome == Outcome.COMPLETED;
    }

    /**
     * Short lower-case tag for logs and metrics: completed, empty, failed, timed_out.
     */
    public String tag() {
        return outcome.name().toLowerCase(Locale.ROOT);
    }
}
