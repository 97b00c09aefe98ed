package com.phillippitts.affectsignal.service.inference;

/**
 * Lifecycle of one remote inference job.
 *
 * <pre>
 * SUBMITTED → RUNNING → { COMPLETED, FAILED, TIMED_OUT }
 * </pre>
 * TIMED_OUT is assigned locally; the service itself only reports the other states.
 */
public enum JobState {
    SUBMITTED,
    RUNNING,
    COMPLETED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMED_OUT;
    }
}
