package com.phillippitts.affectsignal.exception;

/**
 * Describes a job that did not reach a terminal state before its deadline or its poll budget ran out.
 *
 * <p>This is a defined terminal outcome, not a failure of the caller. It is carried as the
 * cause of a timed-out {@code Resolution} for diagnostics and never thrown to the session layer.
 */
public class PollTimeoutException extends AffectSignalException {

    private final String jobId;
    private final long elapsedMs;

    public PollTimeoutException(String jobId, long elapsedMs, String reason) {
        super("Inference job " + jobId + " not resolved after " + elapsedMs + " ms (" + reason + ")");
        this.jobId = jobId;
        this.elapsedMs = elapsedMs;
    }

    public String getJobId() {
        return jobId;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }
}
