package com.phillippitts.affectsignal.exception;

/**
 * Thrown when the remote inference service rejects a job submission outright
 * (transport failure, authentication rejection, or a response without a job id).
 *
 * <p>Not retried at the client layer. The pipeline treats it as an immediate trigger
 * for the fallback synthesizer.
 */
public class SubmissionException extends AffectSignalException {

    private final int statusCode;

    public SubmissionException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public SubmissionException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public SubmissionException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return HTTP status returned by the service, or {@code -1} when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
