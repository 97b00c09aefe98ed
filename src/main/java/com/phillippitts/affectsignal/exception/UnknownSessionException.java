package com.phillippitts.affectsignal.exception;

/**
 * Thrown when a request refers to a session that was never opened or is already closed.
 */
public class UnknownSessionException extends AffectSignalException {

    private final String sessionId;

    public UnknownSessionException(String sessionId) {
        super("No active session: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
