package com.phillippitts.affectsignal.exception;

/**
 * Base exception for all affect-signal application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class AffectSignalException extends RuntimeException {

    public AffectSignalException(String message) {
        super(message);
    }

    public AffectSignalException(String message, Throwable cause) {
        super(message, cause);
    }

    public AffectSignalException(Throwable cause) {
        super(cause);
    }
}
