package com.phillippitts.affectsignal.exception;

/**
 * Thrown when a predictions payload does not have the expected nested shape.
 *
 * <p>Within the fetch loop a schema mismatch means "try again". Only after every fetch
 * attempt has mismatched is it reported, and even then the outcome is an empty vector.
 */
public class SchemaException extends AffectSignalException {

    private final String layer;

    public SchemaException(String layer, String message) {
        super("Unexpected predictions shape at '" + layer + "': " + message);
        this.layer = layer;
    }

    public SchemaException(String layer, String message, Throwable cause) {
        super("Unexpected predictions shape at '" + layer + "': " + message, cause);
        this.layer = layer;
    }

    /**
     * @return name of the payload layer that failed to unwrap
     */
    public String getLayer() {
        return layer;
    }
}
