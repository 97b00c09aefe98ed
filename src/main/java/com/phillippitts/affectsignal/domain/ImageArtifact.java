package com.phillippitts.affectsignal.domain;

import java.util.Objects;

/**
 * A captured frame handed to the inference service.
 *
 * <p>Ephemeral: the submitting call owns it and drops its reference as soon as the submission
 * returns. The payload is not copied.
 */
public final class ImageArtifact {

    public static final String DEFAULT_FILE_NAME = "frame.jpg";

    private final byte[] payload;
    private final String mimeType;
    private final String fileName;

    public ImageArtifact(byte[] payload, String mimeType) {
        this(payload, mimeType, DEFAULT_FILE_NAME);
    }

    /**
     * @throws NullPointerException if payload or mimeType is null
     * @throws IllegalArgumentException if payload is empty
     */
    public ImageArtifact(byte[] payload, String mimeType, String fileName) {
        this.payload = Objects.requireNonNull(payload, "payload");
        this.mimeType = Objects.requireNonNull(mimeType, "mimeType");
        if (payload.length == 0) {
            throw new IllegalArgumentException("image payload must not be empty");
        }
        this.fileName = fileName == null || fileName.isBlank() ? DEFAULT_FILE_NAME : fileName;
    }

    public byte[] payload() {
        return payload;
    }

    public String mimeType() {
        return mimeType;
    }

    public String fileName() {
        return fileName;
    }

    public int size() {
        return payload.length;
    }

    @Override
    public String toString() {
        return "ImageArtifact[" + fileName + ", " + mimeType + ", " + payload.length + " bytes]";
    }
}
