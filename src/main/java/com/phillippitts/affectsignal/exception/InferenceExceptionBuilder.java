package com.phillippitts.affectsignal.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link SubmissionException} with contextual information.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * // Rejected by the service
 * throw InferenceExceptionBuilder.create("Job submission rejected")
 *         .statusCode(401)
 *         .durationMs(120)
 *         .metadata("body", LogSanitizer.truncate(body, 200))
 *         .build();
 *
 * // Transport failure
 * throw InferenceExceptionBuilder.create("Job submission failed")
 *         .cause(ioException)
 *         .metadata("baseUrl", baseUrl)
 *         .build();
 * </pre>
 */
public final class InferenceExceptionBuilder {

    private final String message;
    private Throwable cause;
    private Integer statusCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private InferenceExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static InferenceExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new InferenceExceptionBuilder(message);
    }

    public InferenceExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the HTTP status returned by the inference service.
     *
     * @param statusCode HTTP status code
     * @return this builder for chaining
     */
    public InferenceExceptionBuilder statusCode(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    public InferenceExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public InferenceExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. The final message format is:
     * <pre>
     * {message} (status={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @return constructed SubmissionException
     */
    public SubmissionException build() {
        String detailedMessage = buildDetailedMessage();
        int status = statusCode != null ? statusCode : -1;
        if (cause != null) {
            return new SubmissionException(detailedMessage, status, cause);
        }
        return new SubmissionException(detailedMessage, status);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = statusCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (statusCode != null) {
            sb.append("status=").append(statusCode);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        return sb.append(")").toString();
    }
}
