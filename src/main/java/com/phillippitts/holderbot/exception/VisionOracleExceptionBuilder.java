package com.phillippitts.holderbot.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing VisionOracleException with contextual information.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw VisionOracleExceptionBuilder.create("Oracle returned error status")
 *         .region("main-junction")
 *         .status(429)
 *         .durationMs(1200)
 *         .metadata("model", "gpt-4o")
 *         .build();
 * </pre>
 */
public final class VisionOracleExceptionBuilder {

    private final String message;
    private String region;
    private Throwable cause;
    private Integer status;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private VisionOracleExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static VisionOracleExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new VisionOracleExceptionBuilder(message);
    }

    public VisionOracleExceptionBuilder region(String region) {
        this.region = region;
        return this;
    }

    public VisionOracleExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the HTTP status the oracle answered with.
     */
    public VisionOracleExceptionBuilder status(int status) {
        this.status = status;
        return this;
    }

    public VisionOracleExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public VisionOracleExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (status={status}, durationMs={ms}, {key1}={val1}, ...) (region: {region})
     * </pre>
     */
    public VisionOracleException build() {
        String detailed = buildDetailedMessage();
        String r = region != null ? region : "unknown";
        int s = status != null ? status : -1;
        if (cause != null) {
            return new VisionOracleException(detailed, r, s, cause);
        }
        return new VisionOracleException(detailed, r, s);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = status != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (status != null) {
            sb.append("status=").append(status);
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

        sb.append(")");
        return sb.toString();
    }
}
