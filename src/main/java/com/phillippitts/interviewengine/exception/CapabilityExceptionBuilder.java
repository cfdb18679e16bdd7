package com.phillippitts.interviewengine.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link CapabilityException} with contextual details appended to the message.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw CapabilityExceptionBuilder.create("Chat completion failed")
 *         .capability("llm")
 *         .cause(ex)
 *         .metadata("status", response.getStatusCode().value())
 *         .build();
 *
 * throw CapabilityExceptionBuilder.create("Capability timed out")
 *         .capability("stt")
 *         .reason("timeout")
 *         .durationMs(15000)
 *         .build();
 * </pre>
 */
public final class CapabilityExceptionBuilder {

    private final String message;
    private String capability;
    private String reason = "error";
    private Throwable cause;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private CapabilityExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static CapabilityExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new CapabilityExceptionBuilder(message);
    }

    public CapabilityExceptionBuilder capability(String capability) {
        this.capability = capability;
        return this;
    }

    public CapabilityExceptionBuilder reason(String reason) {
        if (reason != null && !reason.isBlank()) {
            this.reason = reason;
        }
        return this;
    }

    public CapabilityExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public CapabilityExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public CapabilityExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (durationMs={ms}, {key1}={val1}, ...) (capability: {capability})
     * </pre>
     */
    public CapabilityException build() {
        String name = capability != null ? capability : "unknown";
        String detailed = buildDetailedMessage();
        if (cause != null) {
            return new CapabilityException(detailed, name, reason, cause);
        }
        return new CapabilityException(detailed, name, reason);
    }

    private String buildDetailedMessage() {
        if (durationMs == null && metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (durationMs != null) {
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
