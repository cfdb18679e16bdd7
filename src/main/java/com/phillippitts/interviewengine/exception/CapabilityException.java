package com.phillippitts.interviewengine.exception;

/**
 * Thrown when an external capability (speech-to-text, text generation, speech synthesis,
 * thread creation, analytics) fails, times out, or is not configured.
 */
public class CapabilityException extends InterviewEngineException {

    private final String capability;
    private final String reason;

    public CapabilityException(String message, String capability) {
        this(message, capability, "error");
    }

    public CapabilityException(String message, String capability, String reason) {
        super(message + " (capability: " + capability + ")");
        this.capability = capability;
        this.reason = reason;
    }

    public CapabilityException(String message, String capability, String reason, Throwable cause) {
        super(message + " (capability: " + capability + ")", cause);
        this.capability = capability;
        this.reason = reason;
    }

    public String getCapability() {
        return capability;
    }

    /**
     * Short failure category used as a metric tag: "timeout", "error", "unavailable" or
     * "interrupted".
     */
    public String getReason() {
        return reason;
    }
}
