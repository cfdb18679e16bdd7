package com.phillippitts.interviewengine.exception;

/**
 * Thrown when a required setting is missing or unusable, most notably the relay credential
 * secret. Raised at startup so the application refuses to run rather than issue credentials
 * with an unknown key.
 */
public class InterviewConfigurationException extends InterviewEngineException {

    private final String property;

    public InterviewConfigurationException(String property, String message) {
        super(message + " (property: " + property + ")");
        this.property = property;
    }

    public InterviewConfigurationException(String property, String message, Throwable cause) {
        super(message + " (property: " + property + ")", cause);
        this.property = property;
    }

    public String getProperty() {
        return property;
    }
}
