package com.phillippitts.interviewengine.exception;

/**
 * Thrown when an operation names a session id that is not (or no longer) registered.
 */
public class SessionNotFoundException extends InterviewEngineException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Interview session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
