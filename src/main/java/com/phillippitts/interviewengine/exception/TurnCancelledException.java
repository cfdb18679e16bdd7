package com.phillippitts.interviewengine.exception;

/**
 * Signals that an in-flight turn was abandoned because its session is ending.
 * The turn pipeline catches it and discards the uncommitted draft.
 */
public class TurnCancelledException extends InterviewEngineException {

    private final String sessionId;

    public TurnCancelledException(String sessionId) {
        super("Turn cancelled for session: " + sessionId);
        this.sessionId = sessionId;
    }

    public TurnCancelledException(String sessionId, Throwable cause) {
        super("Turn cancelled for session: " + sessionId, cause);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
