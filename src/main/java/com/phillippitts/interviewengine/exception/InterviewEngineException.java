package com.phillippitts.interviewengine.exception;

/**
 * Base exception for all interview engine errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class InterviewEngineException extends RuntimeException {

    public InterviewEngineException(String message) {
        super(message);
    }

    public InterviewEngineException(String message, Throwable cause) {
        super(message, cause);
    }

    public InterviewEngineException(Throwable cause) {
        super(cause);
    }
}
