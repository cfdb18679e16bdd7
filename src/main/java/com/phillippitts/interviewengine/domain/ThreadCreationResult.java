package com.phillippitts.interviewengine.domain;

import java.util.Objects;

/**
 * Identifier returned by the learning-thread service for a created thread.
 */
public record ThreadCreationResult(String threadId) {

    public ThreadCreationResult {
        Objects.requireNonNull(threadId, "threadId must not be null");
    }
}
