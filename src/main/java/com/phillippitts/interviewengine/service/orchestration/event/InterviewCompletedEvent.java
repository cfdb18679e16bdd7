package com.phillippitts.interviewengine.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted when a session reaches the terminated stage, after thread preparation (if requested)
 * has run.
 *
 * @param sessionId       completed session
 * @param userId          session owner
 * @param threadRequested whether the session asked for a learning thread
 * @param threadId        created thread id, or null when none was created
 * @param timestamp       completion time
 */
public record InterviewCompletedEvent(
        String sessionId,
        String userId,
        boolean threadRequested,
        String threadId,
        Instant timestamp
) {}
