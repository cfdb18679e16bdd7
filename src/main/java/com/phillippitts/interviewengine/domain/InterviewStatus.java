package com.phillippitts.interviewengine.domain;

import java.time.Instant;

/**
 * Point-in-time view of an active session.
 *
 * @param sessionId       session id
 * @param stage           current stage
 * @param interestsCount  number of distinct interests detected so far
 * @param turns           transcript entries (user and assistant)
 * @param durationSeconds seconds since the session started
 * @param startedAt       start instant
 */
public record InterviewStatus(
        String sessionId,
        Stage stage,
        int interestsCount,
        int turns,
        double durationSeconds,
        Instant startedAt
) {
}
