package com.phillippitts.interviewengine.service.orchestration.event;

import com.phillippitts.interviewengine.domain.InterestRecord;

/**
 * Emitted once per newly detected interest, after the turn that found it has been committed.
 *
 * @param sessionId owning session
 * @param userId    session owner
 * @param interest  the new interest
 */
public record InterestDetectedEvent(
        String sessionId,
        String userId,
        InterestRecord interest
) {}
