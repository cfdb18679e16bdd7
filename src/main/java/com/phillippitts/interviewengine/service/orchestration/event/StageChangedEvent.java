package com.phillippitts.interviewengine.service.orchestration.event;

import com.phillippitts.interviewengine.domain.Stage;

import java.time.Instant;

/**
 * Emitted when a committed turn moves a session to a later stage.
 */
public record StageChangedEvent(
        String sessionId,
        Stage from,
        Stage to,
        Instant timestamp
) {}
