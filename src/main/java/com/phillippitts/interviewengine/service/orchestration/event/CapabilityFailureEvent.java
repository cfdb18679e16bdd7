package com.phillippitts.interviewengine.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted whenever a capability call fails or times out.
 *
 * @param capability capability name (stt, llm, tts, thread-creation, analytics)
 * @param reason     timeout, error, unavailable or interrupted
 * @param sessionId  session the call was made for; null when not session-bound
 * @param message    failure message, safe to log
 * @param timestamp  failure time
 */
public record CapabilityFailureEvent(
        String capability,
        String reason,
        String sessionId,
        String message,
        Instant timestamp
) {}
