package com.phillippitts.interviewengine.service.capability;

import com.phillippitts.interviewengine.domain.TranscriptEntry;

/**
 * Receives transcript entries as they are committed (live caption feeds, chat relays).
 * Fire-and-forget: failures are logged and never reach the turn.
 */
@FunctionalInterface
public interface TranscriptSink {

    void append(String sessionId, TranscriptEntry entry);
}
