package com.phillippitts.interviewengine.service.orchestration.event;

import com.phillippitts.interviewengine.domain.TranscriptEntry;

/**
 * Emitted for each transcript entry committed to a session; forwarded to the transcript sink.
 *
 * @param sessionId owning session
 * @param entry     the committed entry
 */
public record TranscriptEntryAppendedEvent(
        String sessionId,
        TranscriptEntry entry
) {}
