package com.phillippitts.interviewengine.domain;

import java.util.List;

/**
 * Best-effort analytics record submitted when a session ends.
 */
public record InterviewSummary(
        String userId,
        String sessionId,
        List<InterestRecord> interests,
        List<TranscriptEntry> transcript,
        double durationSeconds
) {

    public InterviewSummary {
        interests = List.copyOf(interests);
        transcript = List.copyOf(transcript);
    }
}
