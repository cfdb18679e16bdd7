package com.phillippitts.interviewengine.domain;

import java.util.List;
import java.util.Map;

/**
 * Full results of a session: transcript, interests, extracted concepts, and hand-off metadata
 * ({@code threadId}, {@code threadCreated}, {@code threadCreationError} and friends).
 */
public record InterviewResult(
        String sessionId,
        String userId,
        String mode,
        Stage stage,
        List<InterestRecord> interests,
        List<TranscriptEntry> transcript,
        List<String> extractedConcepts,
        Map<String, String> metadata,
        double durationSeconds,
        boolean ended
) {

    public InterviewResult {
        interests = List.copyOf(interests);
        transcript = List.copyOf(transcript);
        extractedConcepts = List.copyOf(extractedConcepts);
        metadata = Map.copyOf(metadata);
    }

    public String threadId() {
        return metadata.get(SessionAttributes.THREAD_ID);
    }
}
