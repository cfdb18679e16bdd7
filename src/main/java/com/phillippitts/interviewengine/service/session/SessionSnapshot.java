package com.phillippitts.interviewengine.service.session;

import com.phillippitts.interviewengine.domain.InterestRecord;
import com.phillippitts.interviewengine.domain.Stage;
import com.phillippitts.interviewengine.domain.TranscriptEntry;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable copy of an {@link InterviewSession} taken under the session lock.
 */
public record SessionSnapshot(
        String sessionId,
        String userId,
        String mode,
        String purpose,
        String authToken,
        Instant startedAt,
        Instant endedAt,
        List<TranscriptEntry> transcript,
        List<InterestRecord> interests,
        Stage stage,
        boolean shouldCreateThread,
        List<String> extractedConcepts,
        Map<String, String> attributes
) {

    public SessionSnapshot {
        transcript = List.copyOf(transcript);
        interests = List.copyOf(interests);
        extractedConcepts = List.copyOf(extractedConcepts);
        attributes = Map.copyOf(attributes);
    }

    /** User plus assistant entries. */
    public int turnCount() {
        return transcript.size();
    }

    public List<String> interestNames() {
        return interests.stream().map(InterestRecord::name).collect(Collectors.toList());
    }

    public List<String> userUtterances() {
        return transcript.stream()
                .filter(TranscriptEntry::isUser)
                .map(TranscriptEntry::text)
                .collect(Collectors.toList());
    }

    public List<String> allUtterances() {
        return transcript.stream().map(TranscriptEntry::text).collect(Collectors.toList());
    }

    public Optional<String> firstUserUtterance() {
        return transcript.stream().filter(TranscriptEntry::isUser).map(TranscriptEntry::text).findFirst();
    }

    public boolean isEnded() {
        return endedAt != null;
    }

    public String attribute(String key) {
        return attributes.get(key);
    }
}
