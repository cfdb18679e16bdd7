package com.phillippitts.interviewengine.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * One utterance in a session transcript.
 *
 * <p>Assistant entries always hold the cleaned text, i.e. with interest markers removed.
 *
 * @param speaker   who said it
 * @param text      utterance text (may be empty, never null)
 * @param timestamp when the entry was created
 */
public record TranscriptEntry(Speaker speaker, String text, Instant timestamp) {

    public TranscriptEntry {
        Objects.requireNonNull(speaker, "speaker must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
    }

    public static TranscriptEntry user(String text, Instant at) {
        return new TranscriptEntry(Speaker.USER, text, at);
    }

    public static TranscriptEntry assistant(String text, Instant at) {
        return new TranscriptEntry(Speaker.ASSISTANT, text, at);
    }

    public boolean isUser() {
        return speaker == Speaker.USER;
    }
}
