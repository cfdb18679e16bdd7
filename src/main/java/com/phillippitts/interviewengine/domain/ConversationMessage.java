package com.phillippitts.interviewengine.domain;

import java.util.Objects;

/**
 * A chat message handed to the text generation capability.
 *
 * @param role    author role
 * @param content message text
 */
public record ConversationMessage(Speaker role, String content) {

    public ConversationMessage {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static ConversationMessage of(TranscriptEntry entry) {
        return new ConversationMessage(entry.speaker(), entry.text());
    }
}
