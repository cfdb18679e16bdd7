package com.phillippitts.interviewengine.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/** Author of a transcript entry; the wire name doubles as the chat role. */
public enum Speaker {
    USER("user"),
    ASSISTANT("assistant");

    private final String role;

    Speaker(String role) {
        this.role = role;
    }

    @JsonValue
    public String role() {
        return role;
    }
}
