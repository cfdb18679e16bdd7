package com.phillippitts.interviewengine.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Interview stages in the order a session moves through them.
 *
 * <p>Stages only advance, one step per completed turn; {@link #TERMINATED} is absorbing.
 */
public enum Stage {
    GREETING("greeting"),
    EXPLORATION("exploration"),
    DEEP_DIVE("deep_dive"),
    WRAP_UP("wrap_up"),
    TERMINATED("terminated");

    private final String wireName;

    Stage(String wireName) {
        this.wireName = wireName;
    }

    /** Lower-case name used in status views and prompts. */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == TERMINATED;
    }

    /**
     * Resolves a stage from its wire name.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static Stage fromWireName(String name) {
        return Arrays.stream(values())
                .filter(s -> s.wireName.equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown stage: " + name));
    }
}
