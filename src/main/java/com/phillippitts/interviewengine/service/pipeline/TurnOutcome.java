package com.phillippitts.interviewengine.service.pipeline;

import com.phillippitts.interviewengine.domain.AudioSegment;
import com.phillippitts.interviewengine.domain.InterestRecord;
import com.phillippitts.interviewengine.domain.Stage;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Result of one audio turn.
 *
 * @param status       how the turn ended
 * @param audio        audio to return to the caller (response, silence, or empty)
 * @param stageBefore  session stage when the turn started
 * @param stageAfter   session stage after the turn
 * @param newInterests interests committed by this turn
 */
public record TurnOutcome(
        Status status,
        AudioSegment audio,
        Stage stageBefore,
        Stage stageAfter,
        List<InterestRecord> newInterests
) {

    /**
     * Turn end states.
     */
    public enum Status {
        /** Full turn committed and synthesized. */
        COMPLETED,
        /** Transcript empty or too short; nothing committed, no audio. */
        SILENT_INPUT,
        /** A capability failed; partial or no commit, silence returned. */
        DEGRADED,
        /** Session ended mid-turn; nothing committed. */
        CANCELLED,
        /** Another turn held the session longer than the queue timeout. */
        REJECTED,
        /** Session already terminated. */
        CLOSED;

        /** Lower-case tag value for metrics. */
        public String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public TurnOutcome {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(audio, "audio");
        newInterests = newInterests == null ? List.of() : List.copyOf(newInterests);
    }

    static TurnOutcome unchanged(Status status, AudioSegment audio, Stage stage) {
        return new TurnOutcome(status, audio, stage, stage, List.of());
    }

    /**
     * True when this turn moved the session into the terminated stage.
     */
    public boolean reachedTerminal() {
        return stageAfter == Stage.TERMINATED && stageBefore != Stage.TERMINATED;
    }
}
