package com.phillippitts.interviewengine.service.session;

import com.phillippitts.interviewengine.domain.InterestRecord;
import com.phillippitts.interviewengine.domain.Stage;
import com.phillippitts.interviewengine.domain.TranscriptEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutations staged by one turn. Nothing here touches the session until
 * {@link InterviewSession#commit(TurnDraft)} applies the whole draft at once.
 *
 * <p>Confined to the thread running the turn; not thread-safe.
 */
public final class TurnDraft {

    private TranscriptEntry userEntry;
    private TranscriptEntry assistantEntry;
    private final List<InterestRecord> newInterests = new ArrayList<>();
    private final List<String> concepts = new ArrayList<>();
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private Stage stage;
    private boolean shouldCreateThread;

    public void stageUser(TranscriptEntry entry) {
        this.userEntry = entry;
    }

    public void stageAssistant(TranscriptEntry entry) {
        this.assistantEntry = entry;
    }

    public void addInterests(Collection<InterestRecord> interests) {
        newInterests.addAll(interests);
    }

    public void addConcepts(Collection<String> extracted) {
        concepts.addAll(extracted);
    }

    public void putAttribute(String key, String value) {
        attributes.put(key, value);
    }

    /**
     * Records the outcome of the stage policy for this turn.
     */
    public void decide(StageDecision decision) {
        this.stage = decision.stage();
        this.shouldCreateThread = decision.shouldCreateThread();
    }

    /**
     * A draft holding only the user entry, used when the response could not be generated.
     */
    public TurnDraft userOnly() {
        TurnDraft partial = new TurnDraft();
        partial.stageUser(userEntry);
        return partial;
    }

    /** Staged entries in transcript order. */
    public List<TranscriptEntry> entries() {
        List<TranscriptEntry> entries = new ArrayList<>(2);
        if (userEntry != null) {
            entries.add(userEntry);
        }
        if (assistantEntry != null) {
            entries.add(assistantEntry);
        }
        return entries;
    }

    public TranscriptEntry userEntry() {
        return userEntry;
    }

    public List<InterestRecord> newInterests() {
        return List.copyOf(newInterests);
    }

    public List<String> concepts() {
        return List.copyOf(concepts);
    }

    public Map<String, String> attributes() {
        return Map.copyOf(attributes);
    }

    /** Stage decided for this turn, or null when the policy has not run. */
    public Stage stage() {
        return stage;
    }

    public boolean shouldCreateThread() {
        return shouldCreateThread;
    }
}
