package com.phillippitts.interviewengine.service.session;

import com.phillippitts.interviewengine.domain.InterestRecord;
import com.phillippitts.interviewengine.domain.Stage;
import com.phillippitts.interviewengine.domain.TranscriptEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable interview session aggregate.
 *
 * <p>State is guarded by an internal lock. Readers get immutable {@link SessionSnapshot}s;
 * writers go through {@link #commit(TurnDraft)} (one turn, all or nothing) or
 * {@link #putAttribute(String, String)} (hand-off results).
 *
 * <p><b>Invariants:</b> the transcript only grows, interest names are unique, the stage
 * never moves backwards, and {@code shouldCreateThread} is never cleared once set.
 */
public final class InterviewSession {

    private final Lock lock = new ReentrantLock();

    private final String id;
    private final String userId;
    private final String mode;
    private final String purpose;
    private final String authToken;
    private final Instant startedAt;

    private Instant endedAt;
    private Stage stage = Stage.GREETING;
    private boolean shouldCreateThread;
    private final List<TranscriptEntry> transcript = new ArrayList<>();
    private final Map<String, InterestRecord> interests = new LinkedHashMap<>();
    private final List<String> extractedConcepts = new ArrayList<>();
    private final Map<String, String> attributes = new LinkedHashMap<>();

    public InterviewSession(String id, String userId, String mode, String purpose, String authToken,
                            Instant startedAt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.userId = Objects.requireNonNull(userId, "userId must not be null");
        this.mode = mode;
        this.purpose = purpose;
        this.authToken = authToken;
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
    }

    public String getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public SessionSnapshot snapshot() {
        lock.lock();
        try {
            return new SessionSnapshot(id, userId, mode, purpose, authToken, startedAt, endedAt,
                    transcript, new ArrayList<>(interests.values()), stage, shouldCreateThread,
                    extractedConcepts, attributes);
        } finally {
            lock.unlock();
        }
    }

    public Stage getStage() {
        lock.lock();
        try {
            return stage;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies every mutation staged in {@code draft} in one critical section.
     *
     * @return the interests that were actually added (names already present are skipped)
     */
    public List<InterestRecord> commit(TurnDraft draft) {
        Objects.requireNonNull(draft, "draft must not be null");
        lock.lock();
        try {
            transcript.addAll(draft.entries());
            List<InterestRecord> added = new ArrayList<>();
            for (InterestRecord interest : draft.newInterests()) {
                if (interests.putIfAbsent(interest.name(), interest) == null) {
                    added.add(interest);
                }
            }
            extractedConcepts.addAll(draft.concepts());
            attributes.putAll(draft.attributes());
            Stage next = draft.stage();
            if (next != null && next.compareTo(stage) > 0) {
                stage = next;
            }
            shouldCreateThread = shouldCreateThread || draft.shouldCreateThread();
            return added;
        } finally {
            lock.unlock();
        }
    }

    public void putAttribute(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        lock.lock();
        try {
            if (value == null) {
                attributes.remove(key);
            } else {
                attributes.put(key, value);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sets an attribute only if the key is not present yet.
     *
     * @return true if this call stored the value
     */
    public boolean putAttributeIfAbsent(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        lock.lock();
        try {
            return attributes.putIfAbsent(key, value) == null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records the end time. Later calls keep the first value.
     */
    public void markEnded(Instant at) {
        lock.lock();
        try {
            if (endedAt == null) {
                endedAt = at;
            }
        } finally {
            lock.unlock();
        }
    }
}
