package com.phillippitts.interviewengine.service.session;

import com.phillippitts.interviewengine.exception.SessionNotFoundException;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Active sessions keyed by id.
 *
 * <p>Created at application start and torn down with the context: {@link #shutdown()} cancels
 * every in-flight turn and drops all sessions. Each key is updated atomically; a session stays
 * registered until its end hand-off has finished.
 */
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final ConcurrentMap<String, SessionHandle> sessions = new ConcurrentHashMap<>();

    /**
     * Registers a new session.
     *
     * @throws IllegalStateException if the id is already registered
     */
    public SessionHandle register(InterviewSession session) {
        Objects.requireNonNull(session, "session must not be null");
        SessionHandle handle = new SessionHandle(session);
        SessionHandle existing = sessions.putIfAbsent(session.getId(), handle);
        if (existing != null) {
            throw new IllegalStateException("Session id already registered: " + session.getId());
        }
        return handle;
    }

    public Optional<SessionHandle> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * @throws SessionNotFoundException if no active session has this id
     */
    public SessionHandle require(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Removes the entry only if it still maps to {@code handle}.
     */
    public boolean remove(String sessionId, SessionHandle handle) {
        return sessions.remove(sessionId, handle);
    }

    public int size() {
        return sessions.size();
    }

    public Collection<SessionHandle> handles() {
        return List.copyOf(sessions.values());
    }

    @PreDestroy
    public void shutdown() {
        List<SessionHandle> remaining = new ArrayList<>(sessions.values());
        if (!remaining.isEmpty()) {
            LOG.info("Cancelling {} active interview session(s) on shutdown", remaining.size());
        }
        remaining.forEach(SessionHandle::cancel);
        sessions.clear();
    }
}
