package com.phillippitts.interviewengine.service.session;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry entry for one active session: the aggregate plus its turn-serialization and
 * cancellation state.
 *
 * <p>Turns for a session hold the fair {@code turnLock} for their whole duration, so they run
 * one at a time in arrival order. Capability calls made during a turn are tracked so that
 * {@link #cancel()} can interrupt them when the session ends.
 */
public final class SessionHandle {

    private final InterviewSession session;
    private final ReentrantLock turnLock = new ReentrantLock(true);
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean tearingDown = new AtomicBoolean();
    private volatile boolean cancelled;

    public SessionHandle(InterviewSession session) {
        this.session = Objects.requireNonNull(session, "session must not be null");
    }

    public InterviewSession session() {
        return session;
    }

    public String sessionId() {
        return session.getId();
    }

    /**
     * Waits up to {@code wait} for the turn lock.
     *
     * @return true if the caller now owns the turn
     */
    public boolean tryBeginTurn(Duration wait) throws InterruptedException {
        return turnLock.tryLock(wait.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Blocks until the current turn (if any) finishes. Used by teardown after {@link #cancel()}.
     */
    public void awaitTurnLock() {
        turnLock.lock();
    }

    public void endTurn() {
        turnLock.unlock();
    }

    /**
     * Claims teardown for the caller. Only the first caller wins.
     */
    public boolean beginTeardown() {
        return tearingDown.compareAndSet(false, true);
    }

    /**
     * Marks the session cancelled and interrupts every tracked capability call.
     */
    public void cancel() {
        cancelled = true;
        for (Future<?> future : inFlight) {
            future.cancel(true);
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void track(Future<?> future) {
        inFlight.add(future);
        if (cancelled) {
            future.cancel(true);
        }
    }

    public void untrack(Future<?> future) {
        inFlight.remove(future);
    }

    public int inFlightCount() {
        return inFlight.size();
    }
}
