package com.phillippitts.interviewengine.service.session;

import com.phillippitts.interviewengine.domain.InterviewResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Keeps final results of ended sessions for a bounded time so callers can still read them
 * (including the thread id recorded by the hand-off) after {@code endSession}.
 */
public class CompletedResultsStore {

    private static final Logger LOG = LogManager.getLogger(CompletedResultsStore.class);

    private final ConcurrentMap<String, Retained> results = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration retention;

    public CompletedResultsStore(Clock clock, Duration retention) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.retention = Objects.requireNonNull(retention, "retention");
    }

    public void retain(InterviewResult result) {
        results.put(result.sessionId(), new Retained(result, clock.instant().plus(retention)));
    }

    public Optional<InterviewResult> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        Retained retained = results.get(sessionId);
        if (retained == null) {
            return Optional.empty();
        }
        if (retained.isExpired(clock.instant())) {
            results.remove(sessionId, retained);
            return Optional.empty();
        }
        return Optional.of(retained.result());
    }

    public int size() {
        return results.size();
    }

    /**
     * Drops expired results.
     */
    @Scheduled(fixedDelayString = "${interview.results.purge-interval-ms:60000}")
    public void purgeExpired() {
        Instant now = clock.instant();
        int before = results.size();
        results.values().removeIf(r -> r.isExpired(now));
        int purged = before - results.size();
        if (purged > 0) {
            LOG.debug("Purged {} expired interview result(s)", purged);
        }
    }

    private record Retained(InterviewResult result, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
