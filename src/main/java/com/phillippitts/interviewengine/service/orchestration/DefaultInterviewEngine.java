package com.phillippitts.interviewengine.service.orchestration;

import com.phillippitts.interviewengine.config.properties.InterviewProperties;
import com.phillippitts.interviewengine.domain.AudioSegment;
import com.phillippitts.interviewengine.domain.InterviewResult;
import com.phillippitts.interviewengine.domain.InterviewStatus;
import com.phillippitts.interviewengine.domain.RelayCredential;
import com.phillippitts.interviewengine.domain.SessionAttributes;
import com.phillippitts.interviewengine.exception.SessionNotFoundException;
import com.phillippitts.interviewengine.service.credential.RelayCredentialIssuer;
import com.phillippitts.interviewengine.service.handoff.HandoffService;
import com.phillippitts.interviewengine.service.orchestration.event.InterviewCompletedEvent;
import com.phillippitts.interviewengine.service.pipeline.TurnOutcome;
import com.phillippitts.interviewengine.service.pipeline.TurnPipeline;
import com.phillippitts.interviewengine.service.session.CompletedResultsStore;
import com.phillippitts.interviewengine.service.session.InterviewSession;
import com.phillippitts.interviewengine.service.session.SessionHandle;
import com.phillippitts.interviewengine.service.session.SessionRegistry;
import com.phillippitts.interviewengine.service.session.SessionSnapshot;
import com.phillippitts.interviewengine.service.session.SessionStateMachine;
import com.phillippitts.interviewengine.util.TimeUtils;
import org.apache.logging.log4j.CloseableThreadContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Default {@link InterviewEngine}: registry-backed sessions, per-session turn serialization,
 * and end-of-session hand-off.
 *
 * <p><b>Turn flow:</b> the caller thread takes the session's fair turn lock (waiting at most
 * {@code interview.turn.queue-timeout}), runs the {@link TurnPipeline}, and, when the turn moved
 * the session into the terminated stage, prepares and creates the learning thread before
 * publishing {@link InterviewCompletedEvent}.
 *
 * <p><b>Teardown:</b> {@link #endSession(String)} cancels in-flight capability calls, waits for
 * the turn lock, runs the thread hand-off (if still pending) and the analytics hand-off, retains
 * the final results, and only then removes the session from the registry.
 *
 * <p>Construct via {@link InterviewEngineBuilder}.
 */
public final class DefaultInterviewEngine implements InterviewEngine {

    private static final Logger LOG = LogManager.getLogger(DefaultInterviewEngine.class);

    private static final String MDC_SESSION_ID = "sessionId";
    private static final String MDC_USER_ID = "userId";

    private final SessionRegistry registry;
    private final CompletedResultsStore completedResults;
    private final TurnPipeline pipeline;
    private final SessionStateMachine stateMachine;
    private final HandoffService handoff;
    private final RelayCredentialIssuer credentialIssuer;
    private final InterviewProperties props;
    private final ApplicationEventPublisher publisher;
    private final InterviewMetricsPublisher metrics;
    private final Clock clock;
    private final Supplier<String> idGenerator;

    DefaultInterviewEngine(InterviewEngineBuilder b) {
        this.registry = Objects.requireNonNull(b.registry, "registry");
        this.completedResults = Objects.requireNonNull(b.completedResults, "completedResults");
        this.pipeline = Objects.requireNonNull(b.pipeline, "pipeline");
        this.stateMachine = Objects.requireNonNull(b.stateMachine, "stateMachine");
        this.handoff = Objects.requireNonNull(b.handoff, "handoff");
        this.credentialIssuer = Objects.requireNonNull(b.credentialIssuer, "credentialIssuer");
        this.props = Objects.requireNonNull(b.props, "props");
        this.publisher = Objects.requireNonNull(b.publisher, "publisher");
        this.metrics = b.metrics == null ? InterviewMetricsPublisher.NOOP : b.metrics;
        this.clock = b.clock == null ? Clock.systemUTC() : b.clock;
        this.idGenerator = b.idGenerator == null ? () -> UUID.randomUUID().toString() : b.idGenerator;
    }

    @Override
    public String startSession(String userId, String mode, String purpose, String authToken) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        String effectivePurpose = (purpose == null || purpose.isBlank()) ? props.getDefaultPurpose() : purpose;
        InterviewSession session = new InterviewSession(idGenerator.get(), userId, mode, effectivePurpose,
                authToken, clock.instant());
        registry.register(session);
        metrics.recordSessionStarted();
        try (CloseableThreadContext.Instance ctc = sessionContext(session)) {
            LOG.info("Interview session started: mode={}, active={}", mode, registry.size());
        }
        return session.getId();
    }

    @Override
    public AudioSegment submitAudioTurn(String sessionId, AudioSegment audio) {
        Objects.requireNonNull(audio, "audio");
        SessionHandle handle = registry.require(sessionId);
        try (CloseableThreadContext.Instance ctc = sessionContext(handle.session())) {
            long start = System.nanoTime();
            boolean acquired;
            try {
                acquired = handle.tryBeginTurn(props.getTurn().getQueueTimeout());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return silence(audio);
            }
            if (!acquired) {
                LOG.warn("Turn rejected: session busy for longer than {}", props.getTurn().getQueueTimeout());
                metrics.recordTurn(TurnOutcome.Status.REJECTED.tag(), System.nanoTime() - start);
                return silence(audio);
            }
            try {
                if (handle.isCancelled()) {
                    metrics.recordTurn(TurnOutcome.Status.CANCELLED.tag(), System.nanoTime() - start);
                    return silence(audio);
                }
                TurnOutcome outcome = pipeline.process(handle, audio);
                if (outcome.reachedTerminal()) {
                    completeInterview(handle);
                }
                return outcome.audio();
            } finally {
                handle.endTurn();
            }
        }
    }

    private AudioSegment silence(AudioSegment input) {
        return AudioSegment.silence(input.sampleRate(), props.getTurn().getSilenceDuration());
    }

    @Override
    public InterviewStatus getStatus(String sessionId) {
        SessionSnapshot s = registry.require(sessionId).session().snapshot();
        return new InterviewStatus(
                s.sessionId(),
                s.stage(),
                s.interests().size(),
                s.turnCount(),
                TimeUtils.secondsBetween(s.startedAt(), clock.instant()),
                s.startedAt());
    }

    @Override
    public InterviewResult getResults(String sessionId) {
        return registry.find(sessionId)
                .map(h -> toResult(h.session().snapshot()))
                .or(() -> completedResults.find(sessionId))
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    @Override
    public InterviewResult endSession(String sessionId) {
        SessionHandle handle = registry.require(sessionId);
        if (!handle.beginTeardown()) {
            throw new SessionNotFoundException(sessionId);
        }
        InterviewSession session = handle.session();
        try (CloseableThreadContext.Instance ctc = sessionContext(session)) {
            handle.cancel();
            handle.awaitTurnLock();
            try {
                session.markEnded(clock.instant());
                handoff.createThreadIfRequested(session);
                handoff.submitAnalytics(session);
                InterviewResult result = toResult(session.snapshot());
                completedResults.retain(result);
                metrics.recordSessionEnded();
                LOG.info("Interview session ended: turns={}, interests={}, threadId={}",
                        result.transcript().size(), result.interests().size(), result.threadId());
                return result;
            } finally {
                registry.remove(sessionId, handle);
                handle.endTurn();
            }
        }
    }

    @Override
    public RelayCredential issueRelayCredential(String sessionId, String userId) {
        SessionHandle handle = registry.require(sessionId);
        String identity = (userId == null || userId.isBlank()) ? handle.session().getUserId() : userId;
        return credentialIssuer.issueForSession(sessionId, identity);
    }

    /**
     * Runs when a turn moved the session into the terminated stage. Called with the turn lock held.
     */
    private void completeInterview(SessionHandle handle) {
        InterviewSession session = handle.session();
        SessionSnapshot snapshot = session.snapshot();
        if (snapshot.shouldCreateThread()) {
            stateMachine.summarizeForThread(snapshot)
                    .ifPresent(summary -> session.putAttribute(SessionAttributes.THREAD_SUMMARY, summary));
            handoff.createThreadIfRequested(session);
        }
        String threadId = session.snapshot().attribute(SessionAttributes.THREAD_ID);
        LOG.info("Interview reached terminal stage: threadRequested={}, threadId={}",
                snapshot.shouldCreateThread(), threadId);
        publisher.publishEvent(new InterviewCompletedEvent(session.getId(), session.getUserId(),
                snapshot.shouldCreateThread(), threadId, clock.instant()));
    }

    private InterviewResult toResult(SessionSnapshot s) {
        Instant end = s.endedAt() != null ? s.endedAt() : clock.instant();
        return new InterviewResult(
                s.sessionId(),
                s.userId(),
                s.mode(),
                s.stage(),
                s.interests(),
                s.transcript(),
                s.extractedConcepts(),
                s.attributes(),
                TimeUtils.secondsBetween(s.startedAt(), end),
                s.isEnded());
    }

    private static CloseableThreadContext.Instance sessionContext(InterviewSession session) {
        return CloseableThreadContext.put(MDC_SESSION_ID, session.getId()).put(MDC_USER_ID, session.getUserId());
    }
}
