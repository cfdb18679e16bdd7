package com.phillippitts.interviewengine.service.handoff;

import com.phillippitts.interviewengine.config.properties.CapabilityTimeoutProperties;
import com.phillippitts.interviewengine.domain.InterviewSummary;
import com.phillippitts.interviewengine.domain.SessionAttributes;
import com.phillippitts.interviewengine.domain.ThreadCreationResult;
import com.phillippitts.interviewengine.domain.ThreadPayload;
import com.phillippitts.interviewengine.exception.CapabilityException;
import com.phillippitts.interviewengine.service.capability.Capability;
import com.phillippitts.interviewengine.service.capability.InterviewAnalyticsClient;
import com.phillippitts.interviewengine.service.capability.ThreadCreationClient;
import com.phillippitts.interviewengine.service.orchestration.InterviewMetricsPublisher;
import com.phillippitts.interviewengine.service.pipeline.CapabilityInvoker;
import com.phillippitts.interviewengine.service.session.InterviewSession;
import com.phillippitts.interviewengine.service.session.SessionSnapshot;
import com.phillippitts.interviewengine.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Sends completed sessions downstream: learning-thread creation and analytics.
 *
 * <p>Outcomes are recorded on the session's metadata and never thrown. Thread creation is
 * attempted at most once per session; the attempt is marked before the call so concurrent
 * callers cannot both submit.
 */
public class HandoffService {

    private static final Logger LOG = LogManager.getLogger(HandoffService.class);

    static final String TARGET_THREAD = "thread";
    static final String TARGET_ANALYTICS = "analytics";

    private final ThreadCreationClient threadClient;
    private final InterviewAnalyticsClient analyticsClient;
    private final ThreadPayloadComposer composer;
    private final CapabilityInvoker invoker;
    private final CapabilityTimeoutProperties timeouts;
    private final InterviewMetricsPublisher metrics;
    private final Clock clock;

    public HandoffService(ThreadCreationClient threadClient,
                          InterviewAnalyticsClient analyticsClient,
                          ThreadPayloadComposer composer,
                          CapabilityInvoker invoker,
                          CapabilityTimeoutProperties timeouts,
                          InterviewMetricsPublisher metrics,
                          Clock clock) {
        this.threadClient = Objects.requireNonNull(threadClient, "threadClient");
        this.analyticsClient = Objects.requireNonNull(analyticsClient, "analyticsClient");
        this.composer = Objects.requireNonNull(composer, "composer");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.timeouts = Objects.requireNonNull(timeouts, "timeouts");
        this.metrics = metrics == null ? InterviewMetricsPublisher.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates the learning thread if the session asked for one and no attempt was made yet.
     *
     * @return true if an attempt was made by this call
     */
    public boolean createThreadIfRequested(InterviewSession session) {
        if (!claimThreadAttempt(session)) {
            return false;
        }
        SessionSnapshot snapshot = session.snapshot();
        ThreadPayload payload = composer.compose(snapshot);
        try {
            ThreadCreationResult result = invoker.call(snapshot.sessionId(), Capability.THREAD_CREATION,
                    timeouts.getThreadCreationTimeout(),
                    () -> threadClient.createThread(payload, snapshot.authToken()));
            session.putAttribute(SessionAttributes.THREAD_ID, result.threadId());
            session.putAttribute(SessionAttributes.THREAD_CREATED, "true");
            metrics.recordHandoff(TARGET_THREAD, true);
            LOG.info("Learning thread {} created for session {}", result.threadId(), snapshot.sessionId());
        } catch (CapabilityException e) {
            session.putAttribute(SessionAttributes.THREAD_CREATION_ERROR, e.getMessage());
            metrics.recordHandoff(TARGET_THREAD, false);
            LOG.warn("Learning thread creation failed for session {}: {}", snapshot.sessionId(), e.getMessage());
        }
        return true;
    }

    /**
     * Submits the analytics summary. Failures are recorded under {@code analyticsError}.
     */
    public void submitAnalytics(InterviewSession session) {
        SessionSnapshot snapshot = session.snapshot();
        Instant end = snapshot.endedAt() != null ? snapshot.endedAt() : clock.instant();
        InterviewSummary summary = new InterviewSummary(
                snapshot.userId(),
                snapshot.sessionId(),
                snapshot.interests(),
                snapshot.transcript(),
                TimeUtils.secondsBetween(snapshot.startedAt(), end));
        try {
            invoker.call(snapshot.sessionId(), Capability.ANALYTICS, timeouts.getAnalyticsTimeout(), () -> {
                analyticsClient.submit(summary);
                return null;
            });
            session.putAttribute(SessionAttributes.ANALYTICS_SUBMITTED, "true");
            metrics.recordHandoff(TARGET_ANALYTICS, true);
        } catch (CapabilityException e) {
            session.putAttribute(SessionAttributes.ANALYTICS_ERROR, e.getMessage());
            metrics.recordHandoff(TARGET_ANALYTICS, false);
            LOG.info("Analytics submission failed for session {}: {}", snapshot.sessionId(), e.getMessage());
        }
    }

    private static boolean claimThreadAttempt(InterviewSession session) {
        return session.snapshot().shouldCreateThread()
                && session.putAttributeIfAbsent(SessionAttributes.THREAD_CREATION_ATTEMPTED, "true");
    }
}
