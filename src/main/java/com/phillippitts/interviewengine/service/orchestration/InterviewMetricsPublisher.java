package com.phillippitts.interviewengine.service.orchestration;

import com.phillippitts.interviewengine.domain.Stage;
import com.phillippitts.interviewengine.service.metrics.InterviewMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Null-safe front for {@link InterviewMetrics} used by the engine, pipeline and hand-off.
 *
 * <p>Components take a publisher rather than the metrics bean so they can run without a
 * meter registry in unit tests; {@link #NOOP} drops everything.
 *
 * @see InterviewMetrics
 */
public final class InterviewMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(InterviewMetricsPublisher.class);

    /**
     * Shared no-op instance for tests and builder defaults.
     */
    public static final InterviewMetricsPublisher NOOP = new InterviewMetricsPublisher(null);

    private final InterviewMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public InterviewMetricsPublisher(InterviewMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("InterviewMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordTurn(String outcome, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordTurn(outcome, durationNanos);
    }

    public void recordCapabilitySuccess(String capability, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordCapabilityLatency(capability, durationNanos);
    }

    public void recordCapabilityFailure(String capability, String reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementCapabilityFailure(capability, reason);
    }

    public void recordStageTransition(Stage from, Stage to) {
        if (metrics == null || from == to) {
            return;
        }
        metrics.incrementStageTransition(from.wireName(), to.wireName());
    }

    public void recordInterestsDetected(int count) {
        if (metrics == null) {
            return;
        }
        for (int i = 0; i < count; i++) {
            metrics.incrementInterestDetected();
        }
    }

    public void recordHandoff(String target, boolean success) {
        if (metrics == null) {
            return;
        }
        metrics.incrementHandoff(target, success ? "success" : "failure");
    }

    public void recordSessionStarted() {
        if (metrics == null) {
            return;
        }
        metrics.incrementSession("started");
    }

    public void recordSessionEnded() {
        if (metrics == null) {
            return;
        }
        metrics.incrementSession("ended");
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
