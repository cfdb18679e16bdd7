package com.phillippitts.interviewengine.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for interview sessions.
 *
 * <p>Provides:
 * <ul>
 *   <li>Turn latency and outcome counts</li>
 *   <li>Per-capability call latency and failure counts (tagged with reason)</li>
 *   <li>Stage transitions, detected interests, and hand-off results</li>
 *   <li>Session start/end counts</li>
 * </ul>
 *
 * <p>All metrics are exposed at /actuator/prometheus.
 */
public class InterviewMetrics {

    private static final String METRIC_PREFIX = "interview";

    private final MeterRegistry registry;

    public InterviewMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param outcome turn outcome (completed, silent_input, degraded, cancelled, rejected, closed)
     */
    public void recordTurn(String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".turn.latency")
                .description("Time taken to process one audio turn")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".turn.outcome")
                .description("Number of audio turns by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordCapabilityLatency(String capability, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".capability.latency")
                .description("Latency of successful capability calls")
                .tag("capability", capability)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param reason timeout, error, unavailable or interrupted
     */
    public void incrementCapabilityFailure(String capability, String reason) {
        Counter.builder(METRIC_PREFIX + ".capability.failure")
                .description("Number of failed capability calls")
                .tag("capability", capability)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementStageTransition(String from, String to) {
        Counter.builder(METRIC_PREFIX + ".stage.transition")
                .description("Number of stage transitions")
                .tag("from", from)
                .tag("to", to)
                .register(registry)
                .increment();
    }

    public void incrementInterestDetected() {
        Counter.builder(METRIC_PREFIX + ".interest.detected")
                .description("Number of distinct interests detected")
                .register(registry)
                .increment();
    }

    /**
     * @param target thread or analytics
     * @param result success or failure
     */
    public void incrementHandoff(String target, String result) {
        Counter.builder(METRIC_PREFIX + ".handoff")
                .description("Number of downstream hand-offs by target and result")
                .tag("target", target)
                .tag("result", result)
                .register(registry)
                .increment();
    }

    /**
     * @param event started or ended
     */
    public void incrementSession(String event) {
        Counter.builder(METRIC_PREFIX + ".sessions")
                .description("Number of sessions started and ended")
                .tag("event", event)
                .register(registry)
                .increment();
    }
}
