package com.phillippitts.interviewengine.service.pipeline;

import com.phillippitts.interviewengine.exception.CapabilityException;
import com.phillippitts.interviewengine.exception.CapabilityExceptionBuilder;
import com.phillippitts.interviewengine.exception.TurnCancelledException;
import com.phillippitts.interviewengine.service.orchestration.InterviewMetricsPublisher;
import com.phillippitts.interviewengine.service.orchestration.event.CapabilityFailureEvent;
import com.phillippitts.interviewengine.service.session.SessionHandle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs capability calls on the capability pool and waits for them with a timeout.
 *
 * <p>Every failure surfaces as a {@link CapabilityException} (after being counted and published
 * as a {@link CapabilityFailureEvent}). Session-bound calls are registered on the session's
 * {@link SessionHandle}; if the session is cancelled while the call is in flight, the worker
 * is interrupted and the caller gets a {@link TurnCancelledException} instead.
 */
public class CapabilityInvoker {

    private static final Logger LOG = LogManager.getLogger(CapabilityInvoker.class);

    private final Executor executor;
    private final ApplicationEventPublisher publisher;
    private final InterviewMetricsPublisher metrics;
    private final Clock clock;

    public CapabilityInvoker(Executor executor,
                             ApplicationEventPublisher publisher,
                             InterviewMetricsPublisher metrics,
                             Clock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = metrics == null ? InterviewMetricsPublisher.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Calls a capability on behalf of a session turn.
     *
     * @throws TurnCancelledException if the session was cancelled before or during the call
     * @throws CapabilityException    on failure or timeout
     */
    public <T> T call(SessionHandle handle, String capability, Duration timeout, Callable<T> call) {
        Objects.requireNonNull(handle, "handle");
        if (handle.isCancelled()) {
            throw new TurnCancelledException(handle.sessionId());
        }
        return run(handle, handle.sessionId(), capability, timeout, call);
    }

    /**
     * Calls a capability outside any turn (hand-off during teardown). Not cancellable.
     *
     * @param sessionId session the call is made for, used for failure reporting
     */
    public <T> T call(String sessionId, String capability, Duration timeout, Callable<T> call) {
        return run(null, sessionId, capability, timeout, call);
    }

    private <T> T run(SessionHandle handle, String sessionId, String capability, Duration timeout,
                      Callable<T> call) {
        Objects.requireNonNull(call, "call");
        long start = System.nanoTime();
        FutureTask<T> task = new FutureTask<>(call);
        if (handle != null) {
            handle.track(task);
        }
        try {
            try {
                executor.execute(task);
            } catch (RejectedExecutionException e) {
                throw failure(sessionId, capability, "error", "Capability pool rejected the call", e, start);
            }
            T result = task.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            metrics.recordCapabilitySuccess(capability, System.nanoTime() - start);
            return result;
        } catch (TimeoutException e) {
            task.cancel(true);
            throw failure(sessionId, capability, "timeout",
                    "Capability call timed out after " + timeout.toMillis() + " ms", null, start);
        } catch (CancellationException e) {
            if (handle != null && handle.isCancelled()) {
                throw new TurnCancelledException(sessionId, e);
            }
            throw failure(sessionId, capability, "interrupted", "Capability call was cancelled", e, start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            if (handle != null && handle.isCancelled()) {
                throw new TurnCancelledException(sessionId, e);
            }
            throw failure(sessionId, capability, "interrupted", "Interrupted while waiting for capability", e,
                    start);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (handle != null && handle.isCancelled()) {
                throw new TurnCancelledException(sessionId, cause);
            }
            if (cause instanceof CapabilityException ce) {
                publishFailure(sessionId, ce.getCapability(), ce.getReason(), ce.getMessage());
                throw ce;
            }
            throw failure(sessionId, capability, "error", "Capability call failed", cause, start);
        } finally {
            if (handle != null) {
                handle.untrack(task);
            }
        }
    }

    private CapabilityException failure(String sessionId, String capability, String reason, String message,
                                        Throwable cause, long startNanos) {
        CapabilityException ex = CapabilityExceptionBuilder.create(message)
                .capability(capability)
                .reason(reason)
                .cause(cause)
                .durationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos))
                .metadata("sessionId", sessionId)
                .build();
        publishFailure(sessionId, capability, reason, ex.getMessage());
        return ex;
    }

    private void publishFailure(String sessionId, String capability, String reason, String message) {
        metrics.recordCapabilityFailure(capability, reason);
        LOG.debug("Capability {} failed ({}) for session {}", capability, reason, sessionId);
        publisher.publishEvent(new CapabilityFailureEvent(capability, reason, sessionId, message, clock.instant()));
    }
}
