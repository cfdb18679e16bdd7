package com.phillippitts.interviewengine.service.orchestration;

import com.phillippitts.interviewengine.config.properties.InterviewProperties;
import com.phillippitts.interviewengine.service.credential.RelayCredentialIssuer;
import com.phillippitts.interviewengine.service.handoff.HandoffService;
import com.phillippitts.interviewengine.service.pipeline.TurnPipeline;
import com.phillippitts.interviewengine.service.session.CompletedResultsStore;
import com.phillippitts.interviewengine.service.session.SessionRegistry;
import com.phillippitts.interviewengine.service.session.SessionStateMachine;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.function.Supplier;

/**
 * Builder for {@link DefaultInterviewEngine}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * InterviewEngine engine = InterviewEngineBuilder.builder()
 *     .registry(registry)
 *     .completedResults(completedResults)
 *     .pipeline(pipeline)
 *     .stateMachine(stateMachine)
 *     .handoff(handoff)
 *     .credentialIssuer(issuer)
 *     .properties(props)
 *     .publisher(publisher)
 *     .metrics(metricsPublisher)   // optional, defaults to NOOP
 *     .clock(clock)                // optional, defaults to UTC system clock
 *     .build();
 * }</pre>
 *
 * @since 1.0
 */
public final class InterviewEngineBuilder {

    // Required dependencies
    SessionRegistry registry;
    CompletedResultsStore completedResults;
    TurnPipeline pipeline;
    SessionStateMachine stateMachine;
    HandoffService handoff;
    RelayCredentialIssuer credentialIssuer;
    InterviewProperties props;
    ApplicationEventPublisher publisher;

    // Optional dependencies
    InterviewMetricsPublisher metrics;
    Clock clock;
    Supplier<String> idGenerator;

    private InterviewEngineBuilder() {
    }

    public static InterviewEngineBuilder builder() {
        return new InterviewEngineBuilder();
    }

    public InterviewEngineBuilder registry(SessionRegistry registry) {
        this.registry = registry;
        return this;
    }

    public InterviewEngineBuilder completedResults(CompletedResultsStore completedResults) {
        this.completedResults = completedResults;
        return this;
    }

    public InterviewEngineBuilder pipeline(TurnPipeline pipeline) {
        this.pipeline = pipeline;
        return this;
    }

    public InterviewEngineBuilder stateMachine(SessionStateMachine stateMachine) {
        this.stateMachine = stateMachine;
        return this;
    }

    public InterviewEngineBuilder handoff(HandoffService handoff) {
        this.handoff = handoff;
        return this;
    }

    public InterviewEngineBuilder credentialIssuer(RelayCredentialIssuer credentialIssuer) {
        this.credentialIssuer = credentialIssuer;
        return this;
    }

    public InterviewEngineBuilder properties(InterviewProperties props) {
        this.props = props;
        return this;
    }

    public InterviewEngineBuilder publisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
        return this;
    }

    /**
     * Sets the metrics publisher (optional; {@link InterviewMetricsPublisher#NOOP} when unset).
     */
    public InterviewEngineBuilder metrics(InterviewMetricsPublisher metrics) {
        this.metrics = metrics;
        return this;
    }

    public InterviewEngineBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * Overrides session id generation (random UUIDs by default). Intended for tests.
     */
    public InterviewEngineBuilder idGenerator(Supplier<String> idGenerator) {
        this.idGenerator = idGenerator;
        return this;
    }

    /**
     * @throws NullPointerException if a required dependency is missing
     */
    public DefaultInterviewEngine build() {
        return new DefaultInterviewEngine(this);
    }
}
