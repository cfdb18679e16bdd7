package com.phillippitts.interviewengine.config.orchestration;

import com.phillippitts.interviewengine.config.properties.CapabilityTimeoutProperties;
import com.phillippitts.interviewengine.config.properties.InterviewProperties;
import com.phillippitts.interviewengine.service.capability.InterviewAnalyticsClient;
import com.phillippitts.interviewengine.service.capability.SpeechSynthesizer;
import com.phillippitts.interviewengine.service.capability.SpeechToText;
import com.phillippitts.interviewengine.service.capability.TextGenerator;
import com.phillippitts.interviewengine.service.capability.ThreadCreationClient;
import com.phillippitts.interviewengine.service.credential.RelayCredentialIssuer;
import com.phillippitts.interviewengine.service.handoff.HandoffService;
import com.phillippitts.interviewengine.service.handoff.ThreadPayloadComposer;
import com.phillippitts.interviewengine.service.interest.InterestTagger;
import com.phillippitts.interviewengine.service.metrics.InterviewMetrics;
import com.phillippitts.interviewengine.service.orchestration.InterviewEngine;
import com.phillippitts.interviewengine.service.orchestration.InterviewEngineBuilder;
import com.phillippitts.interviewengine.service.orchestration.InterviewMetricsPublisher;
import com.phillippitts.interviewengine.service.pipeline.CapabilityInvoker;
import com.phillippitts.interviewengine.service.pipeline.TurnPipeline;
import com.phillippitts.interviewengine.service.session.CompletedResultsStore;
import com.phillippitts.interviewengine.service.session.SessionRegistry;
import com.phillippitts.interviewengine.service.session.SessionStateMachine;
import com.phillippitts.interviewengine.service.taxonomy.TaxonomyMatcher;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wires the interview engine explicitly: registry, state machine, turn pipeline, hand-off and
 * the engine itself. Uses constructor injection for the dependencies shared across bean methods.
 */
@Configuration
public class OrchestrationConfig {

    // Capabilities and settings shared across bean methods
    private final SpeechToText speechToText;
    private final SpeechSynthesizer speechSynthesizer;
    private final TextGenerator textGenerator;
    private final ThreadCreationClient threadCreationClient;
    private final InterviewAnalyticsClient analyticsClient;
    private final InterviewProperties interviewProperties;
    private final CapabilityTimeoutProperties timeoutProperties;
    private final ApplicationEventPublisher publisher;

    public OrchestrationConfig(SpeechToText speechToText,
                               SpeechSynthesizer speechSynthesizer,
                               TextGenerator textGenerator,
                               ThreadCreationClient threadCreationClient,
                               InterviewAnalyticsClient analyticsClient,
                               InterviewProperties interviewProperties,
                               CapabilityTimeoutProperties timeoutProperties,
                               ApplicationEventPublisher publisher) {
        this.speechToText = speechToText;
        this.speechSynthesizer = speechSynthesizer;
        this.textGenerator = textGenerator;
        this.threadCreationClient = threadCreationClient;
        this.analyticsClient = analyticsClient;
        this.interviewProperties = interviewProperties;
        this.timeoutProperties = timeoutProperties;
        this.publisher = publisher;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TaxonomyMatcher taxonomyMatcher() {
        return new TaxonomyMatcher();
    }

    @Bean
    public InterestTagger interestTagger() {
        return new InterestTagger();
    }

    @Bean
    public InterviewMetrics interviewMetrics(MeterRegistry meterRegistry) {
        return new InterviewMetrics(meterRegistry);
    }

    @Bean
    public InterviewMetricsPublisher interviewMetricsPublisher(InterviewMetrics interviewMetrics) {
        return new InterviewMetricsPublisher(interviewMetrics);
    }

    /**
     * Runs every capability call on the capability pool so calls can time out and be cancelled.
     */
    @Bean
    public CapabilityInvoker capabilityInvoker(@Qualifier("capabilityExecutor") Executor capabilityExecutor,
                                               InterviewMetricsPublisher metricsPublisher,
                                               Clock clock) {
        return new CapabilityInvoker(capabilityExecutor, publisher, metricsPublisher, clock);
    }

    @Bean
    public SessionStateMachine sessionStateMachine(CapabilityInvoker invoker) {
        return new SessionStateMachine(textGenerator, invoker, timeoutProperties, interviewProperties);
    }

    @Bean
    public TurnPipeline turnPipeline(SessionStateMachine stateMachine,
                                     InterestTagger tagger,
                                     TaxonomyMatcher taxonomy,
                                     CapabilityInvoker invoker,
                                     InterviewMetricsPublisher metricsPublisher,
                                     Clock clock) {
        return new TurnPipeline(speechToText, speechSynthesizer, stateMachine, tagger, taxonomy, invoker,
                timeoutProperties, interviewProperties, publisher, metricsPublisher, clock);
    }

    @Bean
    public ThreadPayloadComposer threadPayloadComposer(TaxonomyMatcher taxonomy) {
        return new ThreadPayloadComposer(taxonomy);
    }

    @Bean
    public HandoffService handoffService(ThreadPayloadComposer composer,
                                         CapabilityInvoker invoker,
                                         InterviewMetricsPublisher metricsPublisher,
                                         Clock clock) {
        return new HandoffService(threadCreationClient, analyticsClient, composer, invoker,
                timeoutProperties, metricsPublisher, clock);
    }

    @Bean
    public SessionRegistry sessionRegistry() {
        return new SessionRegistry();
    }

    @Bean
    public CompletedResultsStore completedResultsStore(Clock clock) {
        return new CompletedResultsStore(clock, interviewProperties.getResults().getRetention());
    }

    @Bean
    public InterviewEngine interviewEngine(SessionRegistry registry,
                                           CompletedResultsStore completedResults,
                                           TurnPipeline pipeline,
                                           SessionStateMachine stateMachine,
                                           HandoffService handoff,
                                           RelayCredentialIssuer credentialIssuer,
                                           InterviewMetricsPublisher metricsPublisher,
                                           Clock clock) {
        return InterviewEngineBuilder.builder()
                .registry(registry)
                .completedResults(completedResults)
                .pipeline(pipeline)
                .stateMachine(stateMachine)
                .handoff(handoff)
                .credentialIssuer(credentialIssuer)
                .properties(this.interviewProperties)
                .publisher(this.publisher)
                .metrics(metricsPublisher)
                .clock(clock)
                .build();
    }

    /**
     * Gauge: interview.sessions.active.
     */
    @Bean
    public MeterBinder activeSessionsMetrics(SessionRegistry registry) {
        return meterRegistry -> Gauge.builder("interview.sessions.active", registry, SessionRegistry::size)
                .description("Number of interview sessions currently registered")
                .register(meterRegistry);
    }
}
