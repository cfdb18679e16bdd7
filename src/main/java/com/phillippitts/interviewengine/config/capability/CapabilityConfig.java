package com.phillippitts.interviewengine.config.capability;

import com.phillippitts.interviewengine.config.properties.DownstreamProperties;
import com.phillippitts.interviewengine.config.properties.LlmProperties;
import com.phillippitts.interviewengine.service.capability.InterviewAnalyticsClient;
import com.phillippitts.interviewengine.service.capability.LoggingTranscriptSink;
import com.phillippitts.interviewengine.service.capability.SpeechSynthesizer;
import com.phillippitts.interviewengine.service.capability.SpeechToText;
import com.phillippitts.interviewengine.service.capability.TextGenerator;
import com.phillippitts.interviewengine.service.capability.ThreadCreationClient;
import com.phillippitts.interviewengine.service.capability.TranscriptSink;
import com.phillippitts.interviewengine.service.capability.UnconfiguredSpeechSynthesizer;
import com.phillippitts.interviewengine.service.capability.UnconfiguredSpeechToText;
import com.phillippitts.interviewengine.service.capability.UnconfiguredTextGenerator;
import com.phillippitts.interviewengine.service.capability.http.HttpInterviewAnalyticsClient;
import com.phillippitts.interviewengine.service.capability.http.HttpThreadCreationClient;
import com.phillippitts.interviewengine.service.capability.http.OpenAiTextGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Capability beans. Every capability has a default so the application starts without any
 * external service configured; deployments replace a default by declaring their own bean.
 *
 * <p>Speech engines have no bundled implementation. Text generation uses an OpenAI-compatible
 * endpoint once {@code interview.llm.api-key} is set. Downstream hand-off uses HTTP clients whose
 * URLs come from {@code downstream.*}.
 */
@Configuration
public class CapabilityConfig {

    private static final Logger LOG = LogManager.getLogger(CapabilityConfig.class);

    @Bean
    @ConditionalOnMissingBean(name = "downstreamRestTemplate")
    public RestTemplate downstreamRestTemplate(RestTemplateBuilder builder, DownstreamProperties props) {
        return builder
                .setConnectTimeout(props.getConnectTimeout())
                .setReadTimeout(props.getReadTimeout())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public SpeechToText speechToText() {
        LOG.warn("No speech-to-text engine configured; turns will be answered with silence");
        return new UnconfiguredSpeechToText();
    }

    @Bean
    @ConditionalOnMissingBean
    public SpeechSynthesizer speechSynthesizer() {
        LOG.warn("No speech synthesizer configured; responses will be silent");
        return new UnconfiguredSpeechSynthesizer();
    }

    @Bean
    @ConditionalOnMissingBean
    public TextGenerator textGenerator(RestTemplate downstreamRestTemplate, LlmProperties props) {
        if (props.getApiKey() == null || props.getApiKey().isBlank()) {
            LOG.warn("interview.llm.api-key not set; text generation unavailable");
            return new UnconfiguredTextGenerator();
        }
        LOG.info("Text generation via {} (model={})", props.getBaseUrl(), props.getModel());
        return new OpenAiTextGenerator(downstreamRestTemplate, props);
    }

    @Bean
    @ConditionalOnMissingBean
    public TranscriptSink transcriptSink() {
        return new LoggingTranscriptSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public ThreadCreationClient threadCreationClient(RestTemplate downstreamRestTemplate,
                                                     DownstreamProperties props) {
        return new HttpThreadCreationClient(downstreamRestTemplate, props.getThreadUrl());
    }

    @Bean
    @ConditionalOnMissingBean
    public InterviewAnalyticsClient interviewAnalyticsClient(RestTemplate downstreamRestTemplate,
                                                             DownstreamProperties props) {
        return new HttpInterviewAnalyticsClient(downstreamRestTemplate, props.getAnalyticsUrl());
    }
}
