package com.phillippitts.interviewengine.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void allDomainExceptionsShareTheBaseType() {
        assertThat(new CapabilityException("x", "stt")).isInstanceOf(InterviewEngineException.class);
        assertThat(new InvalidAudioException("x")).isInstanceOf(InterviewEngineException.class);
        assertThat(new SessionNotFoundException("s")).isInstanceOf(InterviewEngineException.class);
        assertThat(new InterviewConfigurationException("p", "x")).isInstanceOf(InterviewEngineException.class);
        assertThat(new TurnCancelledException("s")).isInstanceOf(InterviewEngineException.class);
        assertThat(new InterviewEngineException("x")).isInstanceOf(RuntimeException.class);
    }

    @Test
    void cancellationIsNotACapabilityFailure() {
        assertThat(new TurnCancelledException("s")).isNotInstanceOf(CapabilityException.class);
    }

    @Test
    void capabilityExceptionNamesCapabilityAndDefaultsReason() {
        CapabilityException ex = new CapabilityException("Engine failed", "llm");

        assertThat(ex.getMessage()).isEqualTo("Engine failed (capability: llm)");
        assertThat(ex.getCapability()).isEqualTo("llm");
        assertThat(ex.getReason()).isEqualTo("error");
    }

    @Test
    void capabilityExceptionKeepsCause() {
        IOException cause = new IOException("connection reset");
        CapabilityException ex = new CapabilityException("Request failed", "thread-creation", "error", cause);

        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void invalidAudioReportsSizeAndReason() {
        InvalidAudioException ex = new InvalidAudioException(3, "odd length");

        assertThat(ex.getMessage()).isEqualTo("Invalid audio data (3 bytes): odd length");
        assertThat(ex.getAudioSize()).isEqualTo(3);
        assertThat(ex.getReason()).isEqualTo("odd length");
        assertThat(new InvalidAudioException("bad rate").getMessage()).isEqualTo("Invalid audio data: bad rate");
    }

    @Test
    void sessionNotFoundCarriesId() {
        SessionNotFoundException ex = new SessionNotFoundException("s-404");

        assertThat(ex.getSessionId()).isEqualTo("s-404");
        assertThat(ex.getMessage()).contains("s-404");
    }

    @Test
    void configurationExceptionNamesProperty() {
        InterviewConfigurationException ex =
                new InterviewConfigurationException("relay.credential.secret", "Secret missing");

        assertThat(ex.getProperty()).isEqualTo("relay.credential.secret");
        assertThat(ex.getMessage()).isEqualTo("Secret missing (property: relay.credential.secret)");
    }
}
