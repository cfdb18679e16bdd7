package com.phillippitts.interviewengine.service.health;

import com.phillippitts.interviewengine.service.session.InterviewSession;
import com.phillippitts.interviewengine.service.session.SessionRegistry;
import com.phillippitts.interviewengine.testutil.FakeSpeechSynthesizer;
import com.phillippitts.interviewengine.testutil.FakeSpeechToText;
import com.phillippitts.interviewengine.testutil.RecordingThreadCreationClient;
import com.phillippitts.interviewengine.testutil.ScriptedTextGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CapabilityHealthIndicatorTest {

    private FakeSpeechToText stt;
    private ScriptedTextGenerator llm;
    private FakeSpeechSynthesizer tts;
    private SessionRegistry registry;
    private CapabilityHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        stt = new FakeSpeechToText("hello");
        llm = new ScriptedTextGenerator("hi");
        tts = new FakeSpeechSynthesizer();
        registry = new SessionRegistry();
        indicator = new CapabilityHealthIndicator(stt, llm, tts, new RecordingThreadCreationClient(), registry);
    }

    @Test
    void upWhenAllTurnCapabilitiesReady() {
        registry.register(new InterviewSession("s-1", "u-1", "thread", "p", null,
                Instant.parse("2026-03-01T10:00:00Z")));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("stt", "ready")
                .containsEntry("llm", "ready")
                .containsEntry("tts", "ready")
                .containsEntry("thread-creation", "ready")
                .containsEntry("activeSessions", 1);
    }

    @Test
    void degradedWhenSomeCapabilitiesUnavailable() {
        llm.healthy = false;

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("llm", "unavailable");
    }

    @Test
    void downWhenNothingReady() {
        stt.healthy = false;
        llm.healthy = false;
        tts.healthy = false;

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("status", "No turn capabilities available");
    }
}
