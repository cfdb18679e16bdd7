package com.phillippitts.interviewengine.presentation.controller;

import com.phillippitts.interviewengine.domain.AudioSegment;
import com.phillippitts.interviewengine.domain.InterviewStatus;
import com.phillippitts.interviewengine.domain.Stage;
import com.phillippitts.interviewengine.exception.InvalidAudioException;
import com.phillippitts.interviewengine.service.orchestration.InterviewEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class InterviewControllerTest {

    private InterviewEngine engine;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        engine = mock(InterviewEngine.class);
        mvc = MockMvcBuilders.standaloneSetup(new InterviewController(engine)).build();
    }

    @Test
    void startReturnsSessionIdAndForwardsAuthorization() throws Exception {
        when(engine.startSession(eq("u-1"), eq("thread"), isNull(), eq("Bearer t"))).thenReturn("s-1");

        mvc.perform(post("/api/interview/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Authorization", "Bearer t")
                        .content("{\"userId\":\"u-1\",\"mode\":\"thread\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("s-1"));
    }

    @Test
    void startWithBlankUserIdIsRejected() throws Exception {
        mvc.perform(post("/api/interview/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\" \"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(engine);
    }

    @Test
    void turnReturnsPcmWithSampleRateHeader() throws Exception {
        byte[] reply = {1, 0, 2, 0};
        when(engine.submitAudioTurn(eq("s-1"), any())).thenReturn(new AudioSegment(24_000, reply));

        mvc.perform(post("/api/interview/s-1/turn")
                        .param("sampleRate", "8000")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[]{0, 0, 0, 0, 0, 0}))
                .andExpect(status().isOk())
                .andExpect(header().string(InterviewController.SAMPLE_RATE_HEADER, "24000"))
                .andExpect(content().bytes(reply));

        ArgumentCaptor<AudioSegment> input = ArgumentCaptor.forClass(AudioSegment.class);
        verify(engine).submitAudioTurn(eq("s-1"), input.capture());
        assertThat(input.getValue().sampleRate()).isEqualTo(8000);
        assertThat(input.getValue().sampleCount()).isEqualTo(3);
    }

    @Test
    void turnWithOutOfRangeSampleRateNeverReachesTheEngine() {
        assertThatThrownBy(() -> mvc.perform(post("/api/interview/s-1/turn")
                .param("sampleRate", String.valueOf(Integer.MAX_VALUE))
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .content(new byte[]{0, 0})))
                .hasRootCauseInstanceOf(InvalidAudioException.class);

        verifyNoInteractions(engine);
    }

    @Test
    void emptyTurnResponseIsNoContent() throws Exception {
        when(engine.submitAudioTurn(anyString(), any())).thenReturn(AudioSegment.empty(16_000));

        mvc.perform(post("/api/interview/s-1/turn")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[]{0, 0}))
                .andExpect(status().isNoContent())
                .andExpect(header().string(InterviewController.SAMPLE_RATE_HEADER, "16000"));
    }

    @Test
    void statusIsRenderedAsJson() throws Exception {
        when(engine.getStatus("s-1")).thenReturn(new InterviewStatus("s-1", Stage.DEEP_DIVE, 2, 8, 42.5,
                Instant.parse("2026-03-01T10:00:00Z")));

        mvc.perform(get("/api/interview/s-1/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stage").value("deep_dive"))
                .andExpect(jsonPath("$.interestsCount").value(2))
                .andExpect(jsonPath("$.turns").value(8));
    }

    @Test
    void iceServersPassesOptionalUserId() throws Exception {
        mvc.perform(get("/api/interview/s-1/ice-servers").param("userId", "u-9"))
                .andExpect(status().isOk());

        verify(engine).issueRelayCredential("s-1", "u-9");
    }
}
