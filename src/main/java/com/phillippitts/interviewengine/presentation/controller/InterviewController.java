package com.phillippitts.interviewengine.presentation.controller;

import com.phillippitts.interviewengine.domain.AudioSegment;
import com.phillippitts.interviewengine.domain.InterviewResult;
import com.phillippitts.interviewengine.domain.InterviewStatus;
import com.phillippitts.interviewengine.domain.RelayCredential;
import com.phillippitts.interviewengine.service.orchestration.InterviewEngine;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * HTTP surface of the interview engine.
 *
 * <p>Audio turns are raw PCM16 little-endian mono bytes in both directions; the response sample
 * rate is returned in the {@value #SAMPLE_RATE_HEADER} header. An empty response (the input held
 * no speech) is answered with 204.
 */
@RestController
@RequestMapping("/api/interview")
class InterviewController {

    private static final Logger LOG = LogManager.getLogger(InterviewController.class);

    static final String SAMPLE_RATE_HEADER = "X-Sample-Rate";

    private final InterviewEngine engine;

    InterviewController(InterviewEngine engine) {
        this.engine = engine;
    }

    @PostMapping(value = "/start", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<Map<String, String>> start(@Valid @RequestBody StartRequest request,
                                              @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false)
                                              String authToken) {
        String sessionId = engine.startSession(request.userId(), request.mode(), request.purpose(), authToken);
        LOG.info("Started interview session {}", sessionId);
        return ResponseEntity.ok(Map.of("sessionId", sessionId));
    }

    @PostMapping(value = "/{sessionId}/turn",
            consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE,
            produces = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    ResponseEntity<byte[]> turn(@PathVariable String sessionId,
                                @RequestParam(defaultValue = "16000") int sampleRate,
                                @RequestBody(required = false) byte[] pcm) {
        AudioSegment response = engine.submitAudioTurn(sessionId, new AudioSegment(sampleRate, pcm));
        if (response.isEmpty()) {
            return ResponseEntity.noContent()
                    .header(SAMPLE_RATE_HEADER, String.valueOf(response.sampleRate()))
                    .build();
        }
        return ResponseEntity.ok()
                .header(SAMPLE_RATE_HEADER, String.valueOf(response.sampleRate()))
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .body(response.pcm());
    }

    @GetMapping("/{sessionId}/status")
    ResponseEntity<InterviewStatus> status(@PathVariable String sessionId) {
        return ResponseEntity.ok(engine.getStatus(sessionId));
    }

    @GetMapping("/{sessionId}/results")
    ResponseEntity<InterviewResult> results(@PathVariable String sessionId) {
        return ResponseEntity.ok(engine.getResults(sessionId));
    }

    @PostMapping("/{sessionId}/end")
    ResponseEntity<InterviewResult> end(@PathVariable String sessionId) {
        return ResponseEntity.ok(engine.endSession(sessionId));
    }

    @GetMapping("/{sessionId}/ice-servers")
    ResponseEntity<RelayCredential> iceServers(@PathVariable String sessionId,
                                               @RequestParam(required = false) String userId) {
        return ResponseEntity.ok(engine.issueRelayCredential(sessionId, userId));
    }

    /**
     * Body of {@code POST /api/interview/start}.
     */
    record StartRequest(
            @NotBlank(message = "userId must not be blank") String userId,
            String mode,
            String purpose
    ) {}
}
