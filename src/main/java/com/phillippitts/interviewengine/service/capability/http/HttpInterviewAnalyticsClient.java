package com.phillippitts.interviewengine.service.capability.http;

import com.phillippitts.interviewengine.domain.InterestRecord;
import com.phillippitts.interviewengine.domain.InterviewSummary;
import com.phillippitts.interviewengine.domain.TranscriptEntry;
import com.phillippitts.interviewengine.exception.CapabilityExceptionBuilder;
import com.phillippitts.interviewengine.service.capability.InterviewAnalyticsClient;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Objects;

/**
 * Posts an {@link InterviewSummary} to the analytics collector. A blank URL disables the client.
 */
public class HttpInterviewAnalyticsClient implements InterviewAnalyticsClient {

    private final RestTemplate restTemplate;
    private final String url;

    public HttpInterviewAnalyticsClient(RestTemplate restTemplate, String url) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.url = url == null ? "" : url.trim();
    }

    @Override
    public void submit(InterviewSummary summary) {
        if (url.isEmpty()) {
            throw CapabilityExceptionBuilder.create("Analytics service not configured")
                    .capability(ANALYTICS)
                    .reason("unavailable")
                    .metadata("property", "downstream.analytics-url")
                    .build();
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            restTemplate.postForEntity(url, new HttpEntity<>(toJson(summary).toString(), headers), String.class);
        } catch (RestClientException e) {
            throw CapabilityExceptionBuilder.create("Analytics submission failed")
                    .capability(ANALYTICS)
                    .cause(e)
                    .metadata("sessionId", summary.sessionId())
                    .build();
        }
    }

    @Override
    public boolean isHealthy() {
        return !url.isEmpty();
    }

    static JSONObject toJson(InterviewSummary summary) {
        JSONArray interests = new JSONArray();
        for (InterestRecord interest : summary.interests()) {
            interests.put(new JSONObject()
                    .put("name", interest.name())
                    .put("details", interest.context())
                    .put("detected_at", interest.detectedAt().toString()));
        }
        JSONArray transcript = new JSONArray();
        for (TranscriptEntry entry : summary.transcript()) {
            transcript.put(new JSONObject()
                    .put("speaker", entry.speaker().role())
                    .put("text", entry.text())
                    .put("timestamp", entry.timestamp().toString()));
        }
        return new JSONObject()
                .put("user_id", summary.userId())
                .put("session_id", summary.sessionId())
                .put("interests", interests)
                .put("transcript", transcript)
                .put("duration", summary.durationSeconds());
    }
}
