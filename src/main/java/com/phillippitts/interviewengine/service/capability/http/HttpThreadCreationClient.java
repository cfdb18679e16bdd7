package com.phillippitts.interviewengine.service.capability.http;

import com.phillippitts.interviewengine.domain.ThreadCreationResult;
import com.phillippitts.interviewengine.domain.ThreadPayload;
import com.phillippitts.interviewengine.exception.CapabilityExceptionBuilder;
import com.phillippitts.interviewengine.service.capability.ThreadCreationClient;
import com.phillippitts.interviewengine.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Objects;

/**
 * Posts a {@link ThreadPayload} as JSON to the learning-thread service.
 *
 * <p>The caller's opaque auth token is forwarded in the {@code Authorization} header as-is.
 * The response must carry {@code threadId} (or {@code id}). A blank URL disables the client.
 */
public class HttpThreadCreationClient implements ThreadCreationClient {

    private static final Logger LOG = LogManager.getLogger(HttpThreadCreationClient.class);

    private final RestTemplate restTemplate;
    private final String url;

    public HttpThreadCreationClient(RestTemplate restTemplate, String url) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.url = url == null ? "" : url.trim();
    }

    @Override
    public ThreadCreationResult createThread(ThreadPayload payload, String authToken) {
        if (url.isEmpty()) {
            throw CapabilityExceptionBuilder.create("Thread creation service not configured")
                    .capability(THREAD_CREATION)
                    .reason("unavailable")
                    .metadata("property", "downstream.thread-url")
                    .build();
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (authToken != null && !authToken.isBlank()) {
            headers.set(HttpHeaders.AUTHORIZATION, authToken);
        }
        LOG.debug("Submitting learning thread for session {} (auth={})",
                payload.metadata().get("sessionId"), LogSanitizer.mask(authToken));
        String body;
        try {
            body = restTemplate.postForObject(url, new HttpEntity<>(toJson(payload).toString(), headers),
                    String.class);
        } catch (RestClientException e) {
            throw CapabilityExceptionBuilder.create("Thread creation request failed")
                    .capability(THREAD_CREATION)
                    .cause(e)
                    .metadata("sessionId", payload.metadata().get("sessionId"))
                    .build();
        }
        String threadId = parseThreadId(body);
        LOG.info("Learning thread created: threadId={}, interests={}", threadId, payload.interests().size());
        return new ThreadCreationResult(threadId);
    }

    @Override
    public boolean isHealthy() {
        return !url.isEmpty();
    }

    static JSONObject toJson(ThreadPayload payload) {
        return new JSONObject()
                .put("userId", payload.userId())
                .put("title", payload.title())
                .put("description", payload.description())
                .put("interests", payload.interests())
                .put("concepts", payload.concepts())
                .put("subjects", payload.subjects())
                .put("topics", payload.topics())
                .put("status", payload.status())
                .put("metadata", payload.metadata());
    }

    private static String parseThreadId(String body) {
        try {
            JSONObject json = new JSONObject(body == null ? "" : body);
            String id = json.optString("threadId", json.optString("id", ""));
            if (!id.isBlank()) {
                return id;
            }
        } catch (JSONException e) {
            throw CapabilityExceptionBuilder.create("Malformed thread creation response")
                    .capability(THREAD_CREATION)
                    .cause(e)
                    .metadata("bodyPreview", LogSanitizer.truncate(body, 120))
                    .build();
        }
        throw CapabilityExceptionBuilder.create("Thread creation response has no thread id")
                .capability(THREAD_CREATION)
                .metadata("bodyPreview", LogSanitizer.truncate(body, 120))
                .build();
    }
}
