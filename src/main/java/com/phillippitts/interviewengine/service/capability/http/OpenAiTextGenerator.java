package com.phillippitts.interviewengine.service.capability.http;

import com.phillippitts.interviewengine.config.properties.LlmProperties;
import com.phillippitts.interviewengine.domain.ConversationMessage;
import com.phillippitts.interviewengine.exception.CapabilityExceptionBuilder;
import com.phillippitts.interviewengine.service.capability.TextGenerator;
import com.phillippitts.interviewengine.util.LogSanitizer;
import com.phillippitts.interviewengine.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Objects;

/**
 * {@link TextGenerator} backed by an OpenAI-compatible {@code /chat/completions} endpoint.
 *
 * <p>Request and response bodies are built and parsed with org.json. The system instruction is
 * sent as the first message, followed by the conversation history.
 */
public class OpenAiTextGenerator implements TextGenerator {

    private static final Logger LOG = LogManager.getLogger(OpenAiTextGenerator.class);

    private final RestTemplate restTemplate;
    private final LlmProperties props;

    public OpenAiTextGenerator(RestTemplate restTemplate, LlmProperties props) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public String generate(List<ConversationMessage> history, String systemInstruction) {
        String url = stripTrailingSlash(props.getBaseUrl()) + "/chat/completions";
        String body = buildRequest(history, systemInstruction).toString();

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(props.getApiKey());
        headers.setContentType(MediaType.APPLICATION_JSON);

        long start = System.nanoTime();
        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
        } catch (RestClientException e) {
            throw CapabilityExceptionBuilder.create("Chat completion request failed")
                    .capability(LLM)
                    .cause(e)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .metadata("model", props.getModel())
                    .build();
        }
        String content = parseContent(response.getBody());
        LOG.debug("Chat completion in {} ms: model={}, preview=\"{}\"",
                TimeUtils.elapsedMillis(start), props.getModel(), LogSanitizer.truncate(content, 60));
        return content;
    }

    @Override
    public boolean isHealthy() {
        return props.getApiKey() != null && !props.getApiKey().isBlank();
    }

    JSONObject buildRequest(List<ConversationMessage> history, String systemInstruction) {
        JSONArray messages = new JSONArray();
        if (systemInstruction != null && !systemInstruction.isBlank()) {
            messages.put(new JSONObject().put("role", "system").put("content", systemInstruction));
        }
        for (ConversationMessage m : history) {
            messages.put(new JSONObject().put("role", m.role().role()).put("content", m.content()));
        }
        return new JSONObject()
                .put("model", props.getModel())
                .put("temperature", props.getTemperature())
                .put("messages", messages);
    }

    private String parseContent(String body) {
        if (body == null || body.isBlank()) {
            throw CapabilityExceptionBuilder.create("Empty chat completion response")
                    .capability(LLM)
                    .build();
        }
        try {
            JSONObject root = new JSONObject(body);
            JSONArray choices = root.getJSONArray("choices");
            if (choices.isEmpty()) {
                throw CapabilityExceptionBuilder.create("Chat completion returned no choices")
                        .capability(LLM)
                        .build();
            }
            return choices.getJSONObject(0).getJSONObject("message").optString("content", "");
        } catch (JSONException e) {
            throw CapabilityExceptionBuilder.create("Malformed chat completion response")
                    .capability(LLM)
                    .cause(e)
                    .metadata("bodyPreview", LogSanitizer.truncate(body, 120))
                    .build();
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
