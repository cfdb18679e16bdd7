package com.phillippitts.interviewengine.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * OpenAI-compatible chat completion settings ({@code interview.llm.*}).
 * The HTTP text generator is only wired when {@code api-key} is set.
 */
@Validated
@ConfigurationProperties(prefix = "interview.llm")
public class LlmProperties {

    @NotBlank
    private String baseUrl = "https://api.openai.com/v1";

    private String apiKey = "";

    @NotBlank
    private String model = "gpt-4.1-nano-2025-04-14";

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperature = 0.7;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }
}
