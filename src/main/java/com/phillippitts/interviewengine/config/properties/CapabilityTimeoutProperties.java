package com.phillippitts.interviewengine.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Per-capability call timeouts ({@code interview.capability.*-timeout}).
 */
@Validated
@ConfigurationProperties(prefix = "interview.capability")
public class CapabilityTimeoutProperties {

    @NotNull
    private Duration sttTimeout = Duration.ofSeconds(15);

    @NotNull
    private Duration llmTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration ttsTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration threadCreationTimeout = Duration.ofSeconds(15);

    @NotNull
    private Duration analyticsTimeout = Duration.ofSeconds(10);

    public Duration getSttTimeout() {
        return sttTimeout;
    }

    public void setSttTimeout(Duration sttTimeout) {
        this.sttTimeout = sttTimeout;
    }

    public Duration getLlmTimeout() {
        return llmTimeout;
    }

    public void setLlmTimeout(Duration llmTimeout) {
        this.llmTimeout = llmTimeout;
    }

    public Duration getTtsTimeout() {
        return ttsTimeout;
    }

    public void setTtsTimeout(Duration ttsTimeout) {
        this.ttsTimeout = ttsTimeout;
    }

    public Duration getThreadCreationTimeout() {
        return threadCreationTimeout;
    }

    public void setThreadCreationTimeout(Duration threadCreationTimeout) {
        this.threadCreationTimeout = threadCreationTimeout;
    }

    public Duration getAnalyticsTimeout() {
        return analyticsTimeout;
    }

    public void setAnalyticsTimeout(Duration analyticsTimeout) {
        this.analyticsTimeout = analyticsTimeout;
    }
}
