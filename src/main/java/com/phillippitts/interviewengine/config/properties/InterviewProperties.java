package com.phillippitts.interviewengine.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for interview behavior ({@code interview.*}).
 */
@Validated
@ConfigurationProperties(prefix = "interview")
public class InterviewProperties {

    /** Mode value that requests a learning thread once an interest is known. */
    @NotBlank
    private String threadMode = "thread";

    @NotBlank
    private String defaultPurpose = "create_learning_thread";

    @Valid
    private Turn turn = new Turn();

    @Valid
    private Analysis analysis = new Analysis();

    @Valid
    private Thread thread = new Thread();

    @Valid
    private Results results = new Results();

    public String getThreadMode() {
        return threadMode;
    }

    public void setThreadMode(String threadMode) {
        this.threadMode = threadMode;
    }

    public String getDefaultPurpose() {
        return defaultPurpose;
    }

    public void setDefaultPurpose(String defaultPurpose) {
        this.defaultPurpose = defaultPurpose;
    }

    public Turn getTurn() {
        return turn;
    }

    public void setTurn(Turn turn) {
        this.turn = turn;
    }

    public Analysis getAnalysis() {
        return analysis;
    }

    public void setAnalysis(Analysis analysis) {
        this.analysis = analysis;
    }

    public Thread getThread() {
        return thread;
    }

    public void setThread(Thread thread) {
        this.thread = thread;
    }

    public Results getResults() {
        return results;
    }

    public void setResults(Results results) {
        this.results = results;
    }

    /**
     * Per-turn processing.
     */
    public static class Turn {
        /** Transcripts shorter than this (after trimming) are treated as silence. */
        @Min(1)
        private int minTranscriptChars = 2;

        /** How long a turn waits behind an in-progress turn of the same session. */
        @NotNull
        private Duration queueTimeout = Duration.ofSeconds(30);

        /** Length of the silence segment returned when a turn degrades. */
        @NotNull
        private Duration silenceDuration = Duration.ofSeconds(1);

        public int getMinTranscriptChars() {
            return minTranscriptChars;
        }

        public void setMinTranscriptChars(int minTranscriptChars) {
            this.minTranscriptChars = minTranscriptChars;
        }

        public Duration getQueueTimeout() {
            return queueTimeout;
        }

        public void setQueueTimeout(Duration queueTimeout) {
            this.queueTimeout = queueTimeout;
        }

        public Duration getSilenceDuration() {
            return silenceDuration;
        }

        public void setSilenceDuration(Duration silenceDuration) {
            this.silenceDuration = silenceDuration;
        }
    }

    /**
     * Optional LLM analysis of each user utterance (sentiment, engagement, topics).
     */
    public static class Analysis {
        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    /**
     * Thread preparation.
     */
    public static class Thread {
        /** Ask the text generator for a thread title/description summary before hand-off. */
        private boolean summaryEnabled = true;

        public boolean isSummaryEnabled() {
            return summaryEnabled;
        }

        public void setSummaryEnabled(boolean summaryEnabled) {
            this.summaryEnabled = summaryEnabled;
        }
    }

    /**
     * Retention of results after a session ends.
     */
    public static class Results {
        @NotNull
        private Duration retention = Duration.ofMinutes(15);

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }
    }
}
