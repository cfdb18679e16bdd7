package com.phillippitts.interviewengine.service.health;

import com.phillippitts.interviewengine.service.capability.SpeechSynthesizer;
import com.phillippitts.interviewengine.service.capability.SpeechToText;
import com.phillippitts.interviewengine.service.capability.TextGenerator;
import com.phillippitts.interviewengine.service.capability.ThreadCreationClient;
import com.phillippitts.interviewengine.service.session.SessionRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of the speech and text capabilities a turn depends on.
 *
 * <ul>
 *   <li>UP: speech-to-text, text generation and synthesis all ready</li>
 *   <li>DEGRADED: at least one of them ready</li>
 *   <li>DOWN: none ready</li>
 * </ul>
 *
 * <p>Thread creation and active session count are reported as details only.
 * Exposed via /actuator/health.
 */
@Component
public class CapabilityHealthIndicator implements HealthIndicator {

    private final SpeechToText speechToText;
    private final TextGenerator textGenerator;
    private final SpeechSynthesizer speechSynthesizer;
    private final ThreadCreationClient threadClient;
    private final SessionRegistry registry;

    public CapabilityHealthIndicator(SpeechToText speechToText,
                                     TextGenerator textGenerator,
                                     SpeechSynthesizer speechSynthesizer,
                                     ThreadCreationClient threadClient,
                                     SessionRegistry registry) {
        this.speechToText = speechToText;
        this.textGenerator = textGenerator;
        this.speechSynthesizer = speechSynthesizer;
        this.threadClient = threadClient;
        this.registry = registry;
    }

    @Override
    public Health health() {
        boolean stt = speechToText.isHealthy();
        boolean llm = textGenerator.isHealthy();
        boolean tts = speechSynthesizer.isHealthy();

        Health.Builder builder = new Health.Builder();
        if (stt && llm && tts) {
            builder.up().withDetail("status", "All turn capabilities operational");
        } else if (stt || llm || tts) {
            builder.status("DEGRADED").withDetail("status", "Partial capability availability");
        } else {
            builder.down().withDetail("status", "No turn capabilities available");
        }
        return builder
                .withDetail(speechToText.getCapabilityName(), describe(stt))
                .withDetail(textGenerator.getCapabilityName(), describe(llm))
                .withDetail(speechSynthesizer.getCapabilityName(), describe(tts))
                .withDetail(threadClient.getCapabilityName(), describe(threadClient.isHealthy()))
                .withDetail("activeSessions", registry.size())
                .build();
    }

    private static String describe(boolean healthy) {
        return healthy ? "ready" : "unavailable";
    }
}
