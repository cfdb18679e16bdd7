package com.phillippitts.interviewengine.service.capability;

import com.phillippitts.interviewengine.domain.ConversationMessage;
import com.phillippitts.interviewengine.exception.CapabilityExceptionBuilder;

import java.util.List;

/**
 * Placeholder used when {@code interview.llm.api-key} is blank and no other generator is wired.
 */
public class UnconfiguredTextGenerator implements TextGenerator {

    @Override
    public String generate(List<ConversationMessage> history, String systemInstruction) {
        throw CapabilityExceptionBuilder.create("No text generation engine configured")
                .capability(LLM)
                .reason("unavailable")
                .metadata("property", "interview.llm.api-key")
                .build();
    }

    @Override
    public boolean isHealthy() {
        return false;
    }
}
