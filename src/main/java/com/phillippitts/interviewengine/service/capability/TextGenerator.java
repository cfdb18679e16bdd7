package com.phillippitts.interviewengine.service.capability;

import com.phillippitts.interviewengine.domain.ConversationMessage;

import java.util.List;

/**
 * Chat-style text generation engine.
 */
public interface TextGenerator extends Capability {

    /**
     * Generates the next assistant message.
     *
     * @param history           prior conversation, oldest first
     * @param systemInstruction instruction placed ahead of the history
     * @return generated text, possibly containing {@code [INTEREST: name]} markers
     * @throws com.phillippitts.interviewengine.exception.CapabilityException on engine failure
     */
    String generate(List<ConversationMessage> history, String systemInstruction);

    @Override
    default String getCapabilityName() {
        return LLM;
    }
}
