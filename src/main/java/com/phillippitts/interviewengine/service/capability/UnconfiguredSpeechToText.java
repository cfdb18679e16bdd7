package com.phillippitts.interviewengine.service.capability;

import com.phillippitts.interviewengine.domain.AudioSegment;
import com.phillippitts.interviewengine.exception.CapabilityExceptionBuilder;

/**
 * Placeholder used when no speech-to-text engine bean is provided. Reports unhealthy and
 * fails every call, so turns degrade to silence.
 */
public class UnconfiguredSpeechToText implements SpeechToText {

    @Override
    public String transcribe(AudioSegment segment) {
        throw CapabilityExceptionBuilder.create("No speech-to-text engine configured")
                .capability(STT)
                .reason("unavailable")
                .build();
    }

    @Override
    public boolean isHealthy() {
        return false;
    }
}
