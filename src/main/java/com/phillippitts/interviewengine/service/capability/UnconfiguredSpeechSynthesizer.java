package com.phillippitts.interviewengine.service.capability;

import com.phillippitts.interviewengine.domain.AudioSegment;
import com.phillippitts.interviewengine.exception.CapabilityExceptionBuilder;

import java.util.stream.Stream;

/**
 * Placeholder used when no speech synthesis engine bean is provided.
 */
public class UnconfiguredSpeechSynthesizer implements SpeechSynthesizer {

    @Override
    public Stream<AudioSegment> synthesize(String text) {
        throw CapabilityExceptionBuilder.create("No speech synthesis engine configured")
                .capability(TTS)
                .reason("unavailable")
                .build();
    }

    @Override
    public boolean isHealthy() {
        return false;
    }
}
