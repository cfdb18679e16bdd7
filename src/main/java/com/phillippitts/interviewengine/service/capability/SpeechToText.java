package com.phillippitts.interviewengine.service.capability;

import com.phillippitts.interviewengine.domain.AudioSegment;

/**
 * Speech-to-text engine.
 */
public interface SpeechToText extends Capability {

    /**
     * Transcribes one audio segment.
     *
     * @param segment PCM16LE mono audio
     * @return transcribed text; empty when nothing intelligible was heard
     * @throws com.phillippitts.interviewengine.exception.CapabilityException on engine failure
     */
    String transcribe(AudioSegment segment);

    @Override
    default String getCapabilityName() {
        return STT;
    }
}
