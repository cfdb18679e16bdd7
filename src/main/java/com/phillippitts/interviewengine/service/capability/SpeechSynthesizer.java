package com.phillippitts.interviewengine.service.capability;

import com.phillippitts.interviewengine.domain.AudioSegment;

import java.util.stream.Stream;

/**
 * Text-to-speech engine. Output is a lazy, finite stream of PCM chunks which the caller
 * concatenates and closes.
 */
public interface SpeechSynthesizer extends Capability {

    Stream<AudioSegment> synthesize(String text);

    @Override
    default String getCapabilityName() {
        return TTS;
    }
}
