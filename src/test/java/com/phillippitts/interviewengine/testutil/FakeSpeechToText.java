package com.phillippitts.interviewengine.testutil;

import com.phillippitts.interviewengine.domain.AudioSegment;
import com.phillippitts.interviewengine.exception.CapabilityException;
import com.phillippitts.interviewengine.service.capability.Capability;
import com.phillippitts.interviewengine.service.capability.SpeechToText;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Test double for SpeechToText with scripted transcripts.
 *
 * <p>Each call pops the next scripted transcript; when the script runs out the
 * {@code cannedText} is returned. {@code cannedText}, {@code healthy} and {@code shouldFail}
 * are public so tests can flip them between turns.
 */
public class FakeSpeechToText implements SpeechToText {
    private final Deque<String> script = new ArrayDeque<>();
    public String cannedText;
    public boolean healthy = true;
    public boolean shouldFail;
    public volatile int calls;

    public FakeSpeechToText(String cannedText) {
        this.cannedText = cannedText;
    }

    public FakeSpeechToText then(String transcript) {
        script.addLast(transcript);
        return this;
    }

    @Override
    public synchronized String transcribe(AudioSegment segment) {
        calls++;
        if (shouldFail) {
            throw new CapabilityException("Engine configured to fail", Capability.STT);
        }
        return script.isEmpty() ? cannedText : script.pollFirst();
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }
}
