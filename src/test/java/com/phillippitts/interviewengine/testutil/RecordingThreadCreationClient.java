package com.phillippitts.interviewengine.testutil;

import com.phillippitts.interviewengine.domain.ThreadCreationResult;
import com.phillippitts.interviewengine.domain.ThreadPayload;
import com.phillippitts.interviewengine.exception.CapabilityException;
import com.phillippitts.interviewengine.service.capability.Capability;
import com.phillippitts.interviewengine.service.capability.ThreadCreationClient;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for ThreadCreationClient that records payloads and auth tokens.
 */
public class RecordingThreadCreationClient implements ThreadCreationClient {
    public final List<ThreadPayload> payloads = new CopyOnWriteArrayList<>();
    public final List<String> authTokens = new CopyOnWriteArrayList<>();
    public String threadId = "thread-42";
    public boolean shouldFail;

    @Override
    public ThreadCreationResult createThread(ThreadPayload payload, String authToken) {
        payloads.add(payload);
        authTokens.add(String.valueOf(authToken));
        if (shouldFail) {
            throw new CapabilityException("Thread service returned 502", Capability.THREAD_CREATION);
        }
        return new ThreadCreationResult(threadId);
    }
}
