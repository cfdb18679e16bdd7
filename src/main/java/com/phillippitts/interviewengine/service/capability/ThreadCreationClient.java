package com.phillippitts.interviewengine.service.capability;

import com.phillippitts.interviewengine.domain.ThreadCreationResult;
import com.phillippitts.interviewengine.domain.ThreadPayload;

/**
 * Downstream service that turns a completed interview into a learning thread.
 */
public interface ThreadCreationClient extends Capability {

    /**
     * @param payload   thread to create
     * @param authToken opaque caller token passed through unchanged; may be null
     */
    ThreadCreationResult createThread(ThreadPayload payload, String authToken);

    @Override
    default String getCapabilityName() {
        return THREAD_CREATION;
    }
}
