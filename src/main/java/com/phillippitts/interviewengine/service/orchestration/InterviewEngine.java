package com.phillippitts.interviewengine.service.orchestration;

import com.phillippitts.interviewengine.domain.AudioSegment;
import com.phillippitts.interviewengine.domain.InterviewResult;
import com.phillippitts.interviewengine.domain.InterviewStatus;
import com.phillippitts.interviewengine.domain.RelayCredential;

/**
 * Entry point for running voice interviews.
 *
 * <p>Sessions are independent and may be driven concurrently. Turns for one session are
 * serialized. Unknown session ids raise
 * {@link com.phillippitts.interviewengine.exception.SessionNotFoundException}.
 */
public interface InterviewEngine {

    /**
     * Starts a session.
     *
     * @param userId    owner (required)
     * @param mode      interview mode; the thread mode requests a learning thread (nullable)
     * @param purpose   purpose tag forwarded to the thread service (nullable)
     * @param authToken opaque token forwarded to downstream services (nullable)
     * @return new session id
     */
    String startSession(String userId, String mode, String purpose, String authToken);

    /**
     * Processes one audio turn.
     *
     * @return the synthesized response, a short silence when the turn degraded, or an empty
     *         segment when the input held no speech
     */
    AudioSegment submitAudioTurn(String sessionId, AudioSegment audio);

    InterviewStatus getStatus(String sessionId);

    /**
     * Results of an active session, or of an ended one within the retention window.
     */
    InterviewResult getResults(String sessionId);

    /**
     * Ends a session: cancels any in-flight turn, runs the downstream hand-off, and removes the
     * session from the registry.
     */
    InterviewResult endSession(String sessionId);

    /**
     * Issues a relay credential scoped to an active session.
     */
    RelayCredential issueRelayCredential(String sessionId, String userId);
}
