package com.phillippitts.interviewengine.service.capability;

/**
 * Common contract of every external collaborator the engine calls.
 *
 * <p>Implementations must be thread-safe: one instance serves all sessions, and calls for
 * different sessions run concurrently on the capability pool. Failures are reported by throwing
 * {@link com.phillippitts.interviewengine.exception.CapabilityException}; the engine never lets
 * them escape a turn.
 */
public interface Capability {

    /** Speech-to-text. */
    String STT = "stt";
    /** Text generation. */
    String LLM = "llm";
    /** Speech synthesis. */
    String TTS = "tts";
    /** Learning-thread creation. */
    String THREAD_CREATION = "thread-creation";
    /** Interview analytics. */
    String ANALYTICS = "analytics";

    /**
     * Name used in logs, metrics tags and health details.
     */
    String getCapabilityName();

    /**
     * Whether the capability is configured and expected to work. Used by the health indicator.
     */
    default boolean isHealthy() {
        return true;
    }
}
