package com.phillippitts.interviewengine.exception;

/**
 * Thrown when an audio segment is not valid PCM16 little-endian mono data
 * (odd byte count, non-positive sample rate, mismatched rates on concatenation).
 */
public class InvalidAudioException extends InterviewEngineException {

    private final int audioSize;
    private final String reason;

    public InvalidAudioException(String reason) {
        super("Invalid audio data: " + reason);
        this.audioSize = 0;
        this.reason = reason;
    }

    public InvalidAudioException(int audioSize, String reason) {
        super("Invalid audio data (" + audioSize + " bytes): " + reason);
        this.audioSize = audioSize;
        this.reason = reason;
    }

    public int getAudioSize() {
        return audioSize;
    }

    public String getReason() {
        return reason;
    }
}
