package com.phillippitts.interviewengine.domain;

import com.phillippitts.interviewengine.exception.InvalidAudioException;

import java.time.Duration;

/**
 * A chunk of mono 16-bit signed little-endian PCM audio tagged with its sample rate.
 *
 * <p>The engine never inspects samples beyond length checks; it forwards segments to the
 * speech capabilities and hands synthesized segments back to the caller.
 *
 * @param sampleRate sample rate in Hz, between 1 and {@value #MAX_SAMPLE_RATE}
 * @param pcm        raw PCM bytes, even length; null is treated as empty
 */
public record AudioSegment(int sampleRate, byte[] pcm) {

    /** Bytes per PCM16 mono frame. */
    public static final int BYTES_PER_SAMPLE = 2;

    /** Default sample rate used by the speech capabilities. */
    public static final int DEFAULT_SAMPLE_RATE = 16_000;

    /** Highest accepted sample rate. */
    public static final int MAX_SAMPLE_RATE = 192_000;

    public AudioSegment {
        if (sampleRate <= 0) {
            throw new InvalidAudioException("sample rate must be positive, got " + sampleRate);
        }
        if (sampleRate > MAX_SAMPLE_RATE) {
            throw new InvalidAudioException("sample rate must not exceed " + MAX_SAMPLE_RATE + " Hz, got "
                    + sampleRate);
        }
        pcm = pcm == null ? new byte[0] : pcm;
        if (pcm.length % BYTES_PER_SAMPLE != 0) {
            throw new InvalidAudioException(pcm.length, "PCM16 data must have an even byte count");
        }
    }

    public static AudioSegment empty(int sampleRate) {
        return new AudioSegment(sampleRate, new byte[0]);
    }

    /**
     * All-zero PCM of the given duration, rounded down to whole samples.
     */
    public static AudioSegment silence(int sampleRate, Duration duration) {
        long samples = (long) sampleRate * duration.toMillis() / 1000L;
        return new AudioSegment(sampleRate, new byte[Math.toIntExact(samples * BYTES_PER_SAMPLE)]);
    }

    public boolean isEmpty() {
        return pcm.length == 0;
    }

    public int sampleCount() {
        return pcm.length / BYTES_PER_SAMPLE;
    }

    public long durationMillis() {
        return sampleCount() * 1000L / sampleRate;
    }
}
