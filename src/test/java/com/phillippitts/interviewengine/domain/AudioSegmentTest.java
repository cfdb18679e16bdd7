package com.phillippitts.interviewengine.domain;

import com.phillippitts.interviewengine.exception.InvalidAudioException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioSegmentTest {

    @Test
    void nullPcmIsEmpty() {
        AudioSegment segment = new AudioSegment(16_000, null);

        assertThat(segment.isEmpty()).isTrue();
        assertThat(segment.sampleCount()).isZero();
    }

    @Test
    void oddByteCountIsInvalid() {
        assertThatThrownBy(() -> new AudioSegment(16_000, new byte[3]))
                .isInstanceOf(InvalidAudioException.class)
                .hasMessageContaining("even byte count");
    }

    @Test
    void nonPositiveSampleRateIsInvalid() {
        assertThatThrownBy(() -> new AudioSegment(0, new byte[2]))
                .isInstanceOf(InvalidAudioException.class)
                .hasMessageContaining("positive");
    }

    @Test
    void sampleRateAboveMaximumIsInvalid() {
        assertThatThrownBy(() -> new AudioSegment(Integer.MAX_VALUE, new byte[2]))
                .isInstanceOf(InvalidAudioException.class)
                .hasMessageContaining("must not exceed 192000");
        assertThatThrownBy(() -> new AudioSegment(AudioSegment.MAX_SAMPLE_RATE + 1, new byte[2]))
                .isInstanceOf(InvalidAudioException.class);
    }

    @Test
    void silenceAtMaximumRateIsOneSecondOfZeros() {
        AudioSegment silence = AudioSegment.silence(AudioSegment.MAX_SAMPLE_RATE, Duration.ofSeconds(1));

        assertThat(silence.sampleCount()).isEqualTo(AudioSegment.MAX_SAMPLE_RATE);
        assertThat(silence.durationMillis()).isEqualTo(1000);
        assertThat(silence.pcm()).containsOnly((byte) 0);
    }

    @Test
    void silenceRoundsDownToWholeSamples() {
        AudioSegment silence = AudioSegment.silence(8_000, Duration.ofMillis(1_001));

        assertThat(silence.sampleCount()).isEqualTo(8_008);
    }
}
