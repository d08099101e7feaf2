package com.ryuqq.audioedit.testkit.fixture;

import com.ryuqq.audioedit.core.model.AudioBuffer;

/**
 * Synthetic audio buffers for tests.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class TestAudio {

    public static final int SAMPLE_RATE = 8_000;

    private TestAudio() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Sine tone.
     *
     * @param millis duration
     * @param frequency tone frequency in Hz
     * @param amplitude peak amplitude in [0, 1]
     * @param channels channel count (same signal on every channel)
     * @return the buffer, format {@code wav}
     */
    public static AudioBuffer sine(long millis, double frequency, double amplitude, int channels) {
        int frames = (int) (millis * SAMPLE_RATE / 1000L);
        float[] samples = new float[frames * channels];
        for (int frame = 0; frame < frames; frame++) {
            float value = (float) (amplitude * Math.sin(2 * Math.PI * frequency * frame / SAMPLE_RATE));
            for (int ch = 0; ch < channels; ch++) {
                samples[frame * channels + ch] = value;
            }
        }
        return AudioBuffer.of(samples, SAMPLE_RATE, channels, "wav");
    }

    /**
     * One second of a 440 Hz mono tone at half scale.
     */
    public static AudioBuffer tone() {
        return sine(1_000, 440.0, 0.5, 1);
    }

    /**
     * Constant-level buffer (every sample equal to {@code level}).
     */
    public static AudioBuffer constant(long millis, float level, int channels) {
        int frames = (int) (millis * SAMPLE_RATE / 1000L);
        float[] samples = new float[frames * channels];
        java.util.Arrays.fill(samples, level);
        return AudioBuffer.of(samples, SAMPLE_RATE, channels, "wav");
    }
}
