package com.ryuqq.audioedit.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AudioBuffer 위치 변환 테스트.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
class AudioBufferTest {

    private static final int RATE = 44_100;

    @Test
    void frameAt_WithinBuffer_ConvertsMillis() {
        AudioBuffer buffer = AudioBuffer.silence(2_000, RATE, 2, "wav");

        assertEquals(0, buffer.frameAt(0));
        assertEquals(RATE / 2, buffer.frameAt(500));
        assertEquals(buffer.frameCount(), buffer.frameAt(2_000));
    }

    @Test
    void frameAt_NegativeMillis_ClampsToStart() {
        AudioBuffer buffer = AudioBuffer.silence(1_000, RATE, 1, "wav");

        assertEquals(0, buffer.frameAt(-5));
    }

    @Test
    void frameAt_MillisWhoseProductOverflows_ClampsToEnd() {
        // 44.1kHz에서 millis * sampleRate가 long 범위를 넘는 값
        AudioBuffer buffer = AudioBuffer.silence(2_000, RATE, 1, "wav");

        assertEquals(buffer.frameCount(), buffer.frameAt(300_000_000_000_000L));
        assertEquals(buffer.frameCount(), buffer.frameAt(Long.MAX_VALUE));
    }
}
