package com.ryuqq.audioedit.adapter.dsp.support;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class PcmMathTest {

    @Test
    void resample_HalfRatio_DoublesLength() {
        float[] out = PcmMath.resample(new float[] {0f, 1f, 0f, -1f}, 1, 0.5);

        assertEquals(8, out.length);
        assertEquals(0.5f, out[1], 1e-6);
    }

    @Test
    void remix_StereoToMono_Averages() {
        float[] out = PcmMath.remix(new float[] {0.2f, 0.4f, -1f, 1f}, 2, 1);

        assertArrayEquals(new float[] {0.3f, 0f}, out, 1e-6f);
    }

    @Test
    void remix_MonoToStereo_Duplicates() {
        float[] out = PcmMath.remix(new float[] {0.2f, -0.4f}, 1, 2);

        assertArrayEquals(new float[] {0.2f, 0.2f, -0.4f, -0.4f}, out);
    }

    @Test
    void resample_InterruptedThread_StopsAndKeepsFlag() {
        Thread.currentThread().interrupt();
        try {
            assertThrows(CancellationException.class, () -> PcmMath.resample(new float[64], 1, 0.5));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void checkInterrupted_OnlyLooksAtCheckpointFrames() {
        Thread.currentThread().interrupt();
        try {
            assertDoesNotThrow(() -> PcmMath.checkInterrupted(1));
            assertThrows(CancellationException.class, () -> PcmMath.checkInterrupted(PcmMath.INTERRUPT_CHECK_FRAMES));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void checkInterrupted_NotInterrupted_Passes() {
        assertDoesNotThrow(() -> PcmMath.checkInterrupted(0));
    }

    @Test
    void moveSegments_ShiftsDropsAndKeepsZero() {
        List<Integer> moved = PcmMath.moveSegments(List.of(0, 100, 200, 300), 1.0, 150, 100);

        assertEquals(List.of(0, 50), moved);
    }

    @Test
    void dbConversions_AreInverse() {
        assertEquals(-6.0, PcmMath.linearToDb(PcmMath.dbToLinear(-6.0)), 1e-9);
        assertEquals(Double.NEGATIVE_INFINITY, PcmMath.linearToDb(0.0));
    }
}
