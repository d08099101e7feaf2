package com.ryuqq.audioedit.adapter.dsp.executor;

import com.ryuqq.audioedit.adapter.dsp.PcmCatalogs;
import com.ryuqq.audioedit.core.catalog.OperationCatalog;
import com.ryuqq.audioedit.core.exception.AudioNotFoundException;
import com.ryuqq.audioedit.core.exception.ValidationException;
import com.ryuqq.audioedit.core.executor.ExecutionContext;
import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.AudioRef;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationParameters;
import com.ryuqq.audioedit.core.model.RequestId;
import com.ryuqq.audioedit.core.outcome.Fail;
import com.ryuqq.audioedit.core.outcome.Ok;
import com.ryuqq.audioedit.core.outcome.Outcome;
import com.ryuqq.audioedit.testkit.fixture.TestAudio;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PCM 실행기 테스트.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
class PcmExecutorsTest {

    private static final OperationCatalog CATALOG = PcmCatalogs.standard();
    private static final int RATE = TestAudio.SAMPLE_RATE;

    // ========== Catalog ==========

    @ParameterizedTest
    @EnumSource(OperationKind.class)
    void standardCatalog_ExampleParameters_ProduceOutput(OperationKind kind) {
        Map<String, Object> example = CATALOG.describe(kind).exampleParameters();
        OperationParameters parameters = CATALOG.normalize(kind, example);

        Outcome outcome = CATALOG.executorFor(kind).execute(TestAudio.sine(2_000, 440, 0.5, 2), parameters,
            contextWith(Map.of(AudioRef.of("audio/second.wav"), TestAudio.sine(500, 220, 0.3, 1))));

        assertTrue(outcome.isOk(), kind + " should succeed on its example parameters: " + outcome);
    }

    // ========== Trim ==========

    @Test
    void trim_KeepsRequestedRegion() {
        AudioBuffer input = TestAudio.sine(2_000, 440, 0.5, 1);

        AudioBuffer output = run(OperationKind.TRIM, Map.of("start_ms", 500, "end_ms", 1500), input);

        assertEquals(1_000, output.durationMillis());
        assertEquals(input.sample(RATE / 2, 0), output.sample(0, 0));
    }

    @Test
    void trim_EndBeyondLength_ClampsToEnd() {
        AudioBuffer output = run(OperationKind.TRIM, Map.of("start_ms", 1500, "end_ms", 60_000),
            TestAudio.sine(2_000, 440, 0.5, 1));

        assertEquals(500, output.durationMillis());
    }

    @Test
    void trim_HugeEnd_ClampsToEndInsteadOfOverflowing() {
        AudioBuffer input = TestAudio.sine(2_000, 440, 0.5, 1);

        AudioBuffer whole = run(OperationKind.TRIM, Map.of("start_ms", 0, "end_ms", Long.MAX_VALUE), input);
        AudioBuffer tail = run(OperationKind.TRIM, Map.of("start_ms", 500, "end_ms", "9e18"), input);

        assertEquals(2_000, whole.durationMillis());
        assertEquals(1_500, tail.durationMillis());
    }

    @Test
    void trim_EndBeyondLongRange_RejectedAtValidation() {
        assertThrows(ValidationException.class,
            () -> CATALOG.normalize(OperationKind.TRIM, Map.of("start_ms", 500, "end_ms", "1e30")));
    }

    @Test
    void trim_StartBeyondLength_Fails() {
        Outcome outcome = execute(OperationKind.TRIM, Map.of("start_ms", 5_000, "end_ms", 6_000),
            TestAudio.sine(1_000, 440, 0.5, 1));

        assertTrue(outcome.isFail());
        assertEquals(TrimExecutor.RANGE_OUT_OF_BOUNDS, ((Fail) outcome).errorCode());
    }

    // ========== Level ==========

    @Test
    void normalize_PeakReachesTarget() {
        AudioBuffer output = run(OperationKind.NORMALIZE, Map.of("target_db", -6.0), TestAudio.sine(500, 440, 0.1, 1));

        assertEquals(Math.pow(10, -6.0 / 20), output.peak(), 1e-3);
    }

    @Test
    void normalize_Silence_Unchanged() {
        AudioBuffer output = run(OperationKind.NORMALIZE, Map.of(), AudioBuffer.silence(500, RATE, 1, "wav"));

        assertEquals(0f, output.peak());
    }

    @Test
    void fadeIn_StartsSilentAndEndsUntouched() {
        AudioBuffer input = TestAudio.constant(1_000, 0.5f, 1);

        AudioBuffer output = run(OperationKind.FADE_IN, Map.of("duration_ms", 500), input);

        assertEquals(0f, output.sample(0, 0));
        assertTrue(output.sample(RATE / 4, 0) < 0.5f);
        assertEquals(0.5f, output.sample(output.frameCount() - 1, 0));
    }

    @Test
    void fadeOut_LongerThanAudio_CoversWholeBuffer() {
        AudioBuffer output = run(OperationKind.FADE_OUT, Map.of("duration_ms", 10_000), TestAudio.constant(1_000, 0.5f, 1));

        assertTrue(output.sample(0, 0) <= 0.5f);
        assertEquals(0f, output.sample(output.frameCount() - 1, 0));
    }

    @Test
    void compress_ReducesLoudSignal() {
        AudioBuffer input = TestAudio.constant(1_000, 0.9f, 1);

        AudioBuffer output = run(OperationKind.COMPRESS, Map.of("threshold_db", -20.0, "ratio", 8.0), input);

        assertTrue(output.sample(output.frameCount() - 1, 0) < 0.9f * 0.8f);
    }

    @Test
    void noiseReduction_AttenuatesQuietTail() {
        float[] samples = new float[RATE];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = i < RATE / 2 ? (float) (0.8 * Math.sin(i * 0.3)) : (i % 2 == 0 ? 0.01f : -0.01f);
        }
        AudioBuffer input = AudioBuffer.of(samples, RATE, 1, "wav");

        AudioBuffer output = run(OperationKind.NOISE_REDUCTION, Map.of("strength", 1.0), input);

        assertTrue(Math.abs(output.sample(RATE - 10, 0)) < 0.005f);
        assertEquals(input.sample(RATE / 4, 0), output.sample(RATE / 4, 0), 1e-6);
    }

    // ========== Time / pitch ==========

    @Test
    void speedChange_ScalesDuration() {
        AudioBuffer output = run(OperationKind.SPEED_CHANGE, Map.of("factor", 2.0), TestAudio.sine(2_000, 440, 0.5, 2));

        assertEquals(1_000, output.durationMillis());
        assertEquals(2, output.channels());
    }

    @Test
    void pitchChange_KeepsDuration() {
        AudioBuffer input = TestAudio.sine(1_000, 440, 0.5, 1);

        AudioBuffer output = run(OperationKind.PITCH_CHANGE, Map.of("semitones", 12.0), input);

        assertEquals(input.frameCount(), output.frameCount());
        assertTrue(output.peak() > 0.1f);
    }

    @Test
    void reverb_AddsTailEnergyAfterImpulse() {
        float[] samples = new float[RATE];
        samples[0] = 1f;
        AudioBuffer output = run(OperationKind.REVERB, Map.of("wet_level", 1.0), AudioBuffer.of(samples, RATE, 1, "wav"));

        float tail = 0f;
        for (int i = RATE / 10; i < RATE / 2; i++) {
            tail = Math.max(tail, Math.abs(output.sample(i, 0)));
        }
        assertTrue(tail > 0f, "reverb should leave energy after the impulse");
        assertEquals(RATE, output.frameCount());
    }

    @Test
    void equalize_BoostRaisesLevelAtBand() {
        AudioBuffer input = TestAudio.sine(1_000, 1_000, 0.2, 1);

        AudioBuffer output = run(OperationKind.EQUALIZE, Map.of("bands", Map.of("1000", 12)), input);

        assertTrue(output.peak() > input.peak() * 2);
    }

    // ========== Format / structure ==========

    @Test
    void convertFormat_ChangesLayoutAndTag() {
        AudioBuffer output = run(OperationKind.CONVERT_FORMAT,
            Map.of("target_format", "flac", "sample_rate", 16_000, "channels", 1),
            TestAudio.sine(1_000, 440, 0.5, 2));

        assertEquals("flac", output.format());
        assertEquals(16_000, output.sampleRate());
        assertEquals(1, output.channels());
        assertEquals(1_000, output.durationMillis());
    }

    @Test
    void convertFormat_MalformedBitrate_RejectedAtValidation() {
        ValidationException e = assertThrows(ValidationException.class, () ->
            CATALOG.normalize(OperationKind.CONVERT_FORMAT, Map.of("target_format", "mp3", "bitrate", "fast")));

        assertEquals("bitrate", e.getParameter());
    }

    @Test
    void merge_AppendsSourcesInOrder() {
        AudioRef second = AudioRef.of("audio/b.wav");
        AudioRef third = AudioRef.of("audio/c.wav");
        ExecutionContext context = contextWith(Map.of(
            second, TestAudio.constant(500, 0.2f, 1),
            third, TestAudio.constant(250, 0.3f, 1)));

        Outcome outcome = execute(OperationKind.MERGE, Map.of("sources", List.of("audio/b.wav", "audio/c.wav")),
            TestAudio.constant(1_000, 0.1f, 2), context);

        AudioBuffer output = ((Ok) outcome).output();
        assertEquals(1_750, output.durationMillis());
        assertEquals(2, output.channels());
        assertEquals(0.3f, output.sample(output.frameCount() - 1, 1));
    }

    @Test
    void merge_Crossfade_OverlapsBoundary() {
        AudioRef second = AudioRef.of("audio/b.wav");
        Outcome outcome = execute(OperationKind.MERGE, Map.of("sources", List.of("audio/b.wav"), "crossfade_ms", 200),
            TestAudio.constant(1_000, 0.1f, 1), contextWith(Map.of(second, TestAudio.constant(1_000, 0.2f, 1))));

        assertEquals(1_800, ((Ok) outcome).output().durationMillis());
    }

    @Test
    void merge_MissingSource_Propagates() {
        assertThrows(AudioNotFoundException.class, () -> execute(OperationKind.MERGE,
            Map.of("sources", List.of("audio/missing.wav")), TestAudio.tone(), contextWith(Map.of())));
    }

    @Test
    void split_MarksSegmentsAndSurvivesLevelChanges() {
        AudioBuffer split = run(OperationKind.SPLIT, Map.of("segment_ms", 300), TestAudio.sine(1_000, 440, 0.5, 1));
        AudioBuffer normalized = run(OperationKind.NORMALIZE, Map.of(), split);

        assertEquals(List.of(0, 2_400, 4_800, 7_200), split.segmentStarts());
        assertEquals(split.segmentStarts(), normalized.segmentStarts());
    }

    @Test
    void speedChange_RescalesSegments() {
        AudioBuffer split = run(OperationKind.SPLIT, Map.of("segment_ms", 500), TestAudio.sine(1_000, 440, 0.5, 1));

        AudioBuffer faster = run(OperationKind.SPEED_CHANGE, Map.of("factor", 2.0), split);

        assertEquals(List.of(0, 2_000), faster.segmentStarts());
    }

    // ========== Interruption ==========

    @ParameterizedTest
    @EnumSource(value = OperationKind.class,
        names = {"REVERB", "COMPRESS", "EQUALIZE", "NOISE_REDUCTION", "PITCH_CHANGE", "SPEED_CHANGE", "NORMALIZE"})
    void interruptedThread_StopsInsteadOfProcessing(OperationKind kind) {
        OperationParameters parameters = CATALOG.normalize(kind, CATALOG.describe(kind).exampleParameters());
        AudioBuffer input = TestAudio.sine(2_000, 440, 0.5, 2);

        Thread.currentThread().interrupt();
        try {
            assertThrows(CancellationException.class,
                () -> CATALOG.executorFor(kind).execute(input, parameters, contextWith(Map.of())));
        } finally {
            Thread.interrupted();
        }
    }

    // ========== Helpers ==========

    private static AudioBuffer run(OperationKind kind, Map<String, ?> raw, AudioBuffer input) {
        Outcome outcome = execute(kind, raw, input);
        assertTrue(outcome.isOk(), kind + " failed: " + outcome);
        return ((Ok) outcome).output();
    }

    private static Outcome execute(OperationKind kind, Map<String, ?> raw, AudioBuffer input) {
        return execute(kind, raw, input, contextWith(Map.of()));
    }

    private static Outcome execute(OperationKind kind, Map<String, ?> raw, AudioBuffer input, ExecutionContext context) {
        OperationParameters parameters = CATALOG.normalize(kind, raw);
        return CATALOG.executorFor(kind).execute(input, parameters, context);
    }

    private static ExecutionContext contextWith(Map<AudioRef, AudioBuffer> sources) {
        return new ExecutionContext() {
            @Override
            public RequestId requestId() {
                return RequestId.of("REQ-000001");
            }

            @Override
            public AudioBuffer loadSource(AudioRef ref) {
                AudioBuffer buffer = sources.get(ref);
                if (buffer == null) {
                    throw new AudioNotFoundException(ref);
                }
                return buffer;
            }
        };
    }
}
