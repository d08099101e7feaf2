package com.ryuqq.audioedit.adapter.dsp.executor;

import com.ryuqq.audioedit.adapter.dsp.support.AbstractPcmExecutor;
import com.ryuqq.audioedit.adapter.dsp.support.PcmMath;
import com.ryuqq.audioedit.core.executor.ExecutionContext;
import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationParameters;

import java.util.Arrays;

/**
 * 잡음 바닥 추정 기반 다운워드 익스팬더.
 *
 * <p>20ms 창의 RMS 분포에서 하위 10%를 잡음 바닥으로 보고, 바닥의 2배 이하인 창을
 * {@code 1 - strength}배로 줄입니다. 창 경계는 게인을 선형 보간해 클릭을 막습니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class NoiseReductionExecutor extends AbstractPcmExecutor {

    private static final int WINDOW_MILLIS = 20;
    private static final double FLOOR_PERCENTILE = 0.10;
    private static final double GATE_MARGIN = 2.0;

    public NoiseReductionExecutor() {
        super(OperationKind.NOISE_REDUCTION);
    }

    @Override
    protected AudioBuffer process(AudioBuffer input, OperationParameters parameters, ExecutionContext context) {
        float strength = (float) parameters.getDouble("strength");
        int channels = input.channels();
        int frames = input.frameCount();
        int window = Math.max(1, input.sampleRate() * WINDOW_MILLIS / 1000);
        int windows = (frames + window - 1) / window;
        float[] samples = input.samples();
        if (windows == 0 || strength == 0f) {
            return input.withSamples(samples);
        }

        double[] rms = new double[windows];
        for (int w = 0; w < windows; w++) {
            int from = w * window;
            int to = Math.min(frames, from + window);
            double sum = 0.0;
            for (int i = from * channels; i < to * channels; i++) {
                sum += samples[i] * samples[i];
            }
            rms[w] = Math.sqrt(sum / Math.max(1, (to - from) * channels));
        }
        double[] sorted = rms.clone();
        Arrays.sort(sorted);
        double threshold = sorted[(int) (FLOOR_PERCENTILE * (windows - 1))] * GATE_MARGIN;

        float[] gains = new float[windows];
        for (int w = 0; w < windows; w++) {
            gains[w] = rms[w] <= threshold ? 1f - strength : 1f;
        }

        for (int frame = 0; frame < frames; frame++) {
            PcmMath.checkInterrupted(frame);
            int w = frame / window;
            float position = (float) (frame % window) / window;
            float next = w + 1 < windows ? gains[w + 1] : gains[w];
            float gain = gains[w] + (next - gains[w]) * position;
            for (int ch = 0; ch < channels; ch++) {
                samples[frame * channels + ch] *= gain;
            }
        }
        return input.withSamples(samples);
    }
}
