package com.ryuqq.audioedit.adapter.dsp.executor;

import com.ryuqq.audioedit.adapter.dsp.support.AbstractPcmExecutor;
import com.ryuqq.audioedit.adapter.dsp.support.PcmMath;
import com.ryuqq.audioedit.core.executor.ExecutionContext;
import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationParameters;

import java.util.Map;
import java.util.NavigableMap;

/**
 * 대역별 피킹 EQ (biquad, Direct Form II Transposed, Q = 1.0).
 *
 * <p>나이퀴스트 이상인 대역은 건너뜁니다. 0.01dB 미만의 게인도 건너뜁니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class EqualizeExecutor extends AbstractPcmExecutor {

    private static final double Q = 1.0;

    public EqualizeExecutor() {
        super(OperationKind.EQUALIZE);
    }

    @Override
    protected AudioBuffer process(AudioBuffer input, OperationParameters parameters, ExecutionContext context) {
        NavigableMap<Double, Double> bands = parameters.getBands("bands");
        int channels = input.channels();
        int frames = input.frameCount();
        double nyquist = input.sampleRate() / 2.0;
        float[] samples = input.samples();

        for (Map.Entry<Double, Double> band : bands.entrySet()) {
            double frequency = band.getKey();
            double gainDb = band.getValue();
            if (frequency >= nyquist || Math.abs(gainDb) < 0.01) {
                continue;
            }
            double[] c = peakingCoefficients(frequency, gainDb, input.sampleRate());
            float b0 = (float) c[0];
            float b1 = (float) c[1];
            float b2 = (float) c[2];
            float a1 = (float) c[3];
            float a2 = (float) c[4];

            for (int ch = 0; ch < channels; ch++) {
                float z1 = 0f;
                float z2 = 0f;
                for (int frame = 0; frame < frames; frame++) {
                    PcmMath.checkInterrupted(frame);
                    int idx = frame * channels + ch;
                    float x = samples[idx];
                    float y = b0 * x + z1;
                    z1 = b1 * x - a1 * y + z2;
                    z2 = b2 * x - a2 * y;
                    samples[idx] = y;
                }
            }
        }
        return input.withSamples(samples);
    }

    /**
     * RBJ Audio EQ Cookbook 피킹 필터 계수, a0로 정규화.
     *
     * @return {b0, b1, b2, a1, a2}
     */
    static double[] peakingCoefficients(double frequency, double gainDb, int sampleRate) {
        double a = Math.pow(10.0, gainDb / 40.0);
        double w0 = 2.0 * Math.PI * frequency / sampleRate;
        double cos = Math.cos(w0);
        double alpha = Math.sin(w0) / (2.0 * Q);

        double a0 = 1.0 + alpha / a;
        return new double[] {
            (1.0 + alpha * a) / a0,
            (-2.0 * cos) / a0,
            (1.0 - alpha * a) / a0,
            (-2.0 * cos) / a0,
            (1.0 - alpha / a) / a0
        };
    }
}
