package com.ryuqq.audioedit.adapter.dsp.executor;

import com.ryuqq.audioedit.adapter.dsp.support.AbstractPcmExecutor;
import com.ryuqq.audioedit.adapter.dsp.support.PcmMath;
import com.ryuqq.audioedit.core.executor.ExecutionContext;
import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationParameters;

/**
 * Feed-forward RMS 컴프레서.
 *
 * <p><strong>알고리즘:</strong></p>
 * <ol>
 *   <li>지수 이동 평균으로 프레임 전력(RMS²) 추정</li>
 *   <li>레벨이 threshold_db를 넘으면 목표 게인 = threshold + (level - threshold) / ratio - level</li>
 *   <li>attack_ms / release_ms 시상수로 게인 감소량을 평활</li>
 * </ol>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class CompressExecutor extends AbstractPcmExecutor {

    private static final float RMS_SMOOTHING = 0.001f;

    public CompressExecutor() {
        super(OperationKind.COMPRESS);
    }

    @Override
    protected AudioBuffer process(AudioBuffer input, OperationParameters parameters, ExecutionContext context) {
        float thresholdDb = (float) parameters.getDouble("threshold_db");
        float ratio = (float) Math.max(1.0, parameters.getDouble("ratio"));
        float attackCoeff = coefficient(parameters.getDouble("attack_ms"), input.sampleRate());
        float releaseCoeff = coefficient(parameters.getDouble("release_ms"), input.sampleRate());

        int channels = input.channels();
        int frames = input.frameCount();
        float[] samples = input.samples();
        float rmsSquared = 0f;
        float gain = 1f;

        for (int frame = 0; frame < frames; frame++) {
            PcmMath.checkInterrupted(frame);
            float sumSq = 0f;
            for (int ch = 0; ch < channels; ch++) {
                float s = samples[frame * channels + ch];
                sumSq += s * s;
            }
            rmsSquared += (sumSq / channels - rmsSquared) * RMS_SMOOTHING;

            float levelDb = rmsSquared > 1e-10f ? (float) (10.0 * Math.log10(rmsSquared)) : -100f;
            float target = 1f;
            if (levelDb > thresholdDb) {
                float gainDb = thresholdDb + (levelDb - thresholdDb) / ratio - levelDb;
                target = (float) Math.pow(10.0, gainDb / 20.0);
            }
            gain += (target - gain) * (target < gain ? attackCoeff : releaseCoeff);

            for (int ch = 0; ch < channels; ch++) {
                samples[frame * channels + ch] *= gain;
            }
        }
        return input.withSamples(samples);
    }

    // 1 - exp(-1 / 시상수 샘플 수)
    private static float coefficient(double millis, int sampleRate) {
        double samples = Math.max(1.0, millis / 1000.0 * sampleRate);
        return (float) (1.0 - Math.exp(-1.0 / samples));
    }
}
