package com.ryuqq.audioedit.adapter.dsp.executor;

import com.ryuqq.audioedit.adapter.dsp.support.AbstractPcmExecutor;
import com.ryuqq.audioedit.adapter.dsp.support.PcmMath;
import com.ryuqq.audioedit.core.executor.ExecutionContext;
import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationParameters;

/**
 * Schroeder 리버브: 병렬 comb 필터 4개 + 직렬 allpass 2개.
 *
 * <p><strong>파라미터 매핑:</strong></p>
 * <ul>
 *   <li>room_size: comb 피드백 (0.70 ~ 0.98)</li>
 *   <li>damping: comb 피드백 경로의 고역 감쇠</li>
 *   <li>wet_level: 원음 대비 잔향 비율</li>
 * </ul>
 *
 * <p>지연 길이는 48kHz 기준 값을 버퍼 샘플레이트에 맞춰 환산합니다. 채널을 모노로 합쳐
 * 잔향을 만든 뒤 모든 채널에 더합니다. 길이는 변하지 않습니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class ReverbExecutor extends AbstractPcmExecutor {

    private static final double REFERENCE_RATE = 48_000.0;
    private static final int[] COMB_DELAYS = {1557, 1617, 1491, 1422};
    private static final int[] ALLPASS_DELAYS = {225, 556};
    private static final float ALLPASS_GAIN = 0.5f;

    public ReverbExecutor() {
        super(OperationKind.REVERB);
    }

    @Override
    protected AudioBuffer process(AudioBuffer input, OperationParameters parameters, ExecutionContext context) {
        float roomSize = (float) parameters.getDouble("room_size");
        float damping = (float) parameters.getDouble("damping");
        float wet = (float) parameters.getDouble("wet_level");
        float feedback = 0.70f + 0.28f * roomSize;

        int channels = input.channels();
        int frames = input.frameCount();
        double scale = input.sampleRate() / REFERENCE_RATE;

        float[][] combs = new float[COMB_DELAYS.length][];
        int[] combIndex = new int[COMB_DELAYS.length];
        float[] combDamp = new float[COMB_DELAYS.length];
        for (int c = 0; c < combs.length; c++) {
            combs[c] = new float[Math.max(1, (int) (COMB_DELAYS[c] * scale))];
        }
        float[][] allpasses = new float[ALLPASS_DELAYS.length][];
        int[] allpassIndex = new int[ALLPASS_DELAYS.length];
        for (int a = 0; a < allpasses.length; a++) {
            allpasses[a] = new float[Math.max(1, (int) (ALLPASS_DELAYS[a] * scale))];
        }

        float[] samples = input.samples();
        for (int frame = 0; frame < frames; frame++) {
            PcmMath.checkInterrupted(frame);
            float mono = 0f;
            for (int ch = 0; ch < channels; ch++) {
                mono += samples[frame * channels + ch];
            }
            mono /= channels;

            float combSum = 0f;
            for (int c = 0; c < combs.length; c++) {
                float[] line = combs[c];
                int idx = combIndex[c];
                float delayed = line[idx];
                combDamp[c] = delayed * (1f - damping) + combDamp[c] * damping;
                line[idx] = mono + combDamp[c] * feedback;
                combIndex[c] = idx + 1 < line.length ? idx + 1 : 0;
                combSum += delayed;
            }

            float ap = combSum / combs.length;
            for (int a = 0; a < allpasses.length; a++) {
                float[] line = allpasses[a];
                int idx = allpassIndex[a];
                float delayed = line[idx];
                float out = -ap + delayed;
                line[idx] = ap + delayed * ALLPASS_GAIN;
                allpassIndex[a] = idx + 1 < line.length ? idx + 1 : 0;
                ap = out;
            }

            for (int ch = 0; ch < channels; ch++) {
                int i = frame * channels + ch;
                samples[i] = PcmMath.clamp(samples[i] * (1f - wet) + ap * wet);
            }
        }
        return input.withSamples(samples);
    }
}
