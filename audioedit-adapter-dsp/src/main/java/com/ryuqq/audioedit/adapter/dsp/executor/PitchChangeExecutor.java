package com.ryuqq.audioedit.adapter.dsp.executor;

import com.ryuqq.audioedit.adapter.dsp.support.AbstractPcmExecutor;
import com.ryuqq.audioedit.adapter.dsp.support.PcmMath;
import com.ryuqq.audioedit.core.executor.ExecutionContext;
import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationParameters;

/**
 * 길이를 유지한 채 semitones만큼 피치 이동.
 *
 * <p>리샘플링으로 피치를 옮긴 뒤 Hann 창 overlap-add로 원래 길이로 늘이거나 줄입니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class PitchChangeExecutor extends AbstractPcmExecutor {

    private static final int GRAIN_FRAMES = 1024;
    private static final int HOP_FRAMES = GRAIN_FRAMES / 4;

    public PitchChangeExecutor() {
        super(OperationKind.PITCH_CHANGE);
    }

    @Override
    protected AudioBuffer process(AudioBuffer input, OperationParameters parameters, ExecutionContext context) {
        double semitones = parameters.getDouble("semitones");
        if (semitones == 0.0) {
            return input.withSamples(input.samples());
        }
        int channels = input.channels();
        double ratio = Math.pow(2.0, semitones / 12.0);
        float[] shifted = PcmMath.resample(input.samples(), channels, ratio);
        return input.withSamples(stretch(shifted, channels, input.frameCount()));
    }

    private static float[] stretch(float[] samples, int channels, int targetFrames) {
        int inFrames = samples.length / channels;
        float[] out = new float[targetFrames * channels];
        float[] weight = new float[targetFrames];
        if (inFrames == 0 || targetFrames == 0) {
            return out;
        }
        double step = (double) inFrames / targetFrames;

        for (int outStart = 0; outStart < targetFrames; outStart += HOP_FRAMES) {
            int inStart = (int) Math.min((long) (outStart * step), Math.max(0, inFrames - 1));
            for (int i = 0; i < GRAIN_FRAMES; i++) {
                int outFrame = outStart + i;
                int inFrame = inStart + i;
                if (outFrame >= targetFrames || inFrame >= inFrames) {
                    break;
                }
                PcmMath.checkInterrupted(outFrame);
                float window = (float) (0.5 - 0.5 * Math.cos(2 * Math.PI * i / (GRAIN_FRAMES - 1)));
                weight[outFrame] += window;
                for (int ch = 0; ch < channels; ch++) {
                    out[outFrame * channels + ch] += samples[inFrame * channels + ch] * window;
                }
            }
        }

        for (int frame = 0; frame < targetFrames; frame++) {
            PcmMath.checkInterrupted(frame);
            if (weight[frame] > 1e-3f) {
                for (int ch = 0; ch < channels; ch++) {
                    out[frame * channels + ch] /= weight[frame];
                }
            }
        }
        return out;
    }
}
