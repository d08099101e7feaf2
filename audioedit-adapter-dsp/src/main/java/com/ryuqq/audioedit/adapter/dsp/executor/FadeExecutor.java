package com.ryuqq.audioedit.adapter.dsp.executor;

import com.ryuqq.audioedit.adapter.dsp.support.AbstractPcmExecutor;
import com.ryuqq.audioedit.core.executor.ExecutionContext;
import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationParameters;

/**
 * 선형 페이드 인/아웃.
 *
 * <p>duration_ms가 오디오보다 길면 전체 길이에 걸쳐 적용합니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class FadeExecutor extends AbstractPcmExecutor {

    private final boolean fadeIn;

    private FadeExecutor(OperationKind kind, boolean fadeIn) {
        super(kind);
        this.fadeIn = fadeIn;
    }

    public static FadeExecutor fadeIn() {
        return new FadeExecutor(OperationKind.FADE_IN, true);
    }

    public static FadeExecutor fadeOut() {
        return new FadeExecutor(OperationKind.FADE_OUT, false);
    }

    @Override
    protected AudioBuffer process(AudioBuffer input, OperationParameters parameters, ExecutionContext context) {
        int frames = input.frameCount();
        int fadeFrames = input.frameAt(parameters.getLong("duration_ms"));
        int channels = input.channels();
        float[] samples = input.samples();
        if (fadeFrames == 0) {
            return input.withSamples(samples);
        }

        int offset = fadeIn ? 0 : frames - fadeFrames;
        for (int i = 0; i < fadeFrames; i++) {
            float gain = fadeIn ? (float) i / fadeFrames : (float) (fadeFrames - 1 - i) / fadeFrames;
            int frame = offset + i;
            for (int ch = 0; ch < channels; ch++) {
                samples[frame * channels + ch] *= gain;
            }
        }
        return input.withSamples(samples);
    }
}
