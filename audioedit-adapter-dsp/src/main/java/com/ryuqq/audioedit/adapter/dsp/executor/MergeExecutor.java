package com.ryuqq.audioedit.adapter.dsp.executor;

import com.ryuqq.audioedit.adapter.dsp.support.AbstractPcmExecutor;
import com.ryuqq.audioedit.adapter.dsp.support.PcmMath;
import com.ryuqq.audioedit.core.executor.ExecutionContext;
import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.AudioRef;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationParameters;

import java.util.List;

/**
 * 현재 오디오 뒤에 sources를 순서대로 이어 붙임.
 *
 * <p>각 소스는 현재 버퍼의 샘플레이트와 채널 수로 맞춘 뒤 붙입니다. crossfade_ms가
 * 0보다 크면 경계에서 선형 크로스페이드로 겹칩니다 (겹치는 길이는 양쪽 중 짧은 쪽을 넘지 않음).</p>
 *
 * <p>소스를 읽지 못하면 {@link ExecutionContext#loadSource(AudioRef)}의 예외가 그대로 전파됩니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class MergeExecutor extends AbstractPcmExecutor {

    public MergeExecutor() {
        super(OperationKind.MERGE);
    }

    @Override
    protected AudioBuffer process(AudioBuffer input, OperationParameters parameters, ExecutionContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null for merge");
        }
        List<AudioRef> sources = parameters.getSources("sources");
        long crossfadeMillis = parameters.getLong("crossfade_ms");
        int channels = input.channels();
        int rate = input.sampleRate();

        float[] merged = input.samples();
        for (AudioRef ref : sources) {
            AudioBuffer next = context.loadSource(ref);
            float[] appended = PcmMath.conform(next.samples(), next.sampleRate(), next.channels(), rate, channels);
            int overlap = (int) Math.min(crossfadeMillis * rate / 1000L,
                Math.min(merged.length, appended.length) / channels);
            merged = append(merged, appended, channels, overlap);
        }
        return input.withSamples(merged);
    }

    private static float[] append(float[] head, float[] tail, int channels, int overlapFrames) {
        int overlap = overlapFrames * channels;
        float[] out = new float[head.length + tail.length - overlap];
        System.arraycopy(head, 0, out, 0, head.length - overlap);
        int base = head.length - overlap;
        for (int frame = 0; frame < overlapFrames; frame++) {
            float t = overlapFrames == 1 ? 0.5f : (float) frame / (overlapFrames - 1);
            for (int ch = 0; ch < channels; ch++) {
                int i = frame * channels + ch;
                out[base + i] = head[base + i] * (1f - t) + tail[i] * t;
            }
        }
        System.arraycopy(tail, overlap, out, head.length, tail.length - overlap);
        return out;
    }
}
