package com.ryuqq.audioedit.adapter.dsp.executor;

import com.ryuqq.audioedit.adapter.dsp.support.AbstractPcmExecutor;
import com.ryuqq.audioedit.adapter.dsp.support.PcmMath;
import com.ryuqq.audioedit.core.executor.ExecutionContext;
import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationParameters;

/**
 * 피크가 target_db dBFS가 되도록 전체 게인 조정.
 *
 * <p>무음 입력은 그대로 반환합니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class NormalizeExecutor extends AbstractPcmExecutor {

    public NormalizeExecutor() {
        super(OperationKind.NORMALIZE);
    }

    @Override
    protected AudioBuffer process(AudioBuffer input, OperationParameters parameters, ExecutionContext context) {
        float peak = input.peak();
        if (peak < PcmMath.SILENCE_THRESHOLD) {
            return input.withSamples(input.samples());
        }
        float gain = (float) (PcmMath.dbToLinear(parameters.getDouble("target_db")) / peak);
        float[] samples = input.samples();
        for (int i = 0; i < samples.length; i++) {
            PcmMath.checkInterrupted(i);
            samples[i] *= gain;
        }
        return input.withSamples(samples);
    }
}
