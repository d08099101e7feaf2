package com.ryuqq.audioedit.adapter.dsp.executor;

import com.ryuqq.audioedit.adapter.dsp.support.AbstractPcmExecutor;
import com.ryuqq.audioedit.adapter.dsp.support.PcmMath;
import com.ryuqq.audioedit.core.executor.ExecutionContext;
import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationParameters;

/**
 * 재생 속도 변경 (길이는 1/factor 배, 피치도 함께 변함).
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class SpeedChangeExecutor extends AbstractPcmExecutor {

    public SpeedChangeExecutor() {
        super(OperationKind.SPEED_CHANGE);
    }

    @Override
    protected AudioBuffer process(AudioBuffer input, OperationParameters parameters, ExecutionContext context) {
        double factor = parameters.getDouble("factor");
        AudioBuffer output = input.withSamples(PcmMath.resample(input.samples(), input.channels(), factor));
        return output.withSegmentStarts(
            PcmMath.moveSegments(input.segmentStarts(), 1.0 / factor, 0, output.frameCount()));
    }
}
