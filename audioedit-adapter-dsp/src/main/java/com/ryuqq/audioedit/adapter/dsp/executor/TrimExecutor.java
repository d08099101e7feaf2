package com.ryuqq.audioedit.adapter.dsp.executor;

import com.ryuqq.audioedit.adapter.dsp.support.AbstractPcmExecutor;
import com.ryuqq.audioedit.adapter.dsp.support.PcmMath;
import com.ryuqq.audioedit.core.executor.ExecutionContext;
import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationParameters;
import com.ryuqq.audioedit.core.outcome.Fail;
import com.ryuqq.audioedit.core.outcome.Outcome;

import java.util.Arrays;

/**
 * [start_ms, end_ms) 구간만 남김. end_ms가 길이를 넘으면 끝에서 자름.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class TrimExecutor extends AbstractPcmExecutor {

    public static final String RANGE_OUT_OF_BOUNDS = "RANGE_OUT_OF_BOUNDS";

    public TrimExecutor() {
        super(OperationKind.TRIM);
    }

    @Override
    protected Outcome reject(AudioBuffer input, OperationParameters parameters) {
        long start = parameters.getLong("start_ms");
        if (start >= input.durationMillis()) {
            return Fail.of(RANGE_OUT_OF_BOUNDS,
                "start_ms " + start + " is beyond the audio length (" + input.durationMillis() + "ms)");
        }
        return null;
    }

    @Override
    protected AudioBuffer process(AudioBuffer input, OperationParameters parameters, ExecutionContext context) {
        int from = input.frameAt(parameters.getLong("start_ms"));
        int to = input.frameAt(parameters.getLong("end_ms"));
        int channels = input.channels();
        AudioBuffer trimmed = input.withSamples(Arrays.copyOfRange(input.samples(), from * channels, to * channels));
        return trimmed.withSegmentStarts(PcmMath.moveSegments(input.segmentStarts(), 1.0, from, to - from));
    }
}
