package com.ryuqq.audioedit.adapter.dsp.executor;

import com.ryuqq.audioedit.adapter.dsp.support.AbstractPcmExecutor;
import com.ryuqq.audioedit.core.executor.ExecutionContext;
import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationParameters;

import java.util.ArrayList;
import java.util.List;

/**
 * segment_ms 간격으로 구간 경계를 표시. 샘플은 바꾸지 않습니다.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class SplitExecutor extends AbstractPcmExecutor {

    public SplitExecutor() {
        super(OperationKind.SPLIT);
    }

    @Override
    protected AudioBuffer process(AudioBuffer input, OperationParameters parameters, ExecutionContext context) {
        long segmentMillis = parameters.getLong("segment_ms");
        int segmentFrames = (int) Math.max(1L, segmentMillis * input.sampleRate() / 1000L);
        List<Integer> starts = new ArrayList<>();
        for (int frame = 0; frame < input.frameCount(); frame += segmentFrames) {
            starts.add(frame);
        }
        if (starts.isEmpty()) {
            starts.add(0);
        }
        return input.withSegmentStarts(starts);
    }
}
