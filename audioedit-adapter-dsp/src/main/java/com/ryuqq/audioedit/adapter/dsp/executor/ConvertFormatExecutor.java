package com.ryuqq.audioedit.adapter.dsp.executor;

import com.ryuqq.audioedit.adapter.dsp.support.AbstractPcmExecutor;
import com.ryuqq.audioedit.adapter.dsp.support.PcmMath;
import com.ryuqq.audioedit.core.exception.ValidationException;
import com.ryuqq.audioedit.core.executor.ExecutionContext;
import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationParameters;

import java.util.regex.Pattern;

/**
 * 출력 포맷 지정과 샘플레이트/채널 변환.
 *
 * <p>인코딩 자체는 저장 계층의 몫이고, 이 실행기는 버퍼의 포맷 태그와 PCM 레이아웃을
 * 맞춥니다. bitrate는 "192k" 형식만 받습니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class ConvertFormatExecutor extends AbstractPcmExecutor {

    private static final Pattern BITRATE = Pattern.compile("^\\d{2,4}k$");

    public ConvertFormatExecutor() {
        super(OperationKind.CONVERT_FORMAT);
    }

    @Override
    public void validate(OperationParameters parameters) {
        String bitrate = parameters.getString("bitrate");
        if (!BITRATE.matcher(bitrate).matches()) {
            throw ValidationException.forParameter(kind().wireName(), "bitrate",
                "'bitrate' must look like 192k (current: " + bitrate + ")");
        }
    }

    @Override
    protected AudioBuffer process(AudioBuffer input, OperationParameters parameters, ExecutionContext context) {
        int targetRate = parameters.getInt("sample_rate");
        int targetChannels = parameters.getInt("channels");
        float[] converted = PcmMath.conform(input.samples(), input.sampleRate(), input.channels(),
            targetRate, targetChannels);

        AudioBuffer output = input.withLayout(converted, targetRate, targetChannels)
            .withFormat(parameters.getString("target_format"));
        double scale = (double) targetRate / input.sampleRate();
        return output.withSegmentStarts(
            PcmMath.moveSegments(input.segmentStarts(), scale, 0, output.frameCount()));
    }
}
