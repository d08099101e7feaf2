package com.ryuqq.audioedit.adapter.dsp;

import com.ryuqq.audioedit.adapter.dsp.executor.CompressExecutor;
import com.ryuqq.audioedit.adapter.dsp.executor.ConvertFormatExecutor;
import com.ryuqq.audioedit.adapter.dsp.executor.EqualizeExecutor;
import com.ryuqq.audioedit.adapter.dsp.executor.FadeExecutor;
import com.ryuqq.audioedit.adapter.dsp.executor.MergeExecutor;
import com.ryuqq.audioedit.adapter.dsp.executor.NoiseReductionExecutor;
import com.ryuqq.audioedit.adapter.dsp.executor.NormalizeExecutor;
import com.ryuqq.audioedit.adapter.dsp.executor.PitchChangeExecutor;
import com.ryuqq.audioedit.adapter.dsp.executor.ReverbExecutor;
import com.ryuqq.audioedit.adapter.dsp.executor.SpeedChangeExecutor;
import com.ryuqq.audioedit.adapter.dsp.executor.SplitExecutor;
import com.ryuqq.audioedit.adapter.dsp.executor.TrimExecutor;
import com.ryuqq.audioedit.core.catalog.OperationCatalog;
import com.ryuqq.audioedit.core.catalog.StandardOperations;
import com.ryuqq.audioedit.core.executor.OperationExecutor;

import java.util.List;

/**
 * 표준 연산 13종을 PCM 실행기와 묶은 카탈로그.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class PcmCatalogs {

    private PcmCatalogs() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 모든 표준 연산이 등록된 새 카탈로그.
     *
     * @return 카탈로그 (추가 등록 가능)
     */
    public static OperationCatalog standard() {
        OperationCatalog catalog = new OperationCatalog();
        for (OperationExecutor executor : executors()) {
            catalog.register(StandardOperations.descriptor(executor.kind()), executor);
        }
        return catalog;
    }

    public static List<OperationExecutor> executors() {
        return List.of(
            new TrimExecutor(),
            new NormalizeExecutor(),
            FadeExecutor.fadeIn(),
            FadeExecutor.fadeOut(),
            new SpeedChangeExecutor(),
            new PitchChangeExecutor(),
            new ReverbExecutor(),
            new NoiseReductionExecutor(),
            new EqualizeExecutor(),
            new CompressExecutor(),
            new ConvertFormatExecutor(),
            new MergeExecutor(),
            new SplitExecutor()
        );
    }
}
