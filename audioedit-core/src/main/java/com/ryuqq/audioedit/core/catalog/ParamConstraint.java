package com.ryuqq.audioedit.core.catalog;

import com.ryuqq.audioedit.core.model.OperationParameters;

/**
 * 여러 파라미터에 걸친 제약 (예: trim의 end_ms &gt; start_ms).
 *
 * <p>개별 파라미터 정규화가 끝난 뒤에 평가됩니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ParamConstraint {

    /**
     * @param parameters 정규화된 파라미터
     * @throws com.ryuqq.audioedit.core.exception.ValidationException 제약 위반
     */
    void check(OperationParameters parameters);
}
