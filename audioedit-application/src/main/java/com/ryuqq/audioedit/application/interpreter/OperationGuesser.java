package com.ryuqq.audioedit.application.interpreter;

import java.util.List;

/**
 * 자유 텍스트 지시문에서 연산을 추정하는 외부 능력.
 *
 * <p>결과는 신뢰하지 않는 입력으로 취급되어 구조화된 입력과 같은 검증을 거칩니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface OperationGuesser {

    /**
     * @param instruction 자유 텍스트 (null 아님)
     * @return 추정된 연산 (인식하지 못하면 빈 목록)
     */
    List<RawOperation> guess(String instruction);
}
