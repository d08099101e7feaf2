package com.ryuqq.audioedit.core.executor;

import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationParameters;
import com.ryuqq.audioedit.core.outcome.Outcome;

/**
 * 연산 종류 하나의 실제 변환을 수행하는 플러그형 실행자.
 *
 * <p>Operation Catalog가 종류별로 하나씩 바인딩하며, 파이프라인은 테이블 조회로
 * 실행자를 선택합니다. 새 효과를 추가해도 엔진의 다른 부분은 바뀌지 않습니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>{@code execute}는 입력 버퍼를 변경하지 않고 새 버퍼를 {@link com.ryuqq.audioedit.core.outcome.Ok}로 반환</li>
 *   <li>일시적 장애는 {@link com.ryuqq.audioedit.core.outcome.Retry} 반환 또는
 *       {@link com.ryuqq.audioedit.core.exception.TransientOperationException} 발생</li>
 *   <li>그 외 예외와 {@link com.ryuqq.audioedit.core.outcome.Fail}은 영구 실패로 처리</li>
 *   <li>구현체는 thread-safe해야 합니다 (여러 워커가 동시에 호출).</li>
 * </ul>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public interface OperationExecutor {

    /**
     * 이 실행자가 담당하는 연산 종류.
     *
     * @return 연산 종류
     */
    OperationKind kind();

    /**
     * 카탈로그 범위 검증 이후 실행자 고유의 추가 검증.
     *
     * <p>기본 구현은 아무것도 하지 않습니다. 위반 시
     * {@link com.ryuqq.audioedit.core.exception.ValidationException}을 던집니다.</p>
     *
     * @param parameters 정규화된 파라미터
     */
    default void validate(OperationParameters parameters) {
    }

    /**
     * 연산 실행.
     *
     * @param input 이전 연산의 출력 (첫 연산은 원본)
     * @param parameters 정규화된 파라미터
     * @param context 요청 단위 실행 문맥
     * @return 실행 결과
     */
    Outcome execute(AudioBuffer input, OperationParameters parameters, ExecutionContext context);
}
