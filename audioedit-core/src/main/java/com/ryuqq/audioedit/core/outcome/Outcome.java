package com.ryuqq.audioedit.core.outcome;

/**
 * 연산 실행자 한 번 호출의 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공, 다음 연산에 넘길 오디오 버퍼 포함</li>
 *   <li>{@link Retry}: 일시적 실패, 재시도 가능</li>
 *   <li>{@link Fail}: 영구적 실패, 재시도 불가</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 허용되는 구현체가 컴파일 타임에 고정됩니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Ok ok) {
 *     buffer = ok.output();
 * } else if (outcome instanceof Retry retry) {
 *     sleep(retry.nextRetryAfterMillis());
 * } else if (outcome instanceof Fail fail) {
 *     abort(fail.errorCode(), fail.message());
 * }
 * </pre>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Retry, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 재시도 가능한지 확인.
     *
     * @return 재시도 가능 여부
     */
    default boolean isRetry() {
        return this instanceof Retry;
    }

    /**
     * 결과가 영구 실패인지 확인.
     *
     * @return 영구 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
