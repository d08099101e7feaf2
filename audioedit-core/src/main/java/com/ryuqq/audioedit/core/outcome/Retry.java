package com.ryuqq.audioedit.core.outcome;

/**
 * 재시도 가능한 일시적 실패.
 *
 * <p>일시적인 자원 부족 등으로 실패했으나 재시도하면 성공할 가능성이 있는 경우입니다.
 * 파이프라인은 재시도 예산을 넘지 않는 한 같은 입력으로 연산을 다시 호출합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>코덱 인스턴스 일시 고갈</li>
 *   <li>임시 디스크 공간 부족</li>
 *   <li>연산 타임아웃</li>
 * </ul>
 *
 * @param reason 재시도 사유
 * @param nextRetryAfterMillis 실행자가 요청한 최소 대기 시간 (밀리초, 0이면 파이프라인 백오프 사용)
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record Retry(
    String reason,
    long nextRetryAfterMillis
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public Retry {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (nextRetryAfterMillis < 0) {
            throw new IllegalArgumentException("nextRetryAfterMillis must be non-negative (current: " + nextRetryAfterMillis + ")");
        }
    }

    /**
     * 대기 시간 힌트 없이 생성.
     *
     * @param reason 재시도 사유
     * @return Retry 인스턴스
     */
    public static Retry of(String reason) {
        return new Retry(reason, 0L);
    }
}
