package com.ryuqq.audioedit.core.outcome;

/**
 * 영구적 실패 (재시도 불가).
 *
 * <p>입력 오디오가 손상되었거나 실행자 내부 오류처럼 재시도해도 성공할 수 없는 경우입니다.
 * 파이프라인은 남은 체인을 즉시 중단합니다.</p>
 *
 * @param errorCode 오류 코드 (예: CORRUPT_AUDIO, UNSUPPORTED_LAYOUT)
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record Fail(
    String errorCode,
    String message,
    String cause
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public Fail {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    public static Fail of(String errorCode, String message, String cause) {
        return new Fail(errorCode, message, cause);
    }

    public static Fail of(String errorCode, String message) {
        return new Fail(errorCode, message, null);
    }
}
