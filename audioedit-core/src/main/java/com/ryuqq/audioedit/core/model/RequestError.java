package com.ryuqq.audioedit.core.model;

/**
 * {@code error} 상태 요청이 가지는 구조화된 오류.
 *
 * <p>파이프라인 실행 실패의 경우 실패한 연산의 위치(인덱스, 종류)를 함께 기록하며,
 * 연산과 무관한 실패(원본 오디오 조회 실패 등)는 {@code operationIndex = -1}입니다.</p>
 *
 * @param code 오류 코드 (예: EXECUTION_FAILED)
 * @param message 오류 메시지 (실행자가 보고한 원인 포함)
 * @param operationIndex 실패한 연산의 0 기반 인덱스, 해당 없으면 -1
 * @param operationKind 실패한 연산 종류 (null 가능)
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record RequestError(
    String code,
    String message,
    int operationIndex,
    OperationKind operationKind
) {

    public static final String EXECUTION_FAILED = "EXECUTION_FAILED";
    public static final String RETRIES_EXHAUSTED = "RETRIES_EXHAUSTED";
    public static final String SOURCE_UNAVAILABLE = "SOURCE_UNAVAILABLE";
    public static final String RESULT_NOT_STORED = "RESULT_NOT_STORED";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    public RequestError {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (operationIndex < -1) {
            throw new IllegalArgumentException("operationIndex must be -1 or greater (current: " + operationIndex + ")");
        }
        if ((operationIndex == -1) != (operationKind == null)) {
            throw new IllegalArgumentException("operationIndex and operationKind must be set together");
        }
    }

    /**
     * 특정 연산에서 발생한 오류.
     */
    public static RequestError atOperation(String code, String message, int operationIndex, OperationKind kind) {
        return new RequestError(code, message, operationIndex, kind);
    }

    /**
     * 연산과 무관한 오류.
     */
    public static RequestError of(String code, String message) {
        return new RequestError(code, message, -1, null);
    }

    public boolean hasOperation() {
        return operationIndex >= 0;
    }
}
