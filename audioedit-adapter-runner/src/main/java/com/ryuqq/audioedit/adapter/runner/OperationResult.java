package com.ryuqq.audioedit.adapter.runner;

import com.ryuqq.audioedit.core.model.OperationKind;

/**
 * 성공한 operation 한 단계의 실행 기록 (진단용).
 *
 * @param index chain 내 위치 (0부터)
 * @param kind operation 종류
 * @param attempts 성공까지 걸린 시도 횟수 (1 이상)
 * @param elapsedMs 재시도 대기를 포함한 소요 시간 (밀리초)
 * @param message executor가 남긴 메시지 (null 허용)
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record OperationResult(
    int index,
    OperationKind kind,
    int attempts,
    long elapsedMs,
    String message
) {

    public OperationResult {
        if (index < 0) {
            throw new IllegalArgumentException("index must be non-negative (current: " + index + ")");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (attempts <= 0) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
    }

    @Override
    public String toString() {
        return "#" + index + " " + kind + " (" + attempts + " attempt(s), " + elapsedMs + "ms"
            + (message == null ? ")" : ", " + message + ")");
    }
}
