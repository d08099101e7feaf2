package com.ryuqq.audioedit.adapter.runner;

/**
 * Operation Pipeline 실행 설정.
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxRetries: operation 하나당 일시적 실패 재시도 횟수 (0이면 재시도 없음)</li>
 *   <li>operationTimeoutMs: operation 한 번의 실행 제한 시간. 초과 시 일시적 실패로 간주</li>
 *   <li>baseBackoffMs / maxBackoffMs / jitterFactor: {@link BackoffCalculator} 파라미터</li>
 * </ul>
 *
 * @param maxRetries 최대 재시도 횟수
 * @param operationTimeoutMs operation 실행 제한 시간 (밀리초)
 * @param baseBackoffMs 첫 재시도 대기 시간 (밀리초)
 * @param maxBackoffMs 최대 재시도 대기 시간 (밀리초)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record PipelineConfig(
    int maxRetries,
    long operationTimeoutMs,
    long baseBackoffMs,
    long maxBackoffMs,
    double jitterFactor
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>maxRetries=3, operationTimeoutMs=30000, baseBackoffMs=100, maxBackoffMs=5000, jitterFactor=0.1</p>
     */
    public PipelineConfig() {
        this(3, 30000, 100, 5000, 0.1);
    }

    public PipelineConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries must be non-negative (current: " + maxRetries + ")"
            );
        }
        if (operationTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "operationTimeoutMs must be positive (current: " + operationTimeoutMs + ")"
            );
        }
        if (baseBackoffMs <= 0) {
            throw new IllegalArgumentException(
                "baseBackoffMs must be positive (current: " + baseBackoffMs + ")"
            );
        }
        if (maxBackoffMs < baseBackoffMs) {
            throw new IllegalArgumentException(
                "maxBackoffMs must be >= baseBackoffMs (base: " + baseBackoffMs + ", max: " + maxBackoffMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    /**
     * 설정값으로 BackoffCalculator 생성.
     *
     * @return 백오프 계산기
     */
    public BackoffCalculator backoffCalculator() {
        return new BackoffCalculator(baseBackoffMs, maxBackoffMs, jitterFactor);
    }

    public PipelineConfig withMaxRetries(int maxRetries) {
        return new PipelineConfig(maxRetries, operationTimeoutMs, baseBackoffMs, maxBackoffMs, jitterFactor);
    }

    public PipelineConfig withOperationTimeoutMs(long operationTimeoutMs) {
        return new PipelineConfig(maxRetries, operationTimeoutMs, baseBackoffMs, maxBackoffMs, jitterFactor);
    }

    /**
     * 백오프 범위만 변경한 새 인스턴스 생성.
     */
    public PipelineConfig withBackoff(long baseBackoffMs, long maxBackoffMs) {
        return new PipelineConfig(maxRetries, operationTimeoutMs, baseBackoffMs, maxBackoffMs, jitterFactor);
    }

    public PipelineConfig withJitterFactor(double jitterFactor) {
        return new PipelineConfig(maxRetries, operationTimeoutMs, baseBackoffMs, maxBackoffMs, jitterFactor);
    }
}
