package com.ryuqq.audioedit.adapter.runner;

/**
 * Worker Pool 설정.
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>workers: 동시에 요청을 처리하는 워커 스레드 수</li>
 *   <li>pollTimeoutMs: 워커가 다음 요청을 기다리는 최대 시간. 종료 신호 확인 주기이기도 함</li>
 *   <li>shutdownTimeoutMs: shutdown 시 진행 중인 요청을 기다리는 최대 시간</li>
 * </ul>
 *
 * @param workers 워커 수
 * @param pollTimeoutMs 요청 대기 시간 (밀리초)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초)
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record WorkerPoolConfig(
    int workers,
    long pollTimeoutMs,
    long shutdownTimeoutMs
) {

    /**
     * 기본 설정 생성자 (workers=4, pollTimeoutMs=200, shutdownTimeoutMs=30000).
     */
    public WorkerPoolConfig() {
        this(4, 200, 30000);
    }

    public WorkerPoolConfig {
        if (workers <= 0) {
            throw new IllegalArgumentException(
                "workers must be positive (current: " + workers + ")"
            );
        }
        if (pollTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "pollTimeoutMs must be positive (current: " + pollTimeoutMs + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    public WorkerPoolConfig withWorkers(int workers) {
        return new WorkerPoolConfig(workers, pollTimeoutMs, shutdownTimeoutMs);
    }

    public WorkerPoolConfig withPollTimeoutMs(long pollTimeoutMs) {
        return new WorkerPoolConfig(workers, pollTimeoutMs, shutdownTimeoutMs);
    }

    public WorkerPoolConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new WorkerPoolConfig(workers, pollTimeoutMs, shutdownTimeoutMs);
    }
}
