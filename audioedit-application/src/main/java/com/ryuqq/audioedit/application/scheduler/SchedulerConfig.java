package com.ryuqq.audioedit.application.scheduler;

/**
 * PriorityScheduler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxActivePerClient: 클라이언트별 queued+processing 요청 상한 (기본 10)</li>
 * </ul>
 *
 * @param maxActivePerClient 클라이언트별 동시 요청 상한 (1 이상)
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record SchedulerConfig(
    int maxActivePerClient
) {

    /**
     * 기본 설정 생성자 (maxActivePerClient=10).
     */
    public SchedulerConfig() {
        this(10);
    }

    public SchedulerConfig {
        if (maxActivePerClient <= 0) {
            throw new IllegalArgumentException(
                "maxActivePerClient must be positive (current: " + maxActivePerClient + ")"
            );
        }
    }

    /**
     * maxActivePerClient만 변경한 새 인스턴스 생성.
     */
    public SchedulerConfig withMaxActivePerClient(int maxActivePerClient) {
        return new SchedulerConfig(maxActivePerClient);
    }
}
