package com.ryuqq.audioedit.application.api;

import com.ryuqq.audioedit.core.statemachine.RequestStatus;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 요청 통계 스냅샷.
 *
 * <p>성공률은 completed / (completed + error) 백분율이며 cancelled는 제외합니다.
 * 종료된 요청이 없으면 0입니다.</p>
 *
 * @param total 저장된 전체 요청 수
 * @param byStatus 상태별 요청 수 (모든 상태 포함, 없으면 0)
 * @param averageProcessingTime completed 요청의 평균 처리 시간 (처리 시작→완료, 없으면 0)
 * @param successRate 성공률 (%, 소수점 한 자리)
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record RequestStatistics(
    long total,
    Map<RequestStatus, Long> byStatus,
    Duration averageProcessingTime,
    double successRate
) {

    public RequestStatistics {
        Map<RequestStatus, Long> counts = new EnumMap<>(RequestStatus.class);
        for (RequestStatus status : RequestStatus.values()) {
            counts.put(status, byStatus == null ? 0L : byStatus.getOrDefault(status, 0L));
        }
        byStatus = Collections.unmodifiableMap(counts);
    }

    public long count(RequestStatus status) {
        return byStatus.get(status);
    }

    public long pending() {
        return count(RequestStatus.QUEUED) + count(RequestStatus.PROCESSING);
    }
}
