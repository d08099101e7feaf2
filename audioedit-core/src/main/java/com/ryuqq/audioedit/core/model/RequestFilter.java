package com.ryuqq.audioedit.core.model;

import com.ryuqq.audioedit.core.statemachine.RequestStatus;

/**
 * 요청 목록 조회 조건.
 *
 * @param clientId 제출자 필터 (null이면 전체)
 * @param status 상태 필터 (null이면 전체)
 * @param limit 최대 반환 개수 (양수)
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record RequestFilter(
    ClientId clientId,
    RequestStatus status,
    int limit
) {

    public static final int DEFAULT_LIMIT = 100;

    public RequestFilter {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
    }

    public static RequestFilter all() {
        return new RequestFilter(null, null, DEFAULT_LIMIT);
    }

    public static RequestFilter byClient(ClientId clientId) {
        return new RequestFilter(clientId, null, DEFAULT_LIMIT);
    }

    public static RequestFilter byStatus(RequestStatus status) {
        return new RequestFilter(null, status, DEFAULT_LIMIT);
    }

    public RequestFilter withLimit(int newLimit) {
        return new RequestFilter(clientId, status, newLimit);
    }

    public boolean matches(EditRequest request) {
        if (clientId != null && !clientId.equals(request.clientId())) {
            return false;
        }
        return status == null || status == request.status();
    }
}
