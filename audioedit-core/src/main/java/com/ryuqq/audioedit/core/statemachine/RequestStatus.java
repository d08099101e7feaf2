package com.ryuqq.audioedit.core.statemachine;

import java.util.Locale;
import java.util.Optional;

/**
 * 편집 요청의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * QUEUED ──────────────► CANCELLED
 *    │                       ▲
 *    ▼ (디스패치)            │ (취소)
 * PROCESSING ────────────────┘
 *    │
 *    ├─► COMPLETED (모든 연산 성공)
 *    │
 *    └─► ERROR (복구 불가능한 실패)
 *
 * 금지된 전이:
 * - COMPLETED / ERROR / CANCELLED → * ❌
 * - PROCESSING → QUEUED ❌
 * - QUEUED → COMPLETED / ERROR ❌
 * </pre>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public enum RequestStatus {

    /**
     * 검증을 통과하고 디스패치를 기다리는 중.
     */
    QUEUED("queued"),

    /**
     * 워커가 연산 체인을 실행하는 중.
     */
    PROCESSING("processing"),

    /**
     * 완료 (결과 참조 보유).
     */
    COMPLETED("completed"),

    /**
     * 실패 (구조화된 오류 보유).
     */
    ERROR("error"),

    /**
     * 클라이언트 요청으로 취소됨.
     */
    CANCELLED("cancelled");

    private final String wireName;

    RequestStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(COMPLETED, ERROR, CANCELLED)에서는 더 이상 다른 상태로 전이할 수 없습니다.</p>
     *
     * @return 종료 상태이면 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR || this == CANCELLED;
    }

    /**
     * 클라이언트별 동시 요청 수 계산에 포함되는 상태인지 확인.
     *
     * @return QUEUED 또는 PROCESSING이면 true
     */
    public boolean isActive() {
        return this == QUEUED || this == PROCESSING;
    }

    public static Optional<RequestStatus> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (RequestStatus status : values()) {
            if (status.wireName.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
