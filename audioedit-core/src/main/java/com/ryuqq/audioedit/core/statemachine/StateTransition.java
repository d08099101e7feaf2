package com.ryuqq.audioedit.core.statemachine;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>QUEUED → PROCESSING (스케줄러 디스패치)</li>
 *   <li>PROCESSING → COMPLETED (모든 연산 완료)</li>
 *   <li>PROCESSING → ERROR (복구 불가능한 실패)</li>
 *   <li>QUEUED / PROCESSING → CANCELLED (명시적 취소)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(COMPLETED, ERROR, CANCELLED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>역방향 전이 불가 (예: PROCESSING → QUEUED)</li>
 * </ul>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class StateTransition {

    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 확인.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전이이면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(RequestStatus from, RequestStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        return switch (from) {
            case QUEUED -> to == RequestStatus.PROCESSING || to == RequestStatus.CANCELLED;
            case PROCESSING -> to == RequestStatus.COMPLETED
                || to == RequestStatus.ERROR
                || to == RequestStatus.CANCELLED;
            case COMPLETED, ERROR, CANCELLED -> false;
        };
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalTransitionException 유효하지 않은 전이인 경우
     */
    public static void validate(RequestStatus from, RequestStatus to) {
        if (isAllowed(from, to)) {
            return;
        }
        if (from.isTerminal()) {
            throw new IllegalTransitionException(from, to,
                String.format("Cannot transition from terminal state: %s → %s", from, to));
        }
        throw new IllegalTransitionException(from, to,
            String.format("Invalid state transition: %s → %s", from, to));
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalTransitionException 유효하지 않은 전이인 경우
     */
    public static RequestStatus transition(RequestStatus current, RequestStatus next) {
        validate(current, next);
        return next;
    }
}
