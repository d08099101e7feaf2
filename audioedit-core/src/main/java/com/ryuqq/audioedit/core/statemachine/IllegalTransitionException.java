package com.ryuqq.audioedit.core.statemachine;

/**
 * 상태 기계 불변식 위반.
 *
 * <p>정상 동작 중에는 발생하지 않아야 하는 내부 결함 신호입니다.
 * 호출자는 이 예외를 삼키지 말고 로그로 남겨야 합니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public class IllegalTransitionException extends IllegalStateException {

    private final RequestStatus from;
    private final RequestStatus to;

    public IllegalTransitionException(RequestStatus from, RequestStatus to, String message) {
        super(message);
        this.from = from;
        this.to = to;
    }

    public RequestStatus getFrom() {
        return from;
    }

    public RequestStatus getTo() {
        return to;
    }
}
