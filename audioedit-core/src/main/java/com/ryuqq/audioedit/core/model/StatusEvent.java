package com.ryuqq.audioedit.core.model;

import com.ryuqq.audioedit.core.statemachine.RequestStatus;

import java.time.Instant;

/**
 * 요청별 상태 채널로 전달되는 전체 상태 스냅샷.
 *
 * <p>델타가 아닌 현재 상태 전체를 담으므로, 전송 계층의 중복 전달(at-least-once)이
 * 발생해도 구독자 입장에서 재적용이 멱등합니다.</p>
 *
 * @param requestId 요청 식별자
 * @param status 현재 상태
 * @param currentStep 완료된 연산 수
 * @param totalSteps 전체 연산 수
 * @param currentOperation 실행 중(또는 다음 실행 예정)인 연산 종류, 처리 중이 아니면 null
 * @param resultRef 결과 참조 (null 가능)
 * @param error 오류 (null 가능)
 * @param updatedAt 요청의 마지막 갱신 시각
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record StatusEvent(
    RequestId requestId,
    RequestStatus status,
    int currentStep,
    int totalSteps,
    OperationKind currentOperation,
    AudioRef resultRef,
    RequestError error,
    Instant updatedAt
) {

    public StatusEvent {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (updatedAt == null) {
            throw new IllegalArgumentException("updatedAt cannot be null");
        }
    }

    /**
     * 요청의 현재 상태로 스냅샷 생성.
     *
     * @param request 편집 요청
     * @return 상태 스냅샷
     */
    public static StatusEvent snapshotOf(EditRequest request) {
        OperationKind current = null;
        if (request.status() == RequestStatus.PROCESSING && request.currentStep() < request.operations().size()) {
            current = request.operations().get(request.currentStep()).kind();
        }
        return new StatusEvent(
            request.id(),
            request.status(),
            request.currentStep(),
            request.operations().size(),
            current,
            request.resultRef(),
            request.error(),
            request.updatedAt()
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
