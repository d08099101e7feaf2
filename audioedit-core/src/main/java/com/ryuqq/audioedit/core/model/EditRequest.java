package com.ryuqq.audioedit.core.model;

import com.ryuqq.audioedit.core.statemachine.RequestStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 클라이언트가 제출한 편집 작업 하나의 스냅샷 (불변).
 *
 * <p>상태 변경은 항상 새 인스턴스를 만들어 Request Store에 원자적으로 반영합니다.
 * {@code markXxx} 메서드는 대상 상태의 필드만 구성하며, 전이 허용 여부는
 * Request Store가 {@link com.ryuqq.audioedit.core.statemachine.StateTransition}으로 검증합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>resultRef는 COMPLETED에서만, error는 ERROR에서만 설정됨</li>
 *   <li>종료 전에는 resultRef와 error 모두 비어 있음</li>
 *   <li>operations는 최소 1개</li>
 *   <li>0 ≤ currentStep ≤ operations.size()</li>
 * </ul>
 *
 * @param id 요청 식별자
 * @param clientId 제출자
 * @param sources 입력 오디오 참조 (첫 번째가 주 입력)
 * @param operations 정규화된 연산 체인
 * @param priority 우선순위
 * @param status 현재 상태
 * @param description 자유 텍스트 지시문 또는 설명 (null 가능)
 * @param createdAt 제출 시각
 * @param updatedAt 마지막 상태 전이 시각
 * @param startedAt 처리 시작 시각 (null 가능)
 * @param finishedAt 종료 시각 (null 가능)
 * @param currentStep 완료된 연산 수 (진행 표시용)
 * @param resultRef 결과 오디오 참조 (COMPLETED에서만)
 * @param error 구조화된 오류 (ERROR에서만)
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record EditRequest(
    RequestId id,
    ClientId clientId,
    List<AudioRef> sources,
    List<OperationSpec> operations,
    Priority priority,
    RequestStatus status,
    String description,
    Instant createdAt,
    Instant updatedAt,
    Instant startedAt,
    Instant finishedAt,
    int currentStep,
    AudioRef resultRef,
    RequestError error
) {

    public EditRequest {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (clientId == null) {
            throw new IllegalArgumentException("clientId cannot be null");
        }
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("sources cannot be null or empty");
        }
        if (operations == null || operations.isEmpty()) {
            throw new IllegalArgumentException("operations cannot be null or empty");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (createdAt == null || updatedAt == null) {
            throw new IllegalArgumentException("createdAt and updatedAt cannot be null");
        }
        if (currentStep < 0 || currentStep > operations.size()) {
            throw new IllegalArgumentException(
                "currentStep must be between 0 and " + operations.size() + " (current: " + currentStep + ")"
            );
        }
        if (resultRef != null && status != RequestStatus.COMPLETED) {
            throw new IllegalArgumentException("resultRef can only be set on completed requests (status: " + status + ")");
        }
        if (error != null && status != RequestStatus.ERROR) {
            throw new IllegalArgumentException("error can only be set on errored requests (status: " + status + ")");
        }
        if (status == RequestStatus.COMPLETED && resultRef == null) {
            throw new IllegalArgumentException("completed request must carry a resultRef");
        }
        if (status == RequestStatus.ERROR && error == null) {
            throw new IllegalArgumentException("errored request must carry an error");
        }
        sources = List.copyOf(sources);
        operations = List.copyOf(operations);
    }

    /**
     * 새 QUEUED 요청 생성.
     *
     * @param id 요청 식별자
     * @param clientId 제출자
     * @param sources 입력 오디오
     * @param operations 정규화된 연산 체인
     * @param priority 우선순위
     * @param description 설명 (null 가능)
     * @param now 제출 시각
     * @return QUEUED 상태 요청
     */
    public static EditRequest queued(RequestId id, ClientId clientId, List<AudioRef> sources,
                                     List<OperationSpec> operations, Priority priority,
                                     String description, Instant now) {
        return new EditRequest(id, clientId, sources, operations, priority, RequestStatus.QUEUED,
            description, now, now, null, null, 0, null, null);
    }

    public EditRequest markProcessing(Instant now) {
        return new EditRequest(id, clientId, sources, operations, priority, RequestStatus.PROCESSING,
            description, createdAt, now, now, null, 0, null, null);
    }

    public EditRequest markCompleted(AudioRef result, Instant now) {
        return new EditRequest(id, clientId, sources, operations, priority, RequestStatus.COMPLETED,
            description, createdAt, now, startedAt, now, operations.size(), result, null);
    }

    public EditRequest markFailed(RequestError failure, Instant now) {
        return new EditRequest(id, clientId, sources, operations, priority, RequestStatus.ERROR,
            description, createdAt, now, startedAt, now, currentStep, null, failure);
    }

    public EditRequest markCancelled(Instant now) {
        return new EditRequest(id, clientId, sources, operations, priority, RequestStatus.CANCELLED,
            description, createdAt, now, startedAt, now, currentStep, null, null);
    }

    /**
     * 진행 표시 갱신 (상태 전이 아님, updatedAt 유지).
     *
     * @param completedSteps 완료된 연산 수
     * @return 진행 표시가 갱신된 요청
     */
    public EditRequest withProgress(int completedSteps) {
        return new EditRequest(id, clientId, sources, operations, priority, status,
            description, createdAt, updatedAt, startedAt, finishedAt, completedSteps, resultRef, error);
    }

    public AudioRef primarySource() {
        return sources.get(0);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * 처리 시작부터 종료까지 걸린 시간.
     *
     * @return 처리 시간, 처리를 시작하지 않았거나 아직 끝나지 않았으면 empty
     */
    public Optional<Duration> processingTime() {
        if (startedAt == null || finishedAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(startedAt, finishedAt));
    }
}
