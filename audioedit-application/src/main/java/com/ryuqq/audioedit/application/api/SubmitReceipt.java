package com.ryuqq.audioedit.application.api;

import com.ryuqq.audioedit.core.model.EditRequest;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationSpec;
import com.ryuqq.audioedit.core.model.Priority;
import com.ryuqq.audioedit.core.model.RequestId;
import com.ryuqq.audioedit.core.statemachine.RequestStatus;

import java.time.Instant;
import java.util.List;

/**
 * 제출 접수 결과.
 *
 * @param id 할당된 요청 id
 * @param status 접수 시점 상태 (queued)
 * @param operations 정규 순서의 연산 종류
 * @param priority 우선순위
 * @param createdAt 접수 시각
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record SubmitReceipt(
    RequestId id,
    RequestStatus status,
    List<OperationKind> operations,
    Priority priority,
    Instant createdAt
) {

    public SubmitReceipt {
        operations = List.copyOf(operations);
    }

    public static SubmitReceipt of(EditRequest request) {
        return new SubmitReceipt(
            request.id(),
            request.status(),
            request.operations().stream().map(OperationSpec::kind).toList(),
            request.priority(),
            request.createdAt()
        );
    }
}
