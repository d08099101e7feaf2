package com.ryuqq.audioedit.application.interpreter;

import com.ryuqq.audioedit.core.model.AudioRef;
import com.ryuqq.audioedit.core.model.ClientId;
import com.ryuqq.audioedit.core.model.OperationSpec;
import com.ryuqq.audioedit.core.model.Priority;
import com.ryuqq.audioedit.core.model.RequestId;

import java.util.List;
import java.util.Optional;

/**
 * Interpreter 출력: 검증과 정렬을 마친 요청 내용.
 *
 * @param requestedId 호출자가 지정한 식별자 (없으면 null)
 * @param clientId 제출자
 * @param sources 입력 오디오
 * @param operations 정규 순서로 정렬된 연산 체인
 * @param priority 우선순위
 * @param description 자유 텍스트 지시문 (null 가능)
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record InterpretedRequest(
    RequestId requestedId,
    ClientId clientId,
    List<AudioRef> sources,
    List<OperationSpec> operations,
    Priority priority,
    String description
) {

    public InterpretedRequest {
        sources = List.copyOf(sources);
        operations = List.copyOf(operations);
    }

    public Optional<RequestId> requestedIdOptional() {
        return Optional.ofNullable(requestedId);
    }
}
