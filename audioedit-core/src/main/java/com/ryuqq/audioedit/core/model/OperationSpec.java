package com.ryuqq.audioedit.core.model;

import java.util.Map;

/**
 * 기본 편집 단계 하나 (연산 종류 + 파라미터).
 *
 * <p>요청이 {@code queued} 상태를 벗어나기 전에 모든 필수 파라미터가
 * 존재하고 유효 범위 안에 있어야 합니다. 이 검증은 Operation Catalog가
 * 담당하며, 이 record 자체는 null 여부만 확인합니다.</p>
 *
 * @param kind 연산 종류
 * @param parameters 정규화된 파라미터
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record OperationSpec(
    OperationKind kind,
    OperationParameters parameters
) {

    public OperationSpec {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (parameters == null) {
            parameters = OperationParameters.empty();
        }
    }

    public static OperationSpec of(OperationKind kind, Map<String, ?> parameters) {
        return new OperationSpec(kind, OperationParameters.of(parameters));
    }

    @Override
    public String toString() {
        return kind.wireName() + parameters;
    }
}
