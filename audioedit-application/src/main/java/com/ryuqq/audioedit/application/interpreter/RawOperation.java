package com.ryuqq.audioedit.application.interpreter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 검증 전의 연산 하나 (외부 입력 그대로).
 *
 * <p>구조화된 입력이든 자유 텍스트에서 추정한 값이든 같은 타입으로 들어오며,
 * Interpreter가 동일한 검증 경로로 처리합니다.</p>
 *
 * @param kind 연산 이름 (예: {@code "fade_in"}, 검증 전이므로 임의 문자열)
 * @param parameters 파라미터 (값 타입 미확정, null 값 허용)
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record RawOperation(
    String kind,
    Map<String, Object> parameters
) {

    public RawOperation {
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static RawOperation of(String kind, Map<String, ?> parameters) {
        return new RawOperation(kind, parameters == null ? null : new LinkedHashMap<>(parameters));
    }

    public static RawOperation of(String kind) {
        return new RawOperation(kind, null);
    }
}
