package com.ryuqq.audioedit.core.catalog;

import com.ryuqq.audioedit.core.model.OperationKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 연산 종류 하나의 카탈로그 항목.
 *
 * <p>{@code describe(kind)}의 응답이며, 지원 연산 목록 API에도 그대로 노출됩니다.</p>
 *
 * @param kind 연산 종류
 * @param description 사람이 읽는 설명
 * @param params 파라미터 선언 (선언 순서 유지)
 * @param constraints 파라미터 간 제약
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record OperationDescriptor(
    OperationKind kind,
    String description,
    List<ParamSpec> params,
    List<ParamConstraint> constraints
) {

    public OperationDescriptor {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("description cannot be null or blank");
        }
        params = params == null ? List.of() : List.copyOf(params);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
        long distinct = params.stream().map(ParamSpec::name).distinct().count();
        if (distinct != params.size()) {
            throw new IllegalArgumentException("parameter names must be unique for " + kind);
        }
    }

    public static OperationDescriptor of(OperationKind kind, String description, ParamSpec... params) {
        return new OperationDescriptor(kind, description, List.of(params), List.of());
    }

    /**
     * 제약을 추가한 사본.
     *
     * @param constraint 파라미터 간 제약
     * @return 새 설명자
     */
    public OperationDescriptor withConstraint(ParamConstraint constraint) {
        List<ParamConstraint> next = new ArrayList<>(constraints);
        next.add(constraint);
        return new OperationDescriptor(kind, description, params, next);
    }

    public List<String> requiredParams() {
        return params.stream().filter(ParamSpec::required).map(ParamSpec::name).toList();
    }

    public Map<String, Object> optionalParamsWithDefaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        for (ParamSpec spec : params) {
            if (!spec.required()) {
                defaults.put(spec.name(), spec.defaultValue());
            }
        }
        return defaults;
    }

    public Map<String, ParamType> paramTypes() {
        Map<String, ParamType> types = new LinkedHashMap<>();
        params.forEach(spec -> types.put(spec.name(), spec.type()));
        return types;
    }

    public Optional<ParamSpec> param(String name) {
        return params.stream().filter(spec -> spec.name().equals(name)).findFirst();
    }

    /**
     * 필수 파라미터는 예시 값, 선택 파라미터는 기본값으로 채운 유효한 파라미터 맵.
     *
     * @return 검증을 통과하는 파라미터 맵
     */
    public Map<String, Object> exampleParameters() {
        Map<String, Object> example = new LinkedHashMap<>();
        params.forEach(spec -> example.put(spec.name(), spec.example()));
        return example;
    }
}
