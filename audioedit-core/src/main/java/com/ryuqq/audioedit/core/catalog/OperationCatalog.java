package com.ryuqq.audioedit.core.catalog;

import com.ryuqq.audioedit.core.exception.ValidationException;
import com.ryuqq.audioedit.core.executor.OperationExecutor;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationParameters;
import com.ryuqq.audioedit.core.model.OperationSpec;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 연산 종류별 파라미터 선언과 실행자 바인딩의 레지스트리.
 *
 * <p>새 연산 종류를 추가하려면 설명자와 실행자를 {@link #register}로 등록하면 되고,
 * 엔진의 나머지 부분은 개별 종류를 알지 못합니다.</p>
 *
 * <p><strong>정규화 규칙 ({@link #normalize}):</strong></p>
 * <ul>
 *   <li>선언되지 않은 파라미터는 거부 (fail closed)</li>
 *   <li>누락된 필수 파라미터는 거부</li>
 *   <li>누락된 선택 파라미터는 기본값으로 채움</li>
 *   <li>숫자 문자열은 숫자로 변환, 범위 검사</li>
 *   <li>파라미터 간 제약, 실행자 고유 검증 순으로 평가</li>
 * </ul>
 *
 * <p>조회와 검증은 부수 효과가 없고 thread-safe합니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class OperationCatalog {

    private final Map<OperationKind, Entry> entries = new ConcurrentHashMap<>();

    /**
     * 연산 종류 등록.
     *
     * @param descriptor 파라미터 선언
     * @param executor 실행자
     * @throws IllegalArgumentException 인자가 null이거나 두 종류가 다른 경우
     * @throws IllegalStateException 이미 등록된 종류인 경우
     */
    public void register(OperationDescriptor descriptor, OperationExecutor executor) {
        if (descriptor == null) {
            throw new IllegalArgumentException("descriptor cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (descriptor.kind() != executor.kind()) {
            throw new IllegalArgumentException(
                "executor kind does not match descriptor (descriptor: " + descriptor.kind()
                    + ", executor: " + executor.kind() + ")"
            );
        }
        Entry previous = entries.putIfAbsent(descriptor.kind(), new Entry(descriptor, executor));
        if (previous != null) {
            throw new IllegalStateException("Operation kind already registered: " + descriptor.kind());
        }
    }

    public boolean isRegistered(OperationKind kind) {
        return kind != null && entries.containsKey(kind);
    }

    /**
     * 연산 종류의 파라미터 선언 조회.
     *
     * @param kind 연산 종류
     * @return 설명자
     * @throws IllegalArgumentException 등록되지 않은 종류인 경우
     */
    public OperationDescriptor describe(OperationKind kind) {
        return entry(kind).descriptor();
    }

    /**
     * 연산 종류에 바인딩된 실행자 조회.
     *
     * @param kind 연산 종류
     * @return 실행자
     * @throws IllegalArgumentException 등록되지 않은 종류인 경우
     */
    public OperationExecutor executorFor(OperationKind kind) {
        return entry(kind).executor();
    }

    /**
     * 등록된 모든 설명자 (열거형 선언 순서).
     *
     * @return 설명자 목록
     */
    public List<OperationDescriptor> descriptors() {
        return entries.values().stream()
            .map(Entry::descriptor)
            .sorted(Comparator.comparing(OperationDescriptor::kind))
            .toList();
    }

    /**
     * 파라미터 검증.
     *
     * @param kind 연산 종류
     * @param parameters 외부 입력 파라미터 (null이면 빈 맵)
     * @throws ValidationException 검증 실패
     */
    public void validate(OperationKind kind, Map<String, ?> parameters) {
        normalize(kind, parameters);
    }

    /**
     * 이미 정규화된 연산 검증 (파이프라인 실행 직전 재확인용).
     *
     * @param spec 연산
     * @throws ValidationException 검증 실패
     */
    public void validate(OperationSpec spec) {
        normalize(spec.kind(), spec.parameters().asMap());
    }

    /**
     * 파라미터 변환, 기본값 채움, 검증.
     *
     * @param kind 연산 종류
     * @param parameters 외부 입력 파라미터 (null이면 빈 맵)
     * @return 정규화된 파라미터
     * @throws ValidationException 검증 실패 (연산 위치는 아직 모름, index -1)
     */
    public OperationParameters normalize(OperationKind kind, Map<String, ?> parameters) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        Entry entry = entries.get(kind);
        if (entry == null) {
            throw ValidationException.forParameter(kind.wireName(), null,
                "operation '" + kind.wireName() + "' is not supported by this engine");
        }
        OperationDescriptor descriptor = entry.descriptor();
        String kindName = kind.wireName();
        Map<String, ?> raw = parameters == null ? Map.of() : parameters;

        for (String name : raw.keySet()) {
            if (descriptor.param(name).isEmpty()) {
                throw ValidationException.forParameter(kindName, name,
                    "unknown parameter '" + name + "' (allowed: " + descriptor.paramTypes().keySet() + ")");
            }
        }

        Map<String, Object> normalized = new LinkedHashMap<>();
        for (ParamSpec spec : descriptor.params()) {
            Object value = raw.get(spec.name());
            if (value == null) {
                if (spec.required()) {
                    throw ValidationException.forParameter(kindName, spec.name(),
                        "missing required parameter '" + spec.name() + "'");
                }
                value = spec.defaultValue();
            }
            normalized.put(spec.name(), spec.coerce(kindName, value));
        }

        OperationParameters result = OperationParameters.of(normalized);
        for (ParamConstraint constraint : descriptor.constraints()) {
            constraint.check(result);
        }
        entry.executor().validate(result);
        return result;
    }

    private Entry entry(OperationKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        Entry entry = entries.get(kind);
        if (entry == null) {
            throw new IllegalArgumentException("Operation kind not registered: " + kind);
        }
        return entry;
    }

    private record Entry(OperationDescriptor descriptor, OperationExecutor executor) {
    }
}
