package com.ryuqq.audioedit.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * 연산 하나의 파라미터 맵 (불변).
 *
 * <p>Operation Catalog의 정규화를 거친 값은 다음 타입만 가집니다:</p>
 * <ul>
 *   <li>NUMBER → {@link Double}</li>
 *   <li>INTEGER → {@link Long}</li>
 *   <li>STRING → {@link String}</li>
 *   <li>BAND_MAP → {@code Map<String, Double>} (주파수 Hz 문자열 → 게인 dB)</li>
 *   <li>SOURCE_LIST → {@code List<String>}</li>
 * </ul>
 *
 * <p>타입별 조회 메서드는 정규화된 값을 전제로 하며, 값이 없거나 타입이 다르면
 * {@link IllegalArgumentException}을 던집니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class OperationParameters {

    private static final OperationParameters EMPTY = new OperationParameters(Map.of());

    private final Map<String, Object> values;

    private OperationParameters(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * 파라미터 맵으로 생성 (얕은 복사).
     *
     * @param values 파라미터 맵 (null이면 빈 파라미터)
     * @return OperationParameters 인스턴스
     */
    public static OperationParameters of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("parameter name cannot be null");
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        return new OperationParameters(copy);
    }

    public static OperationParameters empty() {
        return EMPTY;
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public double getDouble(String name) {
        Object value = require(name);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw typeMismatch(name, "number", value);
    }

    public long getLong(String name) {
        Object value = require(name);
        if (value instanceof Number number) {
            return number.longValue();
        }
        throw typeMismatch(name, "integer", value);
    }

    public int getInt(String name) {
        return Math.toIntExact(getLong(name));
    }

    public String getString(String name) {
        Object value = require(name);
        if (value instanceof String string) {
            return string;
        }
        throw typeMismatch(name, "string", value);
    }

    /**
     * 대역별 게인 맵 조회 (주파수 오름차순).
     *
     * @param name 파라미터 이름
     * @return 주파수(Hz) → 게인(dB)
     */
    public NavigableMap<Double, Double> getBands(String name) {
        Object value = require(name);
        if (!(value instanceof Map<?, ?> raw)) {
            throw typeMismatch(name, "band map", value);
        }
        NavigableMap<Double, Double> bands = new TreeMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (!(entry.getValue() instanceof Number gain)) {
                throw typeMismatch(name + "." + entry.getKey(), "number", entry.getValue());
            }
            bands.put(Double.parseDouble(String.valueOf(entry.getKey())), gain.doubleValue());
        }
        return bands;
    }

    /**
     * 오디오 참조 목록 조회.
     *
     * @param name 파라미터 이름
     * @return 참조 목록 (입력 순서 유지)
     */
    public List<AudioRef> getSources(String name) {
        Object value = require(name);
        if (!(value instanceof List<?> raw)) {
            throw typeMismatch(name, "source list", value);
        }
        List<AudioRef> refs = new ArrayList<>(raw.size());
        for (Object item : raw) {
            refs.add(AudioRef.of(String.valueOf(item)));
        }
        return List.copyOf(refs);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    private Object require(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("parameter '" + name + "' is not present");
        }
        return value;
    }

    private static IllegalArgumentException typeMismatch(String name, String expected, Object actual) {
        return new IllegalArgumentException(
            "parameter '" + name + "' is not a " + expected + " (current: " + actual + ")"
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((OperationParameters) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
