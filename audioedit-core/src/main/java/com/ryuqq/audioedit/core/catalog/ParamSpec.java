package com.ryuqq.audioedit.core.catalog;

import com.ryuqq.audioedit.core.exception.ValidationException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 파라미터 하나의 선언: 이름, 타입, 필수 여부, 기본값, 유효 범위.
 *
 * <p>{@link #coerce(String, Object)}는 외부 입력 값을 선언된 타입으로 변환하고 범위를
 * 검사합니다. 숫자 문자열은 숫자로 변환되며, 실패하면 어느 파라미터를 고쳐야 하는지
 * 알려주는 {@link ValidationException}을 던집니다.</p>
 *
 * <p><strong>범위 해석:</strong></p>
 * <ul>
 *   <li>NUMBER, INTEGER: 값 자체에 [min, max] 적용</li>
 *   <li>BAND_MAP: 게인에 [min, max], 주파수에 [keyMin, keyMax] 적용</li>
 *   <li>SOURCE_LIST: 요소 수에 [min, max] 적용 (max null이면 상한 없음)</li>
 * </ul>
 *
 * @param name 파라미터 이름
 * @param type 값 타입
 * @param required 필수 여부
 * @param defaultValue 선택 파라미터의 기본값 (필수 파라미터는 null)
 * @param min 하한 (포함, null이면 없음)
 * @param max 상한 (포함, null이면 없음)
 * @param keyMin BAND_MAP 주파수 하한
 * @param keyMax BAND_MAP 주파수 상한
 * @param allowedValues STRING 허용 값 (빈 집합이면 제한 없음)
 * @param example 예시 값 (필수 파라미터는 반드시 있음)
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record ParamSpec(
    String name,
    ParamType type,
    boolean required,
    Object defaultValue,
    Double min,
    Double max,
    Double keyMin,
    Double keyMax,
    Set<String> allowedValues,
    Object example
) {

    public ParamSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (required && defaultValue != null) {
            throw new IllegalArgumentException("required parameter '" + name + "' cannot have a default");
        }
        if (!required && defaultValue == null) {
            throw new IllegalArgumentException("optional parameter '" + name + "' must have a default");
        }
        if (required && example == null) {
            throw new IllegalArgumentException("required parameter '" + name + "' must have an example");
        }
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("min must not exceed max (current: " + min + " > " + max + ")");
        }
        allowedValues = allowedValues == null ? Set.of() : Set.copyOf(allowedValues);
        if (example == null) {
            example = defaultValue;
        }
    }

    // ===== factories =====

    public static ParamSpec requiredNumber(String name, double min, double max, double example) {
        return new ParamSpec(name, ParamType.NUMBER, true, null, min, max, null, null, Set.of(), example);
    }

    public static ParamSpec optionalNumber(String name, double defaultValue, double min, double max) {
        return new ParamSpec(name, ParamType.NUMBER, false, defaultValue, min, max, null, null, Set.of(), null);
    }

    public static ParamSpec requiredInteger(String name, long min, Long max, long example) {
        return new ParamSpec(name, ParamType.INTEGER, true, null, (double) min,
            max == null ? null : max.doubleValue(), null, null, Set.of(), example);
    }

    public static ParamSpec optionalInteger(String name, long defaultValue, long min, long max) {
        return new ParamSpec(name, ParamType.INTEGER, false, defaultValue, (double) min, (double) max,
            null, null, Set.of(), null);
    }

    public static ParamSpec requiredChoice(String name, Set<String> allowedValues, String example) {
        return new ParamSpec(name, ParamType.STRING, true, null, null, null, null, null, allowedValues, example);
    }

    public static ParamSpec optionalString(String name, String defaultValue) {
        return new ParamSpec(name, ParamType.STRING, false, defaultValue, null, null, null, null, Set.of(), null);
    }

    public static ParamSpec requiredBands(String name, double minHz, double maxHz,
                                          double minDb, double maxDb, Map<String, ?> example) {
        return new ParamSpec(name, ParamType.BAND_MAP, true, null, minDb, maxDb, minHz, maxHz, Set.of(), example);
    }

    public static ParamSpec requiredSources(String name, List<String> example) {
        return new ParamSpec(name, ParamType.SOURCE_LIST, true, null, 1.0, null, null, null, Set.of(), example);
    }

    // ===== coercion =====

    /**
     * 외부 입력 값을 선언된 타입으로 변환하고 범위를 검사.
     *
     * @param kind 오류 메시지에 쓸 연산 이름
     * @param raw 외부 입력 값 (null 아님)
     * @return 정규화된 값
     * @throws ValidationException 타입 불일치 또는 범위 위반
     */
    public Object coerce(String kind, Object raw) {
        if (raw == null) {
            throw invalid(kind, "must not be null");
        }
        return switch (type) {
            case NUMBER -> checkRange(kind, toDouble(kind, name, raw));
            case INTEGER -> {
                long value = toLong(kind, raw);
                checkRange(kind, value);
                yield value;
            }
            case STRING -> toChoice(kind, raw);
            case BAND_MAP -> toBands(kind, raw);
            case SOURCE_LIST -> toSources(kind, raw);
        };
    }

    private Double checkRange(String kind, double value) {
        if (min != null && value < min || max != null && value > max) {
            throw invalid(kind, "must be within " + rangeText(min, max) + " (current: " + format(value) + ")");
        }
        return value;
    }

    private double toDouble(String kind, String label, Object raw) {
        double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else if (raw instanceof String text && !text.isBlank()) {
            try {
                value = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw ValidationException.forParameter(kind, name, "'" + label + "' must be a number (current: " + raw + ")");
            }
        } else {
            throw ValidationException.forParameter(kind, name, "'" + label + "' must be a number (current: " + raw + ")");
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw ValidationException.forParameter(kind, name, "'" + label + "' must be finite (current: " + raw + ")");
        }
        return value;
    }

    private long toLong(String kind, Object raw) {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        double value = toDouble(kind, name, raw);
        if (value != Math.rint(value)) {
            throw invalid(kind, "must be an integer (current: " + raw + ")");
        }
        // (double) Long.MAX_VALUE는 2^63으로 반올림되므로 같은 값도 범위 밖
        if (value >= (double) Long.MAX_VALUE || value < (double) Long.MIN_VALUE) {
            throw invalid(kind, "must fit in a 64-bit integer (current: " + raw + ")");
        }
        return (long) value;
    }

    private String toChoice(String kind, Object raw) {
        if (!(raw instanceof String) && !(raw instanceof Number)) {
            throw invalid(kind, "must be a string (current: " + raw + ")");
        }
        String text = String.valueOf(raw).trim();
        if (text.isEmpty()) {
            throw invalid(kind, "must not be blank");
        }
        if (allowedValues.isEmpty()) {
            return text;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        if (!allowedValues.contains(lowered)) {
            throw invalid(kind, "must be one of " + new TreeSet<>(allowedValues) + " (current: " + text + ")");
        }
        return lowered;
    }

    private Map<String, Double> toBands(String kind, Object raw) {
        if (!(raw instanceof Map<?, ?> map)) {
            throw invalid(kind, "must be a mapping of frequency (Hz) to gain (dB) (current: " + raw + ")");
        }
        if (map.isEmpty()) {
            throw invalid(kind, "must contain at least one band");
        }
        TreeMap<Double, Double> sorted = new TreeMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String label = name + "." + entry.getKey();
            double hz = toDouble(kind, label, entry.getKey());
            if (keyMin != null && hz < keyMin || keyMax != null && hz > keyMax) {
                throw invalid(kind, "frequency " + format(hz) + " Hz must be within " + rangeText(keyMin, keyMax));
            }
            if (entry.getValue() == null) {
                throw invalid(kind, "gain for " + format(hz) + " Hz must not be null");
            }
            double db = toDouble(kind, label, entry.getValue());
            if (min != null && db < min || max != null && db > max) {
                throw invalid(kind, "gain for " + format(hz) + " Hz must be within "
                    + rangeText(min, max) + " dB (current: " + format(db) + ")");
            }
            if (sorted.put(hz, db) != null) {
                throw invalid(kind, "frequency " + format(hz) + " Hz is given more than once");
            }
        }
        Map<String, Double> normalized = new LinkedHashMap<>();
        sorted.forEach((hz, db) -> normalized.put(format(hz), db));
        return normalized;
    }

    private List<String> toSources(String kind, Object raw) {
        Collection<?> items;
        if (raw instanceof Collection<?> collection) {
            items = collection;
        } else if (raw instanceof String single) {
            items = List.of(single);
        } else {
            throw invalid(kind, "must be a list of audio references (current: " + raw + ")");
        }
        List<String> refs = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof String ref) || ref.isBlank()) {
                throw invalid(kind, "must contain only non-blank audio references (current: " + item + ")");
            }
            refs.add(ref.trim());
        }
        if (min != null && refs.size() < min || max != null && refs.size() > max) {
            throw invalid(kind, "must contain " + rangeText(min, max) + " references (current: " + refs.size() + ")");
        }
        return List.copyOf(refs);
    }

    private ValidationException invalid(String kind, String detail) {
        return ValidationException.forParameter(kind, name, "'" + name + "' " + detail);
    }

    private static String rangeText(Double low, Double high) {
        if (high == null) {
            return "[" + format(low) + ", ∞)";
        }
        if (low == null) {
            return "(-∞, " + format(high) + "]";
        }
        return "[" + format(low) + ", " + format(high) + "]";
    }

    static String format(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
