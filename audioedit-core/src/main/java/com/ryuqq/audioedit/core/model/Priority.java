package com.ryuqq.audioedit.core.model;

import java.util.Locale;
import java.util.Map;

/**
 * 요청 우선순위 (1 = 최우선 ~ 5 = 최하위).
 *
 * <p>스케줄러는 우선순위 단계별 FIFO 큐를 두고, 숫자가 작은 단계부터
 * 디스패치합니다. 기본값은 중간 단계인 3입니다.</p>
 *
 * <p><strong>라벨 매핑:</strong></p>
 * <ul>
 *   <li>urgent → 1</li>
 *   <li>high → 2</li>
 *   <li>normal → 3</li>
 *   <li>low → 4</li>
 *   <li>background → 5</li>
 * </ul>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class Priority implements Comparable<Priority> {

    public static final int HIGHEST_VALUE = 1;
    public static final int LOWEST_VALUE = 5;
    public static final int LEVELS = LOWEST_VALUE - HIGHEST_VALUE + 1;

    private static final Priority[] CACHE = new Priority[LEVELS];

    static {
        for (int i = 0; i < LEVELS; i++) {
            CACHE[i] = new Priority(HIGHEST_VALUE + i);
        }
    }

    public static final Priority HIGHEST = CACHE[0];
    public static final Priority DEFAULT = CACHE[2];
    public static final Priority LOWEST = CACHE[LEVELS - 1];

    private static final Map<String, Integer> LABELS = Map.of(
        "urgent", 1,
        "high", 2,
        "normal", 3,
        "low", 4,
        "background", 5
    );

    private final int value;

    private Priority(int value) {
        this.value = value;
    }

    /**
     * 숫자 값으로 Priority 조회.
     *
     * @param value 1~5
     * @return Priority 인스턴스
     * @throws IllegalArgumentException 범위를 벗어난 경우
     */
    public static Priority of(int value) {
        if (value < HIGHEST_VALUE || value > LOWEST_VALUE) {
            throw new IllegalArgumentException(
                "priority must be between " + HIGHEST_VALUE + " and " + LOWEST_VALUE + " (current: " + value + ")"
            );
        }
        return CACHE[value - HIGHEST_VALUE];
    }

    /**
     * 라벨(urgent/high/normal/low/background) 또는 숫자 문자열로 Priority 조회.
     *
     * @param label 라벨 또는 "1"~"5"
     * @return Priority 인스턴스
     * @throws IllegalArgumentException 알 수 없는 라벨인 경우
     */
    public static Priority fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("priority label cannot be null or blank");
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        Integer mapped = LABELS.get(normalized);
        if (mapped != null) {
            return of(mapped);
        }
        try {
            return of(Integer.parseInt(normalized));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unknown priority label: " + label, e);
        }
    }

    public int getValue() {
        return value;
    }

    /**
     * 스케줄러 내부 배열 인덱스 (0 = 최우선).
     */
    public int tierIndex() {
        return value - HIGHEST_VALUE;
    }

    @Override
    public int compareTo(Priority other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value == ((Priority) o).value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return "Priority{" + value + '}';
    }
}
