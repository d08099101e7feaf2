package com.ryuqq.audioedit.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * 기본 편집 연산의 종류 (닫힌 열거형).
 *
 * <p>각 상수는 외부 페이로드에서 쓰이는 snake_case 이름({@link #wireName()})을
 * 가집니다. 새 연산을 추가하려면 여기에 상수를 추가하고 Operation Catalog에
 * 설명자와 실행자를 등록해야 합니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public enum OperationKind {

    TRIM("trim"),
    NORMALIZE("normalize"),
    FADE_IN("fade_in"),
    FADE_OUT("fade_out"),
    SPEED_CHANGE("speed_change"),
    PITCH_CHANGE("pitch_change"),
    REVERB("reverb"),
    NOISE_REDUCTION("noise_reduction"),
    EQUALIZE("equalize"),
    COMPRESS("compress"),
    CONVERT_FORMAT("convert_format"),
    MERGE("merge"),
    SPLIT("split");

    private final String wireName;

    OperationKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 외부 페이로드에서 쓰이는 이름.
     *
     * @return snake_case 이름 (예: {@code fade_in})
     */
    public String wireName() {
        return wireName;
    }

    /**
     * 외부 이름으로 연산 종류 조회.
     *
     * <p>대소문자와 앞뒤 공백, 하이픈/언더스코어 차이는 무시합니다.</p>
     *
     * @param name 연산 이름 (null 허용)
     * @return 일치하는 연산 종류, 없으면 empty
     */
    public static Optional<OperationKind> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (OperationKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
