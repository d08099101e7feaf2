package com.ryuqq.audioedit.core.catalog;

/**
 * 연산 파라미터의 값 타입.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public enum ParamType {

    /** 실수. 정규화 후 {@link Double}. */
    NUMBER,

    /** 정수. 정규화 후 {@link Long}. */
    INTEGER,

    /** 문자열. 허용 값 목록이 있으면 소문자로 정규화. */
    STRING,

    /** 주파수(Hz) → 게인(dB) 맵. 정규화 후 주파수 오름차순 {@code Map<String, Double>}. */
    BAND_MAP,

    /** 오디오 참조 목록. 정규화 후 {@code List<String>}. */
    SOURCE_LIST
}
