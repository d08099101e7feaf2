package com.ryuqq.audioedit.core.model;

/**
 * 편집 요청의 외부 노출 식별자.
 *
 * <p>제출 시점에 부여되며 이후 변경되지 않습니다. 기본 생성 규칙은
 * {@code REQ-000123} 형태의 순번 기반 식별자입니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class RequestId {

    private static final int MAX_LENGTH = 64;
    private static final String PREFIX = "REQ-";

    private final String value;

    private RequestId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RequestId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("RequestId length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("RequestId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * RequestId 생성.
     *
     * @param value 식별자 값
     * @return RequestId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RequestId of(String value) {
        return new RequestId(value);
    }

    /**
     * 순번으로부터 {@code REQ-000123} 형태의 식별자 생성.
     *
     * @param sequence 1 이상의 순번
     * @return RequestId 인스턴스
     * @throws IllegalArgumentException sequence가 양수가 아닌 경우
     */
    public static RequestId sequential(long sequence) {
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive (current: " + sequence + ")");
        }
        return new RequestId(String.format("%s%06d", PREFIX, sequence));
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RequestId that = (RequestId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
