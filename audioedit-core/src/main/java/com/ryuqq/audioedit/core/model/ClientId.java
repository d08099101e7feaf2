package com.ryuqq.audioedit.core.model;

/**
 * 요청 제출자의 불투명 식별자.
 *
 * <p>엔진은 이 값을 해석하지 않으며, 클라이언트별 동시 요청 수 제한과
 * 목록 필터링에만 사용합니다. 제출자가 식별자를 주지 않으면
 * {@link #ANONYMOUS}가 사용됩니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class ClientId {

    public static final ClientId ANONYMOUS = new ClientId("anonymous");

    private final String value;

    private ClientId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ClientId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ClientId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * ClientId 생성.
     *
     * @param value 식별자 값
     * @return ClientId 인스턴스
     * @throws IllegalArgumentException null 또는 빈 문자열인 경우
     */
    public static ClientId of(String value) {
        return new ClientId(value);
    }

    /**
     * null/빈 값이면 {@link #ANONYMOUS}를 반환.
     *
     * @param value 식별자 값 (null 허용)
     * @return ClientId 인스턴스
     */
    public static ClientId ofNullable(String value) {
        if (value == null || value.isBlank()) {
            return ANONYMOUS;
        }
        return new ClientId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ClientId that = (ClientId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ClientId{" + value + '}';
    }
}
