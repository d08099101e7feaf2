package com.ryuqq.audioedit.core.model;

/**
 * 오디오 저장소(blob store)에 보관된 오디오의 참조.
 *
 * <p>원본 입력({@code audio_source})과 처리 결과({@code result_ref})
 * 모두 이 타입으로 표현합니다. 값의 형식은 저장소 구현체가 정합니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class AudioRef {

    private final String value;

    private AudioRef(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("AudioRef cannot be null or blank");
        }
        this.value = value;
    }

    public static AudioRef of(String value) {
        return new AudioRef(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AudioRef audioRef = (AudioRef) o;
        return value.equals(audioRef.value);
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
