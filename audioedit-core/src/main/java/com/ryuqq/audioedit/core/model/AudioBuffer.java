package com.ryuqq.audioedit.core.model;

import java.util.List;

/**
 * 파이프라인 단계 사이를 흐르는 디코딩된 오디오.
 *
 * <p>샘플은 채널 인터리브된 float PCM(-1.0 ~ 1.0)입니다. 각 연산 실행자는
 * 입력 버퍼를 수정하지 않고 새 버퍼를 반환해야 합니다.</p>
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>samples: 인터리브된 샘플 (길이 = frameCount × channels)</li>
 *   <li>sampleRate: 샘플레이트 (Hz)</li>
 *   <li>channels: 채널 수 (1 이상)</li>
 *   <li>format: 컨테이너/코덱 이름 (예: wav, mp3)</li>
 *   <li>segmentStarts: split 연산이 표시한 구간 시작 프레임 (오름차순, 첫 값은 0)</li>
 * </ul>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class AudioBuffer {

    private final float[] samples;
    private final int sampleRate;
    private final int channels;
    private final String format;
    private final List<Integer> segmentStarts;

    private AudioBuffer(float[] samples, int sampleRate, int channels, String format, List<Integer> segmentStarts) {
        if (samples == null) {
            throw new IllegalArgumentException("samples cannot be null");
        }
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive (current: " + sampleRate + ")");
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be positive (current: " + channels + ")");
        }
        if (samples.length % channels != 0) {
            throw new IllegalArgumentException(
                "samples length " + samples.length + " is not a multiple of channels " + channels
            );
        }
        if (format == null || format.isBlank()) {
            throw new IllegalArgumentException("format cannot be null or blank");
        }
        this.samples = samples.clone();
        this.sampleRate = sampleRate;
        this.channels = channels;
        this.format = format;
        this.segmentStarts = segmentStarts == null ? List.of() : List.copyOf(segmentStarts);
    }

    /**
     * 버퍼 생성.
     *
     * @param samples 인터리브된 샘플 (복사되어 보관)
     * @param sampleRate 샘플레이트
     * @param channels 채널 수
     * @param format 포맷 이름
     * @return AudioBuffer 인스턴스
     */
    public static AudioBuffer of(float[] samples, int sampleRate, int channels, String format) {
        return new AudioBuffer(samples, sampleRate, channels, format, List.of());
    }

    /**
     * 무음 버퍼 생성.
     */
    public static AudioBuffer silence(long durationMillis, int sampleRate, int channels, String format) {
        int frames = (int) (durationMillis * sampleRate / 1000L);
        return new AudioBuffer(new float[frames * channels], sampleRate, channels, format, List.of());
    }

    /**
     * 샘플 배열의 복사본.
     */
    public float[] samples() {
        return samples.clone();
    }

    public float sample(int frame, int channel) {
        return samples[frame * channels + channel];
    }

    public int sampleRate() {
        return sampleRate;
    }

    public int channels() {
        return channels;
    }

    public String format() {
        return format;
    }

    public List<Integer> segmentStarts() {
        return segmentStarts;
    }

    public int frameCount() {
        return samples.length / channels;
    }

    public long durationMillis() {
        return frameCount() * 1000L / sampleRate;
    }

    /**
     * 밀리초 위치를 프레임 인덱스로 변환 (버퍼 길이로 제한).
     *
     * <p>버퍼 길이를 넘는 위치는 곱셈 전에 잘라내므로 아주 큰 값도 마지막 프레임으로 수렴합니다.</p>
     */
    public int frameAt(long millis) {
        if (millis <= 0) {
            return 0;
        }
        if (millis > durationMillis()) {
            return frameCount();
        }
        long frame = millis * sampleRate / 1000L;
        return (int) Math.min(frame, frameCount());
    }

    /**
     * 피크 절대값.
     */
    public float peak() {
        float peak = 0f;
        for (float s : samples) {
            peak = Math.max(peak, Math.abs(s));
        }
        return peak;
    }

    /**
     * 같은 레이아웃의 새 샘플. 길이가 같으면 구간 표시를 유지하고, 달라지면 비웁니다.
     *
     * @param newSamples 인터리브 샘플
     * @return 새 버퍼
     */
    public AudioBuffer withSamples(float[] newSamples) {
        boolean sameLength = newSamples != null && newSamples.length == samples.length;
        return new AudioBuffer(newSamples, sampleRate, channels, format, sameLength ? segmentStarts : List.of());
    }

    public AudioBuffer withLayout(float[] newSamples, int newSampleRate, int newChannels) {
        return new AudioBuffer(newSamples, newSampleRate, newChannels, format, List.of());
    }

    public AudioBuffer withFormat(String newFormat) {
        return new AudioBuffer(samples, sampleRate, channels, newFormat, segmentStarts);
    }

    public AudioBuffer withSegmentStarts(List<Integer> newSegmentStarts) {
        return new AudioBuffer(samples, sampleRate, channels, format, newSegmentStarts);
    }

    @Override
    public String toString() {
        return "AudioBuffer{" + format + ", " + sampleRate + "Hz, " + channels + "ch, "
            + frameCount() + " frames, " + segmentStarts.size() + " segments}";
    }
}
