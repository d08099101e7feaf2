package com.ryuqq.audioedit.adapter.dsp.support;

import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;

/**
 * 인터리브 PCM 버퍼용 계산 유틸리티.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class PcmMath {

    /** 이보다 작은 피크는 무음으로 취급 */
    public static final float SILENCE_THRESHOLD = 1e-6f;

    /** 인터럽트 확인 간격 (프레임, 2의 거듭제곱) */
    public static final int INTERRUPT_CHECK_FRAMES = 4096;

    private PcmMath() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static double dbToLinear(double db) {
        return Math.pow(10.0, db / 20.0);
    }

    public static double linearToDb(double linear) {
        return linear <= 0.0 ? Double.NEGATIVE_INFINITY : 20.0 * Math.log10(linear);
    }

    /**
     * 현재 스레드가 인터럽트되었으면 처리를 중단.
     *
     * <p>프레임 루프 안에서 매번 호출하되 실제 확인은 {@value #INTERRUPT_CHECK_FRAMES} 프레임마다
     * 한 번 합니다. 인터럽트 플래그는 지우지 않습니다.</p>
     *
     * @param frame 현재 프레임 인덱스
     * @throws CancellationException 스레드가 인터럽트된 경우
     */
    public static void checkInterrupted(int frame) {
        if ((frame & (INTERRUPT_CHECK_FRAMES - 1)) == 0 && Thread.currentThread().isInterrupted()) {
            throw new CancellationException("interrupted at frame " + frame);
        }
    }

    /**
     * 선형 보간 리샘플링.
     *
     * <p>출력 프레임 수는 {@code round(frames / ratio)}입니다. ratio가 1보다 크면
     * 짧아지고(빨라지고) 작으면 길어집니다.</p>
     *
     * @param samples 인터리브 샘플
     * @param channels 채널 수
     * @param ratio 입력 프레임 / 출력 프레임
     * @return 리샘플된 인터리브 샘플
     */
    public static float[] resample(float[] samples, int channels, double ratio) {
        if (ratio <= 0.0) {
            throw new IllegalArgumentException("ratio must be positive (current: " + ratio + ")");
        }
        int inFrames = samples.length / channels;
        int outFrames = (int) Math.round(inFrames / ratio);
        float[] out = new float[outFrames * channels];
        if (inFrames == 0) {
            return out;
        }
        for (int frame = 0; frame < outFrames; frame++) {
            checkInterrupted(frame);
            double position = frame * ratio;
            int left = (int) position;
            int right = Math.min(left + 1, inFrames - 1);
            left = Math.min(left, inFrames - 1);
            float fraction = (float) (position - Math.floor(position));
            for (int ch = 0; ch < channels; ch++) {
                float a = samples[left * channels + ch];
                float b = samples[right * channels + ch];
                out[frame * channels + ch] = a + (b - a) * fraction;
            }
        }
        return out;
    }

    /**
     * 채널 수 변환. 다운믹스는 평균, 업믹스는 마지막 채널 복제.
     */
    public static float[] remix(float[] samples, int fromChannels, int toChannels) {
        if (fromChannels == toChannels) {
            return samples.clone();
        }
        int frames = samples.length / fromChannels;
        float[] out = new float[frames * toChannels];
        for (int frame = 0; frame < frames; frame++) {
            checkInterrupted(frame);
            if (toChannels < fromChannels) {
                float sum = 0f;
                for (int ch = 0; ch < fromChannels; ch++) {
                    sum += samples[frame * fromChannels + ch];
                }
                float mixed = sum / fromChannels;
                for (int ch = 0; ch < toChannels; ch++) {
                    out[frame * toChannels + ch] = mixed;
                }
            } else {
                for (int ch = 0; ch < toChannels; ch++) {
                    int source = Math.min(ch, fromChannels - 1);
                    out[frame * toChannels + ch] = samples[frame * fromChannels + source];
                }
            }
        }
        return out;
    }

    /**
     * 샘플레이트와 채널 수를 맞춘 샘플.
     */
    public static float[] conform(float[] samples, int sampleRate, int channels, int targetRate, int targetChannels) {
        float[] remixed = remix(samples, channels, targetChannels);
        if (sampleRate == targetRate) {
            return remixed;
        }
        return resample(remixed, targetChannels, (double) sampleRate / targetRate);
    }

    /**
     * 구간 시작 프레임을 새 타임라인으로 옮김.
     *
     * <p>{@code start * scale - offset}으로 변환한 뒤 [0, frames) 밖의 값은 버립니다.
     * 구간이 하나라도 남으면 첫 값은 항상 0입니다.</p>
     *
     * @param starts 기존 구간 시작 프레임
     * @param scale 시간 배율 (출력 프레임 / 입력 프레임)
     * @param offset 배율 적용 후 뺄 프레임 수
     * @param frames 새 버퍼의 프레임 수
     * @return 변환된 구간 시작 프레임
     */
    public static List<Integer> moveSegments(List<Integer> starts, double scale, int offset, int frames) {
        if (starts.isEmpty() || frames == 0) {
            return List.of();
        }
        TreeSet<Integer> moved = new TreeSet<>();
        moved.add(0);
        for (int start : starts) {
            long position = Math.round(start * scale) - offset;
            if (position > 0 && position < frames) {
                moved.add((int) position);
            }
        }
        return List.copyOf(moved);
    }

    public static float clamp(float value) {
        return Math.max(-1f, Math.min(1f, value));
    }
}
