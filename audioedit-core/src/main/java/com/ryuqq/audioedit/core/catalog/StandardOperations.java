package com.ryuqq.audioedit.core.catalog;

import com.ryuqq.audioedit.core.exception.ValidationException;
import com.ryuqq.audioedit.core.model.OperationKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 기본 연산 13종의 파라미터 선언.
 *
 * <p>단위는 이름에 드러냅니다: {@code _ms}는 밀리초, {@code _db}는 dBFS,
 * {@code factor}는 배율, {@code semitones}는 반음.</p>
 *
 * <p>실행자 바인딩은 어댑터가 담당하며, 이 클래스는 선언만 제공합니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class StandardOperations {

    /** convert_format이 허용하는 컨테이너. */
    public static final Set<String> SUPPORTED_FORMATS = Set.of("wav", "mp3", "flac", "aac", "ogg", "m4a");

    private static final Map<OperationKind, OperationDescriptor> DESCRIPTORS = build();

    private StandardOperations() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * 연산 종류의 표준 설명자.
     *
     * @param kind 연산 종류
     * @return 설명자
     */
    public static OperationDescriptor descriptor(OperationKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return DESCRIPTORS.get(kind);
    }

    public static List<OperationDescriptor> all() {
        return List.copyOf(DESCRIPTORS.values());
    }

    private static Map<OperationKind, OperationDescriptor> build() {
        Map<OperationKind, OperationDescriptor> map = new EnumMap<>(OperationKind.class);

        map.put(OperationKind.TRIM, OperationDescriptor.of(OperationKind.TRIM,
            "Keep only the region between start_ms and end_ms",
            ParamSpec.requiredInteger("start_ms", 0, null, 0),
            ParamSpec.requiredInteger("end_ms", 0, null, 5_000)
        ).withConstraint(params -> {
            long start = params.getLong("start_ms");
            long end = params.getLong("end_ms");
            if (end <= start) {
                throw ValidationException.forParameter("trim", "end_ms",
                    "'end_ms' must be greater than start_ms (start_ms: " + start + ", end_ms: " + end + ")");
            }
        }));

        map.put(OperationKind.NORMALIZE, OperationDescriptor.of(OperationKind.NORMALIZE,
            "Scale the signal so that its peak reaches target_db dBFS",
            ParamSpec.optionalNumber("target_db", -20.0, -70.0, 0.0)));

        map.put(OperationKind.FADE_IN, OperationDescriptor.of(OperationKind.FADE_IN,
            "Ramp the level up from silence over duration_ms at the start",
            ParamSpec.optionalInteger("duration_ms", 1_000, 1, 600_000)));

        map.put(OperationKind.FADE_OUT, OperationDescriptor.of(OperationKind.FADE_OUT,
            "Ramp the level down to silence over duration_ms at the end",
            ParamSpec.optionalInteger("duration_ms", 1_000, 1, 600_000)));

        map.put(OperationKind.SPEED_CHANGE, OperationDescriptor.of(OperationKind.SPEED_CHANGE,
            "Change playback speed by factor (duration scales by 1/factor)",
            ParamSpec.requiredNumber("factor", 0.25, 4.0, 1.5)));

        map.put(OperationKind.PITCH_CHANGE, OperationDescriptor.of(OperationKind.PITCH_CHANGE,
            "Shift pitch by semitones while keeping the duration",
            ParamSpec.requiredNumber("semitones", -24.0, 24.0, 2.0)));

        map.put(OperationKind.REVERB, OperationDescriptor.of(OperationKind.REVERB,
            "Add room reverberation",
            ParamSpec.optionalNumber("room_size", 0.5, 0.0, 1.0),
            ParamSpec.optionalNumber("damping", 0.5, 0.0, 1.0),
            ParamSpec.optionalNumber("wet_level", 0.3, 0.0, 1.0)));

        map.put(OperationKind.NOISE_REDUCTION, OperationDescriptor.of(OperationKind.NOISE_REDUCTION,
            "Attenuate low-level background noise",
            ParamSpec.optionalNumber("strength", 0.5, 0.0, 1.0)));

        map.put(OperationKind.EQUALIZE, OperationDescriptor.of(OperationKind.EQUALIZE,
            "Apply per-band gain (bands maps frequency in Hz to gain in dB)",
            ParamSpec.requiredBands("bands", 20.0, 20_000.0, -24.0, 24.0, Map.of("100", -2.0, "3000", 3.0))));

        map.put(OperationKind.COMPRESS, OperationDescriptor.of(OperationKind.COMPRESS,
            "Reduce dynamic range above threshold_db by ratio",
            ParamSpec.optionalNumber("threshold_db", -20.0, -60.0, 0.0),
            ParamSpec.optionalNumber("ratio", 4.0, 1.0, 20.0),
            ParamSpec.optionalNumber("attack_ms", 5.0, 0.1, 1_000.0),
            ParamSpec.optionalNumber("release_ms", 100.0, 1.0, 5_000.0)));

        map.put(OperationKind.CONVERT_FORMAT, OperationDescriptor.of(OperationKind.CONVERT_FORMAT,
            "Re-encode into target_format with the given bitrate, sample rate and channel count",
            ParamSpec.requiredChoice("target_format", SUPPORTED_FORMATS, "mp3"),
            ParamSpec.optionalString("bitrate", "192k"),
            ParamSpec.optionalInteger("sample_rate", 44_100, 8_000, 192_000),
            ParamSpec.optionalInteger("channels", 2, 1, 2)));

        map.put(OperationKind.MERGE, OperationDescriptor.of(OperationKind.MERGE,
            "Append the listed sources after the current audio, optionally crossfading",
            ParamSpec.requiredSources("sources", List.of("audio/second.wav")),
            ParamSpec.optionalInteger("crossfade_ms", 0, 0, 10_000)));

        map.put(OperationKind.SPLIT, OperationDescriptor.of(OperationKind.SPLIT,
            "Mark segment boundaries every segment_ms",
            ParamSpec.requiredInteger("segment_ms", 100, 3_600_000L, 30_000)));

        return map;
    }
}
