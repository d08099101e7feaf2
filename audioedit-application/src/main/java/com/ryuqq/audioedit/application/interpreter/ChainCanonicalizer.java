package com.ryuqq.audioedit.application.interpreter;

import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationSpec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 연산 체인을 고정된 우선순위로 정렬.
 *
 * <p><strong>정렬 단계:</strong></p>
 * <ol>
 *   <li>split, trim (구조 편집)</li>
 *   <li>merge</li>
 *   <li>speed_change, pitch_change</li>
 *   <li>noise_reduction, equalize, compress, reverb, fade_in, fade_out</li>
 *   <li>normalize</li>
 *   <li>convert_format</li>
 * </ol>
 *
 * <p>같은 단계 안에서는 호출자가 준 순서를 유지합니다 (안정 정렬).
 * 순서가 어긋난 입력은 거부하지 않고 조용히 재정렬합니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class ChainCanonicalizer {

    private static final Comparator<OperationSpec> BY_TIER = Comparator.comparingInt(spec -> tier(spec.kind()));

    private ChainCanonicalizer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 연산 종류의 정렬 단계 (작을수록 먼저).
     *
     * @param kind 연산 종류
     * @return 1~6
     */
    public static int tier(OperationKind kind) {
        return switch (kind) {
            case SPLIT, TRIM -> 1;
            case MERGE -> 2;
            case SPEED_CHANGE, PITCH_CHANGE -> 3;
            case NOISE_REDUCTION, EQUALIZE, COMPRESS, REVERB, FADE_IN, FADE_OUT -> 4;
            case NORMALIZE -> 5;
            case CONVERT_FORMAT -> 6;
        };
    }

    /**
     * 정규 순서로 정렬된 새 목록 반환.
     *
     * @param operations 입력 순서의 연산
     * @return 정렬된 불변 목록
     */
    public static List<OperationSpec> canonicalize(List<OperationSpec> operations) {
        List<OperationSpec> sorted = new ArrayList<>(operations);
        sorted.sort(BY_TIER);
        return List.copyOf(sorted);
    }
}
