package com.ryuqq.audioedit.core.outcome;

import com.ryuqq.audioedit.core.model.AudioBuffer;

/**
 * 성공 결과.
 *
 * <p>연산이 끝났고 {@code output}이 체인의 다음 연산 입력이 됩니다.</p>
 *
 * @param output 연산 결과 오디오
 * @param message 성공 메시지 (선택, null 가능)
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record Ok(
    AudioBuffer output,
    String message
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException output이 null인 경우
     */
    public Ok {
        if (output == null) {
            throw new IllegalArgumentException("output cannot be null");
        }
        // message는 null 허용
    }

    /**
     * 메시지 없이 성공 결과 생성.
     *
     * @param output 연산 결과 오디오
     * @return Ok 인스턴스
     */
    public static Ok of(AudioBuffer output) {
        return new Ok(output, null);
    }
}
