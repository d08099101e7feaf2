package com.ryuqq.audioedit.application.interpreter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 제출된 편집 요청 원문.
 *
 * <p>{@code operations}가 비어 있으면 {@code instruction}(자유 텍스트)과
 * {@code guess}(외부 분류기의 추정, 신뢰하지 않음)로 연산을 결정합니다.</p>
 *
 * @param id 호출자가 지정한 식별자 (null이면 자동 할당)
 * @param clientId 제출자 (null이면 anonymous)
 * @param audioSources 입력 오디오 참조 (첫 번째가 주 입력)
 * @param operations 구조화된 연산 목록 (비어 있을 수 있음)
 * @param instruction 자유 텍스트 지시문 (null 가능)
 * @param guess 자유 텍스트에 대한 외부 추정 (null 가능)
 * @param priority 우선순위 1~5 또는 라벨 (null이면 기본값 3)
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public record EditPayload(
    String id,
    String clientId,
    List<String> audioSources,
    List<RawOperation> operations,
    String instruction,
    RawOperation guess,
    String priority
) {

    public EditPayload {
        audioSources = audioSources == null ? List.of() : List.copyOf(audioSources);
        operations = operations == null ? List.of() : List.copyOf(operations);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 테스트와 어댑터에서 쓰는 빌더.
     */
    public static final class Builder {

        private String id;
        private String clientId;
        private final List<String> audioSources = new ArrayList<>();
        private final List<RawOperation> operations = new ArrayList<>();
        private String instruction;
        private RawOperation guess;
        private String priority;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder source(String ref) {
            this.audioSources.add(ref);
            return this;
        }

        public Builder sources(List<String> refs) {
            this.audioSources.addAll(refs);
            return this;
        }

        public Builder operation(String kind, Map<String, ?> parameters) {
            this.operations.add(RawOperation.of(kind, parameters));
            return this;
        }

        public Builder operation(RawOperation operation) {
            this.operations.add(operation);
            return this;
        }

        public Builder instruction(String instruction) {
            this.instruction = instruction;
            return this;
        }

        public Builder guess(RawOperation guess) {
            this.guess = guess;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = String.valueOf(priority);
            return this;
        }

        public Builder priority(String priority) {
            this.priority = priority;
            return this;
        }

        public EditPayload build() {
            return new EditPayload(id, clientId, audioSources, operations, instruction, guess, priority);
        }
    }
}
