package com.ryuqq.audioedit.application.interpreter;

import com.ryuqq.audioedit.core.catalog.OperationCatalog;
import com.ryuqq.audioedit.core.exception.ValidationException;
import com.ryuqq.audioedit.core.model.AudioRef;
import com.ryuqq.audioedit.core.model.ClientId;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationParameters;
import com.ryuqq.audioedit.core.model.OperationSpec;
import com.ryuqq.audioedit.core.model.Priority;
import com.ryuqq.audioedit.core.model.RequestId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 제출된 요청을 검증된 정규 연산 체인으로 변환.
 *
 * <p><strong>연산 결정 순서:</strong></p>
 * <ol>
 *   <li>구조화된 {@code operations}가 있으면 그대로 사용</li>
 *   <li>없으면 외부에서 함께 온 {@code guess}</li>
 *   <li>그것도 없고 {@code instruction}이 있으면 설정된 {@link OperationGuesser}</li>
 * </ol>
 *
 * <p>어느 경로로 왔든 모든 연산은 {@link OperationCatalog#normalize}를 거칩니다.
 * 첫 번째 위반에서 멈추고, 입력 기준 연산 위치와 파라미터를 담은
 * {@link ValidationException}을 던집니다. 검증이 끝나면
 * {@link ChainCanonicalizer}로 정렬합니다.</p>
 *
 * <p>외부 I/O가 없고 블로킹하지 않습니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class InstructionInterpreter {

    private static final Logger log = LoggerFactory.getLogger(InstructionInterpreter.class);

    private static final String MERGE_SOURCES = "sources";

    private final OperationCatalog catalog;
    private final OperationGuesser guesser;

    /**
     * 자유 텍스트 추정 없이 생성.
     *
     * @param catalog 연산 카탈로그
     */
    public InstructionInterpreter(OperationCatalog catalog) {
        this(catalog, null);
    }

    /**
     * 생성자.
     *
     * @param catalog 연산 카탈로그
     * @param guesser 자유 텍스트 추정기 (null 가능)
     * @throws IllegalArgumentException catalog가 null인 경우
     */
    public InstructionInterpreter(OperationCatalog catalog, OperationGuesser guesser) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        this.catalog = catalog;
        this.guesser = guesser;
    }

    /**
     * 요청 해석.
     *
     * @param payload 제출된 요청
     * @return 검증, 정렬된 요청 내용
     * @throws ValidationException 요청 또는 연산이 유효하지 않은 경우
     */
    public InterpretedRequest interpret(EditPayload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }

        List<AudioRef> sources = resolveSources(payload.audioSources());
        List<RawOperation> rawOperations = resolveOperations(payload);

        List<OperationSpec> validated = new ArrayList<>(rawOperations.size());
        for (int index = 0; index < rawOperations.size(); index++) {
            validated.add(validate(index, rawOperations.get(index), sources));
        }

        List<OperationSpec> canonical = ChainCanonicalizer.canonicalize(validated);
        if (!canonical.equals(validated)) {
            log.debug("Reordered operation chain {} -> {}", kinds(validated), kinds(canonical));
        }

        return new InterpretedRequest(
            resolveId(payload.id()),
            ClientId.ofNullable(payload.clientId()),
            sources,
            canonical,
            resolvePriority(payload.priority()),
            payload.instruction()
        );
    }

    private List<RawOperation> resolveOperations(EditPayload payload) {
        if (!payload.operations().isEmpty()) {
            return payload.operations();
        }
        if (payload.guess() != null) {
            return List.of(payload.guess());
        }
        String instruction = payload.instruction();
        if (instruction == null || instruction.isBlank()) {
            throw ValidationException.forRequest("request must carry operations or a free-text instruction");
        }
        if (guesser == null) {
            throw ValidationException.forRequest("no operation given and free-text instructions are not interpreted here");
        }
        List<RawOperation> guessed = guesser.guess(instruction);
        if (guessed == null || guessed.isEmpty()) {
            throw ValidationException.forRequest("could not recognize an operation in instruction: " + instruction);
        }
        log.debug("Guessed {} operation(s) from instruction '{}'", guessed.size(), instruction);
        return guessed;
    }

    private OperationSpec validate(int index, RawOperation raw, List<AudioRef> sources) {
        if (raw == null) {
            throw new ValidationException(index, null, null, "operations[" + index + "] cannot be null");
        }
        OperationKind kind = OperationKind.fromWireName(raw.kind())
            .orElseThrow(() -> new ValidationException(index, raw.kind(), null,
                "operations[" + index + "]: unknown operation kind '" + raw.kind() + "'"));

        Map<String, Object> parameters = new LinkedHashMap<>(raw.parameters());
        if (kind == OperationKind.MERGE && parameters.get(MERGE_SOURCES) == null && sources.size() > 1) {
            List<String> extra = new ArrayList<>();
            for (AudioRef ref : sources.subList(1, sources.size())) {
                extra.add(ref.getValue());
            }
            parameters.put(MERGE_SOURCES, extra);
        }

        try {
            OperationParameters normalized = catalog.normalize(kind, parameters);
            return new OperationSpec(kind, normalized);
        } catch (ValidationException e) {
            throw e.atIndex(index);
        }
    }

    private static List<AudioRef> resolveSources(List<String> audioSources) {
        if (audioSources.isEmpty()) {
            throw ValidationException.forRequest("audio_source is required");
        }
        List<AudioRef> refs = new ArrayList<>(audioSources.size());
        for (String source : audioSources) {
            if (source == null || source.isBlank()) {
                throw ValidationException.forRequest("audio_source entries cannot be blank");
            }
            refs.add(AudioRef.of(source.trim()));
        }
        return refs;
    }

    private static RequestId resolveId(String id) {
        if (id == null || id.isBlank()) {
            return null;
        }
        try {
            return RequestId.of(id.trim());
        } catch (IllegalArgumentException e) {
            throw ValidationException.forRequest("invalid id '" + id + "': " + e.getMessage());
        }
    }

    private static Priority resolvePriority(String priority) {
        if (priority == null || priority.isBlank()) {
            return Priority.DEFAULT;
        }
        try {
            return Priority.fromLabel(priority);
        } catch (IllegalArgumentException e) {
            throw ValidationException.forRequest(
                "priority must be 1-5 or one of urgent/high/normal/low/background (current: " + priority + ")");
        }
    }

    private static List<OperationKind> kinds(List<OperationSpec> operations) {
        return operations.stream().map(OperationSpec::kind).toList();
    }
}
