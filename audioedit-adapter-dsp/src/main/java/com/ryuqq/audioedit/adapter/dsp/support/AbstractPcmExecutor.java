package com.ryuqq.audioedit.adapter.dsp.support;

import com.ryuqq.audioedit.core.executor.ExecutionContext;
import com.ryuqq.audioedit.core.executor.OperationExecutor;
import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.OperationParameters;
import com.ryuqq.audioedit.core.outcome.Ok;
import com.ryuqq.audioedit.core.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;

/**
 * PCM 버퍼를 처리하는 실행기의 공통 골격.
 *
 * <p>하위 클래스는 {@link #process(AudioBuffer, OperationParameters, ExecutionContext)}만
 * 구현합니다. 입력 검사, 처리 시간 측정, {@link Ok} 포장은 이 클래스가 담당합니다.</p>
 *
 * <p><strong>실패 표현:</strong></p>
 * <ul>
 *   <li>입력으로 처리할 수 없는 경우: {@link #reject(AudioBuffer, OperationParameters)}가 {@code Fail} 반환</li>
 *   <li>그 외 예외는 그대로 전파 (파이프라인이 실패로 기록)</li>
 *   <li>스레드 인터럽트: 시작 전과 프레임 루프 안({@link PcmMath#checkInterrupted(int)})에서 확인해
 *       {@link CancellationException}으로 중단</li>
 * </ul>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public abstract class AbstractPcmExecutor implements OperationExecutor {

    private static final Logger log = LoggerFactory.getLogger(AbstractPcmExecutor.class);

    private final OperationKind kind;

    protected AbstractPcmExecutor(OperationKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        this.kind = kind;
    }

    @Override
    public final OperationKind kind() {
        return kind;
    }

    @Override
    public final Outcome execute(AudioBuffer input, OperationParameters parameters, ExecutionContext context) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        if (parameters == null) {
            throw new IllegalArgumentException("parameters cannot be null");
        }
        Outcome rejection = reject(input, parameters);
        if (rejection != null) {
            return rejection;
        }

        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException(kind.wireName() + " interrupted before start");
        }
        long started = System.nanoTime();
        AudioBuffer output = process(input, parameters, context);
        long elapsedMicros = (System.nanoTime() - started) / 1_000L;
        log.trace("{} processed {} -> {} in {}us", kind.wireName(), input, output, elapsedMicros);
        return new Ok(output, kind.wireName() + ": " + input.durationMillis() + "ms -> " + output.durationMillis() + "ms");
    }

    /**
     * 처리 전 입력 검사.
     *
     * @return 처리할 수 없으면 Fail, 가능하면 null
     */
    protected Outcome reject(AudioBuffer input, OperationParameters parameters) {
        return null;
    }

    protected abstract AudioBuffer process(AudioBuffer input, OperationParameters parameters, ExecutionContext context);
}
