package com.ryuqq.audioedit.adapter.runner;

import com.ryuqq.audioedit.application.status.StatusPublisher;
import com.ryuqq.audioedit.core.catalog.OperationCatalog;
import com.ryuqq.audioedit.core.exception.AudioNotFoundException;
import com.ryuqq.audioedit.core.exception.TransientOperationException;
import com.ryuqq.audioedit.core.exception.ValidationException;
import com.ryuqq.audioedit.core.executor.ExecutionContext;
import com.ryuqq.audioedit.core.executor.OperationExecutor;
import com.ryuqq.audioedit.core.model.AudioBuffer;
import com.ryuqq.audioedit.core.model.AudioRef;
import com.ryuqq.audioedit.core.model.EditRequest;
import com.ryuqq.audioedit.core.model.OperationSpec;
import com.ryuqq.audioedit.core.model.RequestError;
import com.ryuqq.audioedit.core.model.RequestId;
import com.ryuqq.audioedit.core.outcome.Fail;
import com.ryuqq.audioedit.core.outcome.Ok;
import com.ryuqq.audioedit.core.outcome.Outcome;
import com.ryuqq.audioedit.core.outcome.Retry;
import com.ryuqq.audioedit.core.spi.AudioStore;
import com.ryuqq.audioedit.core.spi.RequestStore;
import com.ryuqq.audioedit.core.statemachine.IllegalTransitionException;
import com.ryuqq.audioedit.core.statemachine.RequestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Operation Pipeline 실행기.
 *
 * <p>{@code processing} 상태로 claim된 요청 하나의 operation chain을 순서대로 실행하고,
 * 요청을 종료 상태({@code completed}, {@code error})로 옮깁니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * run(request)
 *   ↓
 * 1. audioStore.get(primarySource)        → 실패 시 error(SOURCE_UNAVAILABLE)
 *   ↓
 * 2. For each operation (chain 순서):
 *      a. 취소 확인 (store 상태가 processing이 아니면 중단, 산출물 폐기)
 *      b. executor.execute(buffer) → operationTimeoutMs 내 완료 대기
 *      c. Outcome 분기:
 *         - Ok → 다음 operation의 입력, recordProgress + 상태 발행
 *         - Retry / TransientOperationException / timeout → backoff 후 재시도
 *           (maxRetries 초과 시 error(RETRIES_EXHAUSTED))
 *         - Fail / ValidationException / 기타 예외 → error(EXECUTION_FAILED), 재시도 없음
 *   ↓
 * 3. audioStore.put(최종 buffer) → processing → completed(resultRef)
 * </pre>
 *
 * <p><strong>취소 규칙:</strong></p>
 * <ul>
 *   <li>취소는 operation 경계와 재시도 대기 직후에만 관찰</li>
 *   <li>실행 중인 operation은 끝까지 실행되지만 결과는 버려짐</li>
 *   <li>완료 직전 취소와 경합하면 저장한 산출물을 삭제</li>
 * </ul>
 *
 * <p>제한 시간을 넘긴 operation은 {@code Future.cancel(true)}로 인터럽트합니다. PCM 실행기는
 * 프레임 루프에서 인터럽트를 확인해 멈추므로 operation 스레드 풀은 상한 없이 둡니다.</p>
 *
 * <p>실패한 요청의 부분 산출물은 저장하지 않습니다. 런타임에 관찰된 불법 상태 전이는
 * 취소 경합이 아니면 ERROR로 로깅합니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class PipelineExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    private final OperationCatalog catalog;
    private final RequestStore store;
    private final AudioStore audioStore;
    private final StatusPublisher publisher;
    private final PipelineConfig config;
    private final BackoffCalculator backoffCalculator;
    private final Clock clock;
    private final ExecutorService operationThreads;

    /**
     * 생성자.
     *
     * @param catalog operation 종류별 executor 바인딩
     * @param store 요청 저장소
     * @param audioStore 오디오 저장소 (원본 로드, 결과 저장)
     * @param publisher 상태 발행기
     * @param config 실행 설정
     * @param clock 시간 소스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public PipelineExecutor(OperationCatalog catalog,
                            RequestStore store,
                            AudioStore audioStore,
                            StatusPublisher publisher,
                            PipelineConfig config,
                            Clock clock) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (audioStore == null) {
            throw new IllegalArgumentException("audioStore cannot be null");
        }
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }

        this.catalog = catalog;
        this.store = store;
        this.audioStore = audioStore;
        this.publisher = publisher;
        this.config = config;
        this.backoffCalculator = config.backoffCalculator();
        this.clock = clock;
        this.operationThreads = Executors.newCachedThreadPool(daemonThreads("audioedit-op-"));
    }

    /**
     * 요청 하나의 operation chain 실행.
     *
     * @param request {@code processing} 상태로 claim된 요청
     * @return 실행을 마친 시점의 저장된 요청 상태
     * @throws InterruptedException 워커 스레드가 인터럽트된 경우 (요청은 error로 종료됨)
     * @throws IllegalArgumentException request가 null이거나 processing 상태가 아닌 경우
     */
    public EditRequest run(EditRequest request) throws InterruptedException {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (request.status() != RequestStatus.PROCESSING) {
            throw new IllegalArgumentException(
                "request must be processing (current: " + request.status() + ")"
            );
        }

        RequestId id = request.id();
        try {
            return execute(request);
        } catch (InterruptedException e) {
            log.warn("{} interrupted while running, marking as error", id);
            finishWithError(id, RequestError.of(RequestError.INTERNAL_ERROR, "worker interrupted"));
            throw e;
        } catch (RuntimeException e) {
            log.error("{} failed unexpectedly", id, e);
            return finishWithError(id, RequestError.of(RequestError.INTERNAL_ERROR, describe(e)));
        }
    }

    /**
     * operation 실행용 스레드 정리.
     */
    @Override
    public void close() {
        operationThreads.shutdownNow();
    }

    private EditRequest execute(EditRequest request) throws InterruptedException {
        RequestId id = request.id();
        long started = System.nanoTime();

        AudioBuffer buffer;
        try {
            buffer = audioStore.get(request.primarySource());
        } catch (RuntimeException e) {
            log.warn("{} cannot load source {}: {}", id, request.primarySource(), e.getMessage());
            return finishWithError(id, RequestError.of(RequestError.SOURCE_UNAVAILABLE,
                "cannot load source " + request.primarySource() + ": " + describe(e)));
        }

        ExecutionContext context = new StoreBackedContext(id, audioStore);
        List<OperationSpec> operations = request.operations();
        List<OperationResult> results = new ArrayList<>(operations.size());

        for (int index = 0; index < operations.size(); index++) {
            if (isAbandoned(id)) {
                return abandon(id, index);
            }
            try {
                buffer = runStep(id, index, operations.get(index), buffer, context, results);
            } catch (StepFailedException e) {
                return finishWithError(id, e.error);
            } catch (StepAbandonedException e) {
                return abandon(id, index);
            }

            EditRequest progressed = store.recordProgress(id, index + 1);
            if (progressed.status() == RequestStatus.PROCESSING) {
                publisher.publish(progressed);
            }
        }

        if (isAbandoned(id)) {
            return abandon(id, operations.size());
        }
        EditRequest completed = complete(id, buffer);
        log.info("{} finished as {} in {}ms: {}", id, completed.status(),
            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started), results);
        return completed;
    }

    private AudioBuffer runStep(RequestId id,
                                int index,
                                OperationSpec spec,
                                AudioBuffer input,
                                ExecutionContext context,
                                List<OperationResult> results)
        throws StepFailedException, StepAbandonedException, InterruptedException {

        OperationExecutor executor = catalog.executorFor(spec.kind());
        long started = System.nanoTime();
        int attempt = 0;

        while (true) {
            attempt++;
            Outcome outcome = attempt(executor, input, spec, index, context);

            if (outcome instanceof Ok ok) {
                OperationResult result = new OperationResult(index, spec.kind(), attempt,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started), ok.message());
                results.add(result);
                log.debug("{} step {}", id, result);
                return ok.output();
            }
            if (outcome instanceof Fail fail) {
                log.warn("{} operation #{} ({}) failed: {} - {}", id, index, spec.kind(), fail.errorCode(), fail.message());
                throw new StepFailedException(RequestError.atOperation(RequestError.EXECUTION_FAILED,
                    fail.errorCode() + ": " + fail.message(), index, spec.kind()));
            }

            Retry retry = (Retry) outcome;
            if (attempt > config.maxRetries()) {
                log.warn("{} operation #{} ({}) gave up after {} attempt(s): {}", id, index, spec.kind(), attempt, retry.reason());
                throw new StepFailedException(RequestError.atOperation(RequestError.RETRIES_EXHAUSTED,
                    "gave up after " + attempt + " attempt(s): " + retry.reason(), index, spec.kind()));
            }

            long delay = retry.nextRetryAfterMillis() > 0
                ? retry.nextRetryAfterMillis()
                : backoffCalculator.calculate(attempt);
            log.info("{} operation #{} ({}) retry scheduled after {}ms (attempt {}): {}",
                id, index, spec.kind(), delay, attempt, retry.reason());
            Thread.sleep(delay);

            if (isAbandoned(id)) {
                throw new StepAbandonedException();
            }
        }
    }

    /**
     * executor 한 번 호출 후 결과를 Outcome으로 정규화.
     *
     * <p>일시적 장애(TransientOperationException, timeout)는 {@link Retry}로,
     * 그 밖의 예외는 재시도 없는 실패로 변환합니다.</p>
     */
    private Outcome attempt(OperationExecutor executor,
                            AudioBuffer input,
                            OperationSpec spec,
                            int index,
                            ExecutionContext context) throws StepFailedException, InterruptedException {
        Future<Outcome> future = operationThreads.submit(
            () -> executor.execute(input, spec.parameters(), context));
        try {
            Outcome outcome = future.get(config.operationTimeoutMs(), TimeUnit.MILLISECONDS);
            if (outcome == null) {
                throw new StepFailedException(RequestError.atOperation(RequestError.EXECUTION_FAILED,
                    "executor returned no outcome", index, spec.kind()));
            }
            return outcome;
        } catch (TimeoutException e) {
            future.cancel(true);
            return Retry.of("timed out after " + config.operationTimeoutMs() + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof TransientOperationException) {
                return Retry.of(describe(cause));
            }
            String code = cause instanceof AudioNotFoundException
                ? RequestError.SOURCE_UNAVAILABLE
                : RequestError.EXECUTION_FAILED;
            if (cause instanceof ValidationException) {
                log.warn("Operation #{} ({}) rejected its parameters: {}", index, spec.kind(), cause.getMessage());
            } else {
                log.warn("Operation #{} ({}) threw", index, spec.kind(), cause);
            }
            throw new StepFailedException(RequestError.atOperation(code, describe(cause), index, spec.kind()));
        }
    }

    private EditRequest complete(RequestId id, AudioBuffer output) {
        AudioRef resultRef;
        try {
            resultRef = audioStore.put(id.getValue(), output);
        } catch (RuntimeException e) {
            log.error("{} result could not be stored", id, e);
            return finishWithError(id, RequestError.of(RequestError.RESULT_NOT_STORED, describe(e)));
        }

        try {
            EditRequest completed = store.transition(id, RequestStatus.COMPLETED,
                request -> request.markCompleted(resultRef, clock.instant()));
            publisher.publish(completed);
            return completed;
        } catch (IllegalTransitionException e) {
            audioStore.delete(resultRef);
            reportConflict(id, e);
            return store.get(id);
        }
    }

    private EditRequest finishWithError(RequestId id, RequestError error) {
        try {
            EditRequest failed = store.transition(id, RequestStatus.ERROR,
                request -> request.markFailed(error, clock.instant()));
            publisher.publish(failed);
            return failed;
        } catch (IllegalTransitionException e) {
            reportConflict(id, e);
            return store.get(id);
        }
    }

    private EditRequest abandon(RequestId id, int completedSteps) {
        EditRequest current = store.get(id);
        log.info("{} no longer processing ({}) after {} step(s), output discarded", id, current.status(), completedSteps);
        return current;
    }

    private boolean isAbandoned(RequestId id) {
        Optional<EditRequest> current = store.find(id);
        return current.isEmpty() || current.get().status() != RequestStatus.PROCESSING;
    }

    private void reportConflict(RequestId id, IllegalTransitionException e) {
        if (e.getFrom() == RequestStatus.CANCELLED) {
            log.info("{} was cancelled before it could finish", id);
            return;
        }
        log.error("Illegal transition for {}: {} -> {}", id, e.getFrom(), e.getTo(), e);
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record StoreBackedContext(RequestId requestId, AudioStore audioStore) implements ExecutionContext {

        @Override
        public AudioBuffer loadSource(AudioRef ref) {
            return audioStore.get(ref);
        }
    }

    private static final class StepFailedException extends Exception {

        private final RequestError error;

        StepFailedException(RequestError error) {
            super(error.message(), null, false, false);
            this.error = error;
        }
    }

    private static final class StepAbandonedException extends Exception {

        StepAbandonedException() {
            super(null, null, false, false);
        }
    }
}
