package com.ryuqq.audioedit.application.api;

import com.ryuqq.audioedit.application.interpreter.EditPayload;
import com.ryuqq.audioedit.application.interpreter.InstructionInterpreter;
import com.ryuqq.audioedit.application.interpreter.InterpretedRequest;
import com.ryuqq.audioedit.application.scheduler.PriorityScheduler;
import com.ryuqq.audioedit.application.status.StatusPublisher;
import com.ryuqq.audioedit.core.catalog.OperationCatalog;
import com.ryuqq.audioedit.core.catalog.OperationDescriptor;
import com.ryuqq.audioedit.core.exception.ValidationException;
import com.ryuqq.audioedit.core.model.EditRequest;
import com.ryuqq.audioedit.core.model.RequestFilter;
import com.ryuqq.audioedit.core.model.RequestId;
import com.ryuqq.audioedit.core.model.StatusEvent;
import com.ryuqq.audioedit.core.spi.AudioStore;
import com.ryuqq.audioedit.core.spi.RequestIdGenerator;
import com.ryuqq.audioedit.core.spi.RequestStore;
import com.ryuqq.audioedit.core.spi.StatusChannel;
import com.ryuqq.audioedit.core.spi.Subscription;
import com.ryuqq.audioedit.core.statemachine.IllegalTransitionException;
import com.ryuqq.audioedit.core.statemachine.RequestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@link EditRequestService} 기본 구현.
 *
 * <p><strong>제출 흐름:</strong></p>
 * <pre>
 * interpret(payload)   → 검증, 기본값, 정렬 (실패 시 ValidationException)
 *   ↓
 * id 결정              → 호출자 지정 id 또는 순번 id
 *   ↓
 * scheduler.admit()    → 입장 제어 + 저장 + 큐 삽입 (실패 시 AdmissionException)
 *   ↓
 * SubmitReceipt (queued)
 * </pre>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class DefaultEditRequestService implements EditRequestService {

    private static final Logger log = LoggerFactory.getLogger(DefaultEditRequestService.class);

    private final InstructionInterpreter interpreter;
    private final PriorityScheduler scheduler;
    private final RequestStore store;
    private final AudioStore audioStore;
    private final StatusChannel statusChannel;
    private final StatusPublisher publisher;
    private final OperationCatalog catalog;
    private final RequestIdGenerator idGenerator;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DefaultEditRequestService(InstructionInterpreter interpreter,
                                     PriorityScheduler scheduler,
                                     RequestStore store,
                                     AudioStore audioStore,
                                     StatusChannel statusChannel,
                                     StatusPublisher publisher,
                                     OperationCatalog catalog,
                                     RequestIdGenerator idGenerator,
                                     Clock clock) {
        this.interpreter = requireNonNull(interpreter, "interpreter");
        this.scheduler = requireNonNull(scheduler, "scheduler");
        this.store = requireNonNull(store, "store");
        this.audioStore = requireNonNull(audioStore, "audioStore");
        this.statusChannel = requireNonNull(statusChannel, "statusChannel");
        this.publisher = requireNonNull(publisher, "publisher");
        this.catalog = requireNonNull(catalog, "catalog");
        this.idGenerator = requireNonNull(idGenerator, "idGenerator");
        this.clock = requireNonNull(clock, "clock");
    }

    @Override
    public SubmitReceipt submit(EditPayload payload) {
        InterpretedRequest interpreted = interpreter.interpret(payload);
        RequestId id = interpreted.requestedIdOptional().orElseGet(this::freshId);
        if (interpreted.requestedId() != null && store.find(id).isPresent()) {
            throw ValidationException.forRequest("id already in use: " + id);
        }

        EditRequest request = EditRequest.queued(
            id,
            interpreted.clientId(),
            interpreted.sources(),
            interpreted.operations(),
            interpreted.priority(),
            interpreted.description(),
            clock.instant()
        );
        try {
            scheduler.admit(request);
        } catch (IllegalStateException e) {
            throw ValidationException.forRequest("id already in use: " + id);
        }

        log.info("Accepted {} from {}: {} operation(s), priority {}",
            id, request.clientId(), request.operations().size(), request.priority());
        return SubmitReceipt.of(request);
    }

    @Override
    public EditRequest get(RequestId id) {
        return store.get(requireNonNull(id, "id"));
    }

    @Override
    public List<EditRequest> list(RequestFilter filter) {
        return store.list(filter == null ? RequestFilter.all() : filter);
    }

    @Override
    public EditRequest cancel(RequestId id) {
        EditRequest current = store.get(requireNonNull(id, "id"));
        if (current.isTerminal()) {
            log.debug("Cancel of {} ignored: already {}", id, current.status());
            return current;
        }
        try {
            EditRequest cancelled = store.transition(id, RequestStatus.CANCELLED,
                request -> request.markCancelled(clock.instant()));
            log.info("Cancelled {} (was {})", id, current.status());
            publisher.publish(cancelled);
            return cancelled;
        } catch (IllegalTransitionException e) {
            // 조회 이후 워커가 먼저 종료 상태로 옮긴 경우: 취소는 no-op
            log.debug("Cancel of {} ignored: finished concurrently ({})", id, e.getMessage());
            return store.get(id);
        }
    }

    @Override
    public EditRequest delete(RequestId id) {
        EditRequest removed = store.delete(requireNonNull(id, "id"));
        if (removed.resultRef() != null) {
            audioStore.delete(removed.resultRef());
        }
        log.info("Deleted {} ({})", id, removed.status());
        return removed;
    }

    @Override
    public List<OperationDescriptor> supportedOperations() {
        return catalog.descriptors();
    }

    @Override
    public RequestStatistics statistics() {
        List<EditRequest> all = store.list(RequestFilter.all().withLimit(Integer.MAX_VALUE));

        Map<RequestStatus, Long> counts = new EnumMap<>(RequestStatus.class);
        Duration totalProcessing = Duration.ZERO;
        long timedCompletions = 0;
        for (EditRequest request : all) {
            counts.merge(request.status(), 1L, Long::sum);
            if (request.status() == RequestStatus.COMPLETED) {
                Optional<Duration> elapsed = request.processingTime();
                if (elapsed.isPresent()) {
                    totalProcessing = totalProcessing.plus(elapsed.get());
                    timedCompletions++;
                }
            }
        }

        long completed = counts.getOrDefault(RequestStatus.COMPLETED, 0L);
        long failed = counts.getOrDefault(RequestStatus.ERROR, 0L);
        double successRate = completed + failed == 0
            ? 0.0
            : Math.round(completed * 1000.0 / (completed + failed)) / 10.0;
        Duration average = timedCompletions == 0 ? Duration.ZERO : totalProcessing.dividedBy(timedCompletions);

        return new RequestStatistics(all.size(), counts, average, successRate);
    }

    @Override
    public Subscription subscribe(RequestId id, Consumer<StatusEvent> listener) {
        requireNonNull(listener, "listener");
        EditRequest current = store.get(requireNonNull(id, "id"));
        Subscription subscription = statusChannel.subscribe(id, listener);
        listener.accept(StatusEvent.snapshotOf(current));
        return subscription;
    }

    private RequestId freshId() {
        RequestId id = idGenerator.next();
        while (store.find(id).isPresent()) {
            id = idGenerator.next();
        }
        return id;
    }

    private static <T> T requireNonNull(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        return value;
    }
}
