package com.ryuqq.audioedit.application.scheduler;

import com.ryuqq.audioedit.application.status.StatusPublisher;
import com.ryuqq.audioedit.core.exception.AdmissionException;
import com.ryuqq.audioedit.core.exception.RequestNotFoundException;
import com.ryuqq.audioedit.core.model.EditRequest;
import com.ryuqq.audioedit.core.model.Priority;
import com.ryuqq.audioedit.core.model.RequestId;
import com.ryuqq.audioedit.core.spi.RequestStore;
import com.ryuqq.audioedit.core.statemachine.IllegalTransitionException;
import com.ryuqq.audioedit.core.statemachine.RequestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 우선순위 단계별 FIFO 큐로 다음 처리 요청을 결정하는 스케줄러.
 *
 * <p><strong>알고리즘:</strong></p>
 * <ul>
 *   <li>우선순위 1~5마다 FIFO 큐 하나</li>
 *   <li>{@link #next}는 항상 가장 높은 (숫자가 작은) 비어 있지 않은 큐에서 꺼냄</li>
 *   <li>큐 안에서는 도착 순서 엄수, 단계 간 aging 없음</li>
 * </ul>
 *
 * <p><strong>중복 디스패치 방지:</strong></p>
 * <p>큐에서 꺼낸 id는 Request Store의 {@code queued → processing} 전이로 점유합니다.
 * 이 전이는 id 단위로 원자적이므로 두 워커가 같은 요청을 동시에 받을 수 없습니다.
 * 이미 취소되었거나 삭제된 id는 조용히 건너뜁니다.</p>
 *
 * <p><strong>입장 제어:</strong></p>
 * <p>{@link #admit}은 클라이언트별 활성 요청 수 검사, 저장, 큐 삽입을 하나의 임계 구역에서
 * 수행합니다. 상한 초과는 {@link AdmissionException}으로 알립니다.</p>
 *
 * <p>큐 구조는 이 인스턴스가 소유하며 외부에는 {@code admit}/{@code next}만 노출합니다.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class PriorityScheduler {

    private static final Logger log = LoggerFactory.getLogger(PriorityScheduler.class);

    private final RequestStore store;
    private final StatusPublisher publisher;
    private final SchedulerConfig config;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final List<ArrayDeque<RequestId>> tiers;

    /**
     * 생성자.
     *
     * @param store 요청 저장소
     * @param publisher 상태 발행기
     * @param config 설정
     * @param clock 시각 공급원
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public PriorityScheduler(RequestStore store, StatusPublisher publisher, SchedulerConfig config, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
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
        this.store = store;
        this.publisher = publisher;
        this.config = config;
        this.clock = clock;
        this.tiers = new ArrayList<>(Priority.LEVELS);
        for (int i = 0; i < Priority.LEVELS; i++) {
            tiers.add(new ArrayDeque<>());
        }
    }

    /**
     * 검증된 queued 요청을 저장하고 큐에 넣음.
     *
     * @param request queued 상태의 새 요청
     * @throws AdmissionException 클라이언트의 활성 요청 수가 상한에 도달한 경우
     * @throws IllegalArgumentException request가 null이거나 queued가 아닌 경우
     * @throws IllegalStateException 같은 id가 이미 저장되어 있는 경우
     */
    public void admit(EditRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (request.status() != RequestStatus.QUEUED) {
            throw new IllegalArgumentException("only queued requests can be admitted (current: " + request.status() + ")");
        }

        lock.lock();
        try {
            int active = store.countActive(request.clientId());
            if (active >= config.maxActivePerClient()) {
                log.info("Admission rejected for {} (client {}, active {}/{})",
                    request.id(), request.clientId(), active, config.maxActivePerClient());
                throw new AdmissionException(request.clientId(), active, config.maxActivePerClient());
            }
            store.create(request);
            tiers.get(request.priority().tierIndex()).addLast(request.id());
            notEmpty.signal();
        } finally {
            lock.unlock();
        }

        log.debug("Admitted {} at priority {}", request.id(), request.priority());
        publisher.publish(request);
    }

    /**
     * 다음 요청을 점유해 반환 (요청이 생길 때까지 블로킹).
     *
     * @return processing으로 전이된 요청
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public EditRequest next() throws InterruptedException {
        while (true) {
            RequestId id = take(-1L);
            Optional<EditRequest> claimed = claim(id);
            if (claimed.isPresent()) {
                return claimed.get();
            }
        }
    }

    /**
     * 다음 요청을 점유해 반환 (최대 timeout 대기).
     *
     * @param timeout 최대 대기 시간
     * @return processing으로 전이된 요청, 시간 내 없으면 empty
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public Optional<EditRequest> next(Duration timeout) throws InterruptedException {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be non-negative (current: " + timeout + ")");
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = Math.max(0L, deadline - System.nanoTime());
            RequestId id = take(remaining);
            if (id == null) {
                return Optional.empty();
            }
            Optional<EditRequest> claimed = claim(id);
            if (claimed.isPresent()) {
                return claimed;
            }
        }
    }

    /**
     * 큐에 남아 있는 id 수 (취소되어 건너뛸 id 포함).
     *
     * @return 대기 중인 id 수
     */
    public int pending() {
        lock.lock();
        try {
            int total = 0;
            for (ArrayDeque<RequestId> tier : tiers) {
                total += tier.size();
            }
            return total;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 가장 높은 단계에서 id 하나를 꺼냄.
     *
     * @param timeoutNanos 음수면 무기한 대기
     * @return id, 시간 초과 시 null
     */
    private RequestId take(long timeoutNanos) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            long nanos = timeoutNanos;
            RequestId id;
            while ((id = pollHighest()) == null) {
                if (timeoutNanos < 0) {
                    notEmpty.await();
                } else {
                    if (nanos <= 0L) {
                        return null;
                    }
                    nanos = notEmpty.awaitNanos(nanos);
                }
            }
            return id;
        } finally {
            lock.unlock();
        }
    }

    private RequestId pollHighest() {
        for (ArrayDeque<RequestId> tier : tiers) {
            RequestId id = tier.pollFirst();
            if (id != null) {
                return id;
            }
        }
        return null;
    }

    /**
     * queued → processing 전이로 요청을 점유.
     *
     * <p>취소, 삭제, 다른 워커의 점유로 이미 queued가 아니면 empty.</p>
     */
    private Optional<EditRequest> claim(RequestId id) {
        Optional<EditRequest> current = store.find(id);
        if (current.isEmpty()) {
            log.debug("Skipping {}: no longer stored", id);
            return Optional.empty();
        }
        if (current.get().status() != RequestStatus.QUEUED) {
            log.debug("Skipping {}: status is {}", id, current.get().status());
            return Optional.empty();
        }
        try {
            EditRequest processing = store.transition(id, RequestStatus.PROCESSING,
                request -> request.markProcessing(clock.instant()));
            publisher.publish(processing);
            log.debug("Dispatched {} (priority {})", id, processing.priority());
            return Optional.of(processing);
        } catch (IllegalTransitionException e) {
            log.debug("Skipping {}: status changed before dispatch ({})", id, e.getMessage());
            return Optional.empty();
        } catch (RequestNotFoundException e) {
            log.debug("Skipping {}: deleted before dispatch", id);
            return Optional.empty();
        }
    }

    /**
     * 단계별 대기 수 (진단용).
     *
     * @param priority 우선순위
     * @return 해당 단계 큐 길이
     */
    public int pending(Priority priority) {
        lock.lock();
        try {
            return tiers.get(priority.tierIndex()).size();
        } finally {
            lock.unlock();
        }
    }
}
