package com.ryuqq.audioedit.adapter.runner;

import com.ryuqq.audioedit.application.runtime.Runtime;
import com.ryuqq.audioedit.application.scheduler.PriorityScheduler;
import com.ryuqq.audioedit.core.model.EditRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Worker Pool Runtime 구현체.
 *
 * <p>고정된 수의 워커 스레드가 각자 {@link #pump()}를 반복 호출합니다.
 * 워커 하나는 한 번에 요청 하나만 처리하며, 요청이 없으면 scheduler에서 대기합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * start()
 *   ↓
 * workers개 스레드, 각 스레드에서:
 *   while (running):
 *     pump()
 *       1. scheduler.next(pollTimeout) → 없으면 false
 *       2. pipeline.run(request)      → completed / error / cancelled
 *   ↓
 * shutdown() → running=false, 진행 중인 요청 완료 대기 (shutdownTimeout)
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>같은 요청을 두 워커가 처리하지 않음 (scheduler가 store 전이로 claim)</li>
 *   <li>워커 루프의 예기치 않은 예외는 로깅 후 다음 cycle로 진행</li>
 *   <li>인터럽트되면 해당 워커는 종료</li>
 * </ul>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class WorkerPool implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final PriorityScheduler scheduler;
    private final PipelineExecutor pipeline;
    private final WorkerPoolConfig config;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong processed = new AtomicLong();
    private volatile ExecutorService workerExecutor;

    /**
     * 생성자.
     *
     * @param scheduler 요청 공급원
     * @param pipeline 요청 실행기
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public WorkerPool(PriorityScheduler scheduler, PipelineExecutor pipeline, WorkerPoolConfig config) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        if (pipeline == null) {
            throw new IllegalArgumentException("pipeline cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.scheduler = scheduler;
        this.pipeline = pipeline;
        this.config = config;
    }

    @Override
    public boolean pump() throws InterruptedException {
        Optional<EditRequest> next = scheduler.next(Duration.ofMillis(config.pollTimeoutMs()));
        if (next.isEmpty()) {
            return false;
        }

        EditRequest finished = pipeline.run(next.get());
        processed.incrementAndGet();
        log.debug("{} left the pipeline as {}", finished.id(), finished.status());
        return true;
    }

    /**
     * 워커 스레드 시작.
     *
     * @throws IllegalStateException 이미 실행 중인 경우
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("worker pool is already running");
        }

        AtomicInteger sequence = new AtomicInteger();
        workerExecutor = Executors.newFixedThreadPool(config.workers(), runnable -> {
            Thread thread = new Thread(runnable, "audioedit-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        for (int i = 0; i < config.workers(); i++) {
            workerExecutor.submit(this::workLoop);
        }
        log.info("Worker pool started with {} worker(s)", config.workers());
    }

    /**
     * 워커 종료 (리소스 정리).
     *
     * <p>새 요청을 더 가져가지 않고, 진행 중인 요청이 끝나기를 shutdownTimeoutMs 동안
     * 기다립니다. 시간 안에 끝나지 않으면 워커를 인터럽트합니다.</p>
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public synchronized void shutdown() throws InterruptedException {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("Workers did not finish within {}ms, interrupting", config.shutdownTimeoutMs());
            workerExecutor.shutdownNow();
            workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS);
        }
        log.info("Worker pool stopped after {} request(s)", processed.get());
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * 시작 이후 파이프라인을 통과한 요청 수.
     */
    public long processedCount() {
        return processed.get();
    }

    private void workLoop() {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                pump();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("{} interrupted, exiting", Thread.currentThread().getName());
                return;
            } catch (RuntimeException e) {
                log.error("Worker cycle failed on {}", Thread.currentThread().getName(), e);
            }
        }
    }
}
