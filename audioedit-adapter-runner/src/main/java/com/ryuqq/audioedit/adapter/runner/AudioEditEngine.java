package com.ryuqq.audioedit.adapter.runner;

import com.ryuqq.audioedit.adapter.dsp.PcmCatalogs;
import com.ryuqq.audioedit.adapter.inmemory.channel.InMemoryStatusChannel;
import com.ryuqq.audioedit.adapter.inmemory.store.InMemoryAudioStore;
import com.ryuqq.audioedit.adapter.inmemory.store.InMemoryRequestStore;
import com.ryuqq.audioedit.application.api.DefaultEditRequestService;
import com.ryuqq.audioedit.application.api.EditRequestService;
import com.ryuqq.audioedit.application.api.SequentialRequestIdGenerator;
import com.ryuqq.audioedit.application.interpreter.InstructionInterpreter;
import com.ryuqq.audioedit.application.interpreter.OperationGuesser;
import com.ryuqq.audioedit.application.scheduler.PriorityScheduler;
import com.ryuqq.audioedit.application.scheduler.SchedulerConfig;
import com.ryuqq.audioedit.application.status.StatusPublisher;
import com.ryuqq.audioedit.core.catalog.OperationCatalog;
import com.ryuqq.audioedit.core.spi.AudioStore;
import com.ryuqq.audioedit.core.spi.RequestIdGenerator;
import com.ryuqq.audioedit.core.spi.RequestStore;
import com.ryuqq.audioedit.core.spi.StatusChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * 엔진 조립 지점.
 *
 * <p>SPI 구현체와 설정을 받아 Request API, Scheduler, Pipeline, Worker Pool을 연결합니다.
 * 지정하지 않은 구성 요소는 in-memory 어댑터와 PCM 레퍼런스 executor로 채워집니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * try (AudioEditEngine engine = AudioEditEngine.builder()
 *         .workerPoolConfig(new WorkerPoolConfig().withWorkers(2))
 *         .build()) {
 *     engine.start();
 *     SubmitReceipt receipt = engine.service().submit(payload);
 *     ...
 * }
 * }</pre>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class AudioEditEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AudioEditEngine.class);

    private final RequestStore requestStore;
    private final AudioStore audioStore;
    private final StatusChannel statusChannel;
    private final OperationCatalog catalog;
    private final EditRequestService service;
    private final PriorityScheduler scheduler;
    private final PipelineExecutor pipeline;
    private final WorkerPool workerPool;

    private AudioEditEngine(Builder builder) {
        this.requestStore = builder.requestStore != null ? builder.requestStore : new InMemoryRequestStore();
        this.audioStore = builder.audioStore != null ? builder.audioStore : new InMemoryAudioStore();
        this.statusChannel = builder.statusChannel != null ? builder.statusChannel : new InMemoryStatusChannel();
        this.catalog = builder.catalog != null ? builder.catalog : PcmCatalogs.standard();

        StatusPublisher publisher = new StatusPublisher(statusChannel);
        this.scheduler = new PriorityScheduler(requestStore, publisher, builder.schedulerConfig, builder.clock);
        InstructionInterpreter interpreter = new InstructionInterpreter(catalog, builder.guesser);
        this.service = new DefaultEditRequestService(
            interpreter,
            scheduler,
            requestStore,
            audioStore,
            statusChannel,
            publisher,
            catalog,
            builder.idGenerator,
            builder.clock
        );
        this.pipeline = new PipelineExecutor(catalog, requestStore, audioStore, publisher,
            builder.pipelineConfig, builder.clock);
        this.workerPool = new WorkerPool(scheduler, pipeline, builder.workerPoolConfig);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 워커 시작.
     */
    public void start() {
        workerPool.start();
    }

    /**
     * 워커를 멈추고 operation 스레드를 정리합니다.
     */
    @Override
    public void close() {
        try {
            workerPool.shutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping workers");
        } finally {
            pipeline.close();
        }
    }

    public EditRequestService service() {
        return service;
    }

    public RequestStore requestStore() {
        return requestStore;
    }

    public AudioStore audioStore() {
        return audioStore;
    }

    public StatusChannel statusChannel() {
        return statusChannel;
    }

    public OperationCatalog catalog() {
        return catalog;
    }

    public PriorityScheduler scheduler() {
        return scheduler;
    }

    public WorkerPool workerPool() {
        return workerPool;
    }

    /**
     * AudioEditEngine 빌더.
     */
    public static final class Builder {

        private RequestStore requestStore;
        private AudioStore audioStore;
        private StatusChannel statusChannel;
        private OperationCatalog catalog;
        private OperationGuesser guesser;
        private RequestIdGenerator idGenerator = new SequentialRequestIdGenerator();
        private SchedulerConfig schedulerConfig = new SchedulerConfig();
        private PipelineConfig pipelineConfig = new PipelineConfig();
        private WorkerPoolConfig workerPoolConfig = new WorkerPoolConfig();
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder requestStore(RequestStore requestStore) {
            this.requestStore = requireNonNull(requestStore, "requestStore");
            return this;
        }

        public Builder audioStore(AudioStore audioStore) {
            this.audioStore = requireNonNull(audioStore, "audioStore");
            return this;
        }

        public Builder statusChannel(StatusChannel statusChannel) {
            this.statusChannel = requireNonNull(statusChannel, "statusChannel");
            return this;
        }

        public Builder catalog(OperationCatalog catalog) {
            this.catalog = requireNonNull(catalog, "catalog");
            return this;
        }

        /**
         * 자유 텍스트 지시문 분류기 (없으면 instruction만 있는 payload는 거부됨).
         */
        public Builder guesser(OperationGuesser guesser) {
            this.guesser = requireNonNull(guesser, "guesser");
            return this;
        }

        public Builder idGenerator(RequestIdGenerator idGenerator) {
            this.idGenerator = requireNonNull(idGenerator, "idGenerator");
            return this;
        }

        public Builder schedulerConfig(SchedulerConfig schedulerConfig) {
            this.schedulerConfig = requireNonNull(schedulerConfig, "schedulerConfig");
            return this;
        }

        public Builder pipelineConfig(PipelineConfig pipelineConfig) {
            this.pipelineConfig = requireNonNull(pipelineConfig, "pipelineConfig");
            return this;
        }

        public Builder workerPoolConfig(WorkerPoolConfig workerPoolConfig) {
            this.workerPoolConfig = requireNonNull(workerPoolConfig, "workerPoolConfig");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = requireNonNull(clock, "clock");
            return this;
        }

        public AudioEditEngine build() {
            return new AudioEditEngine(this);
        }

        private static <T> T requireNonNull(T value, String name) {
            if (value == null) {
                throw new IllegalArgumentException(name + " cannot be null");
            }
            return value;
        }
    }
}
