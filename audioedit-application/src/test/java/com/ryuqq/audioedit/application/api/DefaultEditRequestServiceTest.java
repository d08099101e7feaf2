package com.ryuqq.audioedit.application.api;

import com.ryuqq.audioedit.adapter.inmemory.channel.InMemoryStatusChannel;
import com.ryuqq.audioedit.adapter.inmemory.store.InMemoryAudioStore;
import com.ryuqq.audioedit.adapter.inmemory.store.InMemoryRequestStore;
import com.ryuqq.audioedit.application.interpreter.EditPayload;
import com.ryuqq.audioedit.application.interpreter.InstructionInterpreter;
import com.ryuqq.audioedit.application.scheduler.PriorityScheduler;
import com.ryuqq.audioedit.application.scheduler.SchedulerConfig;
import com.ryuqq.audioedit.application.status.StatusPublisher;
import com.ryuqq.audioedit.core.catalog.OperationCatalog;
import com.ryuqq.audioedit.core.exception.RequestNotFoundException;
import com.ryuqq.audioedit.core.exception.ValidationException;
import com.ryuqq.audioedit.core.model.AudioRef;
import com.ryuqq.audioedit.core.model.EditRequest;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.RequestError;
import com.ryuqq.audioedit.core.model.RequestFilter;
import com.ryuqq.audioedit.core.model.RequestId;
import com.ryuqq.audioedit.core.model.StatusEvent;
import com.ryuqq.audioedit.core.statemachine.RequestStatus;
import com.ryuqq.audioedit.testkit.executor.TestCatalogs;
import com.ryuqq.audioedit.testkit.fixture.TestAudio;
import com.ryuqq.audioedit.testkit.fixture.TestRequests;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * DefaultEditRequestService 유닛 테스트.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
class DefaultEditRequestServiceTest {

    private static final Instant NOW = TestRequests.EPOCH.plusSeconds(60);

    private InMemoryRequestStore store;
    private InMemoryAudioStore audioStore;
    private InMemoryStatusChannel channel;
    private PriorityScheduler scheduler;
    private DefaultEditRequestService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryRequestStore();
        audioStore = new InMemoryAudioStore();
        channel = new InMemoryStatusChannel();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        OperationCatalog catalog = TestCatalogs.passThrough();
        StatusPublisher publisher = new StatusPublisher(channel);
        scheduler = new PriorityScheduler(store, publisher, new SchedulerConfig(), clock);
        service = new DefaultEditRequestService(
            new InstructionInterpreter(catalog),
            scheduler,
            store,
            audioStore,
            channel,
            publisher,
            catalog,
            new SequentialRequestIdGenerator(),
            clock
        );
    }

    // ========== submit ==========

    @Test
    void submit_유효한_요청은_대기_상태로_접수된다() {
        // given
        EditPayload payload = EditPayload.builder()
            .clientId("client-a")
            .source("audio/in.wav")
            .operation("normalize", Map.of())
            .operation("trim", Map.of("start_ms", 0, "end_ms", 1000))
            .priority(2)
            .build();

        // when
        SubmitReceipt receipt = service.submit(payload);

        // then
        assertThat(receipt.id()).isEqualTo(RequestId.of("REQ-000001"));
        assertThat(receipt.status()).isEqualTo(RequestStatus.QUEUED);
        assertThat(receipt.operations()).containsExactly(OperationKind.TRIM, OperationKind.NORMALIZE);
        assertThat(receipt.createdAt()).isEqualTo(NOW);
        assertThat(scheduler.pending()).isEqualTo(1);
        assertThat(channel.history(receipt.id())).extracting(StatusEvent::status).containsExactly(RequestStatus.QUEUED);
    }

    @Test
    void submit_검증_실패는_저장되지_않는다() {
        // given
        EditPayload payload = EditPayload.builder()
            .source("audio/in.wav")
            .operation("equalize", Map.of())
            .build();

        // when / then
        assertThatThrownBy(() -> service.submit(payload))
            .isInstanceOf(ValidationException.class);
        assertThat(service.list(RequestFilter.all())).isEmpty();
        assertThat(scheduler.pending()).isZero();
    }

    @Test
    void submit_호출자_id가_이미_사용중이면_거부된다() {
        EditPayload payload = EditPayload.builder()
            .id("job-1")
            .source("audio/in.wav")
            .operation("normalize", Map.of())
            .build();
        service.submit(payload);

        assertThatThrownBy(() -> service.submit(payload))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("job-1");
    }

    @Test
    void submit_생성_id는_호출자가_선점한_id를_건너뛴다() {
        // given
        service.submit(EditPayload.builder().id("REQ-000001").source("audio/in.wav")
            .operation("normalize", Map.of()).build());

        // when
        SubmitReceipt receipt = service.submit(EditPayload.builder().source("audio/in.wav")
            .operation("normalize", Map.of()).build());

        // then
        assertThat(receipt.id()).isEqualTo(RequestId.of("REQ-000002"));
    }

    // ========== cancel ==========

    @Test
    void cancel_대기중_요청은_취소되고_디스패치되지_않는다() throws InterruptedException {
        // given
        SubmitReceipt receipt = submitNormalize();

        // when
        EditRequest cancelled = service.cancel(receipt.id());

        // then
        assertThat(cancelled.status()).isEqualTo(RequestStatus.CANCELLED);
        assertThat(scheduler.next(Duration.ofMillis(20))).isEmpty();
        assertThat(channel.history(receipt.id())).extracting(StatusEvent::status)
            .containsExactly(RequestStatus.QUEUED, RequestStatus.CANCELLED);
    }

    @Test
    void cancel_완료된_요청은_변경없이_현재_상태를_반환한다() {
        // given
        SubmitReceipt receipt = submitNormalize();
        store.transition(receipt.id(), RequestStatus.PROCESSING, r -> r.markProcessing(NOW.plusSeconds(1)));
        EditRequest completed = store.transition(receipt.id(), RequestStatus.COMPLETED,
            r -> r.markCompleted(AudioRef.of("mem://x/1"), NOW.plusSeconds(2)));

        // when
        EditRequest result = service.cancel(receipt.id());

        // then
        assertThat(result.status()).isEqualTo(RequestStatus.COMPLETED);
        assertThat(result.updatedAt()).isEqualTo(completed.updatedAt());
        assertThat(store.get(receipt.id())).isEqualTo(completed);
    }

    @Test
    void cancel_없는_요청은_NotFound() {
        assertThatThrownBy(() -> service.cancel(RequestId.of("REQ-999999")))
            .isInstanceOf(RequestNotFoundException.class);
    }

    // ========== delete ==========

    @Test
    void delete_완료된_요청과_결과_오디오를_제거한다() {
        // given
        SubmitReceipt receipt = submitNormalize();
        AudioRef result = audioStore.put(receipt.id().getValue(), TestAudio.tone());
        store.transition(receipt.id(), RequestStatus.PROCESSING, r -> r.markProcessing(NOW));
        store.transition(receipt.id(), RequestStatus.COMPLETED, r -> r.markCompleted(result, NOW));

        // when
        service.delete(receipt.id());

        // then
        assertThat(store.find(receipt.id())).isEmpty();
        assertThat(audioStore.exists(result)).isFalse();
    }

    @Test
    void delete_진행중_요청은_거부된다() {
        SubmitReceipt receipt = submitNormalize();

        assertThatThrownBy(() -> service.delete(receipt.id()))
            .isInstanceOf(IllegalStateException.class);
        assertThat(store.find(receipt.id())).isPresent();
    }

    // ========== statistics ==========

    @Test
    void statistics_상태별_건수와_성공률과_평균_처리시간() {
        // given
        complete(submitNormalize().id(), Duration.ofSeconds(2));
        complete(submitNormalize().id(), Duration.ofSeconds(4));
        complete(submitNormalize().id(), Duration.ofSeconds(6));
        RequestId failed = submitNormalize().id();
        store.transition(failed, RequestStatus.PROCESSING, r -> r.markProcessing(NOW));
        store.transition(failed, RequestStatus.ERROR, r -> r.markFailed(
            RequestError.atOperation(RequestError.EXECUTION_FAILED, "boom", 0, OperationKind.NORMALIZE), NOW));
        submitNormalize();

        // when
        RequestStatistics statistics = service.statistics();

        // then
        assertThat(statistics.total()).isEqualTo(5);
        assertThat(statistics.count(RequestStatus.COMPLETED)).isEqualTo(3);
        assertThat(statistics.count(RequestStatus.ERROR)).isEqualTo(1);
        assertThat(statistics.count(RequestStatus.CANCELLED)).isZero();
        assertThat(statistics.pending()).isEqualTo(1);
        assertThat(statistics.successRate()).isEqualTo(75.0);
        assertThat(statistics.averageProcessingTime()).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void statistics_요청이_없으면_0() {
        RequestStatistics statistics = service.statistics();

        assertThat(statistics.total()).isZero();
        assertThat(statistics.successRate()).isZero();
        assertThat(statistics.averageProcessingTime()).isEqualTo(Duration.ZERO);
    }

    // ========== subscribe / catalog ==========

    @Test
    void subscribe_현재_스냅샷을_즉시_받고_이후_변경을_받는다() {
        // given
        SubmitReceipt receipt = submitNormalize();
        List<StatusEvent> received = new ArrayList<>();

        // when
        service.subscribe(receipt.id(), received::add);
        service.cancel(receipt.id());

        // then
        assertThat(received).extracting(StatusEvent::status)
            .containsExactly(RequestStatus.QUEUED, RequestStatus.CANCELLED);
    }

    @Test
    void supportedOperations_모든_연산을_설명한다() {
        assertThat(service.supportedOperations()).hasSize(OperationKind.values().length);
    }

    private SubmitReceipt submitNormalize() {
        return service.submit(EditPayload.builder()
            .clientId("client-a")
            .source("audio/in.wav")
            .operation("normalize", Map.of())
            .build());
    }

    private void complete(RequestId id, Duration elapsed) {
        store.transition(id, RequestStatus.PROCESSING, r -> r.markProcessing(NOW));
        store.transition(id, RequestStatus.COMPLETED, r -> r.markCompleted(AudioRef.of("mem://" + id + "/1"),
            NOW.plus(elapsed)));
    }
}
