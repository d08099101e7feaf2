package com.ryuqq.audioedit.adapter.intake.bus;

import com.ryuqq.audioedit.adapter.inmemory.bus.InMemoryMessageBus;
import com.ryuqq.audioedit.adapter.inmemory.store.InMemoryAudioStore;
import com.ryuqq.audioedit.adapter.intake.codec.Rejection;
import com.ryuqq.audioedit.adapter.intake.codec.RejectionCodec;
import com.ryuqq.audioedit.adapter.intake.codec.StatusEventCodec;
import com.ryuqq.audioedit.adapter.intake.guess.KeywordOperationGuesser;
import com.ryuqq.audioedit.adapter.runner.AudioEditEngine;
import com.ryuqq.audioedit.adapter.runner.PipelineConfig;
import com.ryuqq.audioedit.adapter.runner.WorkerPoolConfig;
import com.ryuqq.audioedit.application.api.EditRequestService;
import com.ryuqq.audioedit.application.interpreter.EditPayload;
import com.ryuqq.audioedit.application.scheduler.SchedulerConfig;
import com.ryuqq.audioedit.core.model.AudioRef;
import com.ryuqq.audioedit.core.model.EditRequest;
import com.ryuqq.audioedit.core.model.RequestId;
import com.ryuqq.audioedit.core.model.StatusEvent;
import com.ryuqq.audioedit.core.statemachine.RequestStatus;
import com.ryuqq.audioedit.testkit.fixture.TestAudio;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class IntakeListenerTest {

    private static final String SOURCE = "uploads/voice.wav";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

    private final RejectionCodec rejectionCodec = new RejectionCodec();

    private InMemoryMessageBus bus;
    private InMemoryAudioStore audioStore;
    private AudioEditEngine engine;
    private IntakeListener listener;
    private List<Rejection> rejections;

    @BeforeEach
    void setUp() {
        bus = new InMemoryMessageBus();
        audioStore = new InMemoryAudioStore();
        audioStore.save(AudioRef.of(SOURCE), TestAudio.tone());
        engine = AudioEditEngine.builder()
            .audioStore(audioStore)
            .statusChannel(new MessageBusStatusChannel(bus))
            .guesser(new KeywordOperationGuesser())
            .schedulerConfig(new SchedulerConfig().withMaxActivePerClient(1))
            .pipelineConfig(new PipelineConfig().withBackoff(1, 10))
            .workerPoolConfig(new WorkerPoolConfig(1, 20, 5_000))
            .build();
        listener = new IntakeListener(bus, engine.service(), CLOCK);
        listener.start();
        rejections = new CopyOnWriteArrayList<>();
        bus.subscribe(IntakeTopics.REJECTIONS, json -> rejections.add(rejectionCodec.decode(json)));
    }

    @AfterEach
    void tearDown() {
        listener.close();
        engine.close();
    }

    // ========== acceptance ==========

    @Test
    void validSubmission_IsQueued() {
        // When
        bus.publish(IntakeTopics.EDIT, "{\"id\":\"job-1\",\"client_id\":\"studio-1\",\"audio_source\":\"" + SOURCE
            + "\",\"operation\":\"normalize\",\"parameters\":{\"target_db\":-3}}");

        // Then
        assertThat(listener.acceptedCount()).isEqualTo(1);
        assertThat(rejections).isEmpty();
        EditRequest request = engine.service().get(RequestId.of("job-1"));
        assertThat(request.status()).isEqualTo(RequestStatus.QUEUED);
        assertThat(request.clientId().getValue()).isEqualTo("studio-1");
    }

    // ========== rejection ==========

    @Test
    void unknownOperation_IsRejectedWithItsIndexAndNothingIsStored() {
        bus.publish(IntakeTopics.EDIT, "{\"id\":\"job-2\",\"client_id\":\"studio-1\",\"audio_source\":\"" + SOURCE
            + "\",\"operations\":[{\"operation\":\"reverse\"}]}");

        assertThat(listener.rejectedCount()).isEqualTo(1);
        assertThat(rejections).hasSize(1);
        Rejection rejection = rejections.get(0);
        assertThat(rejection.requestId()).isEqualTo("job-2");
        assertThat(rejection.clientId()).isEqualTo("studio-1");
        assertThat(rejection.errorCode()).isEqualTo("VALIDATION_ERROR");
        assertThat(rejection.operationIndex()).isEqualTo(0);
        assertThat(rejection.operationKind()).isEqualTo("reverse");
        assertThat(rejection.rejectedAt()).isEqualTo(CLOCK.instant());
        assertThat(engine.service().statistics().total()).isZero();
    }

    @Test
    void malformedJson_IsRejectedWithoutIds() {
        bus.publish(IntakeTopics.EDIT, "{\"operation\": ");

        assertThat(rejections).hasSize(1);
        assertThat(rejections.get(0).errorCode()).isEqualTo("VALIDATION_ERROR");
        assertThat(rejections.get(0).requestId()).isNull();
        assertThat(listener.acceptedCount()).isZero();
    }

    @Test
    void clientOverActiveLimit_IsRejectedByAdmission() {
        String first = "{\"id\":\"job-3\",\"client_id\":\"studio-1\",\"audio_source\":\"" + SOURCE
            + "\",\"operation\":\"reverb\"}";
        String second = first.replace("job-3", "job-4");

        bus.publish(IntakeTopics.EDIT, first);
        bus.publish(IntakeTopics.EDIT, second);

        assertThat(listener.acceptedCount()).isEqualTo(1);
        assertThat(rejections).extracting(Rejection::errorCode).containsExactly("ADMISSION_REJECTED");
        assertThat(rejections.get(0).requestId()).isEqualTo("job-4");
    }

    @Test
    void unexpectedFailure_IsRejectedAsInternalError() {
        EditRequestService broken = mock(EditRequestService.class);
        when(broken.submit(any(EditPayload.class))).thenThrow(new IllegalStateException("store offline"));
        listener.close();
        IntakeListener brokenListener = new IntakeListener(bus, broken, CLOCK);
        brokenListener.start();

        bus.publish(IntakeTopics.EDIT, "{\"audio_source\":\"a.wav\",\"operation\":\"reverb\"}");
        brokenListener.close();

        assertThat(rejections).hasSize(1);
        assertThat(rejections.get(0).errorCode()).isEqualTo("INTERNAL_ERROR");
        assertThat(rejections.get(0).message()).contains("store offline");
    }

    // ========== lifecycle ==========

    @Test
    void close_StopsConsuming() {
        listener.close();

        assertThat(bus.subscriberCount(IntakeTopics.EDIT)).isZero();
        bus.publish(IntakeTopics.EDIT, "{\"audio_source\":\"a.wav\",\"operation\":\"reverb\"}");
        assertThat(listener.acceptedCount()).isZero();
        assertThat(bus.undeliveredTopics()).contains(IntakeTopics.EDIT);
    }

    @Test
    void start_Twice_Throws() {
        assertThatThrownBy(() -> listener.start())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already started");
    }

    // ========== end to end ==========

    @Test
    void freeTextInstruction_IsGuessedExecutedAndReportedOnStatusTopic() throws Exception {
        // Given
        StatusEventCodec statusCodec = new StatusEventCodec();
        List<StatusEvent> events = new CopyOnWriteArrayList<>();
        bus.subscribe(IntakeTopics.status(RequestId.of("job-42")), json -> events.add(statusCodec.decode(json)));

        // When
        bus.publish(IntakeTopics.EDIT, "{\"id\":\"job-42\",\"client_id\":\"studio-9\",\"audio_source\":\"" + SOURCE
            + "\",\"instruction\":\"trim the first 500ms and normalize to -3 dB\"}");
        engine.start();
        EditRequest finished = awaitTerminal(RequestId.of("job-42"));

        // Then
        assertThat(finished.status()).isEqualTo(RequestStatus.COMPLETED);
        assertThat(finished.operations()).extracting(spec -> spec.kind().wireName())
            .containsExactly("trim", "normalize");
        assertThat(events.get(0).status()).isEqualTo(RequestStatus.QUEUED);
        assertThat(events.get(events.size() - 1).status()).isEqualTo(RequestStatus.COMPLETED);
        assertThat(events.get(events.size() - 1).resultRef()).isEqualTo(finished.resultRef());
        assertThat(audioStore.get(finished.resultRef()).durationMillis()).isEqualTo(500);
    }

    private EditRequest awaitTerminal(RequestId id) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        EditRequest current = engine.service().get(id);
        while (!current.isTerminal() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
            current = engine.service().get(id);
        }
        return current;
    }
}
