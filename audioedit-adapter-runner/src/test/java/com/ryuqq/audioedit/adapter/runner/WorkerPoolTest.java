package com.ryuqq.audioedit.adapter.runner;

import com.ryuqq.audioedit.adapter.inmemory.channel.InMemoryStatusChannel;
import com.ryuqq.audioedit.adapter.inmemory.store.InMemoryAudioStore;
import com.ryuqq.audioedit.adapter.inmemory.store.InMemoryRequestStore;
import com.ryuqq.audioedit.application.scheduler.PriorityScheduler;
import com.ryuqq.audioedit.application.scheduler.SchedulerConfig;
import com.ryuqq.audioedit.application.status.StatusPublisher;
import com.ryuqq.audioedit.core.model.EditRequest;
import com.ryuqq.audioedit.core.model.OperationKind;
import com.ryuqq.audioedit.core.model.RequestFilter;
import com.ryuqq.audioedit.core.statemachine.RequestStatus;
import com.ryuqq.audioedit.testkit.executor.ScriptedOperationExecutor;
import com.ryuqq.audioedit.testkit.executor.TestCatalogs;
import com.ryuqq.audioedit.testkit.fixture.TestAudio;
import com.ryuqq.audioedit.testkit.fixture.TestRequests;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WorkerPool 유닛 테스트.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
class WorkerPoolTest {

    private InMemoryRequestStore store;
    private PriorityScheduler scheduler;
    private PipelineExecutor pipeline;
    private ScriptedOperationExecutor trim;
    private WorkerPool pool;

    @BeforeEach
    void setUp() {
        store = new InMemoryRequestStore();
        InMemoryAudioStore audioStore = new InMemoryAudioStore();
        audioStore.save(TestRequests.SOURCE, TestAudio.tone());
        StatusPublisher publisher = new StatusPublisher(new InMemoryStatusChannel());
        Clock clock = Clock.systemUTC();
        scheduler = new PriorityScheduler(store, publisher, new SchedulerConfig().withMaxActivePerClient(100), clock);
        trim = ScriptedOperationExecutor.passThrough(OperationKind.TRIM);
        pipeline = new PipelineExecutor(TestCatalogs.passThrough(trim), store, audioStore, publisher,
            new PipelineConfig().withBackoff(1, 5), clock);
        pool = new WorkerPool(scheduler, pipeline, new WorkerPoolConfig(4, 20, 5_000));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        pool.shutdown();
        pipeline.close();
    }

    @Test
    void pump_대기_요청이_없으면_false를_반환한다() throws Exception {
        // when
        boolean processed = pool.pump();

        // then
        assertThat(processed).isFalse();
        assertThat(pool.processedCount()).isZero();
    }

    @Test
    void pump_대기_요청_하나를_종료_상태까지_처리한다() throws Exception {
        // given
        EditRequest request = TestRequests.queued("REQ-000001", "client-a", 5);
        scheduler.admit(request);

        // when
        boolean processed = pool.pump();

        // then
        assertThat(processed).isTrue();
        assertThat(store.get(request.id()).status()).isEqualTo(RequestStatus.COMPLETED);
        assertThat(pool.processedCount()).isEqualTo(1);
        assertThat(pool.pump()).isFalse();
    }

    @Test
    void 여러_워커가_모든_요청을_한번씩_처리한다() throws Exception {
        // given
        int total = 40;
        for (int i = 1; i <= total; i++) {
            scheduler.admit(TestRequests.queued(String.format("REQ-%06d", i), "client-" + (i % 3), 1 + (i % 5)));
        }

        // when
        pool.start();
        long deadline = System.currentTimeMillis() + 10_000;
        while (pool.processedCount() < total && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        pool.shutdown();

        // then
        List<EditRequest> all = store.list(RequestFilter.all().withLimit(Integer.MAX_VALUE));
        assertThat(all).hasSize(total);
        assertThat(all).extracting(EditRequest::status).containsOnly(RequestStatus.COMPLETED);
        assertThat(pool.processedCount()).isEqualTo(total);
        assertThat(trim.invocations()).isEqualTo(total);
    }

    @Test
    void start를_두번_호출하면_예외가_발생한다() {
        // given
        pool.start();

        // when & then
        assertThatThrownBy(() -> pool.start())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already running");
    }

    @Test
    void shutdown_이후에는_실행_중이_아니다() throws Exception {
        // given
        pool.start();
        assertThat(pool.isRunning()).isTrue();

        // when
        pool.shutdown();

        // then
        assertThat(pool.isRunning()).isFalse();
    }
}
