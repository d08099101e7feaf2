package com.ryuqq.audioedit.adapter.inmemory.channel;

import com.ryuqq.audioedit.core.model.EditRequest;
import com.ryuqq.audioedit.core.model.StatusEvent;
import com.ryuqq.audioedit.core.spi.StatusChannel;
import com.ryuqq.audioedit.core.statemachine.RequestStatus;
import com.ryuqq.audioedit.testkit.contract.AbstractStatusChannelContractTest;
import com.ryuqq.audioedit.testkit.fixture.TestRequests;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryStatusChannelContractTest extends AbstractStatusChannelContractTest {

    @Override
    protected StatusChannel createChannel() {
        return new InMemoryStatusChannel();
    }

    @Test
    void history_구독자가_없어도_발행_순서대로_기록된다() {
        // given
        InMemoryStatusChannel inMemory = (InMemoryStatusChannel) channel;
        EditRequest request = TestRequests.queued("REQ-000001", "client-a", 3);

        // when
        inMemory.publish(StatusEvent.snapshotOf(request));
        inMemory.publish(StatusEvent.snapshotOf(request.markProcessing(TestRequests.EPOCH.plusSeconds(1))));

        // then
        assertThat(inMemory.history(request.id()))
            .extracting(StatusEvent::status)
            .containsExactly(RequestStatus.QUEUED, RequestStatus.PROCESSING);
    }

    @Test
    void clear_기록과_구독을_제거한다() {
        InMemoryStatusChannel inMemory = (InMemoryStatusChannel) channel;
        EditRequest request = TestRequests.queued("REQ-000001", "client-a", 3);
        inMemory.publish(StatusEvent.snapshotOf(request));

        inMemory.clear(request.id());

        assertThat(inMemory.history(request.id())).isEmpty();
    }
}
