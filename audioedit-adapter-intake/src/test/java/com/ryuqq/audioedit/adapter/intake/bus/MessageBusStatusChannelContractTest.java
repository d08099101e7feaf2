package com.ryuqq.audioedit.adapter.intake.bus;

import com.ryuqq.audioedit.adapter.inmemory.bus.InMemoryMessageBus;
import com.ryuqq.audioedit.core.model.EditRequest;
import com.ryuqq.audioedit.core.model.StatusEvent;
import com.ryuqq.audioedit.core.spi.StatusChannel;
import com.ryuqq.audioedit.testkit.contract.AbstractStatusChannelContractTest;
import com.ryuqq.audioedit.testkit.fixture.TestRequests;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class MessageBusStatusChannelContractTest extends AbstractStatusChannelContractTest {

    private InMemoryMessageBus bus;

    @Override
    protected StatusChannel createChannel() {
        bus = new InMemoryMessageBus();
        return new MessageBusStatusChannel(bus);
    }

    @Test
    void publish_WritesJsonToPerRequestTopic() {
        // Given
        EditRequest request = TestRequests.queued("REQ-000001", "client-a", 3);
        List<String> raw = new CopyOnWriteArrayList<>();
        bus.subscribe("audio/status/REQ-000001", raw::add);

        // When
        channel.publish(StatusEvent.snapshotOf(request));

        // Then
        assertThat(raw).hasSize(1);
        assertThat(raw.get(0)).contains("\"request_id\":\"REQ-000001\"").contains("\"status\":\"queued\"");
    }

    @Test
    void subscribe_SkipsUndecodableMessages() {
        EditRequest request = TestRequests.queued("REQ-000001", "client-a", 3);
        List<StatusEvent> received = new CopyOnWriteArrayList<>();
        channel.subscribe(request.id(), received::add);

        bus.publish("audio/status/REQ-000001", "not json");
        channel.publish(StatusEvent.snapshotOf(request));

        assertThat(received).hasSize(1);
        assertThat(received.get(0).requestId()).isEqualTo(request.id());
    }
}
