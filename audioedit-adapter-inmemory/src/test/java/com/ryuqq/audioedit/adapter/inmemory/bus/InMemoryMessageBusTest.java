package com.ryuqq.audioedit.adapter.inmemory.bus;

import com.ryuqq.audioedit.core.spi.Subscription;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryMessageBusTest {

    private final InMemoryMessageBus bus = new InMemoryMessageBus();

    @Test
    void publish_같은_토픽의_모든_구독자에게_전달된다() {
        // given
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();
        bus.subscribe("audio/edit", first::add);
        bus.subscribe("audio/edit", second::add);
        bus.subscribe("audio/other", message -> {
            throw new AssertionError("wrong topic");
        });

        // when
        bus.publish("audio/edit", "{\"id\":\"REQ-000001\"}");

        // then
        assertThat(first).containsExactly("{\"id\":\"REQ-000001\"}");
        assertThat(second).containsExactly("{\"id\":\"REQ-000001\"}");
    }

    @Test
    void publish_구독자가_없으면_미전달_토픽으로_기록된다() {
        bus.publish("audio/edit", "{}");

        assertThat(bus.undeliveredTopics()).containsExactly("audio/edit");
    }

    @Test
    void publish_실패한_구독자는_다른_구독자를_막지_않는다() {
        List<String> received = new ArrayList<>();
        bus.subscribe("audio/edit", message -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe("audio/edit", received::add);

        bus.publish("audio/edit", "payload");

        assertThat(received).containsExactly("payload");
    }

    @Test
    void cancel_이후에는_전달되지_않는다() {
        List<String> received = new ArrayList<>();
        Subscription subscription = bus.subscribe("audio/edit", received::add);

        subscription.cancel();
        bus.publish("audio/edit", "payload");

        assertThat(received).isEmpty();
        assertThat(bus.subscriberCount("audio/edit")).isZero();
    }

    @Test
    void publish_빈_토픽은_거부된다() {
        assertThatThrownBy(() -> bus.publish(" ", "payload"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("topic");
    }
}
