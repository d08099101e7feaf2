package com.ryuqq.audioedit.core.spi;

import java.util.function.Consumer;

/**
 * Topic-based pub/sub transport carrying text payloads.
 *
 * <p>Stands in for the external broker. Topics are matched exactly.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public interface MessageBus {

    /**
     * Publishes a payload to every current subscriber of {@code topic}.
     *
     * @param topic the topic (e.g. {@code audio/edit})
     * @param payload the message body
     */
    void publish(String topic, String payload);

    Subscription subscribe(String topic, Consumer<String> listener);
}
