package com.ryuqq.audioedit.adapter.inmemory.bus;

import com.ryuqq.audioedit.core.spi.MessageBus;
import com.ryuqq.audioedit.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory implementation of {@link MessageBus} SPI.
 *
 * <p>Stands in for the external pub/sub broker. Topics are matched exactly and
 * payloads are delivered synchronously on the publishing thread.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Fan-out to every current subscriber of a topic</li>
 *   <li>A failing subscriber is logged and skipped</li>
 *   <li>Messages published to a topic with no subscribers are counted as undelivered</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * MessageBus bus = new InMemoryMessageBus();
 * Subscription sub = bus.subscribe("audio/edit", payload -&gt; intake.accept(payload));
 * bus.publish("audio/edit", "{\"operation\":\"normalize\",\"audio_source\":\"a.wav\"}");
 * sub.cancel();
 * </pre>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public class InMemoryMessageBus implements MessageBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<String>>> topics = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<String> undelivered = new CopyOnWriteArrayList<>();

    @Override
    public void publish(String topic, String payload) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        List<Consumer<String>> listeners = topics.get(topic);
        if (listeners == null || listeners.isEmpty()) {
            log.debug("No subscriber on {}, message dropped", topic);
            undelivered.add(topic);
            return;
        }
        for (Consumer<String> listener : listeners) {
            try {
                listener.accept(payload);
            } catch (RuntimeException e) {
                log.warn("Subscriber on {} failed", topic, e);
            }
        }
    }

    @Override
    public Subscription subscribe(String topic, Consumer<String> listener) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        topics.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> {
            CopyOnWriteArrayList<Consumer<String>> listeners = topics.get(topic);
            if (listeners != null) {
                listeners.remove(listener);
            }
        };
    }

    public int subscriberCount(String topic) {
        List<Consumer<String>> listeners = topics.get(topic);
        return listeners == null ? 0 : listeners.size();
    }

    /**
     * Topics of messages that found no subscriber, in publish order.
     */
    public List<String> undeliveredTopics() {
        return List.copyOf(undelivered);
    }
}
