package com.ryuqq.audioedit.adapter.intake.bus;

import com.ryuqq.audioedit.adapter.intake.codec.StatusEventCodec;
import com.ryuqq.audioedit.core.model.RequestId;
import com.ryuqq.audioedit.core.model.StatusEvent;
import com.ryuqq.audioedit.core.spi.MessageBus;
import com.ryuqq.audioedit.core.spi.StatusChannel;
import com.ryuqq.audioedit.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * {@link StatusChannel} that publishes JSON snapshots on {@code audio/status/{id}}.
 *
 * <p>Subscribers receive decoded events. A message that cannot be decoded is logged and
 * skipped; it is not delivered to the subscriber.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public final class MessageBusStatusChannel implements StatusChannel {

    private static final Logger log = LoggerFactory.getLogger(MessageBusStatusChannel.class);

    private final MessageBus bus;
    private final StatusEventCodec codec;

    public MessageBusStatusChannel(MessageBus bus) {
        this(bus, new StatusEventCodec());
    }

    public MessageBusStatusChannel(MessageBus bus, StatusEventCodec codec) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.bus = bus;
        this.codec = codec;
    }

    @Override
    public void publish(StatusEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        bus.publish(IntakeTopics.status(event.requestId()), codec.encode(event));
    }

    @Override
    public Subscription subscribe(RequestId requestId, Consumer<StatusEvent> listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        String topic = IntakeTopics.status(requestId);
        return bus.subscribe(topic, json -> {
            StatusEvent event;
            try {
                event = codec.decode(json);
            } catch (IllegalArgumentException e) {
                log.warn("Skipping undecodable message on {}: {}", topic, e.getMessage());
                return;
            }
            listener.accept(event);
        });
    }
}
