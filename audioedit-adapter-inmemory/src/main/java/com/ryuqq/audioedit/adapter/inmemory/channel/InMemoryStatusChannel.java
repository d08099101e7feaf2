package com.ryuqq.audioedit.adapter.inmemory.channel;

import com.ryuqq.audioedit.core.model.RequestId;
import com.ryuqq.audioedit.core.model.StatusEvent;
import com.ryuqq.audioedit.core.spi.StatusChannel;
import com.ryuqq.audioedit.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory implementation of {@link StatusChannel} SPI.
 *
 * <p>Delivers each event synchronously to every subscriber of the request, on the
 * publishing thread. A failing subscriber is logged and does not affect the others
 * or the publisher.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>One logical channel per request id</li>
 *   <li>Any number of subscribers per channel ({@link CopyOnWriteArrayList})</li>
 *   <li>Per-request event history, kept until {@link #clear(RequestId)}</li>
 * </ul>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public class InMemoryStatusChannel implements StatusChannel {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStatusChannel.class);

    private final ConcurrentHashMap<RequestId, CopyOnWriteArrayList<Consumer<StatusEvent>>> subscribers =
        new ConcurrentHashMap<>();
    private final ConcurrentHashMap<RequestId, CopyOnWriteArrayList<StatusEvent>> history =
        new ConcurrentHashMap<>();

    @Override
    public void publish(StatusEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        history.computeIfAbsent(event.requestId(), id -> new CopyOnWriteArrayList<>()).add(event);
        for (Consumer<StatusEvent> listener : subscribers.getOrDefault(event.requestId(), new CopyOnWriteArrayList<>())) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Status subscriber of {} failed on {}", event.requestId(), event.status(), e);
            }
        }
    }

    @Override
    public Subscription subscribe(RequestId requestId, Consumer<StatusEvent> listener) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        subscribers.computeIfAbsent(requestId, id -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> {
            CopyOnWriteArrayList<Consumer<StatusEvent>> listeners = subscribers.get(requestId);
            if (listeners != null) {
                listeners.remove(listener);
            }
        };
    }

    /**
     * Events published for one request, in publish order.
     *
     * @param requestId the request
     * @return snapshot of the history (may be empty)
     */
    public List<StatusEvent> history(RequestId requestId) {
        CopyOnWriteArrayList<StatusEvent> events = history.get(requestId);
        return events == null ? List.of() : List.copyOf(events);
    }

    /**
     * Drops the history and subscribers of one request.
     *
     * @param requestId the request
     */
    public void clear(RequestId requestId) {
        history.remove(requestId);
        subscribers.remove(requestId);
    }
}
