package com.ryuqq.audioedit.core.spi;

import com.ryuqq.audioedit.core.model.RequestId;
import com.ryuqq.audioedit.core.model.StatusEvent;

import java.util.function.Consumer;

/**
 * Per-request publish/subscribe status channel.
 *
 * <p>One logical channel per request id, consumable by any number of subscribers.
 * Events are full-state snapshots, so subscribers must tolerate duplicates and may
 * treat the latest event as the truth.</p>
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
public interface StatusChannel {

    /**
     * Hands an event to the transport.
     *
     * @param event the snapshot
     * @throws RuntimeException if the transport refused the event (the caller may retry)
     */
    void publish(StatusEvent event);

    /**
     * Subscribes to one request's channel.
     *
     * @param requestId the request
     * @param listener invoked for every event on that channel
     * @return handle used to stop listening
     */
    Subscription subscribe(RequestId requestId, Consumer<StatusEvent> listener);
}
