package com.ryuqq.audioedit.core.spi;

/**
 * Handle to an active subscription.
 *
 * @author AudioEdit Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    /**
     * Stops delivery. Idempotent.
     */
    void cancel();

    @Override
    default void close() {
        cancel();
    }
}
