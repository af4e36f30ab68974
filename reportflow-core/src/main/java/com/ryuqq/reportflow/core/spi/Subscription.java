package com.ryuqq.reportflow.core.spi;

/**
 * Handle returned by {@link NotificationBus#subscribe}.
 *
 * <p>Closing the handle removes the listener. {@link #unsubscribe()} is idempotent.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public interface Subscription extends AutoCloseable {

    /**
     * Removes the listener from the bus. Calling it again has no effect.
     */
    void unsubscribe();

    /**
     * @return true while the listener is still registered
     */
    boolean isActive();

    @Override
    default void close() {
        unsubscribe();
    }
}
