package com.ryuqq.reportflow.core.spi;

import com.ryuqq.reportflow.core.contract.NotificationEvent;
import com.ryuqq.reportflow.core.model.TopicKey;

import java.util.function.Consumer;

/**
 * In-process publish/subscribe registry keyed by tenant identity.
 *
 * <p>The bus is an injected object with the lifetime of its owner, never a global.</p>
 *
 * <p><strong>Delivery Semantics:</strong></p>
 * <ul>
 *   <li>Synchronous: every listener registered for the key is invoked before publish returns</li>
 *   <li>Exact Match: no wildcard keys</li>
 *   <li>No Replay: listeners registered after a publish never see it</li>
 *   <li>Isolation: a listener that throws does not prevent delivery to the others</li>
 * </ul>
 *
 * <p>Order across listeners of the same key is unspecified.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public interface NotificationBus {

    /**
     * Publishes an event to all current listeners of a key.
     *
     * @param key topic key
     * @param event event to deliver
     * @return number of listeners invoked
     * @throws IllegalArgumentException if key or event is null
     */
    int publish(TopicKey key, NotificationEvent event);

    /**
     * Registers a listener for a key.
     *
     * @param key topic key
     * @param listener event consumer
     * @return subscription handle used to unsubscribe
     * @throws IllegalArgumentException if key or listener is null
     */
    Subscription subscribe(TopicKey key, Consumer<NotificationEvent> listener);

    /**
     * @param key topic key
     * @return number of listeners currently registered for the key
     */
    int listenerCount(TopicKey key);
}
