package com.ryuqq.reportflow.adapter.inmemory.bus;

import com.ryuqq.reportflow.core.contract.NotificationEvent;
import com.ryuqq.reportflow.core.model.TopicKey;
import com.ryuqq.reportflow.core.spi.NotificationBus;
import com.ryuqq.reportflow.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * In-memory implementation of {@link NotificationBus}.
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Registry:</strong> ConcurrentHashMap&lt;TopicKey, CopyOnWriteArrayList&lt;Registration&gt;&gt;</li>
 *   <li><strong>Publish:</strong> iterates a snapshot of the key's listeners on the caller thread</li>
 * </ul>
 *
 * <p>Each subscribe call creates its own registration, so the same listener subscribed
 * twice receives an event twice and is removed one registration at a time.</p>
 *
 * <p>The bus is owned by whoever constructs it (normally the bootstrap) and passed to the
 * notification service and the stream relay.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class InMemoryNotificationBus implements NotificationBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryNotificationBus.class);

    private final ConcurrentHashMap<TopicKey, CopyOnWriteArrayList<Registration>> listeners = new ConcurrentHashMap<>();

    @Override
    public int publish(TopicKey key, NotificationEvent event) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }

        List<Registration> registrations = listeners.get(key);
        if (registrations == null) {
            return 0;
        }

        int invoked = 0;
        for (Registration registration : registrations) {
            invoked++;
            try {
                registration.listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener on {} failed for event '{}'", key.value(), event.title(), e);
            }
        }
        return invoked;
    }

    @Override
    public Subscription subscribe(TopicKey key, Consumer<NotificationEvent> listener) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }

        Registration registration = new Registration(key, listener);
        listeners.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(registration);
        log.debug("Subscribed listener to {}", key.value());
        return registration;
    }

    @Override
    public int listenerCount(TopicKey key) {
        List<Registration> registrations = listeners.get(key);
        return registrations == null ? 0 : registrations.size();
    }

    /**
     * Removes every listener. Used for test cleanup.
     */
    public void clear() {
        listeners.clear();
    }

    private void remove(Registration registration) {
        listeners.computeIfPresent(registration.key, (k, registrations) -> {
            registrations.remove(registration);
            return registrations.isEmpty() ? null : registrations;
        });
    }

    private final class Registration implements Subscription {
        private final TopicKey key;
        private final Consumer<NotificationEvent> listener;
        private final AtomicBoolean active = new AtomicBoolean(true);

        Registration(TopicKey key, Consumer<NotificationEvent> listener) {
            this.key = key;
            this.listener = listener;
        }

        @Override
        public void unsubscribe() {
            if (active.compareAndSet(true, false)) {
                remove(this);
                log.debug("Unsubscribed listener from {}", key.value());
            }
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
