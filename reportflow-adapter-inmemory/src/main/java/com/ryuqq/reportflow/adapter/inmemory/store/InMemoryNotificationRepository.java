package com.ryuqq.reportflow.adapter.inmemory.store;

import com.ryuqq.reportflow.core.contract.NotificationEvent;
import com.ryuqq.reportflow.core.model.TopicKey;
import com.ryuqq.reportflow.core.spi.NotificationRepository;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of {@link NotificationRepository}.
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class InMemoryNotificationRepository implements NotificationRepository {

    private final ConcurrentHashMap<TopicKey, CopyOnWriteArrayList<NotificationEvent>> notifications = new ConcurrentHashMap<>();

    @Override
    public NotificationEvent create(NotificationEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        notifications.computeIfAbsent(event.topicKey(), k -> new CopyOnWriteArrayList<>()).add(event);
        return event;
    }

    @Override
    public List<NotificationEvent> findByTopic(TopicKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        List<NotificationEvent> events = notifications.get(key);
        return events == null ? List.of() : List.copyOf(events);
    }

    /**
     * Total number of stored notifications. Used for test assertions.
     */
    public int count() {
        return notifications.values().stream().mapToInt(List::size).sum();
    }

    public void clear() {
        notifications.clear();
    }
}
