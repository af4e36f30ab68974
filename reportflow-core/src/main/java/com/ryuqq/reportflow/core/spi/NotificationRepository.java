package com.ryuqq.reportflow.core.spi;

import com.ryuqq.reportflow.core.contract.NotificationEvent;
import com.ryuqq.reportflow.core.model.TopicKey;

import java.util.List;

/**
 * Durable record of notifications, the backstop for events missed by live streams.
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public interface NotificationRepository {

    NotificationEvent create(NotificationEvent event);

    /**
     * @return notifications for the key, oldest first
     */
    List<NotificationEvent> findByTopic(TopicKey key);
}
