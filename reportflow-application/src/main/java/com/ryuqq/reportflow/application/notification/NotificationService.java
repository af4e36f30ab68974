package com.ryuqq.reportflow.application.notification;

import com.ryuqq.reportflow.core.contract.NotificationEvent;
import com.ryuqq.reportflow.core.spi.NotificationBus;
import com.ryuqq.reportflow.core.spi.NotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * 알림 이중 기록 서비스.
 *
 * <p>알림을 영속 레코드로 저장하고 Notification Bus에 발행합니다. 두 쓰기는 서로
 * 독립적입니다: 한쪽이 실패해도 다른 쪽은 시도되며, 실패는 로그로만 남고
 * 호출자(Job)로 전파되지 않습니다.</p>
 *
 * <p><strong>경로:</strong></p>
 * <ul>
 *   <li>{@link #notify(NotificationEvent)}: 저장 + 발행 (파이프라인, 배달 handler)</li>
 *   <li>{@link #relay(NotificationEvent)}: 발행만 (다른 곳에서 이미 저장된 알림 중계)</li>
 * </ul>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationRepository repository;
    private final NotificationBus bus;
    private final Clock clock;

    public NotificationService(NotificationRepository repository, NotificationBus bus, Clock clock) {
        if (repository == null) {
            throw new IllegalArgumentException("repository cannot be null");
        }
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.repository = repository;
        this.bus = bus;
        this.clock = clock;
    }

    /**
     * 읽지 않은 새 알림을 만들어 이중 기록.
     *
     * @return 기록한 알림
     */
    public NotificationEvent notify(String title, String description, String tenantId, String platformId) {
        NotificationEvent event = NotificationEvent.unread(title, description, tenantId, platformId, clock.instant());
        notify(event);
        return event;
    }

    /**
     * 알림 이중 기록 (저장 + 발행).
     *
     * @param event 알림
     * @return 영속 저장 성공 여부
     */
    public boolean notify(NotificationEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }

        boolean persisted = false;
        try {
            repository.create(event);
            persisted = true;
        } catch (RuntimeException e) {
            log.warn("Failed to persist notification '{}' for {}", event.title(), event.topicKey().value(), e);
        }

        publish(event);
        return persisted;
    }

    /**
     * 알림을 저장하지 않고 발행만.
     *
     * @param event 알림
     * @return 알림을 받은 listener 수 (발행 실패 시 0)
     */
    public int relay(NotificationEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        return publish(event);
    }

    private int publish(NotificationEvent event) {
        try {
            int listeners = bus.publish(event.topicKey(), event);
            log.debug("Published '{}' to {} ({} listeners)", event.title(), event.topicKey().value(), listeners);
            return listeners;
        } catch (RuntimeException e) {
            log.warn("Failed to publish notification '{}' to {}", event.title(), event.topicKey().value(), e);
            return 0;
        }
    }
}
