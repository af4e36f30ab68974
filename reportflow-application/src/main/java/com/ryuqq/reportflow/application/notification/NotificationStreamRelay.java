package com.ryuqq.reportflow.application.notification;

import com.ryuqq.reportflow.core.contract.StreamMessage;
import com.ryuqq.reportflow.core.model.TopicKey;
import com.ryuqq.reportflow.core.spi.EventChannel;
import com.ryuqq.reportflow.core.spi.NotificationBus;
import com.ryuqq.reportflow.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 이벤트 스트림 연결을 Notification Bus에 연결하는 relay.
 *
 * <p><strong>attach 흐름:</strong></p>
 * <ol>
 *   <li>channel.keepAlive()</li>
 *   <li>테넌트 키로 bus 구독</li>
 *   <li>{@code connected} 인사 전송 (실패 시 즉시 구독 해제)</li>
 *   <li>이후 발행되는 알림을 {@code update} 이벤트로 전달</li>
 * </ol>
 *
 * <p>연결 종료(onClose) 또는 전송 실패 시 구독을 해제하므로 listener가 남지 않습니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class NotificationStreamRelay {

    private static final Logger log = LoggerFactory.getLogger(NotificationStreamRelay.class);

    private final NotificationBus bus;

    public NotificationStreamRelay(NotificationBus bus) {
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        this.bus = bus;
    }

    /**
     * 클라이언트 채널을 테넌트 키에 연결.
     *
     * @param platformId 플랫폼 ID
     * @param tenantId 테넌트(조직) ID
     * @param channel 클라이언트 채널
     * @return 구독 handle (인사 전송 실패 시 이미 해제된 상태)
     */
    public Subscription attach(String platformId, String tenantId, EventChannel channel) {
        return attach(TopicKey.of(platformId, tenantId), channel);
    }

    public Subscription attach(TopicKey key, EventChannel channel) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }

        channel.keepAlive();

        AtomicReference<Subscription> holder = new AtomicReference<>();
        Subscription subscription = bus.subscribe(key, event -> {
            try {
                channel.send(StreamMessage.update(event));
            } catch (IOException e) {
                log.debug("Stream for {} is gone, unsubscribing: {}", key.value(), e.getMessage());
                Subscription current = holder.get();
                if (current != null) {
                    current.unsubscribe();
                }
            }
        });
        holder.set(subscription);
        channel.onClose(subscription::unsubscribe);

        try {
            channel.send(StreamMessage.connected());
        } catch (IOException e) {
            log.warn("Failed to greet stream for {}, unsubscribing", key.value(), e);
            subscription.unsubscribe();
        }
        return subscription;
    }
}
