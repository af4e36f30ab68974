package com.ryuqq.reportflow.application.delivery;

import com.ryuqq.reportflow.core.model.QueueName;

/**
 * Delivery Dispatcher 설정.
 *
 * <p><strong>필드:</strong></p>
 * <ul>
 *   <li><strong>queueName:</strong> 이메일 Job 큐 이름 (기본 "email")</li>
 *   <li><strong>delayMs:</strong> 기본 가시성 지연 (기본 300,000ms = 5분)</li>
 *   <li><strong>senderAddress:</strong> 리포트 메일 발신 주소</li>
 * </ul>
 *
 * @param queueName 이메일 큐 이름
 * @param delayMs 기본 가시성 지연 (0 이상)
 * @param senderAddress 발신 주소
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record DeliveryConfig(QueueName queueName, long delayMs, String senderAddress) {

    public static final String DEFAULT_QUEUE = "email";
    public static final long DEFAULT_DELAY_MS = 300_000L;
    public static final String DEFAULT_SENDER = "james@12butterflies.life";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 값이 유효하지 않은 경우
     */
    public DeliveryConfig {
        if (queueName == null) {
            throw new IllegalArgumentException("queueName cannot be null");
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be non-negative (current: " + delayMs + ")");
        }
        if (senderAddress == null || senderAddress.isBlank()) {
            throw new IllegalArgumentException("senderAddress cannot be null or blank");
        }
    }

    /**
     * 기본 설정.
     */
    public DeliveryConfig() {
        this(QueueName.of(DEFAULT_QUEUE), DEFAULT_DELAY_MS, DEFAULT_SENDER);
    }

    public DeliveryConfig withQueueName(QueueName newQueueName) {
        return new DeliveryConfig(newQueueName, delayMs, senderAddress);
    }

    public DeliveryConfig withDelayMs(long newDelayMs) {
        return new DeliveryConfig(queueName, newDelayMs, senderAddress);
    }

    public DeliveryConfig withSenderAddress(String newSenderAddress) {
        return new DeliveryConfig(queueName, delayMs, newSenderAddress);
    }
}
