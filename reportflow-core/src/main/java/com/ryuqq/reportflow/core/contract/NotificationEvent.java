package com.ryuqq.reportflow.core.contract;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ryuqq.reportflow.core.model.TopicKey;

import java.time.Instant;

/**
 * 테넌트에게 전달되는 알림.
 *
 * <p>알림은 두 번 기록됩니다: 영속 레코드로 저장되고, Notification Bus에 일시적으로
 * 발행됩니다. 두 쓰기는 서로 독립적이며 한쪽 실패가 다른 쪽이나 Job을 되돌리지 않습니다.</p>
 *
 * @param title 제목
 * @param description 설명
 * @param refLink 참조 링크 (빈 문자열 허용)
 * @param read 읽음 여부
 * @param tenantId 테넌트(조직) ID
 * @param platformId 플랫폼 ID (null 가능)
 * @param createdAt 생성 시각
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NotificationEvent(
    @JsonProperty("notificationTitle") String title,
    @JsonProperty("notificationDescription") String description,
    @JsonProperty("refLink") String refLink,
    @JsonProperty("notificationRead") boolean read,
    @JsonProperty("organizationId") String tenantId,
    @JsonProperty("platformId") String platformId,
    @JsonProperty("createdAt") Instant createdAt
) {

    public NotificationEvent {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        if (description == null) {
            throw new IllegalArgumentException("description cannot be null");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be null or blank");
        }
        if (refLink == null) {
            refLink = "";
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    /**
     * 읽지 않은 새 알림 생성.
     */
    public static NotificationEvent unread(String title, String description, String tenantId, String platformId, Instant createdAt) {
        return new NotificationEvent(title, description, "", false, tenantId, platformId, createdAt);
    }

    /**
     * 이 알림의 Notification Bus 토픽 키.
     */
    @JsonIgnore
    public TopicKey topicKey() {
        return TopicKey.of(platformId, tenantId);
    }
}
