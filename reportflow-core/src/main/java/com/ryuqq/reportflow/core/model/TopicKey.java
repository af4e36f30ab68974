package com.ryuqq.reportflow.core.model;

/**
 * Notification Bus 토픽 키 (platformId, tenantId 조합).
 *
 * <p>알림 수신 대상(테넌트)을 식별하며, Notification Bus의 토픽이자
 * 이벤트 스트림 연결의 필터로 사용됩니다. 값은 {@code platformId + "_" + tenantId}
 * 형태의 불투명한 문자열입니다.</p>
 *
 * <p>platformId가 없는 테넌트는 {@code "null"} 문자열로 결합됩니다.
 * 발행자와 구독자가 같은 규칙으로 키를 만들기 때문에 서로 매칭됩니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class TopicKey {

    private static final String SEPARATOR = "_";

    private final String value;

    private TopicKey(String value) {
        this.value = value;
    }

    /**
     * (platformId, tenantId)로 TopicKey 생성.
     *
     * @param platformId 플랫폼 ID (null 허용)
     * @param tenantId 테넌트(조직) ID
     * @return TopicKey 인스턴스
     * @throws IllegalArgumentException tenantId가 null이거나 빈 문자열인 경우
     */
    public static TopicKey of(String platformId, String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be null or blank");
        }
        return new TopicKey(platformId + SEPARATOR + tenantId);
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TopicKey topicKey = (TopicKey) o;
        return value.equals(topicKey.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "TopicKey{" + value + '}';
    }
}
