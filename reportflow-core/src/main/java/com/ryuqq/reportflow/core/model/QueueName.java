package com.ryuqq.reportflow.core.model;

/**
 * Durable Queue 이름.
 *
 * <p>Worker Pool은 큐 이름 단위로 등록되며, 같은 이름의 큐에서만 Job을 가져옵니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~100자</li>
 *   <li>패턴: 영문자로 시작, 영숫자/하이픈/언더스코어/점</li>
 * </ul>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class QueueName {

    private final String value;

    private QueueName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("QueueName cannot be null or blank");
        }
        if (value.length() > 100) {
            throw new IllegalArgumentException("QueueName length cannot exceed 100 characters");
        }
        if (!value.matches("^[A-Za-z][A-Za-z0-9_.\\-]*$")) {
            throw new IllegalArgumentException("QueueName must start with a letter and contain only alphanumeric, '_', '.', '-' (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * QueueName 생성.
     *
     * @param value 큐 이름
     * @return QueueName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static QueueName of(String value) {
        return new QueueName(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QueueName that = (QueueName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
