package com.ryuqq.reportflow.core.model;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Job의 전역 고유 식별자.
 *
 * <p>JobId는 Durable Queue가 발급하며, 리포트 레코드에 예약된 배달 Job을
 * 기록하거나 대기 중인 Job의 데이터를 수정할 때 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>최대 {@value #MAX_LENGTH}자, 영숫자와 '-', '_'만 허용 (UUID 포함)</li>
 * </ul>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class JobId {

    public static final int MAX_LENGTH = 255;

    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9_-]+");

    private final String value;

    private JobId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("jobId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH || !ALLOWED.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid jobId: " + value);
        }
        this.value = value;
    }

    /**
     * JobId 생성.
     *
     * @param value JobId 값
     * @return JobId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static JobId of(String value) {
        return new JobId(value);
    }

    /**
     * UUID 기반 JobId 생성.
     *
     * @return 새 JobId
     */
    public static JobId generate() {
        return new JobId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof JobId && value.equals(((JobId) o).value));
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
