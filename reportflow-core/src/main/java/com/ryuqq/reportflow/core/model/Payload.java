package com.ryuqq.reportflow.core.model;

/**
 * Job에 실려 전달되는 직렬화된 업무 데이터.
 *
 * <p>Durable Queue는 Payload의 내용을 해석하지 않습니다. 리포트 Job과 이메일 Job은
 * JSON 문자열을 담으며, 직렬화/역직렬화는 application 계층의 codec이 담당합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>JSON: Payload.of("{\"reportId\":\"r-1\",\"orgName\":\"Acme\"}")</li>
 *   <li>빈 Payload: Payload.empty()</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가 (대기 중인 Job의 데이터 수정은
 * 새 Payload로 교체하는 방식)</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload("");

    private final String value;

    private Payload(String value) {
        this.value = value;
    }

    /**
     * @param value 직렬화된 데이터 (null은 빈 Payload)
     */
    public static Payload of(String value) {
        return value == null || value.isEmpty() ? EMPTY : new Payload(value);
    }

    public static Payload empty() {
        return EMPTY;
    }

    /**
     * @return 직렬화된 데이터 (null 아님)
     */
    public String getValue() {
        return value;
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Payload && value.equals(((Payload) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Payload[" + value.length() + " chars]";
    }
}
