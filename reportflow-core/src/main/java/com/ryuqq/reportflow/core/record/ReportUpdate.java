package com.ryuqq.reportflow.core.record;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 리포트 레코드 부분 갱신.
 *
 * <p>설정한 필드만 기록하고 나머지 필드는 건드리지 않습니다. 필드에 null을 설정하면
 * 해당 값을 지웁니다 ("설정 안 함"과 "null로 설정"을 구분).</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ReportUpdate update = ReportUpdate.builder()
 *     .deliveryStatus(DeliveryStatus.DELIVERED)
 *     .mailMessageId("msg-1")
 *     .build();
 * repository.update(reportId, update);
 * </pre>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class ReportUpdate {

    private final Map<ReportField, Object> values;

    private ReportUpdate(Map<ReportField, Object> values) {
        this.values = Collections.unmodifiableMap(new EnumMap<>(values));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 이 갱신에 포함된 필드인지 확인.
     */
    public boolean contains(ReportField field) {
        return values.containsKey(field);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * 설정된 필드와 값 (null 값 포함).
     */
    public Map<ReportField, Object> values() {
        return values;
    }

    /**
     * 레코드에 갱신 적용.
     *
     * @param record 기존 레코드
     * @return 설정된 필드만 바뀐 새 레코드
     * @throws IllegalArgumentException record가 null인 경우
     */
    public ReportRecord applyTo(ReportRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        return new ReportRecord(
            record.id(),
            pick(ReportField.PLATFORM_ID, record.platformId()),
            pick(ReportField.TENANT_ID, record.tenantId()),
            pick(ReportField.PRE_ANALYSIS_DATA, record.preAnalysisData()),
            pick(ReportField.SUPPLEMENTARY_DATA, record.supplementaryData()),
            pick(ReportField.VALUATION_DATA, record.valuationData()),
            pick(ReportField.LOWER_VALUATION_RANGE, record.lowerValuationRange()),
            pick(ReportField.UPPER_VALUATION_RANGE, record.upperValuationRange()),
            pick(ReportField.RENDERED_DOCUMENT, record.renderedDocument()),
            pick(ReportField.DELIVERY_STATUS, record.deliveryStatus()),
            pick(ReportField.DELIVERY_ERROR, record.deliveryError()),
            pick(ReportField.DELIVERY_JOB_ID, record.deliveryJobId()),
            pick(ReportField.MAIL_MESSAGE_ID, record.mailMessageId())
        );
    }

    @SuppressWarnings("unchecked")
    private <T> T pick(ReportField field, T current) {
        return values.containsKey(field) ? (T) values.get(field) : current;
    }

    @Override
    public String toString() {
        return "ReportUpdate{fields=" + values.keySet() + '}';
    }

    /**
     * ReportUpdate 빌더.
     */
    public static final class Builder {

        private final EnumMap<ReportField, Object> values = new EnumMap<>(ReportField.class);

        private Builder() {
        }

        public Builder tenant(String platformId, String tenantId) {
            values.put(ReportField.PLATFORM_ID, platformId);
            values.put(ReportField.TENANT_ID, tenantId);
            return this;
        }

        public Builder preAnalysisData(String json) {
            values.put(ReportField.PRE_ANALYSIS_DATA, json);
            return this;
        }

        public Builder supplementaryData(String json) {
            values.put(ReportField.SUPPLEMENTARY_DATA, json);
            return this;
        }

        public Builder valuationData(String json) {
            values.put(ReportField.VALUATION_DATA, json);
            return this;
        }

        public Builder valuationRange(String lower, String upper) {
            values.put(ReportField.LOWER_VALUATION_RANGE, lower);
            values.put(ReportField.UPPER_VALUATION_RANGE, upper);
            return this;
        }

        public Builder renderedDocument(byte[] document) {
            values.put(ReportField.RENDERED_DOCUMENT, document == null ? null : document.clone());
            return this;
        }

        public Builder deliveryStatus(DeliveryStatus status) {
            values.put(ReportField.DELIVERY_STATUS, status);
            return this;
        }

        public Builder deliveryError(String error) {
            values.put(ReportField.DELIVERY_ERROR, error);
            return this;
        }

        public Builder deliveryJobId(String jobId) {
            values.put(ReportField.DELIVERY_JOB_ID, jobId);
            return this;
        }

        public Builder mailMessageId(String messageId) {
            values.put(ReportField.MAIL_MESSAGE_ID, messageId);
            return this;
        }

        public ReportUpdate build() {
            return new ReportUpdate(values);
        }
    }
}
