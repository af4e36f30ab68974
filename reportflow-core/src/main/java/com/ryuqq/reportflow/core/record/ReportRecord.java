package com.ryuqq.reportflow.core.record;

import java.util.Arrays;
import java.util.Objects;

/**
 * 영속 리포트 레코드.
 *
 * <p>리포트 파이프라인의 각 단계 결과와 배달 상태를 담습니다. 레코드는 불변이며,
 * 변경은 {@link ReportUpdate}를 적용한 새 인스턴스로 표현합니다.</p>
 *
 * <p>모든 산출물 필드는 null 가능합니다 (해당 단계가 실패했거나 실행되지 않음).</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record ReportRecord(
    String id,
    String platformId,
    String tenantId,
    String preAnalysisData,
    String supplementaryData,
    String valuationData,
    String lowerValuationRange,
    String upperValuationRange,
    byte[] renderedDocument,
    DeliveryStatus deliveryStatus,
    String deliveryError,
    String deliveryJobId,
    String mailMessageId
) {

    public ReportRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        renderedDocument = renderedDocument == null ? null : renderedDocument.clone();
    }

    /**
     * 산출물이 없는 빈 레코드 생성.
     *
     * @param id 리포트 ID
     * @return 빈 레코드
     */
    public static ReportRecord empty(String id) {
        return new ReportRecord(id, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    @Override
    public byte[] renderedDocument() {
        return renderedDocument == null ? null : renderedDocument.clone();
    }

    public boolean hasRenderedDocument() {
        return renderedDocument != null && renderedDocument.length > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReportRecord)) return false;
        ReportRecord that = (ReportRecord) o;
        return id.equals(that.id)
            && Objects.equals(platformId, that.platformId)
            && Objects.equals(tenantId, that.tenantId)
            && Objects.equals(preAnalysisData, that.preAnalysisData)
            && Objects.equals(supplementaryData, that.supplementaryData)
            && Objects.equals(valuationData, that.valuationData)
            && Objects.equals(lowerValuationRange, that.lowerValuationRange)
            && Objects.equals(upperValuationRange, that.upperValuationRange)
            && Arrays.equals(renderedDocument, that.renderedDocument)
            && deliveryStatus == that.deliveryStatus
            && Objects.equals(deliveryError, that.deliveryError)
            && Objects.equals(deliveryJobId, that.deliveryJobId)
            && Objects.equals(mailMessageId, that.mailMessageId);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(id, platformId, tenantId, preAnalysisData, supplementaryData, valuationData,
            lowerValuationRange, upperValuationRange, deliveryStatus, deliveryError, deliveryJobId, mailMessageId);
        return 31 * result + Arrays.hashCode(renderedDocument);
    }

    @Override
    public String toString() {
        return "ReportRecord{id=" + id
            + ", deliveryStatus=" + deliveryStatus
            + ", deliveryJobId=" + deliveryJobId
            + ", renderedDocument=" + (renderedDocument == null ? "null" : renderedDocument.length + " bytes")
            + '}';
    }
}
