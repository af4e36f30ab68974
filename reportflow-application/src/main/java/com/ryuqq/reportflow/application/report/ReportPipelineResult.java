package com.ryuqq.reportflow.application.report;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * 리포트 Job 결과 (Job result payload).
 *
 * @param reportId 리포트 ID
 * @param stage 도달한 단계 (성공 시 DONE)
 * @param preAnalysisGenerated 사전 분석 생성 여부
 * @param supplementaryGenerated 경쟁 비교 생성 여부
 * @param valuationGenerated 가치 평가 생성 여부
 * @param documentRendered 문서 렌더링 여부
 * @param deliveryJobId 예약된 이메일 Job ID (예약하지 않았으면 null)
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record ReportPipelineResult(
    @JsonProperty("reportId") String reportId,
    @JsonProperty("stage") ReportStage stage,
    @JsonProperty("preAnalysisGenerated") boolean preAnalysisGenerated,
    @JsonProperty("supplementaryGenerated") boolean supplementaryGenerated,
    @JsonProperty("valuationGenerated") boolean valuationGenerated,
    @JsonProperty("documentRendered") boolean documentRendered,
    @JsonProperty("deliveryJobId") String deliveryJobId
) {

    public Optional<String> deliveryJob() {
        return Optional.ofNullable(deliveryJobId);
    }
}
