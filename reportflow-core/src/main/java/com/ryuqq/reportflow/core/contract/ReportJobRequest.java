package com.ryuqq.reportflow.core.contract;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Optional;

/**
 * 리포트 큐 Job의 Payload.
 *
 * <p>enqueue 이후에는 변경되지 않습니다. 와이어 계약의 필드명
 * ({@code enableADV}, {@code pdvAnswers})은 {@link JsonProperty}로 유지합니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>organizationId:</strong> 테넌트 ID (알림 토픽 키의 일부)</li>
 *   <li><strong>platformId:</strong> 플랫폼 ID (null 가능)</li>
 *   <li><strong>enableValuation:</strong> 가치 평가 단계 실행 여부</li>
 *   <li><strong>answers:</strong> 가치 평가 설문 답변 (순서 유지, null이면 빈 목록)</li>
 * </ul>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReportJobRequest(
    @JsonProperty("reportId") String reportId,
    @JsonProperty("orgName") String orgName,
    @JsonProperty("workflowId") String workflowId,
    @JsonProperty("reportType") ReportType reportType,
    @JsonProperty("userEmail") String userEmail,
    @JsonProperty("platformId") String platformId,
    @JsonProperty("organizationId") String organizationId,
    @JsonProperty("orgWorkflowId") String orgWorkflowId,
    @JsonProperty("subdomain") String subdomain,
    @JsonProperty("enableADV") boolean enableValuation,
    @JsonProperty("pdvAnswers") List<QuestionAnswer> answers
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException reportId, orgName, organizationId가 비어 있는 경우
     */
    public ReportJobRequest {
        if (reportId == null || reportId.isBlank()) {
            throw new IllegalArgumentException("reportId cannot be null or blank");
        }
        if (orgName == null || orgName.isBlank()) {
            throw new IllegalArgumentException("orgName cannot be null or blank");
        }
        if (organizationId == null || organizationId.isBlank()) {
            throw new IllegalArgumentException("organizationId cannot be null or blank");
        }
        if (reportType == null) {
            reportType = ReportType.PDV;
        }
        answers = answers == null ? List.of() : List.copyOf(answers);
    }

    /**
     * 테넌트 ID (organizationId).
     */
    public String tenantId() {
        return organizationId;
    }

    /**
     * 배달 대상 이메일 (비어 있으면 empty).
     */
    public Optional<String> recipient() {
        if (userEmail == null || userEmail.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(userEmail.trim());
    }

    /**
     * 질문에 대한 답변 조회.
     *
     * @param question 질문 원문
     * @return 답변 (없으면 empty)
     */
    public Optional<String> answerTo(String question) {
        return answers.stream()
            .filter(qa -> qa.question().equals(question))
            .map(QuestionAnswer::answer)
            .findFirst();
    }
}
