package com.ryuqq.reportflow.application.report.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.reportflow.application.report.analysis.PreAnalysis;
import com.ryuqq.reportflow.application.report.valuation.Valuation;

import java.util.List;
import java.util.Optional;

/**
 * 렌더러 입력.
 *
 * <p>세 산출물은 각각 없을 수 있으며(null), sections에는 원본 데이터가 있는 섹션만 순서대로 들어 있습니다.</p>
 *
 * @param orgName 조직 이름
 * @param preAnalysis 사전 분석 (없으면 null)
 * @param supplementary 경쟁 비교 JSON (없으면 null)
 * @param valuation 가치 평가 (없으면 null)
 * @param sections 순서가 정해진 섹션
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record ReportDocument(
    String orgName,
    PreAnalysis preAnalysis,
    JsonNode supplementary,
    Valuation valuation,
    List<DocumentSection> sections
) {

    public ReportDocument {
        if (orgName == null || orgName.isBlank()) {
            throw new IllegalArgumentException("orgName cannot be null or blank");
        }
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    public Optional<DocumentSection> section(SectionKind kind) {
        return sections.stream().filter(section -> section.kind() == kind).findFirst();
    }

    public boolean hasSection(SectionKind kind) {
        return section(kind).isPresent();
    }
}
