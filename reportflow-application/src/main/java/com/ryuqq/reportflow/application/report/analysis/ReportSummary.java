package com.ryuqq.reportflow.application.report.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * 사전 분석 요약 (요약문, 경쟁 우위, data profile 표).
 *
 * <p>생성된 JSON을 해석하지 못하면 {@link #empty()}로 대체합니다. null 필드는 빈 값으로 정규화되므로
 * 소비자는 항상 빈 컬렉션을 다룰 수 있습니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReportSummary(
    @JsonProperty("summary") String summary,
    @JsonProperty("competitiveAdvantages") List<String> competitiveAdvantages,
    @JsonProperty("dataProfileTable") List<DataProfileRow> dataProfileTable
) {

    public ReportSummary {
        summary = summary == null ? "" : summary;
        competitiveAdvantages = competitiveAdvantages == null
            ? List.of()
            : competitiveAdvantages.stream().filter(Objects::nonNull).toList();
        dataProfileTable = dataProfileTable == null
            ? List.of()
            : dataProfileTable.stream().filter(Objects::nonNull).toList();
    }

    public static ReportSummary empty() {
        return new ReportSummary("", List.of(), List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return summary.isBlank() && competitiveAdvantages.isEmpty() && dataProfileTable.isEmpty();
    }
}
