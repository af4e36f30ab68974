package com.ryuqq.reportflow.application.report.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 사전 분석 산출물 (리포트 레코드의 preAnalysisData JSON).
 *
 * <p><strong>필드:</strong></p>
 * <ul>
 *   <li>overview: 5줄 회사 개요</li>
 *   <li>dataReliance ~ sectorReliance: 지표별 추정 응답 원문</li>
 *   <li>dataCollection: 데이터 수집 분석 문단</li>
 *   <li>summary: 요약 JSON (해석 실패 시 빈 구조)</li>
 * </ul>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PreAnalysis(
    @JsonProperty("overview") String overview,
    @JsonProperty("dataReliance") String dataReliance,
    @JsonProperty("dataAttribute") String dataAttribute,
    @JsonProperty("dataUniqueness") String dataUniqueness,
    @JsonProperty("dataScarcity") String dataScarcity,
    @JsonProperty("dataOwnership") String dataOwnership,
    @JsonProperty("sectorReliance") String sectorReliance,
    @JsonProperty("dataCollection") String dataCollection,
    @JsonProperty("summary") ReportSummary summary
) {

    public PreAnalysis {
        overview = nullToEmpty(overview);
        dataReliance = nullToEmpty(dataReliance);
        dataAttribute = nullToEmpty(dataAttribute);
        dataUniqueness = nullToEmpty(dataUniqueness);
        dataScarcity = nullToEmpty(dataScarcity);
        dataOwnership = nullToEmpty(dataOwnership);
        sectorReliance = nullToEmpty(sectorReliance);
        dataCollection = nullToEmpty(dataCollection);
        summary = summary == null ? ReportSummary.empty() : summary;
    }

    /**
     * 지표 응답에서 추출한 백분율.
     */
    @JsonIgnore
    public ProfileMetrics metrics() {
        return ProfileMetrics.extract(dataReliance, dataAttribute, dataUniqueness, dataScarcity, dataOwnership, sectorReliance);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
