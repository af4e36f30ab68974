package com.ryuqq.reportflow.application.report.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data profile 표의 한 행.
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DataProfileRow(
    @JsonProperty("dataMetric") String dataMetric,
    @JsonProperty("estimate") String estimate,
    @JsonProperty("strategicSignificance") String strategicSignificance
) {

    public DataProfileRow {
        dataMetric = dataMetric == null ? "" : dataMetric;
        estimate = estimate == null ? "" : estimate;
        strategicSignificance = strategicSignificance == null ? "" : strategicSignificance;
    }
}
