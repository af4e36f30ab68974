package com.ryuqq.reportflow.application.report.valuation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * 설문 답변에서 추출한 가치 평가 입력.
 *
 * <p>yearlyValuations가 없으면 생성 자체가 실패하며, 가치 평가는 건너뜁니다.
 * 백분율이 없으면 NaN으로 두어 보정 규칙이 적용되게 합니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ValuationInputs(
    @JsonProperty("yearsCollectingData") Integer yearsCollectingData,
    @JsonProperty("dataAttributablePercent") Double dataAttributablePercent,
    @JsonProperty("dataReliancePercent") Double dataReliancePercent,
    @JsonProperty("currentCompanyValue") BigDecimal currentCompanyValue,
    @JsonProperty("yearlyValuations") List<BigDecimal> yearlyValuations
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException yearlyValuations가 없는 경우
     */
    public ValuationInputs {
        if (yearlyValuations == null) {
            throw new IllegalArgumentException("yearlyValuations cannot be null");
        }
        yearlyValuations = yearlyValuations.stream().filter(Objects::nonNull).toList();
        if (yearsCollectingData == null) {
            yearsCollectingData = yearlyValuations.size();
        }
        if (dataAttributablePercent == null) {
            dataAttributablePercent = Double.NaN;
        }
        if (dataReliancePercent == null) {
            dataReliancePercent = Double.NaN;
        }
        if (currentCompanyValue == null) {
            currentCompanyValue = BigDecimal.ZERO;
        }
    }
}
