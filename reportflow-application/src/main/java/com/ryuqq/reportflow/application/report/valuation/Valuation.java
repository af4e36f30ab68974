package com.ryuqq.reportflow.application.report.valuation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ryuqq.reportflow.core.contract.QuestionAnswer;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 가치 평가 산출물 (리포트 레코드의 valuationData JSON).
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record Valuation(
    @JsonProperty("lowerADV") long lowerBound,
    @JsonProperty("upperADV") long upperBound,
    @JsonProperty("chartData") ChartData chartData,
    @JsonProperty("calculationDetails") CalculationDetails calculationDetails,
    @JsonProperty("qaTable") List<QuestionAnswer> qaTable
) {

    private static final BigDecimal MILLION = BigDecimal.valueOf(1_000_000);

    public Valuation {
        if (chartData == null) {
            throw new IllegalArgumentException("chartData cannot be null");
        }
        if (calculationDetails == null) {
            throw new IllegalArgumentException("calculationDetails cannot be null");
        }
        qaTable = qaTable == null ? List.of() : List.copyOf(qaTable);
    }

    /**
     * 하한 표시 라벨 (예: "$0.2M").
     */
    @JsonIgnore
    public String lowerRangeLabel() {
        return rangeLabel(lowerBound);
    }

    @JsonIgnore
    public String upperRangeLabel() {
        return rangeLabel(upperBound);
    }

    static String rangeLabel(long amount) {
        return "$" + BigDecimal.valueOf(amount).divide(MILLION).setScale(1, RoundingMode.HALF_UP).toPlainString() + "M";
    }

    /**
     * 범위 차트 데이터.
     */
    public record ChartData(
        @JsonProperty("labels") List<String> labels,
        @JsonProperty("values") List<Long> values,
        @JsonProperty("percentages") Percentages percentages
    ) {
        public static final List<String> RANGE_LABELS = List.of("Bottom PDV Range", "Top PDV Range");

        public static ChartData of(long lower, long upper, Percentages percentages) {
            return new ChartData(RANGE_LABELS, List.of(lower, upper), percentages);
        }
    }

    /**
     * 현재 회사 가치 대비 비율 ("12.5%" 또는 "n/a").
     */
    public record Percentages(
        @JsonProperty("lower") String lower,
        @JsonProperty("upper") String upper
    ) {
    }

    /**
     * 계산 근거.
     */
    public record CalculationDetails(
        @JsonProperty("totalValuation") BigDecimal totalValuation,
        @JsonProperty("dataRelianceValuation") BigDecimal dataRelianceValuation,
        @JsonProperty("dataDecayPercent") BigDecimal dataDecayPercent,
        @JsonProperty("lowerBoundDiscountPercent") BigDecimal lowerBoundDiscountPercent,
        @JsonProperty("qualityMultiplier") BigDecimal qualityMultiplier,
        @JsonProperty("yearsCollectingData") int yearsCollectingData,
        @JsonProperty("dataReliancePercent") double dataReliancePercent,
        @JsonProperty("dataAttributablePercent") double dataAttributablePercent,
        @JsonProperty("currentCompanyValue") BigDecimal currentCompanyValue
    ) {
    }
}
