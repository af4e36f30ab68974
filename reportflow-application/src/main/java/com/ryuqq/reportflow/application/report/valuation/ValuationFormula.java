package com.ryuqq.reportflow.application.report.valuation;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

/**
 * 데이터 가치 범위 계산식.
 *
 * <pre>
 * total       = Σ yearlyValuations
 * reliance    = total × reliancePercent / 100
 * afterDecay  = reliance × (1 − 12.5 / 100)
 * upper       = afterDecay × qualityMultiplier
 * lower       = upper × (1 − 30 / 100)
 * </pre>
 *
 * <p>upper와 lower는 각각 반올림(HALF_UP)한 정수입니다. lower는 반올림 전 upper에서 계산합니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class ValuationFormula {

    public static final BigDecimal DATA_DECAY_PERCENT = new BigDecimal("12.5");
    public static final BigDecimal LOWER_BOUND_DISCOUNT_PERCENT = BigDecimal.valueOf(30);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private ValuationFormula() {
    }

    /**
     * 계산 결과.
     */
    public record Figures(
        BigDecimal totalValuation,
        BigDecimal dataRelianceValuation,
        BigDecimal afterDecay,
        BigDecimal qualityMultiplier,
        long upperBound,
        long lowerBound
    ) {
    }

    /**
     * @param yearlyValuations 연도별 회사 가치
     * @param reliancePercent 보정된 data reliance %
     * @param quality 품질 지표
     * @return 계산 결과
     */
    public static Figures compute(List<BigDecimal> yearlyValuations, double reliancePercent, QualityMetrics quality) {
        if (yearlyValuations == null) {
            throw new IllegalArgumentException("yearlyValuations cannot be null");
        }
        if (quality == null) {
            throw new IllegalArgumentException("quality cannot be null");
        }

        BigDecimal total = yearlyValuations.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal reliance = total.multiply(percentOf(BigDecimal.valueOf(reliancePercent)));
        BigDecimal afterDecay = reliance.multiply(BigDecimal.ONE.subtract(percentOf(DATA_DECAY_PERCENT)));
        BigDecimal multiplier = quality.multiplier();
        BigDecimal upper = afterDecay.multiply(multiplier, MathContext.DECIMAL64);
        BigDecimal lower = upper.multiply(BigDecimal.ONE.subtract(percentOf(LOWER_BOUND_DISCOUNT_PERCENT)));

        return new Figures(
            normalize(total),
            normalize(reliance),
            normalize(afterDecay),
            normalize(multiplier),
            round(upper),
            round(lower)
        );
    }

    private static BigDecimal percentOf(BigDecimal percent) {
        return percent.divide(HUNDRED, MathContext.DECIMAL64);
    }

    private static long round(BigDecimal value) {
        return value.setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    private static BigDecimal normalize(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }
}
