package com.ryuqq.reportflow.application.report.valuation;

import com.ryuqq.reportflow.application.report.analysis.ProfileMetrics;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * 품질 할인 지표 (scarcity, ownership, uniqueness).
 *
 * <p>세 값의 평균 / 100이 quality multiplier입니다. 사전 분석 지표가 없으면 기본값
 * 50 / 80 / 50을 사용합니다.</p>
 *
 * @param scarcity 희소성 %
 * @param ownership 소유권 %
 * @param uniqueness 고유성 %
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record QualityMetrics(double scarcity, double ownership, double uniqueness) {

    public static final double DEFAULT_SCARCITY = 50.0;
    public static final double DEFAULT_OWNERSHIP = 80.0;
    public static final double DEFAULT_UNIQUENESS = 50.0;

    private static final BigDecimal THREE = BigDecimal.valueOf(3);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public QualityMetrics {
        requirePercent("scarcity", scarcity);
        requirePercent("ownership", ownership);
        requirePercent("uniqueness", uniqueness);
    }

    public static QualityMetrics defaults() {
        return new QualityMetrics(DEFAULT_SCARCITY, DEFAULT_OWNERSHIP, DEFAULT_UNIQUENESS);
    }

    /**
     * 사전 분석 지표에서 생성 (없는 지표는 기본값).
     *
     * @param metrics 사전 분석 지표 (null이면 전부 기본값)
     */
    public static QualityMetrics from(ProfileMetrics metrics) {
        if (metrics == null) {
            return defaults();
        }
        return new QualityMetrics(
            metrics.scarcity().orElse(DEFAULT_SCARCITY),
            metrics.ownership().orElse(DEFAULT_OWNERSHIP),
            metrics.uniqueness().orElse(DEFAULT_UNIQUENESS)
        );
    }

    /**
     * 품질 배수: avg(scarcity, ownership, uniqueness) / 100.
     */
    public BigDecimal multiplier() {
        BigDecimal sum = BigDecimal.valueOf(scarcity)
            .add(BigDecimal.valueOf(ownership))
            .add(BigDecimal.valueOf(uniqueness));
        return sum.divide(THREE, MathContext.DECIMAL64).divide(HUNDRED, MathContext.DECIMAL64);
    }

    private static void requirePercent(String name, double value) {
        if (Double.isNaN(value) || value < 0 || value > 100) {
            throw new IllegalArgumentException(name + " must be between 0 and 100 (current: " + value + ")");
        }
    }
}
