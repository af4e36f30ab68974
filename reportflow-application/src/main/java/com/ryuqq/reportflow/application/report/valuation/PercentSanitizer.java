package com.ryuqq.reportflow.application.report.valuation;

import java.util.OptionalDouble;

/**
 * 비현실적인 백분율 보정.
 *
 * <p>0 이하, 100 이상, NaN은 비현실적인 값으로 보고 fallback(사전 분석 지표)으로 대체합니다.
 * fallback이 없으면 {@value #DEFAULT_PERCENT}를 사용합니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class PercentSanitizer {

    public static final double DEFAULT_PERCENT = 50.0;

    private PercentSanitizer() {
    }

    /**
     * @param value 추출된 백분율
     * @param fallback 사전 분석 지표
     * @return 0 초과 100 미만이면 value, 아니면 fallback 또는 50
     */
    public static double sanitize(double value, OptionalDouble fallback) {
        if (isRealistic(value)) {
            return value;
        }
        return fallback == null ? DEFAULT_PERCENT : fallback.orElse(DEFAULT_PERCENT);
    }

    public static boolean isRealistic(double value) {
        return !Double.isNaN(value) && value > 0 && value < 100;
    }
}
