package com.ryuqq.reportflow.application.report.valuation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * PercentSanitizer 테스트.
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
class PercentSanitizerTest {

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 100.0, -5.0, 150.0, Double.NaN})
    void 비현실적인_값은_사전_분석_지표로_대체된다(double value) {
        assertThat(PercentSanitizer.sanitize(value, OptionalDouble.of(42.0))).isEqualTo(42.0);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 100.0})
    void 지표가_없으면_50으로_대체된다(double value) {
        assertThat(PercentSanitizer.sanitize(value, OptionalDouble.empty())).isEqualTo(50.0);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.5, 1.0, 37.5, 80.0, 99.9})
    void 범위_안의_값은_그대로_유지된다(double value) {
        assertThat(PercentSanitizer.sanitize(value, OptionalDouble.of(42.0))).isEqualTo(value);
    }

    @Test
    void fallback이_null이면_50을_사용한다() {
        assertThat(PercentSanitizer.sanitize(0.0, null)).isEqualTo(50.0);
    }
}
