package com.ryuqq.reportflow.application.report.analysis;

import com.ryuqq.reportflow.core.text.PercentageExtractor;

import java.util.OptionalDouble;

/**
 * 사전 분석 응답에서 추출한 수치 지표.
 *
 * <p>각 지표는 응답 텍스트의 첫 번째 백분율 값이며 [0,100]으로 제한됩니다.
 * 백분율이 없는 응답은 empty입니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record ProfileMetrics(
    OptionalDouble reliance,
    OptionalDouble attributable,
    OptionalDouble uniqueness,
    OptionalDouble scarcity,
    OptionalDouble ownership,
    OptionalDouble sectorReliance
) {

    public ProfileMetrics {
        reliance = orEmpty(reliance);
        attributable = orEmpty(attributable);
        uniqueness = orEmpty(uniqueness);
        scarcity = orEmpty(scarcity);
        ownership = orEmpty(ownership);
        sectorReliance = orEmpty(sectorReliance);
    }

    public static ProfileMetrics empty() {
        OptionalDouble none = OptionalDouble.empty();
        return new ProfileMetrics(none, none, none, none, none, none);
    }

    /**
     * 응답 텍스트에서 지표 추출.
     */
    public static ProfileMetrics extract(
        String reliance,
        String attributable,
        String uniqueness,
        String scarcity,
        String ownership,
        String sectorReliance
    ) {
        return new ProfileMetrics(
            PercentageExtractor.extract(reliance),
            PercentageExtractor.extract(attributable),
            PercentageExtractor.extract(uniqueness),
            PercentageExtractor.extract(scarcity),
            PercentageExtractor.extract(ownership),
            PercentageExtractor.extract(sectorReliance)
        );
    }

    public boolean hasAny() {
        return reliance.isPresent() || attributable.isPresent() || uniqueness.isPresent()
            || scarcity.isPresent() || ownership.isPresent() || sectorReliance.isPresent();
    }

    private static OptionalDouble orEmpty(OptionalDouble value) {
        return value == null ? OptionalDouble.empty() : value;
    }
}
