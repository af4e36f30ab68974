package com.ryuqq.reportflow.application.report.render;

/**
 * 리포트 문서 섹션 종류 (문서 내 순서).
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public enum SectionKind {
    OVERVIEW,
    DATA_METRICS,
    DATA_COLLECTION,
    SUMMARY,
    COMPETITIVE_COMPARISON,
    VALUATION
}
