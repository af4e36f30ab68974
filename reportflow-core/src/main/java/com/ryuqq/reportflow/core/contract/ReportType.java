package com.ryuqq.reportflow.core.contract;

/**
 * 리포트 종류.
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public enum ReportType {

    /**
     * 사전 분석 리포트.
     */
    PRE_ADV,

    /**
     * 데이터 가치 평가 리포트.
     */
    PDV,

    /**
     * 경쟁 비교 보충 리포트.
     */
    SUPPLEMENT
}
