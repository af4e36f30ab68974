package com.ryuqq.reportflow.core.record;

/**
 * 리포트 레코드의 부분 갱신 대상 필드.
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public enum ReportField {
    PLATFORM_ID,
    TENANT_ID,
    PRE_ANALYSIS_DATA,
    SUPPLEMENTARY_DATA,
    VALUATION_DATA,
    LOWER_VALUATION_RANGE,
    UPPER_VALUATION_RANGE,
    RENDERED_DOCUMENT,
    DELIVERY_STATUS,
    DELIVERY_ERROR,
    DELIVERY_JOB_ID,
    MAIL_MESSAGE_ID
}
