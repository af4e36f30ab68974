/**
 * 리포트 레코드와 부분 갱신 타입.
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.core.record;
