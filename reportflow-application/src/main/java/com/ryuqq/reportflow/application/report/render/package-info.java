/**
 * 리포트 문서 조립과 렌더러 경계.
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.application.report.render;
