/**
 * 리포트 파이프라인.
 *
 * <h2>진입점</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reportflow.application.report.ReportSubmitter}: 리포트 Job 접수</li>
 *   <li>{@link com.ryuqq.reportflow.application.report.ReportJobHandler}: 리포트 큐 handler</li>
 * </ul>
 *
 * <h2>하위 패키지</h2>
 * <ul>
 *   <li>analysis: 사전 분석, 경쟁 비교</li>
 *   <li>valuation: 가치 평가</li>
 *   <li>render: 문서 조립, 렌더러 경계</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.application.report;
