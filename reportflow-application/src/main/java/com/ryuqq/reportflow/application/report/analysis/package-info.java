/**
 * 리포트 분석 단계 (사전 분석, 경쟁 비교).
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reportflow.application.report.analysis.ReportPrompts}: prompt 목록</li>
 *   <li>{@link com.ryuqq.reportflow.application.report.analysis.PreAnalysisGenerator}: 개요, 지표, 수집 분석, 요약</li>
 *   <li>{@link com.ryuqq.reportflow.application.report.analysis.SupplementaryGenerator}: 부문/지역 비교</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.application.report.analysis;
