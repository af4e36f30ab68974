/**
 * 가치 평가 단계.
 *
 * <h2>계산</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reportflow.application.report.valuation.PercentSanitizer}: 비현실적인 백분율 보정</li>
 *   <li>{@link com.ryuqq.reportflow.application.report.valuation.QualityMetrics}: quality multiplier</li>
 *   <li>{@link com.ryuqq.reportflow.application.report.valuation.ValuationFormula}: 범위 계산식</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.application.report.valuation;
