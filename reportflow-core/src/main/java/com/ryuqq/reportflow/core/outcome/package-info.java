/**
 * Job 실행 결과 타입 패키지.
 *
 * <ul>
 *   <li>{@link com.ryuqq.reportflow.core.outcome.Ok} - 성공 (결과 Payload 저장, COMPLETED)</li>
 *   <li>{@link com.ryuqq.reportflow.core.outcome.Fail} - 실패 (FAILED, 자동 재시도 없음)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.core.outcome;
