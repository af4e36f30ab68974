/**
 * 외부 호출 보호 정책 패키지.
 *
 * <p>텍스트 생성, 문서 렌더링, 메일 전송 등 모든 외부 호출은 {@link com.ryuqq.reportflow.core.protection.TimeoutPolicy}가
 * 정한 deadline 안에서 실행됩니다. 정책이 0을 돌려주면 deadline 없이 실행합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.reportflow.core.protection.FixedTimeoutPolicy} - 호출 이름별 고정 deadline</li>
 *   <li>{@link com.ryuqq.reportflow.core.protection.noop.NoOpTimeoutPolicy} - deadline 없음 (테스트용)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.core.protection;
