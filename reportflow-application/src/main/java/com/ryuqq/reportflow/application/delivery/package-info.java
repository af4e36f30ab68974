/**
 * Delivery Dispatcher.
 *
 * <h2>구성</h2>
 * <ul>
 *   <li>{@link com.ryuqq.reportflow.application.delivery.DeliveryDispatcher}: 이메일 Job 예약/교체</li>
 *   <li>{@link com.ryuqq.reportflow.application.delivery.DeliveryJobHandler}: 메일 전송과 결과 기록</li>
 *   <li>{@link com.ryuqq.reportflow.application.delivery.ReportEmailComposer}: 리포트 완료 메일 작성</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.application.delivery;
