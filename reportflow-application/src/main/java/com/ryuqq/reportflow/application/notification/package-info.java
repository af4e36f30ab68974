/**
 * 알림 이중 기록과 이벤트 스트림 relay.
 *
 * @since 1.0.0
 * @author ReportFlow Team
 */
package com.ryuqq.reportflow.application.notification;
