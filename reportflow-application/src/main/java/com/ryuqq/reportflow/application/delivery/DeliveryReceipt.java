package com.ryuqq.reportflow.application.delivery;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 이메일 Job 결과 (Job result payload).
 *
 * @param jobId 이메일 Job ID
 * @param messageId 메일 전송 서비스가 부여한 메시지 ID
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record DeliveryReceipt(
    @JsonProperty("jobId") String jobId,
    @JsonProperty("messageId") String messageId
) {
}
