package com.ryuqq.reportflow.core.contract;

/**
 * 메일 전송 결과.
 *
 * @param messageId 메일 전송 서비스가 발급한 메시지 ID
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record MailReceipt(String messageId) {

    public MailReceipt {
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalArgumentException("messageId cannot be null or blank");
        }
    }
}
