package com.ryuqq.reportflow.application.codec;

/**
 * Job payload 또는 생성된 JSON의 직렬화/역직렬화 실패.
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class JobPayloadException extends RuntimeException {

    public JobPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
