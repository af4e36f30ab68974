package com.ryuqq.reportflow.application.protection;

/**
 * 외부 호출이 deadline 안에 끝나지 않음.
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class ExternalCallTimeoutException extends RuntimeException {

    private final String callName;
    private final long timeoutMs;

    public ExternalCallTimeoutException(String callName, long timeoutMs) {
        super("External call '" + callName + "' timed out after " + timeoutMs + "ms");
        this.callName = callName;
        this.timeoutMs = timeoutMs;
    }

    public String getCallName() {
        return callName;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
