package com.ryuqq.reportflow.core.contract;

/**
 * 이벤트 스트림 연결로 전송되는 메시지.
 *
 * @param id 메시지 ID (null 가능)
 * @param event 이벤트 이름 (connected, update, error)
 * @param data 전송 데이터
 * @param retryMs 클라이언트 재연결 대기 시간 (밀리초)
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record StreamMessage(String id, String event, Object data, long retryMs) {

    public static final String EVENT_CONNECTED = "connected";
    public static final String EVENT_UPDATE = "update";
    public static final String EVENT_ERROR = "error";

    private static final long DEFAULT_RETRY_MS = 1000;

    public StreamMessage {
        if (event == null || event.isBlank()) {
            throw new IllegalArgumentException("event cannot be null or blank");
        }
        if (retryMs < 0) {
            throw new IllegalArgumentException("retryMs must be non-negative (current: " + retryMs + ")");
        }
    }

    public static StreamMessage connected() {
        return new StreamMessage(null, EVENT_CONNECTED, "Connected", DEFAULT_RETRY_MS);
    }

    public static StreamMessage update(NotificationEvent notification) {
        return new StreamMessage(null, EVENT_UPDATE, notification, DEFAULT_RETRY_MS);
    }

    public static StreamMessage error(String message) {
        return new StreamMessage(null, EVENT_ERROR, message, DEFAULT_RETRY_MS);
    }
}
