package com.ryuqq.reportflow.core.outcome;

/**
 * 실패 결과.
 *
 * <p>handler 예외, 리포트 파이프라인 전체 실패, 메일 전송 실패 등이 여기에 해당합니다.
 * Job은 FAILED로 종료되며 자동으로 다시 큐에 들어가지 않습니다.</p>
 *
 * @param errorCode 오류 코드 (예: HANDLER_ERROR, PAYLOAD_INVALID)
 * @param message 오류 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record Fail(
    String errorCode,
    String message,
    String cause
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public Fail {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    public static Fail of(String errorCode, String message, String cause) {
        return new Fail(errorCode, message, cause);
    }

    public static Fail of(String errorCode, String message) {
        return new Fail(errorCode, message, null);
    }

    /**
     * 예외로부터 Fail 생성.
     *
     * <p>예외 메시지가 비어 있으면 예외 클래스 이름을 메시지로 사용합니다.</p>
     *
     * @param errorCode 오류 코드
     * @param throwable 원인 예외
     * @return Fail 인스턴스
     */
    public static Fail from(String errorCode, Throwable throwable) {
        if (throwable == null) {
            throw new IllegalArgumentException("throwable cannot be null");
        }
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            message = throwable.getClass().getSimpleName();
        }
        return new Fail(errorCode, message, throwable.getClass().getName());
    }
}
