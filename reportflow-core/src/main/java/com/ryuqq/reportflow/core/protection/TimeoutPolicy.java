package com.ryuqq.reportflow.core.protection;

/**
 * Timeout Policy SPI.
 *
 * <p>외부 호출(텍스트 생성, 문서 렌더링, 메일 전송)의 최대 허용 시간을 설정하여
 * 멈춘 호출이 Worker 슬롯을 무기한 점유하지 않도록 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * long timeout = policy.getPerCallTimeoutMs("text-generation");
 * if (timeout > 0) {
 *     CompletableFuture<String> future = CompletableFuture.supplyAsync(() -> generator.generate(request));
 *     try {
 *         return future.get(timeout, TimeUnit.MILLISECONDS);
 *     } catch (TimeoutException e) {
 *         policy.recordTimeout("text-generation", timeout);
 *         throw e;
 *     }
 * }
 * }</pre>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public interface TimeoutPolicy {

    /**
     * 호출당 타임아웃 시간 조회.
     *
     * @param callName 외부 호출 이름 (예: text-generation, render, mail-send)
     * @return 타임아웃 시간 (밀리초), 0은 타임아웃 없음을 의미
     */
    long getPerCallTimeoutMs(String callName);

    /**
     * 타임아웃 발생 기록.
     *
     * @param callName 외부 호출 이름
     * @param elapsedMs 실제 경과 시간 (밀리초)
     */
    void recordTimeout(String callName, long elapsedMs);
}
