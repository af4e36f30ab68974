package com.ryuqq.reportflow.adapter.runner;

/**
 * QueueWorkerRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollingIntervalMs: lease 루프 간격 (기본 100ms)</li>
 *   <li>concurrency: 큐당 동시 실행 handler 수 (기본 5)</li>
 *   <li>shutdownTimeoutMs: shutdown 시 실행 중인 handler 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * <p><strong>튜닝:</strong> 리포트 큐는 외부 호출이 길어 concurrency를 낮게(2),
 * 이메일 큐는 기본값(5)을 사용합니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 * @param pollingIntervalMs lease 루프 간격 (밀리초, 양수여야 함)
 * @param concurrency 동시 실행 handler 수 (1 이상이어야 함)
 * @param shutdownTimeoutMs shutdown 대기 시간 (밀리초, 0 이상)
 */
public record QueueWorkerConfig(
    long pollingIntervalMs,
    int concurrency,
    long shutdownTimeoutMs
) {

    public static final long DEFAULT_POLLING_INTERVAL_MS = 100;
    public static final int DEFAULT_CONCURRENCY = 5;
    public static final long DEFAULT_SHUTDOWN_TIMEOUT_MS = 60_000;

    /**
     * 기본 설정 생성자.
     */
    public QueueWorkerConfig() {
        this(DEFAULT_POLLING_INTERVAL_MS, DEFAULT_CONCURRENCY, DEFAULT_SHUTDOWN_TIMEOUT_MS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public QueueWorkerConfig {
        if (pollingIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollingIntervalMs must be positive (current: " + pollingIntervalMs + ")"
            );
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be non-negative (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    public QueueWorkerConfig withPollingIntervalMs(long newPollingIntervalMs) {
        return new QueueWorkerConfig(newPollingIntervalMs, concurrency, shutdownTimeoutMs);
    }

    public QueueWorkerConfig withConcurrency(int newConcurrency) {
        return new QueueWorkerConfig(pollingIntervalMs, newConcurrency, shutdownTimeoutMs);
    }

    public QueueWorkerConfig withShutdownTimeoutMs(long newShutdownTimeoutMs) {
        return new QueueWorkerConfig(pollingIntervalMs, concurrency, newShutdownTimeoutMs);
    }
}
