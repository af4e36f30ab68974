package com.ryuqq.reportflow.core.contract;

import java.time.Duration;

/**
 * enqueue 옵션.
 *
 * <p>delayMs는 권고 사항인 visibility delay입니다. Job은 {@code enqueue 시각 + delayMs}
 * 이후에 lease 대상이 되며, 정확한 실행 시각을 보장하지 않습니다.</p>
 *
 * @param delayMs visibility delay (밀리초, 0 이상)
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record JobOptions(long delayMs) {

    private static final JobOptions IMMEDIATE = new JobOptions(0);

    public JobOptions {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative, but was: " + delayMs);
        }
    }

    /**
     * 즉시 실행 옵션.
     */
    public static JobOptions immediate() {
        return IMMEDIATE;
    }

    /**
     * 지연 실행 옵션.
     *
     * @param delay visibility delay
     * @return JobOptions
     */
    public static JobOptions delayed(Duration delay) {
        if (delay == null) {
            throw new IllegalArgumentException("delay cannot be null");
        }
        return new JobOptions(delay.toMillis());
    }
}
