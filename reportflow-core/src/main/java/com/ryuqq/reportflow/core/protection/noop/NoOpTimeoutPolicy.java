package com.ryuqq.reportflow.core.protection.noop;

import com.ryuqq.reportflow.core.protection.TimeoutPolicy;

/**
 * Timeout Policy NoOp 구현.
 *
 * <p>타임아웃을 적용하지 않습니다 (0 반환). 단위 테스트처럼 외부 호출이
 * 즉시 끝나는 환경에서 사용합니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class NoOpTimeoutPolicy implements TimeoutPolicy {

    @Override
    public long getPerCallTimeoutMs(String callName) {
        return 0;
    }

    @Override
    public void recordTimeout(String callName, long elapsedMs) {
        // NoOp
    }
}
