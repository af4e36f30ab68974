package com.ryuqq.reportflow.core.protection;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 호출 이름별 고정 타임아웃 정책.
 *
 * <p>이름별 오버라이드가 없으면 기본 타임아웃을 적용합니다. 타임아웃 발생 횟수는
 * 호출 이름별로 집계되어 {@link #timeoutCount(String)}로 조회할 수 있습니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class FixedTimeoutPolicy implements TimeoutPolicy {

    private final long defaultTimeoutMs;
    private final Map<String, Long> overrides;
    private final ConcurrentHashMap<String, AtomicLong> timeouts = new ConcurrentHashMap<>();

    /**
     * @param defaultTimeoutMs 기본 타임아웃 (밀리초, 0 이상, 0은 무제한)
     * @param overrides 호출 이름별 타임아웃 (null 허용)
     */
    public FixedTimeoutPolicy(long defaultTimeoutMs, Map<String, Long> overrides) {
        if (defaultTimeoutMs < 0) {
            throw new IllegalArgumentException("defaultTimeoutMs must be non-negative (current: " + defaultTimeoutMs + ")");
        }
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
    }

    public FixedTimeoutPolicy(long defaultTimeoutMs) {
        this(defaultTimeoutMs, Map.of());
    }

    @Override
    public long getPerCallTimeoutMs(String callName) {
        return overrides.getOrDefault(callName, defaultTimeoutMs);
    }

    @Override
    public void recordTimeout(String callName, long elapsedMs) {
        timeouts.computeIfAbsent(callName, k -> new AtomicLong()).incrementAndGet();
    }

    /**
     * 호출 이름별 타임아웃 발생 횟수.
     */
    public long timeoutCount(String callName) {
        AtomicLong count = timeouts.get(callName);
        return count == null ? 0 : count.get();
    }
}
