package com.ryuqq.reportflow.core.statemachine;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Job 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>DELAYED → WAITING</li>
 *   <li>DELAYED → ACTIVE</li>
 *   <li>WAITING → ACTIVE</li>
 *   <li>ACTIVE → COMPLETED</li>
 *   <li>ACTIVE → FAILED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(COMPLETED, FAILED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>ACTIVE에서 대기 상태로 되돌아가지 않음</li>
 * </ul>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class JobStateTransition {

    private static final Map<JobState, Set<JobState>> ALLOWED = new EnumMap<>(JobState.class);

    static {
        ALLOWED.put(JobState.DELAYED, EnumSet.of(JobState.WAITING, JobState.ACTIVE));
        ALLOWED.put(JobState.WAITING, EnumSet.of(JobState.ACTIVE));
        ALLOWED.put(JobState.ACTIVE, EnumSet.of(JobState.COMPLETED, JobState.FAILED));
        ALLOWED.put(JobState.COMPLETED, EnumSet.noneOf(JobState.class));
        ALLOWED.put(JobState.FAILED, EnumSet.noneOf(JobState.class));
    }

    private JobStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(JobState from, JobState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Job is already %s, cannot move to %s", from, to)
            );
        }
        if (!ALLOWED.get(from).contains(to)) {
            throw new IllegalStateException(
                String.format("Job cannot move from %s to %s", from, to)
            );
        }
    }

    /**
     * 현재 상태에서 갈 수 있는 상태 목록.
     *
     * @param from 현재 상태
     * @return 읽기 전용 집합 (종료 상태면 빈 집합)
     */
    public static Set<JobState> allowedFrom(JobState from) {
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        return Collections.unmodifiableSet(ALLOWED.get(from));
    }

    /**
     * 검증 후 다음 상태 반환.
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return next
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static JobState transition(JobState current, JobState next) {
        validate(current, next);
        return next;
    }
}
