package com.ryuqq.reportflow.core.contract;

import com.ryuqq.reportflow.core.model.JobId;
import com.ryuqq.reportflow.core.model.Payload;
import com.ryuqq.reportflow.core.model.QueueName;
import com.ryuqq.reportflow.core.statemachine.JobState;

/**
 * Durable Queue가 소유하는 Job의 스냅샷.
 *
 * <p>Job은 큐가 배타적으로 소유합니다. Worker는 lease 시점의 스냅샷을 받아
 * handler에 전달하며, 상태 변경은 항상 큐를 통해서만 이루어집니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>enqueuedAt / visibleAt:</strong> epoch milliseconds, visibleAt = enqueuedAt + delayMs</li>
 *   <li><strong>attemptCount:</strong> lease 횟수 (enqueue 직후 0)</li>
 *   <li><strong>result / failedReason:</strong> 종료 상태에서만 채워짐 (null 가능)</li>
 * </ul>
 *
 * @param id Job ID
 * @param queueName 큐 이름
 * @param payload 업무 데이터
 * @param enqueuedAt enqueue 시각 (epoch millis)
 * @param visibleAt lease 가능 시각 (epoch millis)
 * @param state 현재 상태
 * @param attemptCount lease 횟수
 * @param result 성공 결과 (null 가능)
 * @param failedReason 실패 사유 (null 가능)
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record Job(
    JobId id,
    QueueName queueName,
    Payload payload,
    long enqueuedAt,
    long visibleAt,
    JobState state,
    int attemptCount,
    Payload result,
    String failedReason
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 시각/횟수가 유효하지 않은 경우
     */
    public Job {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (queueName == null) {
            throw new IllegalArgumentException("queueName cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (visibleAt < enqueuedAt) {
            throw new IllegalArgumentException("visibleAt must be >= enqueuedAt (enqueuedAt: " + enqueuedAt + ", visibleAt: " + visibleAt + ")");
        }
        if (attemptCount < 0) {
            throw new IllegalArgumentException("attemptCount must be non-negative (current: " + attemptCount + ")");
        }
    }

    /**
     * 새로 enqueue된 Job 생성.
     *
     * @param id Job ID
     * @param queueName 큐 이름
     * @param payload 업무 데이터
     * @param enqueuedAt enqueue 시각 (epoch millis)
     * @param delayMs visibility delay (밀리초, 0 이상)
     * @return WAITING(delayMs=0) 또는 DELAYED 상태의 Job
     */
    public static Job enqueued(JobId id, QueueName queueName, Payload payload, long enqueuedAt, long delayMs) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs cannot be negative, but was: " + delayMs);
        }
        JobState state = delayMs == 0 ? JobState.WAITING : JobState.DELAYED;
        return new Job(id, queueName, payload, enqueuedAt, enqueuedAt + delayMs, state, 0, null, null);
    }

    /**
     * 상태만 변경한 새 인스턴스 생성 (전이 규칙은 호출자가 검증).
     */
    public Job withState(JobState state) {
        return new Job(id, queueName, payload, enqueuedAt, visibleAt, state, attemptCount, result, failedReason);
    }

    /**
     * Payload만 교체한 새 인스턴스 생성.
     */
    public Job withPayload(Payload payload) {
        return new Job(id, queueName, payload, enqueuedAt, visibleAt, state, attemptCount, result, failedReason);
    }

    /**
     * lease된 Job 생성 (ACTIVE, attemptCount + 1).
     */
    public Job leased() {
        return new Job(id, queueName, payload, enqueuedAt, visibleAt, JobState.ACTIVE, attemptCount + 1, result, failedReason);
    }

    /**
     * 완료된 Job 생성.
     */
    public Job completed(Payload result) {
        return new Job(id, queueName, payload, enqueuedAt, visibleAt, JobState.COMPLETED, attemptCount, result, null);
    }

    /**
     * 실패한 Job 생성.
     */
    public Job failed(String failedReason) {
        return new Job(id, queueName, payload, enqueuedAt, visibleAt, JobState.FAILED, attemptCount, null, failedReason);
    }

    /**
     * 주어진 시각에 lease 가능한지 확인.
     *
     * @param nowMillis 현재 시각 (epoch millis)
     * @return 대기 상태이고 visibleAt이 지났으면 true
     */
    public boolean isEligibleAt(long nowMillis) {
        return state.isPending() && visibleAt <= nowMillis;
    }
}
