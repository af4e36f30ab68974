package com.ryuqq.reportflow.core.statemachine;

/**
 * Job의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * DELAYED ──(visibleAt 도래)──► WAITING
 *    │                            │
 *    └──────────(lease)───────────┤
 *                                 ▼
 *                               ACTIVE
 *                                 │
 *                                 ├─► COMPLETED (handler 성공)
 *                                 │
 *                                 └─► FAILED (handler 예외)
 *
 * 금지된 전이:
 * - COMPLETED/FAILED → 어떤 상태로도 ❌
 * - ACTIVE → WAITING/DELAYED ❌ (자동 재큐잉 없음)
 * </pre>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public enum JobState {

    /**
     * 즉시 lease 가능.
     */
    WAITING,

    /**
     * visibility delay가 끝나지 않아 대기 중.
     */
    DELAYED,

    /**
     * Worker가 lease하여 실행 중.
     */
    ACTIVE,

    /**
     * 완료 (성공).
     */
    COMPLETED,

    /**
     * 실패 (재시도는 외부 브로커 정책).
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * 아직 lease되지 않은 대기 상태인지 확인.
     *
     * <p>대기 상태의 Job만 데이터 수정(updateData)이 허용됩니다.</p>
     *
     * @return WAITING 또는 DELAYED인 경우 true
     */
    public boolean isPending() {
        return this == WAITING || this == DELAYED;
    }
}
