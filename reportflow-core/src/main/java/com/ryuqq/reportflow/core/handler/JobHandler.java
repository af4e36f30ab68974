package com.ryuqq.reportflow.core.handler;

import com.ryuqq.reportflow.core.contract.Job;
import com.ryuqq.reportflow.core.model.Payload;

/**
 * 큐 단위로 등록되는 Job 실행 로직.
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>정상 반환 값은 Job 결과로 저장됩니다 (null이면 빈 결과)</li>
 *   <li>예외를 던지면 Job은 FAILED로 종료됩니다</li>
 *   <li>같은 큐의 Job 간 순서는 eligible 시각 기준 FIFO 이상을 가정하지 않습니다</li>
 *   <li>처음부터 다시 실행되어도 안전해야 합니다 (부수 효과 멱등성)</li>
 * </ul>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * Job 실행.
     *
     * @param job lease된 Job 스냅샷 (ACTIVE)
     * @return 결과 Payload (null 허용)
     * @throws Exception 실행 실패 시
     */
    Payload handle(Job job) throws Exception;
}
