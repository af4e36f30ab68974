package com.ryuqq.reportflow.application.report;

/**
 * 리포트 파이프라인 단계.
 *
 * <p><strong>진행 순서:</strong></p>
 * <pre>
 * RECEIVED → GENERATING_PRE_ANALYSIS → GENERATING_SUPPLEMENT
 *   → (활성화 시) GENERATING_VALUATION → RENDERING → PERSISTING
 *   → SCHEDULING_DELIVERY → DONE
 * </pre>
 *
 * <p>FAILED는 어느 단계에서든 도달할 수 있는 종료 단계입니다.
 * 단계는 한 번의 handler 호출 안에서만 진행되며 별도로 영속화되지 않습니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public enum ReportStage {
    RECEIVED,
    GENERATING_PRE_ANALYSIS,
    GENERATING_SUPPLEMENT,
    GENERATING_VALUATION,
    RENDERING,
    PERSISTING,
    SCHEDULING_DELIVERY,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
