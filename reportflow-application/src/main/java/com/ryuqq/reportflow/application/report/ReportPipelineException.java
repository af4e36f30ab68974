package com.ryuqq.reportflow.application.report;

/**
 * 파이프라인 전체 실패.
 *
 * <p>단계별 처리로 흡수되지 않은 오류(예: 필수 저장 실패)를 감쌉니다.
 * worker는 이 예외로 리포트 Job을 FAILED로 표시합니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class ReportPipelineException extends RuntimeException {

    private final String reportId;
    private final ReportStage failedStage;

    public ReportPipelineException(String reportId, ReportStage failedStage, Throwable cause) {
        super("Report " + reportId + " failed at " + failedStage + ": " + cause.getMessage(), cause);
        this.reportId = reportId;
        this.failedStage = failedStage;
    }

    public String getReportId() {
        return reportId;
    }

    public ReportStage getFailedStage() {
        return failedStage;
    }
}
