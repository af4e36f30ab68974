package com.ryuqq.reportflow.application.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.reportflow.application.report.analysis.PreAnalysis;
import com.ryuqq.reportflow.application.report.valuation.Valuation;
import com.ryuqq.reportflow.core.contract.JobHandle;
import com.ryuqq.reportflow.core.contract.ReportJobRequest;

/**
 * 파이프라인 한 번 실행의 중간 결과.
 *
 * <p>한 worker 스레드에서만 사용됩니다. 각 산출물은 해당 단계가 실패하면 null로 남습니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
final class ReportRun {

    private final ReportJobRequest request;
    private ReportStage stage = ReportStage.RECEIVED;
    private PreAnalysis preAnalysis;
    private JsonNode supplementary;
    private Valuation valuation;
    private byte[] renderedDocument;
    private JobHandle deliveryHandle;

    ReportRun(ReportJobRequest request) {
        this.request = request;
    }

    void advance(ReportStage next) {
        if (stage.isTerminal()) {
            throw new IllegalStateException("Run for report " + request.reportId() + " already ended at " + stage);
        }
        this.stage = next;
    }

    ReportJobRequest request() {
        return request;
    }

    ReportStage stage() {
        return stage;
    }

    PreAnalysis preAnalysis() {
        return preAnalysis;
    }

    void preAnalysis(PreAnalysis preAnalysis) {
        this.preAnalysis = preAnalysis;
    }

    JsonNode supplementary() {
        return supplementary;
    }

    void supplementary(JsonNode supplementary) {
        this.supplementary = supplementary;
    }

    Valuation valuation() {
        return valuation;
    }

    void valuation(Valuation valuation) {
        this.valuation = valuation;
    }

    byte[] renderedDocument() {
        return renderedDocument;
    }

    void renderedDocument(byte[] renderedDocument) {
        this.renderedDocument = renderedDocument == null || renderedDocument.length == 0 ? null : renderedDocument;
    }

    boolean hasRenderedDocument() {
        return renderedDocument != null;
    }

    JobHandle deliveryHandle() {
        return deliveryHandle;
    }

    void deliveryHandle(JobHandle deliveryHandle) {
        this.deliveryHandle = deliveryHandle;
    }

    ReportPipelineResult toResult() {
        return new ReportPipelineResult(
            request.reportId(),
            stage,
            preAnalysis != null,
            supplementary != null,
            valuation != null,
            renderedDocument != null,
            deliveryHandle == null ? null : deliveryHandle.id().getValue()
        );
    }
}
