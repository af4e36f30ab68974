package com.ryuqq.reportflow.application.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.reportflow.application.codec.JobPayloadCodec;
import com.ryuqq.reportflow.application.delivery.DeliveryDispatcher;
import com.ryuqq.reportflow.application.delivery.ReportEmailComposer;
import com.ryuqq.reportflow.application.notification.NotificationService;
import com.ryuqq.reportflow.application.protection.ExternalCallGuard;
import com.ryuqq.reportflow.application.report.analysis.PreAnalysis;
import com.ryuqq.reportflow.application.report.analysis.PreAnalysisGenerator;
import com.ryuqq.reportflow.application.report.analysis.ProfileMetrics;
import com.ryuqq.reportflow.application.report.analysis.SupplementaryGenerator;
import com.ryuqq.reportflow.application.report.render.DocumentRenderer;
import com.ryuqq.reportflow.application.report.render.ReportDocument;
import com.ryuqq.reportflow.application.report.render.ReportDocumentAssembler;
import com.ryuqq.reportflow.application.report.valuation.Valuation;
import com.ryuqq.reportflow.application.report.valuation.ValuationCalculator;
import com.ryuqq.reportflow.core.contract.DeliveryMessage;
import com.ryuqq.reportflow.core.contract.JobHandle;
import com.ryuqq.reportflow.core.contract.ReportJobRequest;
import com.ryuqq.reportflow.core.record.DeliveryStatus;
import com.ryuqq.reportflow.core.record.ReportUpdate;
import com.ryuqq.reportflow.core.spi.ReportRepository;
import com.ryuqq.reportflow.core.spi.TextGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 리포트 파이프라인.
 *
 * <p>리포트 요청 하나를 완성된 문서와 예약된 이메일 Job으로 바꿉니다. 모든 단계는
 * 한 번의 handler 호출 안에서 순서대로 실행됩니다.</p>
 *
 * <p><strong>단계와 실패 처리:</strong></p>
 * <ol>
 *   <li>사전 분석: 실패 시 없음</li>
 *   <li>경쟁 비교: 사전 분석과 무관하게 실행, 실패 시 없음</li>
 *   <li>가치 평가 (enableADV일 때만): 실패 시 없음</li>
 *   <li>렌더링: 실패 시 문서 없음</li>
 *   <li>저장: 항상 실행, 실패 시 파이프라인 전체 실패</li>
 *   <li>배달 예약: 문서와 수신자가 모두 있을 때만</li>
 *   <li>알림: 성공/실패 알림 이중 기록</li>
 * </ol>
 *
 * <p><strong>전체 실패:</strong> 레코드를 DELIVERY_FAILED + 오류 메시지로 갱신하고
 * 실패 알림을 보낸 뒤 {@link ReportPipelineException}을 던집니다.</p>
 *
 * <p>지표 prompt 실행기를 소유하므로 사용 후 {@link #close()}해야 합니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class ReportPipeline implements AutoCloseable {

    public static final String GENERATED_TITLE = "PDV Report Generated";
    public static final String FAILED_TITLE = "PDV Report Generation Failed";

    static final String GENERATED_DESCRIPTION = "Your PDV report has been generated successfully.";
    static final String GENERATED_SCHEDULED_DESCRIPTION =
        "Your PDV report has been generated successfully. Email delivery has been scheduled.";

    private static final Logger log = LoggerFactory.getLogger(ReportPipeline.class);

    private final PreAnalysisGenerator preAnalysisGenerator;
    private final SupplementaryGenerator supplementaryGenerator;
    private final ValuationCalculator valuationCalculator;
    private final ReportDocumentAssembler assembler;
    private final DocumentRenderer renderer;
    private final ReportRepository reportRepository;
    private final DeliveryDispatcher deliveryDispatcher;
    private final ReportEmailComposer emailComposer;
    private final NotificationService notificationService;
    private final JobPayloadCodec codec;
    private final ExternalCallGuard guard;
    private final ExecutorService metricExecutor;

    public ReportPipeline(
        TextGenerator textGenerator,
        DocumentRenderer renderer,
        ReportRepository reportRepository,
        DeliveryDispatcher deliveryDispatcher,
        ReportEmailComposer emailComposer,
        NotificationService notificationService,
        JobPayloadCodec codec,
        ExternalCallGuard guard,
        Clock clock,
        PipelineConfig config
    ) {
        this(textGenerator, renderer, reportRepository, deliveryDispatcher, emailComposer,
            notificationService, codec, guard, clock, config, new ReportDocumentAssembler());
    }

    ReportPipeline(
        TextGenerator textGenerator,
        DocumentRenderer renderer,
        ReportRepository reportRepository,
        DeliveryDispatcher deliveryDispatcher,
        ReportEmailComposer emailComposer,
        NotificationService notificationService,
        JobPayloadCodec codec,
        ExternalCallGuard guard,
        Clock clock,
        PipelineConfig config,
        ReportDocumentAssembler assembler
    ) {
        if (textGenerator == null) {
            throw new IllegalArgumentException("textGenerator cannot be null");
        }
        if (renderer == null) {
            throw new IllegalArgumentException("renderer cannot be null");
        }
        if (reportRepository == null) {
            throw new IllegalArgumentException("reportRepository cannot be null");
        }
        if (deliveryDispatcher == null) {
            throw new IllegalArgumentException("deliveryDispatcher cannot be null");
        }
        if (emailComposer == null) {
            throw new IllegalArgumentException("emailComposer cannot be null");
        }
        if (notificationService == null) {
            throw new IllegalArgumentException("notificationService cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (guard == null) {
            throw new IllegalArgumentException("guard cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (assembler == null) {
            throw new IllegalArgumentException("assembler cannot be null");
        }

        this.metricExecutor = Executors.newFixedThreadPool(config.metricConcurrency(), new MetricThreadFactory());
        this.preAnalysisGenerator = new PreAnalysisGenerator(textGenerator, guard, codec, metricExecutor);
        this.supplementaryGenerator = new SupplementaryGenerator(textGenerator, guard, codec);
        this.valuationCalculator = new ValuationCalculator(textGenerator, guard, codec, clock);
        this.assembler = assembler;
        this.renderer = renderer;
        this.reportRepository = reportRepository;
        this.deliveryDispatcher = deliveryDispatcher;
        this.emailComposer = emailComposer;
        this.notificationService = notificationService;
        this.codec = codec;
        this.guard = guard;
    }

    /**
     * 파이프라인 실행.
     *
     * @param request 리포트 요청
     * @return 실행 결과
     * @throws ReportPipelineException 저장 실패 등 전체 실패
     */
    public ReportPipelineResult run(ReportJobRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        ReportRun run = new ReportRun(request);
        log.info("Starting report {} for {}", request.reportId(), request.orgName());

        try {
            run.advance(ReportStage.GENERATING_PRE_ANALYSIS);
            run.preAnalysis(attempt(run, () -> preAnalysisGenerator.generate(request.orgName())));

            run.advance(ReportStage.GENERATING_SUPPLEMENT);
            ProfileMetrics metrics = run.preAnalysis() == null ? null : run.preAnalysis().metrics();
            run.supplementary(attempt(run, () -> supplementaryGenerator.generate(request.orgName(), metrics)));

            if (request.enableValuation()) {
                run.advance(ReportStage.GENERATING_VALUATION);
                Optional<Valuation> valuation = attempt(run, () -> valuationCalculator.calculate(request, metrics));
                run.valuation(valuation == null ? null : valuation.orElse(null));
            }

            run.advance(ReportStage.RENDERING);
            run.renderedDocument(attempt(run, () -> {
                ReportDocument document = assembler.assemble(
                    request.orgName(), run.preAnalysis(), run.supplementary(), run.valuation());
                return guard.call(ExternalCallGuard.DOCUMENT_RENDER, () -> renderer.render(document));
            }));

            run.advance(ReportStage.PERSISTING);
            persist(run);

            run.advance(ReportStage.SCHEDULING_DELIVERY);
            scheduleDelivery(run);

            run.advance(ReportStage.DONE);
        } catch (Exception e) {
            ReportStage failedAt = run.stage();
            run.advance(ReportStage.FAILED);
            log.error("Report {} for {} failed at {}", request.reportId(), request.orgName(), failedAt, e);
            recordFailure(request, e);
            notificationService.notify(
                FAILED_TITLE,
                "PDV report generation failed for " + request.orgName() + ": " + errorMessage(e),
                request.tenantId(),
                request.platformId()
            );
            throw new ReportPipelineException(request.reportId(), failedAt, e);
        }

        notificationService.notify(
            GENERATED_TITLE,
            run.deliveryHandle() == null ? GENERATED_DESCRIPTION : GENERATED_SCHEDULED_DESCRIPTION,
            request.tenantId(),
            request.platformId()
        );
        log.info("Report {} for {} completed (document: {}, delivery job: {})",
            request.reportId(), request.orgName(), run.hasRenderedDocument(),
            run.deliveryHandle() == null ? "none" : run.deliveryHandle().id().getValue());
        return run.toResult();
    }

    /**
     * 단계 실행. 실패는 로그로 남기고 null(결과 없음)을 반환합니다.
     */
    private <T> T attempt(ReportRun run, Callable<T> stage) {
        try {
            return stage.call();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Report {} interrupted during {}", run.request().reportId(), run.stage());
            return null;
        } catch (Exception e) {
            log.warn("Report {} stage {} failed, continuing without its result: {}",
                run.request().reportId(), run.stage(), errorMessage(e), e);
            return null;
        }
    }

    private void persist(ReportRun run) {
        ReportJobRequest request = run.request();
        Valuation valuation = run.valuation();
        JsonNode supplementary = run.supplementary();

        reportRepository.update(request.reportId(), ReportUpdate.builder()
            .tenant(request.platformId(), request.tenantId())
            .preAnalysisData(run.preAnalysis() == null ? null : codec.toJson(run.preAnalysis()))
            .supplementaryData(supplementary == null ? null : codec.toJson(supplementary))
            .valuationData(valuation == null ? null : codec.toJson(valuation))
            .valuationRange(
                valuation == null ? null : valuation.lowerRangeLabel(),
                valuation == null ? null : valuation.upperRangeLabel())
            .renderedDocument(run.renderedDocument())
            .deliveryError(null)
            .build());
        log.debug("Persisted report {}", request.reportId());
    }

    private void scheduleDelivery(ReportRun run) {
        ReportJobRequest request = run.request();
        if (!run.hasRenderedDocument()) {
            log.info("Report {} has no rendered document, delivery not scheduled", request.reportId());
            return;
        }
        if (request.recipient().isEmpty()) {
            log.info("Report {} has no recipient, delivery not scheduled", request.reportId());
            return;
        }

        DeliveryMessage message = emailComposer.compose(request, run.renderedDocument());
        JobHandle handle = deliveryDispatcher.schedule(message);
        run.deliveryHandle(handle);

        reportRepository.update(request.reportId(), ReportUpdate.builder()
            .deliveryJobId(handle.id().getValue())
            .deliveryStatus(DeliveryStatus.PENDING)
            .build());
    }

    private void recordFailure(ReportJobRequest request, Exception cause) {
        try {
            reportRepository.update(request.reportId(), ReportUpdate.builder()
                .deliveryStatus(DeliveryStatus.DELIVERY_FAILED)
                .deliveryError(errorMessage(cause))
                .build());
        } catch (RuntimeException e) {
            log.error("Failed to record failure status for report {}", request.reportId(), e);
        }
    }

    static String errorMessage(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    @Override
    public void close() {
        metricExecutor.shutdown();
        try {
            if (!metricExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                metricExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            metricExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class MetricThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "report-metric-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
