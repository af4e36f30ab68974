package com.ryuqq.reportflow.application.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.reportflow.adapter.inmemory.bus.InMemoryNotificationBus;
import com.ryuqq.reportflow.adapter.inmemory.queue.InMemoryJobQueue;
import com.ryuqq.reportflow.adapter.inmemory.store.InMemoryNotificationRepository;
import com.ryuqq.reportflow.adapter.inmemory.store.InMemoryReportRepository;
import com.ryuqq.reportflow.application.codec.JobPayloadCodec;
import com.ryuqq.reportflow.application.delivery.DeliveryConfig;
import com.ryuqq.reportflow.application.delivery.DeliveryDispatcher;
import com.ryuqq.reportflow.application.delivery.ReportEmailComposer;
import com.ryuqq.reportflow.application.notification.NotificationService;
import com.ryuqq.reportflow.application.protection.ExternalCallGuard;
import com.ryuqq.reportflow.application.report.ScriptedTextGenerator.Call;
import com.ryuqq.reportflow.application.report.analysis.PreAnalysis;
import com.ryuqq.reportflow.application.report.render.ReportDocument;
import com.ryuqq.reportflow.application.report.render.ReportDocumentAssembler;
import com.ryuqq.reportflow.application.report.valuation.Valuation;
import com.ryuqq.reportflow.core.contract.DeliveryMessage;
import com.ryuqq.reportflow.core.contract.Job;
import com.ryuqq.reportflow.core.contract.JobHandle;
import com.ryuqq.reportflow.core.contract.JobOptions;
import com.ryuqq.reportflow.core.contract.NotificationEvent;
import com.ryuqq.reportflow.core.contract.QuestionAnswer;
import com.ryuqq.reportflow.core.contract.ReportJobRequest;
import com.ryuqq.reportflow.core.contract.ReportType;
import com.ryuqq.reportflow.core.model.JobId;
import com.ryuqq.reportflow.core.model.Payload;
import com.ryuqq.reportflow.core.model.QueueName;
import com.ryuqq.reportflow.core.model.TopicKey;
import com.ryuqq.reportflow.core.protection.noop.NoOpTimeoutPolicy;
import com.ryuqq.reportflow.core.record.DeliveryStatus;
import com.ryuqq.reportflow.core.record.ReportRecord;
import com.ryuqq.reportflow.testkit.time.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ReportPipeline 테스트.
 *
 * <p>인메모리 어댑터와 스크립트된 텍스트 생성기로 파이프라인 전체를 실행합니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
class ReportPipelineTest {

    private static final byte[] PDF = "%PDF-1.7 report".getBytes(StandardCharsets.US_ASCII);
    private static final QueueName EMAIL = QueueName.of(DeliveryConfig.DEFAULT_QUEUE);
    private static final TopicKey TENANT = TopicKey.of("p1", "o1");

    private MutableClock clock;
    private InMemoryJobQueue queue;
    private InMemoryReportRepository reportRepository;
    private InMemoryNotificationRepository notificationRepository;
    private InMemoryNotificationBus bus;
    private ScriptedTextGenerator textGenerator;
    private ExternalCallGuard guard;
    private JobPayloadCodec codec;
    private List<ReportDocument> rendered;
    private AtomicBoolean renderFails;
    private List<NotificationEvent> published;
    private ReportPipeline pipeline;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        queue = new InMemoryJobQueue(clock);
        reportRepository = new InMemoryReportRepository();
        notificationRepository = new InMemoryNotificationRepository();
        bus = new InMemoryNotificationBus();
        textGenerator = new ScriptedTextGenerator();
        guard = new ExternalCallGuard(new NoOpTimeoutPolicy());
        codec = new JobPayloadCodec();
        rendered = new CopyOnWriteArrayList<>();
        renderFails = new AtomicBoolean();
        published = new CopyOnWriteArrayList<>();
        bus.subscribe(TENANT, published::add);

        DeliveryConfig deliveryConfig = new DeliveryConfig();
        pipeline = new ReportPipeline(
            textGenerator,
            document -> {
                rendered.add(document);
                if (renderFails.get()) {
                    throw new IllegalStateException("renderer crashed");
                }
                return PDF;
            },
            reportRepository,
            new DeliveryDispatcher(queue, codec, deliveryConfig),
            new ReportEmailComposer(deliveryConfig.senderAddress(), clock),
            new NotificationService(notificationRepository, bus, clock),
            codec,
            guard,
            clock,
            new PipelineConfig()
        );

        reportRepository.create(ReportRecord.empty("r-1"));
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
        guard.close();
    }

    private static ReportJobRequest request(boolean enableValuation, String email, List<QuestionAnswer> answers) {
        return new ReportJobRequest("r-1", "Acme", "wf-1", ReportType.PDV, email,
            "p1", "o1", "owf-1", "acme", enableValuation, answers);
    }

    private static List<QuestionAnswer> answers() {
        return List.of(new QuestionAnswer("How long has your business been collecting data?", "3 years"));
    }

    private ReportRecord record() {
        return reportRepository.findById("r-1").orElseThrow();
    }

    // ============================================================
    // 1. 가치 평가 비활성화 시나리오
    // ============================================================

    @Test
    void 가치_평가_없이_실행하면_이메일_Job_하나가_5분_지연으로_예약된다() {
        // when
        ReportPipelineResult result = pipeline.run(request(false, "user@acme.io", answers()));

        // then: 단계
        assertThat(result.stage()).isEqualTo(ReportStage.DONE);
        assertThat(textGenerator.count(Call.OVERVIEW)).isEqualTo(1);
        assertThat(textGenerator.count(Call.SUPPLEMENTARY)).isEqualTo(1);
        assertThat(textGenerator.count(Call.VALUATION)).isZero();
        assertThat(rendered).hasSize(1);
        assertThat(rendered.get(0).valuation()).isNull();

        // then: 레코드
        ReportRecord record = record();
        assertThat(record.preAnalysisData()).isNotNull();
        assertThat(record.supplementaryData()).isNotNull();
        assertThat(record.valuationData()).isNull();
        assertThat(record.lowerValuationRange()).isNull();
        assertThat(record.renderedDocument()).isEqualTo(PDF);
        assertThat(record.tenantId()).isEqualTo("o1");
        assertThat(record.platformId()).isEqualTo("p1");

        // then: 배달
        List<Job> emailJobs = queue.jobs(EMAIL);
        assertThat(emailJobs).hasSize(1);
        Job emailJob = emailJobs.get(0);
        assertThat(emailJob.visibleAt() - emailJob.enqueuedAt()).isEqualTo(300_000L);
        assertThat(record.deliveryJobId()).isEqualTo(emailJob.id().getValue());
        assertThat(record.deliveryStatus()).isEqualTo(DeliveryStatus.PENDING);
        assertThat(result.deliveryJobId()).isEqualTo(emailJob.id().getValue());

        DeliveryMessage message = codec.decode(emailJob.payload(), DeliveryMessage.class);
        assertThat(message.recipient()).isEqualTo("user@acme.io");
        assertThat(message.correlationId()).contains("r-1");
    }

    @Test
    void 성공_알림은_저장되고_테넌트_키로_발행된다() {
        pipeline.run(request(false, "user@acme.io", List.of()));

        assertThat(published).singleElement().satisfies(event -> {
            assertThat(event.title()).isEqualTo(ReportPipeline.GENERATED_TITLE);
            assertThat(event.description()).isEqualTo(ReportPipeline.GENERATED_SCHEDULED_DESCRIPTION);
        });
        assertThat(notificationRepository.findByTopic(TENANT)).hasSize(1);
    }

    // ============================================================
    // 2. 단계별 실패 격리
    // ============================================================

    @Test
    void 요약이_깨져도_빈_구조로_저장까지_진행한다() {
        // given
        textGenerator.respond(Call.SUMMARY, "this is not json at all");

        // when
        pipeline.run(request(false, "user@acme.io", List.of()));

        // then
        JsonNode preAnalysis = codec.readTree(record().preAnalysisData());
        JsonNode summary = preAnalysis.path("summary");
        assertThat(summary.path("summary").asText()).isEmpty();
        assertThat(summary.path("competitiveAdvantages").isArray()).isTrue();
        assertThat(summary.path("competitiveAdvantages").size()).isZero();
        assertThat(summary.path("dataProfileTable").size()).isZero();
        assertThat(preAnalysis.path("overview").asText()).isEqualTo(ScriptedTextGenerator.OVERVIEW);
    }

    @Test
    void 렌더링이_실패하면_이메일을_예약하지_않는다() {
        // given
        renderFails.set(true);

        // when
        ReportPipelineResult result = pipeline.run(request(false, "user@acme.io", List.of()));

        // then
        assertThat(queue.jobs(EMAIL)).isEmpty();
        ReportRecord record = record();
        assertThat(record.deliveryJobId()).isNull();
        assertThat(record.deliveryStatus()).isNull();
        assertThat(record.hasRenderedDocument()).isFalse();
        assertThat(record.preAnalysisData()).isNotNull();
        assertThat(result.documentRendered()).isFalse();
        assertThat(published).singleElement()
            .extracting(NotificationEvent::description)
            .isEqualTo(ReportPipeline.GENERATED_DESCRIPTION);
    }

    @Test
    void 문서_조립이_실패해도_앞_단계_결과는_저장된다() {
        // given
        DeliveryConfig deliveryConfig = new DeliveryConfig();
        ReportDocumentAssembler brokenAssembler = new ReportDocumentAssembler() {
            @Override
            public ReportDocument assemble(String orgName, PreAnalysis preAnalysis,
                                           JsonNode supplementary, Valuation valuation) {
                throw new IllegalStateException("assembly crashed");
            }
        };
        ReportPipeline assemblyFailing = new ReportPipeline(
            textGenerator,
            document -> PDF,
            reportRepository,
            new DeliveryDispatcher(queue, codec, deliveryConfig),
            new ReportEmailComposer(deliveryConfig.senderAddress(), clock),
            new NotificationService(notificationRepository, bus, clock),
            codec,
            guard,
            clock,
            new PipelineConfig(),
            brokenAssembler
        );

        // when
        ReportPipelineResult result;
        try {
            result = assemblyFailing.run(request(false, "user@acme.io", answers()));
        } finally {
            assemblyFailing.close();
        }

        // then
        assertThat(result.stage()).isEqualTo(ReportStage.DONE);
        assertThat(result.documentRendered()).isFalse();
        assertThat(record().preAnalysisData()).isNotNull();
        assertThat(record().supplementaryData()).isNotNull();
        assertThat(record().hasRenderedDocument()).isFalse();
        assertThat(queue.jobs(EMAIL)).isEmpty();
        assertThat(published).singleElement()
            .extracting(NotificationEvent::title)
            .isEqualTo(ReportPipeline.GENERATED_TITLE);
    }

    @Test
    void 수신자가_없으면_이메일을_예약하지_않는다() {
        pipeline.run(request(false, "  ", List.of()));

        assertThat(queue.jobs(EMAIL)).isEmpty();
        assertThat(record().hasRenderedDocument()).isTrue();
        assertThat(record().deliveryJobId()).isNull();
    }

    @Test
    void 사전_분석이_실패해도_경쟁_비교는_생성된다() {
        // given
        textGenerator.fail(Call.OVERVIEW);

        // when
        ReportPipelineResult result = pipeline.run(request(false, "user@acme.io", List.of()));

        // then
        assertThat(result.preAnalysisGenerated()).isFalse();
        assertThat(result.supplementaryGenerated()).isTrue();
        assertThat(record().preAnalysisData()).isNull();
        assertThat(codec.readTree(record().supplementaryData()).path("sectorName").asText()).isEqualTo("Logistics");
        assertThat(rendered.get(0).preAnalysis()).isNull();
    }

    @Test
    void 경쟁_비교가_해석되지_않으면_빈_객체로_저장한다() {
        textGenerator.respond(Call.SUPPLEMENTARY, "no comparison available");

        pipeline.run(request(false, "user@acme.io", List.of()));

        assertThat(record().supplementaryData()).isEqualTo("{}");
    }

    @Test
    void 경쟁_비교_prompt는_사전_분석_지표로_seed된다() {
        pipeline.run(request(false, "user@acme.io", List.of()));

        assertThat(textGenerator.requests())
            .filteredOn(request -> ScriptedTextGenerator.classify(request.prompt()) == Call.SUPPLEMENTARY)
            .singleElement()
            .satisfies(request -> assertThat(request.prompt()).contains("- data reliance: 70%"));
    }

    // ============================================================
    // 3. 가치 평가
    // ============================================================

    @Test
    void 가치_평가가_활성화되면_범위를_저장한다() {
        // when
        ReportPipelineResult result = pipeline.run(request(true, "user@acme.io", answers()));

        // then: 6,000,000 × 80% × 0.875 × avg(60,60,60)% = 2,520,000
        assertThat(result.valuationGenerated()).isTrue();
        ReportRecord record = record();
        assertThat(record.upperValuationRange()).isEqualTo("$2.5M");
        assertThat(record.lowerValuationRange()).isEqualTo("$1.8M");
        JsonNode valuation = codec.readTree(record.valuationData());
        assertThat(valuation.path("upperADV").asLong()).isEqualTo(2_520_000L);
        assertThat(valuation.path("lowerADV").asLong()).isEqualTo(1_764_000L);
        assertThat(valuation.path("chartData").path("percentages").path("upper").asText()).isEqualTo("126.0%");
        assertThat(rendered.get(0).valuation()).isNotNull();
    }

    @Test
    void 가치_평가_응답이_깨지면_가치_평가_없이_진행한다() {
        textGenerator.respond(Call.VALUATION, "cannot extract");

        ReportPipelineResult result = pipeline.run(request(true, "user@acme.io", answers()));

        assertThat(result.valuationGenerated()).isFalse();
        assertThat(record().valuationData()).isNull();
        assertThat(queue.jobs(EMAIL)).hasSize(1);
    }

    // ============================================================
    // 4. 전체 실패
    // ============================================================

    @Test
    void 저장이_실패하면_파이프라인_예외와_실패_알림() {
        // given
        reportRepository.clear();

        // when / then
        assertThatThrownBy(() -> pipeline.run(request(false, "user@acme.io", List.of())))
            .isInstanceOf(ReportPipelineException.class)
            .satisfies(e -> assertThat(((ReportPipelineException) e).getFailedStage()).isEqualTo(ReportStage.PERSISTING));

        assertThat(queue.jobs(EMAIL)).isEmpty();
        assertThat(published).singleElement()
            .extracting(NotificationEvent::title)
            .isEqualTo(ReportPipeline.FAILED_TITLE);
    }

    @Test
    void 배달_예약이_실패하면_DELIVERY_FAILED로_기록한다() {
        // given
        ReportPipeline failingDelivery = new ReportPipeline(
            textGenerator,
            document -> PDF,
            reportRepository,
            new DeliveryDispatcher(new InMemoryJobQueue(clock) {
                @Override
                public JobHandle enqueue(QueueName queueName, Payload payload, JobOptions options) {
                    throw new IllegalStateException("queue unavailable");
                }
            }, codec, new DeliveryConfig()),
            new ReportEmailComposer(DeliveryConfig.DEFAULT_SENDER, clock),
            new NotificationService(notificationRepository, bus, clock),
            codec,
            guard,
            clock,
            new PipelineConfig()
        );

        // when / then
        try (failingDelivery) {
            assertThatThrownBy(() -> failingDelivery.run(request(false, "user@acme.io", List.of())))
                .isInstanceOf(ReportPipelineException.class)
                .hasMessageContaining("queue unavailable");
        }

        ReportRecord record = record();
        assertThat(record.deliveryStatus()).isEqualTo(DeliveryStatus.DELIVERY_FAILED);
        assertThat(record.deliveryError()).isEqualTo("queue unavailable");
        assertThat(record.hasRenderedDocument()).isTrue();
    }

    // ============================================================
    // 5. Job handler
    // ============================================================

    @Test
    void Job_handler는_payload를_해석해_결과를_반환한다() {
        // given
        ReportJobHandler handler = new ReportJobHandler(pipeline, codec);
        Payload payload = codec.encode(request(false, "user@acme.io", List.of()));
        Job job = Job.enqueued(JobId.of("report-job"), QueueName.of("report"), payload, 0L, 0L).leased();

        // when
        ReportPipelineResult result = codec.decode(handler.handle(job), ReportPipelineResult.class);

        // then
        assertThat(result.reportId()).isEqualTo("r-1");
        assertThat(result.stage()).isEqualTo(ReportStage.DONE);
        assertThat(result.deliveryJob()).isPresent();
    }
}
