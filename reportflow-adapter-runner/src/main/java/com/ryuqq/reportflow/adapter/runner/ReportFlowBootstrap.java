package com.ryuqq.reportflow.adapter.runner;

import com.ryuqq.reportflow.adapter.inmemory.bus.InMemoryNotificationBus;
import com.ryuqq.reportflow.adapter.inmemory.queue.InMemoryJobQueue;
import com.ryuqq.reportflow.adapter.inmemory.store.InMemoryNotificationRepository;
import com.ryuqq.reportflow.adapter.inmemory.store.InMemoryReportRepository;
import com.ryuqq.reportflow.application.codec.JobPayloadCodec;
import com.ryuqq.reportflow.application.delivery.DeliveryConfig;
import com.ryuqq.reportflow.application.delivery.DeliveryDispatcher;
import com.ryuqq.reportflow.application.delivery.DeliveryJobHandler;
import com.ryuqq.reportflow.application.delivery.ReportEmailComposer;
import com.ryuqq.reportflow.application.notification.NotificationService;
import com.ryuqq.reportflow.application.notification.NotificationStreamRelay;
import com.ryuqq.reportflow.application.protection.ExternalCallGuard;
import com.ryuqq.reportflow.application.report.PipelineConfig;
import com.ryuqq.reportflow.application.report.ReportJobHandler;
import com.ryuqq.reportflow.application.report.ReportPipeline;
import com.ryuqq.reportflow.application.report.ReportSubmitter;
import com.ryuqq.reportflow.application.report.render.DocumentRenderer;
import com.ryuqq.reportflow.core.contract.JobHandle;
import com.ryuqq.reportflow.core.contract.ReportJobRequest;
import com.ryuqq.reportflow.core.spi.JobQueue;
import com.ryuqq.reportflow.core.spi.MailTransport;
import com.ryuqq.reportflow.core.spi.NotificationBus;
import com.ryuqq.reportflow.core.spi.NotificationRepository;
import com.ryuqq.reportflow.core.spi.ReportRepository;
import com.ryuqq.reportflow.core.spi.TextGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * ReportFlow 구성 루트.
 *
 * <p>큐, 저장소, 알림 버스, 파이프라인, 배달 handler를 조립하고 리포트 큐와 이메일 큐에
 * Worker를 등록합니다. 외부 연동(텍스트 생성, 문서 렌더링, 메일 전송)은 반드시 주입해야 하며,
 * 나머지는 지정하지 않으면 인메모리 어댑터를 사용합니다.</p>
 *
 * <pre>{@code
 * try (ReportFlowBootstrap flow = ReportFlowBootstrap.builder()
 *         .textGenerator(generator)
 *         .documentRenderer(renderer)
 *         .mailTransport(transport)
 *         .build()) {
 *     flow.start();
 *     flow.submit(request);
 * }
 * }</pre>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class ReportFlowBootstrap implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReportFlowBootstrap.class);

    private final JobQueue jobQueue;
    private final ReportRepository reportRepository;
    private final NotificationRepository notificationRepository;
    private final NotificationBus notificationBus;
    private final NotificationService notificationService;
    private final NotificationStreamRelay streamRelay;
    private final DeliveryDispatcher deliveryDispatcher;
    private final ReportSubmitter submitter;
    private final ReportPipeline pipeline;
    private final ExternalCallGuard guard;
    private final WorkerPool workerPool;

    private ReportFlowBootstrap(Builder builder) {
        ReportFlowSettings settings = builder.settings == null ? ReportFlowSettings.load() : builder.settings;
        Clock clock = builder.clock == null ? Clock.systemUTC() : builder.clock;
        JobPayloadCodec codec = new JobPayloadCodec();
        PipelineConfig pipelineConfig = settings.pipelineConfig();
        DeliveryConfig deliveryConfig = settings.deliveryConfig();

        this.jobQueue = builder.jobQueue == null ? new InMemoryJobQueue(clock) : builder.jobQueue;
        this.reportRepository = builder.reportRepository == null ? new InMemoryReportRepository() : builder.reportRepository;
        this.notificationRepository = builder.notificationRepository == null
            ? new InMemoryNotificationRepository() : builder.notificationRepository;
        this.notificationBus = builder.notificationBus == null ? new InMemoryNotificationBus() : builder.notificationBus;

        this.guard = new ExternalCallGuard(settings.timeoutPolicy());
        this.notificationService = new NotificationService(notificationRepository, notificationBus, clock);
        this.streamRelay = new NotificationStreamRelay(notificationBus);
        this.deliveryDispatcher = new DeliveryDispatcher(jobQueue, codec, deliveryConfig);
        this.submitter = new ReportSubmitter(jobQueue, reportRepository, codec, pipelineConfig);
        this.pipeline = new ReportPipeline(
            builder.textGenerator,
            builder.documentRenderer,
            reportRepository,
            deliveryDispatcher,
            new ReportEmailComposer(deliveryConfig.senderAddress(), clock),
            notificationService,
            codec,
            guard,
            clock,
            pipelineConfig
        );

        this.workerPool = new WorkerPool(jobQueue, settings.workerConfig());
        workerPool.registerWorker(pipelineConfig.queueName(), settings.reportConcurrency(),
            new ReportJobHandler(pipeline, codec));
        workerPool.registerWorker(deliveryConfig.queueName(), settings.emailConcurrency(),
            new DeliveryJobHandler(builder.mailTransport, reportRepository, notificationService, codec, guard));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 모든 Worker의 lease 루프 시작.
     */
    public void start() {
        workerPool.startAll();
        log.info("ReportFlow started with queues {}", workerPool.queueNames());
    }

    /**
     * 리포트 Job 접수.
     */
    public JobHandle submit(ReportJobRequest request) {
        return submitter.submit(request);
    }

    public JobQueue jobQueue() {
        return jobQueue;
    }

    public ReportRepository reportRepository() {
        return reportRepository;
    }

    public NotificationRepository notificationRepository() {
        return notificationRepository;
    }

    public NotificationBus notificationBus() {
        return notificationBus;
    }

    public NotificationService notificationService() {
        return notificationService;
    }

    public NotificationStreamRelay streamRelay() {
        return streamRelay;
    }

    public DeliveryDispatcher deliveryDispatcher() {
        return deliveryDispatcher;
    }

    public WorkerPool workerPool() {
        return workerPool;
    }

    @Override
    public void close() {
        workerPool.close();
        pipeline.close();
        guard.close();
        log.info("ReportFlow stopped");
    }

    /**
     * {@link ReportFlowBootstrap} 빌더.
     */
    public static final class Builder {
        private TextGenerator textGenerator;
        private DocumentRenderer documentRenderer;
        private MailTransport mailTransport;
        private JobQueue jobQueue;
        private ReportRepository reportRepository;
        private NotificationRepository notificationRepository;
        private NotificationBus notificationBus;
        private Clock clock;
        private ReportFlowSettings settings;

        private Builder() {
        }

        public Builder textGenerator(TextGenerator textGenerator) {
            this.textGenerator = textGenerator;
            return this;
        }

        public Builder documentRenderer(DocumentRenderer documentRenderer) {
            this.documentRenderer = documentRenderer;
            return this;
        }

        public Builder mailTransport(MailTransport mailTransport) {
            this.mailTransport = mailTransport;
            return this;
        }

        public Builder jobQueue(JobQueue jobQueue) {
            this.jobQueue = jobQueue;
            return this;
        }

        public Builder reportRepository(ReportRepository reportRepository) {
            this.reportRepository = reportRepository;
            return this;
        }

        public Builder notificationRepository(NotificationRepository notificationRepository) {
            this.notificationRepository = notificationRepository;
            return this;
        }

        public Builder notificationBus(NotificationBus notificationBus) {
            this.notificationBus = notificationBus;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder settings(ReportFlowSettings settings) {
            this.settings = settings;
            return this;
        }

        /**
         * @throws IllegalStateException 외부 연동이 지정되지 않은 경우
         */
        public ReportFlowBootstrap build() {
            if (textGenerator == null) {
                throw new IllegalStateException("textGenerator is required");
            }
            if (documentRenderer == null) {
                throw new IllegalStateException("documentRenderer is required");
            }
            if (mailTransport == null) {
                throw new IllegalStateException("mailTransport is required");
            }
            return new ReportFlowBootstrap(this);
        }
    }
}
