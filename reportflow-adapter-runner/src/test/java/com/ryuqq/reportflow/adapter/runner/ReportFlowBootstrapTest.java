package com.ryuqq.reportflow.adapter.runner;

import com.ryuqq.reportflow.core.contract.DeliveryMessage;
import com.ryuqq.reportflow.core.contract.GeneratedText;
import com.ryuqq.reportflow.core.contract.Job;
import com.ryuqq.reportflow.core.contract.JobHandle;
import com.ryuqq.reportflow.core.contract.MailReceipt;
import com.ryuqq.reportflow.core.contract.NotificationEvent;
import com.ryuqq.reportflow.core.contract.ReportJobRequest;
import com.ryuqq.reportflow.core.contract.ReportType;
import com.ryuqq.reportflow.core.contract.StreamMessage;
import com.ryuqq.reportflow.core.model.JobId;
import com.ryuqq.reportflow.core.model.QueueName;
import com.ryuqq.reportflow.core.model.TopicKey;
import com.ryuqq.reportflow.core.record.DeliveryStatus;
import com.ryuqq.reportflow.core.record.ReportRecord;
import com.ryuqq.reportflow.core.spi.EventChannel;
import com.ryuqq.reportflow.core.statemachine.JobState;
import com.ryuqq.reportflow.testkit.time.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ReportFlowBootstrap 통합 테스트.
 *
 * <p>인메모리 어댑터로 리포트 접수부터 5분 뒤 이메일 배달까지 전체 흐름을 검증합니다.
 * lease 루프는 시작하지 않고 {@link WorkerPool#pumpAll()}로 직접 구동합니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
class ReportFlowBootstrapTest {

    private static final TopicKey TENANT = TopicKey.of("p1", "o1");

    private MutableClock clock;
    private List<DeliveryMessage> sent;
    private List<StreamMessage> streamed;
    private ReportFlowBootstrap flow;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        sent = new CopyOnWriteArrayList<>();
        streamed = new CopyOnWriteArrayList<>();
        flow = ReportFlowBootstrap.builder()
            .textGenerator(request -> GeneratedText.of(cannedAnswer(request.prompt())))
            .documentRenderer(document -> ("%PDF " + document.orgName()).getBytes(StandardCharsets.UTF_8))
            .mailTransport(message -> {
                sent.add(message);
                return new MailReceipt("msg-" + sent.size());
            })
            .clock(clock)
            .settings(ReportFlowSettings.load(new Properties(), Map.of()))
            .build();
    }

    @AfterEach
    void tearDown() {
        flow.close();
    }

    private static String cannedAnswer(String prompt) {
        if (prompt.contains("Competitive Moat comparison")) {
            return "{\"sectorName\":\"Logistics\",\"comparisonTable\":[]}";
        }
        return "Estimated at 60% based on public information.";
    }

    private static ReportJobRequest request() {
        return new ReportJobRequest("r-1", "Acme", "wf-1", ReportType.PDV, "user@acme.io",
            "p1", "o1", "owf-1", "acme", false, List.of());
    }

    @Test
    void 리포트_생성_후_5분_뒤_이메일이_배달된다() throws InterruptedException {
        // given
        flow.streamRelay().attach(TENANT, new RecordingChannel());

        // when: 리포트 Job 실행
        JobHandle reportJob = flow.submit(request());
        flow.workerPool().pumpAll();
        assertThat(awaitTerminal(reportJob.id()).state()).isEqualTo(JobState.COMPLETED);

        // then: 이메일 Job이 5분 지연으로 대기
        ReportRecord generated = flow.reportRepository().findById("r-1").orElseThrow();
        assertThat(generated.deliveryStatus()).isEqualTo(DeliveryStatus.PENDING);
        assertThat(generated.hasRenderedDocument()).isTrue();
        assertThat(generated.supplementaryData()).contains("Logistics");
        JobId emailJob = JobId.of(generated.deliveryJobId());
        assertThat(flow.jobQueue().findById(emailJob)).hasValueSatisfying(job -> {
            assertThat(job.queueName()).isEqualTo(QueueName.of("email"));
            assertThat(job.visibleAt() - job.enqueuedAt()).isEqualTo(Duration.ofMinutes(5).toMillis());
        });

        flow.workerPool().pumpAll();
        assertThat(sent).isEmpty();

        // when: 5분 경과
        clock.advance(Duration.ofMinutes(5));
        flow.workerPool().pumpAll();
        assertThat(awaitTerminal(emailJob).state()).isEqualTo(JobState.COMPLETED);

        // then: 배달 기록
        assertThat(sent).singleElement().satisfies(message -> {
            assertThat(message.recipient()).isEqualTo("user@acme.io");
            assertThat(message.subject()).isEqualTo("Your PDV Report - Acme is Ready");
            assertThat(message.attachments()).hasSize(1);
        });
        ReportRecord delivered = flow.reportRepository().findById("r-1").orElseThrow();
        assertThat(delivered.deliveryStatus()).isEqualTo(DeliveryStatus.DELIVERED);
        assertThat(delivered.mailMessageId()).isEqualTo("msg-1");
        assertThat(delivered.deliveryError()).isNull();

        // then: 알림 이중 기록
        assertThat(flow.notificationRepository().findByTopic(TENANT))
            .extracting(NotificationEvent::title)
            .containsExactly("PDV Report Generated", "PDV Report Delivered");
        assertThat(streamed)
            .extracting(StreamMessage::event)
            .containsExactly(StreamMessage.EVENT_CONNECTED, StreamMessage.EVENT_UPDATE, StreamMessage.EVENT_UPDATE);
    }

    @Test
    void 리포트_큐와_이메일_큐에_Worker가_등록된다() {
        assertThat(flow.workerPool().runner(QueueName.of("report"))).hasValueSatisfying(runner ->
            assertThat(runner.config().concurrency()).isEqualTo(2));
        assertThat(flow.workerPool().runner(QueueName.of("email"))).hasValueSatisfying(runner ->
            assertThat(runner.config().concurrency()).isEqualTo(5));
    }

    @Test
    void 외부_연동이_없으면_build가_실패한다() {
        assertThatThrownBy(() -> ReportFlowBootstrap.builder()
            .textGenerator(request -> GeneratedText.of("x"))
            .documentRenderer(document -> new byte[0])
            .build())
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("mailTransport is required");
    }

    private Job awaitTerminal(JobId jobId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            Job job = flow.jobQueue().findById(jobId).orElseThrow();
            if (job.state().isTerminal()) {
                return job;
            }
            Thread.sleep(10);
        }
        throw new AssertionError("job " + jobId.getValue() + " did not finish");
    }

    private final class RecordingChannel implements EventChannel {
        @Override
        public void send(StreamMessage message) {
            streamed.add(message);
        }

        @Override
        public void keepAlive() {
        }

        @Override
        public void onClose(Runnable callback) {
        }
    }
}
