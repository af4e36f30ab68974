package com.ryuqq.reportflow.application.report;

import com.ryuqq.reportflow.adapter.inmemory.queue.InMemoryJobQueue;
import com.ryuqq.reportflow.adapter.inmemory.store.InMemoryReportRepository;
import com.ryuqq.reportflow.application.codec.JobPayloadCodec;
import com.ryuqq.reportflow.core.contract.Job;
import com.ryuqq.reportflow.core.contract.JobHandle;
import com.ryuqq.reportflow.core.contract.ReportJobRequest;
import com.ryuqq.reportflow.core.contract.ReportType;
import com.ryuqq.reportflow.core.model.QueueName;
import com.ryuqq.reportflow.core.record.ReportRecord;
import com.ryuqq.reportflow.core.record.ReportUpdate;
import com.ryuqq.reportflow.testkit.time.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReportSubmitterTest {

    private MutableClock clock;
    private InMemoryJobQueue queue;
    private InMemoryReportRepository reportRepository;
    private JobPayloadCodec codec;
    private ReportSubmitter submitter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        queue = new InMemoryJobQueue(clock);
        reportRepository = new InMemoryReportRepository();
        codec = new JobPayloadCodec();
        submitter = new ReportSubmitter(queue, reportRepository, codec, new PipelineConfig());
    }

    private static ReportJobRequest request(String reportId) {
        return new ReportJobRequest(reportId, "Acme", "wf-1", ReportType.PDV, "user@acme.io",
            "p1", "o1", "owf-1", "acme", false, List.of());
    }

    @Test
    void 접수하면_빈_레코드를_만들고_즉시_실행으로_enqueue한다() {
        // when
        JobHandle handle = submitter.submit(request("r-1"));

        // then
        assertThat(reportRepository.findById("r-1")).contains(ReportRecord.empty("r-1"));
        assertThat(handle.queueName()).isEqualTo(QueueName.of(PipelineConfig.DEFAULT_QUEUE));
        assertThat(handle.visibleAt()).isEqualTo(clock.millis());

        List<Job> jobs = queue.jobs(QueueName.of(PipelineConfig.DEFAULT_QUEUE));
        assertThat(jobs).singleElement().satisfies(job ->
            assertThat(codec.decode(job.payload(), ReportJobRequest.class)).isEqualTo(request("r-1")));
    }

    @Test
    void 기존_레코드는_덮어쓰지_않는다() {
        // given
        reportRepository.create(ReportRecord.empty("r-1"));
        reportRepository.update("r-1", ReportUpdate.builder().deliveryError("previous run").build());

        // when
        submitter.submit(request("r-1"));

        // then
        assertThat(reportRepository.findById("r-1"))
            .hasValueSatisfying(record -> assertThat(record.deliveryError()).isEqualTo("previous run"));
        assertThat(queue.pendingCount(QueueName.of(PipelineConfig.DEFAULT_QUEUE))).isEqualTo(1);
    }

    @Test
    void 설정한_큐_이름으로_enqueue한다() {
        ReportSubmitter custom = new ReportSubmitter(queue, reportRepository, codec,
            new PipelineConfig().withQueueName(QueueName.of("reports-eu")));

        custom.submit(request("r-2"));

        assertThat(queue.jobs(QueueName.of("reports-eu"))).hasSize(1);
        assertThat(queue.jobs(QueueName.of(PipelineConfig.DEFAULT_QUEUE))).isEmpty();
    }

    @Test
    void null_요청은_거부한다() {
        assertThatThrownBy(() -> submitter.submit(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("request cannot be null");
    }
}
