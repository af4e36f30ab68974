package com.ryuqq.reportflow.application.report;

import com.ryuqq.reportflow.application.codec.JobPayloadCodec;
import com.ryuqq.reportflow.core.contract.JobHandle;
import com.ryuqq.reportflow.core.contract.JobOptions;
import com.ryuqq.reportflow.core.contract.ReportJobRequest;
import com.ryuqq.reportflow.core.record.ReportRecord;
import com.ryuqq.reportflow.core.spi.JobQueue;
import com.ryuqq.reportflow.core.spi.ReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 리포트 Job 접수.
 *
 * <p>리포트 생성을 백그라운드로 시작하는 유일한 진입점입니다.
 * 리포트 레코드가 없으면 빈 레코드를 만든 뒤 리포트 큐에 즉시 실행으로 enqueue합니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class ReportSubmitter {

    private static final Logger log = LoggerFactory.getLogger(ReportSubmitter.class);

    private final JobQueue queue;
    private final ReportRepository reportRepository;
    private final JobPayloadCodec codec;
    private final PipelineConfig config;

    public ReportSubmitter(JobQueue queue, ReportRepository reportRepository, JobPayloadCodec codec, PipelineConfig config) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (reportRepository == null) {
            throw new IllegalArgumentException("reportRepository cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.queue = queue;
        this.reportRepository = reportRepository;
        this.codec = codec;
        this.config = config;
    }

    /**
     * 리포트 Job 접수.
     *
     * @param request 리포트 요청
     * @return enqueue 확인 (Job handle)
     */
    public JobHandle submit(ReportJobRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        if (reportRepository.findById(request.reportId()).isEmpty()) {
            try {
                reportRepository.create(ReportRecord.empty(request.reportId()));
            } catch (IllegalStateException e) {
                log.debug("Report {} was created concurrently: {}", request.reportId(), e.getMessage());
            }
        }

        JobHandle handle = queue.enqueue(config.queueName(), codec.encode(request), JobOptions.immediate());
        log.info("Submitted report {} for {} as job {}", request.reportId(), request.orgName(), handle.id().getValue());
        return handle;
    }
}
