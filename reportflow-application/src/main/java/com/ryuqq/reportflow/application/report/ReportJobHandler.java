package com.ryuqq.reportflow.application.report;

import com.ryuqq.reportflow.application.codec.JobPayloadCodec;
import com.ryuqq.reportflow.core.contract.Job;
import com.ryuqq.reportflow.core.contract.ReportJobRequest;
import com.ryuqq.reportflow.core.handler.JobHandler;
import com.ryuqq.reportflow.core.model.Payload;

/**
 * 리포트 Job handler.
 *
 * <p>Job payload를 {@link ReportJobRequest}로 해석해 {@link ReportPipeline}을 실행하고
 * {@link ReportPipelineResult}를 결과로 반환합니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class ReportJobHandler implements JobHandler {

    private final ReportPipeline pipeline;
    private final JobPayloadCodec codec;

    public ReportJobHandler(ReportPipeline pipeline, JobPayloadCodec codec) {
        if (pipeline == null) {
            throw new IllegalArgumentException("pipeline cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.pipeline = pipeline;
        this.codec = codec;
    }

    @Override
    public Payload handle(Job job) {
        ReportJobRequest request = codec.decode(job.payload(), ReportJobRequest.class);
        return codec.encode(pipeline.run(request));
    }
}
