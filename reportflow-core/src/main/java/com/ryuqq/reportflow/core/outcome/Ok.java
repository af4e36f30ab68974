package com.ryuqq.reportflow.core.outcome;

import com.ryuqq.reportflow.core.model.JobId;
import com.ryuqq.reportflow.core.model.Payload;

/**
 * 성공 결과.
 *
 * @param jobId Job ID
 * @param result handler가 반환한 결과 (null이면 빈 Payload)
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record Ok(
    JobId jobId,
    Payload result
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException jobId가 null인 경우
     */
    public Ok {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (result == null) {
            result = Payload.empty();
        }
    }

    /**
     * 결과 없이 성공 생성.
     *
     * @param jobId Job ID
     * @return Ok 인스턴스
     */
    public static Ok of(JobId jobId) {
        return new Ok(jobId, Payload.empty());
    }
}
