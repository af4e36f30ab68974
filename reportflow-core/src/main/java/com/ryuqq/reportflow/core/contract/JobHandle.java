package com.ryuqq.reportflow.core.contract;

import com.ryuqq.reportflow.core.model.JobId;
import com.ryuqq.reportflow.core.model.QueueName;

/**
 * enqueue 결과로 반환되는 Job 핸들.
 *
 * @param id 발급된 Job ID
 * @param queueName Job이 들어간 큐
 * @param visibleAt lease 가능 시각 (epoch millis)
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record JobHandle(JobId id, QueueName queueName, long visibleAt) {

    public JobHandle {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (queueName == null) {
            throw new IllegalArgumentException("queueName cannot be null");
        }
    }
}
