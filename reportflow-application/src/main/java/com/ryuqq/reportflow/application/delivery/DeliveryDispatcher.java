package com.ryuqq.reportflow.application.delivery;

import com.ryuqq.reportflow.application.codec.JobPayloadCodec;
import com.ryuqq.reportflow.core.contract.DeliveryMessage;
import com.ryuqq.reportflow.core.contract.JobHandle;
import com.ryuqq.reportflow.core.contract.JobOptions;
import com.ryuqq.reportflow.core.model.JobId;
import com.ryuqq.reportflow.core.spi.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 이메일 Job 예약기.
 *
 * <p>{@link DeliveryMessage}를 이메일 큐에 가시성 지연과 함께 enqueue합니다.
 * 실제 전송은 {@link DeliveryJobHandler}가 Job 실행 시점에 수행합니다.</p>
 *
 * <p><strong>작업:</strong></p>
 * <ul>
 *   <li>{@link #schedule(DeliveryMessage)}: 기본 지연(5분)으로 예약</li>
 *   <li>{@link #schedule(DeliveryMessage, Duration)}: 지정 지연으로 예약</li>
 *   <li>{@link #updateScheduled(JobId, DeliveryMessage)}: 아직 실행 전인 Job의 메시지 교체</li>
 * </ul>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class DeliveryDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DeliveryDispatcher.class);

    private final JobQueue queue;
    private final JobPayloadCodec codec;
    private final DeliveryConfig config;

    public DeliveryDispatcher(JobQueue queue, JobPayloadCodec codec, DeliveryConfig config) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.queue = queue;
        this.codec = codec;
        this.config = config;
    }

    public JobHandle schedule(DeliveryMessage message) {
        return schedule(message, Duration.ofMillis(config.delayMs()));
    }

    /**
     * 지정 지연으로 이메일 Job 예약.
     *
     * @param message 배달 메시지
     * @param delay 가시성 지연 (음수 불가)
     * @return 예약된 Job handle
     */
    public JobHandle schedule(DeliveryMessage message, Duration delay) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        JobHandle handle = queue.enqueue(config.queueName(), codec.encode(message), JobOptions.delayed(delay));
        log.info("Scheduled email to {} as job {} (visible at {})",
            message.recipient(), handle.id().getValue(), handle.visibleAt());
        return handle;
    }

    /**
     * 대기 중인 이메일 Job의 메시지 교체.
     *
     * @param jobId 이메일 Job ID
     * @param message 새 메시지
     * @return Job이 존재해 교체했으면 true, 알 수 없는 Job이면 false
     * @throws IllegalStateException Job이 이미 실행 중이거나 종료된 경우
     */
    public boolean updateScheduled(JobId jobId, DeliveryMessage message) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        boolean updated = queue.updateData(jobId, codec.encode(message));
        if (!updated) {
            log.warn("Email job {} not found, nothing updated", jobId.getValue());
        }
        return updated;
    }

    public DeliveryConfig config() {
        return config;
    }
}
