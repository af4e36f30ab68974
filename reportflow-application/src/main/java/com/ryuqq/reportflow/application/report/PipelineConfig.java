package com.ryuqq.reportflow.application.report;

import com.ryuqq.reportflow.core.model.QueueName;

/**
 * 리포트 파이프라인 설정.
 *
 * <p><strong>필드:</strong></p>
 * <ul>
 *   <li><strong>queueName:</strong> 리포트 Job 큐 이름 (기본 "report")</li>
 *   <li><strong>metricConcurrency:</strong> 지표 prompt 동시 실행 수 (기본 6, 1~16)</li>
 * </ul>
 *
 * @param queueName 리포트 큐 이름
 * @param metricConcurrency 지표 호출 스레드 수
 * @author ReportFlow Team
 * @since 1.0.0
 */
public record PipelineConfig(QueueName queueName, int metricConcurrency) {

    public static final String DEFAULT_QUEUE = "report";
    public static final int DEFAULT_METRIC_CONCURRENCY = 6;

    private static final int MAX_METRIC_CONCURRENCY = 16;

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 값이 유효하지 않은 경우
     */
    public PipelineConfig {
        if (queueName == null) {
            throw new IllegalArgumentException("queueName cannot be null");
        }
        if (metricConcurrency < 1 || metricConcurrency > MAX_METRIC_CONCURRENCY) {
            throw new IllegalArgumentException(
                String.format("metricConcurrency must be between 1 and %d (current: %d)",
                    MAX_METRIC_CONCURRENCY, metricConcurrency)
            );
        }
    }

    public PipelineConfig() {
        this(QueueName.of(DEFAULT_QUEUE), DEFAULT_METRIC_CONCURRENCY);
    }

    public PipelineConfig withQueueName(QueueName newQueueName) {
        return new PipelineConfig(newQueueName, metricConcurrency);
    }

    public PipelineConfig withMetricConcurrency(int newMetricConcurrency) {
        return new PipelineConfig(queueName, newMetricConcurrency);
    }
}
