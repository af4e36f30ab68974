package com.ryuqq.reportflow.adapter.runner;

import com.ryuqq.reportflow.core.handler.JobHandler;
import com.ryuqq.reportflow.core.model.QueueName;
import com.ryuqq.reportflow.core.spi.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 큐별 Worker 레지스트리.
 *
 * <p>큐 이름마다 {@link QueueWorkerRunner} 하나를 만들고 함께 시작/종료합니다.
 * 같은 큐에 두 번 등록할 수 없습니다.</p>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final JobQueue queue;
    private final QueueWorkerConfig baseConfig;
    private final Map<QueueName, QueueWorkerRunner> runners = new ConcurrentHashMap<>();

    public WorkerPool(JobQueue queue) {
        this(queue, new QueueWorkerConfig());
    }

    /**
     * @param queue Job 큐
     * @param baseConfig 등록 시 concurrency만 바꿔 쓰는 기본 설정
     */
    public WorkerPool(JobQueue queue, QueueWorkerConfig baseConfig) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (baseConfig == null) {
            throw new IllegalArgumentException("baseConfig cannot be null");
        }
        this.queue = queue;
        this.baseConfig = baseConfig;
    }

    /**
     * Worker 등록.
     *
     * @param queueName 큐 이름
     * @param concurrency 동시 실행 handler 수
     * @param handler Job handler
     * @return 생성된 runner
     * @throws IllegalStateException 이미 등록된 큐인 경우
     */
    public synchronized QueueWorkerRunner registerWorker(QueueName queueName, int concurrency, JobHandler handler) {
        if (queueName == null) {
            throw new IllegalArgumentException("queueName cannot be null");
        }
        if (runners.containsKey(queueName)) {
            throw new IllegalStateException("worker already registered for queue: " + queueName.getValue());
        }
        QueueWorkerRunner runner = new QueueWorkerRunner(queue, queueName, handler, baseConfig.withConcurrency(concurrency));
        runners.put(queueName, runner);
        log.info("Registered worker for queue {} (concurrency {})", queueName.getValue(), concurrency);
        return runner;
    }

    public Optional<QueueWorkerRunner> runner(QueueName queueName) {
        return Optional.ofNullable(runners.get(queueName));
    }

    public List<QueueName> queueNames() {
        return new ArrayList<>(runners.keySet());
    }

    /**
     * 모든 Worker의 lease 루프 시작.
     */
    public void startAll() {
        runners.values().forEach(QueueWorkerRunner::start);
    }

    /**
     * 스케줄러 없이 모든 Worker를 한 번씩 pump.
     */
    public void pumpAll() {
        runners.values().forEach(QueueWorkerRunner::pump);
    }

    /**
     * 모든 Worker 종료.
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        for (QueueWorkerRunner runner : runners.values()) {
            runner.shutdown();
        }
    }

    @Override
    public void close() {
        try {
            shutdown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while shutting down workers");
        }
    }
}
