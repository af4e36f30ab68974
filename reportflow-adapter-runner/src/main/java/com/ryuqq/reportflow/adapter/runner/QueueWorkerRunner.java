package com.ryuqq.reportflow.adapter.runner;

import com.ryuqq.reportflow.application.runtime.Runtime;
import com.ryuqq.reportflow.core.contract.Job;
import com.ryuqq.reportflow.core.handler.JobHandler;
import com.ryuqq.reportflow.core.model.JobId;
import com.ryuqq.reportflow.core.model.Payload;
import com.ryuqq.reportflow.core.model.QueueName;
import com.ryuqq.reportflow.core.outcome.Fail;
import com.ryuqq.reportflow.core.outcome.Ok;
import com.ryuqq.reportflow.core.spi.JobQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Queue Worker Runner 구현체.
 *
 * <p>큐 하나에서 Job을 lease해 등록된 {@link JobHandler}로 실행하고, 결과에 따라
 * complete 또는 fail로 기록합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * 빈 슬롯 확보 (Semaphore.tryAcquire) → n개
 *   ↓
 * lease(queueName, n) → [Job1, Job2, ...]
 *   ↓
 * 남는 슬롯 반환
 *   ↓
 * For each Job (worker 스레드):
 *   1. handler.handle(job)
 *   2. 반환 → queue.complete(Ok(result))
 *   3. 예외 → log + queue.fail(Fail HANDLER_ERROR)
 *   4. 슬롯 반환
 * </pre>
 *
 * <p><strong>동시성 제어:</strong></p>
 * <ul>
 *   <li>실행 중인 handler 수는 concurrency를 넘지 않음</li>
 *   <li>pump()는 handler 실행을 기다리지 않음</li>
 *   <li>실패한 Job은 재큐잉하지 않음</li>
 * </ul>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public final class QueueWorkerRunner implements Runtime {

    public static final String HANDLER_ERROR = "HANDLER_ERROR";

    private static final Logger log = LoggerFactory.getLogger(QueueWorkerRunner.class);

    private final JobQueue queue;
    private final QueueName queueName;
    private final JobHandler handler;
    private final QueueWorkerConfig config;
    private final Semaphore slots;
    private final ExecutorService workerExecutor;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile ScheduledExecutorService scheduler;

    /**
     * 생성자.
     *
     * @param queue Job 큐
     * @param queueName 담당 큐 이름
     * @param handler Job handler
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public QueueWorkerRunner(JobQueue queue, QueueName queueName, JobHandler handler, QueueWorkerConfig config) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (queueName == null) {
            throw new IllegalArgumentException("queueName cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.queue = queue;
        this.queueName = queueName;
        this.handler = handler;
        this.config = config;
        this.slots = new Semaphore(config.concurrency());
        this.workerExecutor = Executors.newFixedThreadPool(
            config.concurrency(), new NamedThreadFactory("worker-" + queueName.getValue()));
    }

    @Override
    public void pump() {
        if (stopped.get()) {
            return;
        }

        int free = 0;
        while (slots.tryAcquire()) {
            free++;
        }
        if (free == 0) {
            return;
        }

        List<Job> jobs;
        try {
            jobs = queue.lease(queueName, free);
        } catch (RuntimeException e) {
            slots.release(free);
            throw e;
        }

        if (jobs.size() < free) {
            slots.release(free - jobs.size());
        }

        for (int i = 0; i < jobs.size(); i++) {
            Job job = jobs.get(i);
            try {
                workerExecutor.execute(() -> process(job));
            } catch (RejectedExecutionException e) {
                log.warn("Worker pool for {} rejected job {}, marking it failed", queueName.getValue(), job.id().getValue());
                failQuietly(job.id(), Fail.from(HANDLER_ERROR, e));
                slots.release();
            }
        }
    }

    /**
     * 주기적 lease 루프 시작.
     *
     * @throws IllegalStateException 이미 시작했거나 종료된 경우
     */
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("runner for " + queueName.getValue() + " is shut down");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("runner for " + queueName.getValue() + " is already started");
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(
            new NamedThreadFactory("lease-" + queueName.getValue()));
        scheduler.scheduleWithFixedDelay(
            this::safePump, 0, config.pollingIntervalMs(), TimeUnit.MILLISECONDS);
        log.info("Started worker for queue {} (concurrency {}, polling {}ms)",
            queueName.getValue(), config.concurrency(), config.pollingIntervalMs());
    }

    /**
     * Runner 종료.
     *
     * <p>lease 루프를 멈추고 실행 중인 handler가 끝나기를 shutdownTimeoutMs까지 기다립니다.</p>
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        ScheduledExecutorService current = scheduler;
        if (current != null) {
            current.shutdownNow();
        }

        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("Worker for queue {} did not drain within {}ms, interrupting handlers",
                queueName.getValue(), config.shutdownTimeoutMs());
            workerExecutor.shutdownNow();
        }
        log.info("Stopped worker for queue {}", queueName.getValue());
    }

    /**
     * 현재 실행 중인 handler 수.
     */
    public int activeCount() {
        return config.concurrency() - slots.availablePermits();
    }

    public QueueName queueName() {
        return queueName;
    }

    public QueueWorkerConfig config() {
        return config;
    }

    private void safePump() {
        try {
            pump();
        } catch (RuntimeException e) {
            log.error("Lease loop for queue {} failed", queueName.getValue(), e);
        }
    }

    private void process(Job job) {
        JobId jobId = job.id();
        try {
            Payload result;
            try {
                result = handler.handle(job);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Job {} on {} interrupted", jobId.getValue(), queueName.getValue());
                failQuietly(jobId, Fail.from(HANDLER_ERROR, e));
                return;
            } catch (Exception e) {
                log.error("Job {} on {} failed (attempt {})",
                    jobId.getValue(), queueName.getValue(), job.attemptCount(), e);
                failQuietly(jobId, Fail.from(HANDLER_ERROR, e));
                return;
            }
            completeQuietly(jobId, result);
        } finally {
            slots.release();
        }
    }

    private void completeQuietly(JobId jobId, Payload result) {
        try {
            queue.complete(jobId, new Ok(jobId, result));
            log.debug("Job {} on {} completed", jobId.getValue(), queueName.getValue());
        } catch (RuntimeException e) {
            log.error("Failed to record completion of job {} on {}", jobId.getValue(), queueName.getValue(), e);
        }
    }

    private void failQuietly(JobId jobId, Fail fail) {
        try {
            queue.fail(jobId, fail);
        } catch (RuntimeException e) {
            log.error("Failed to record failure of job {} on {}", jobId.getValue(), queueName.getValue(), e);
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
