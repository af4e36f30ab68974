package com.ryuqq.reportflow.testkit.contract;

import com.ryuqq.reportflow.core.contract.Job;
import com.ryuqq.reportflow.core.contract.JobHandle;
import com.ryuqq.reportflow.core.contract.JobOptions;
import com.ryuqq.reportflow.core.model.JobId;
import com.ryuqq.reportflow.core.model.Payload;
import com.ryuqq.reportflow.core.model.QueueName;
import com.ryuqq.reportflow.core.outcome.Fail;
import com.ryuqq.reportflow.core.outcome.Ok;
import com.ryuqq.reportflow.core.spi.JobQueue;
import com.ryuqq.reportflow.core.statemachine.JobState;
import com.ryuqq.reportflow.testkit.time.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Test for {@link JobQueue} implementations.
 *
 * <p>Adapters extend this class and provide a queue bound to the supplied clock.</p>
 *
 * <p><strong>Tested Contract:</strong></p>
 * <ul>
 *   <li>Delayed visibility: a job is leasable only once enqueueTime + delayMs has passed</li>
 *   <li>Exclusive lease: concurrent lease calls never return the same job twice</li>
 *   <li>FIFO by eligible time within one queue</li>
 *   <li>Terminal outcomes: COMPLETED/FAILED are final and never re-leased</li>
 *   <li>updateData: pending jobs only</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyJobQueueContractTest extends AbstractJobQueueContractTest {
 *     {@literal @}Override
 *     protected JobQueue createQueue(MutableClock clock) {
 *         return new MyJobQueue(clock);
 *     }
 * }
 * </pre>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public abstract class AbstractJobQueueContractTest {

    protected static final QueueName EMAIL = QueueName.of("email");
    protected static final QueueName REPORT = QueueName.of("report");

    protected MutableClock clock;
    protected JobQueue queue;

    /**
     * Creates the queue under test.
     *
     * @param clock clock the queue must use for visibility decisions
     * @return fresh, empty queue
     */
    protected abstract JobQueue createQueue(MutableClock clock);

    @BeforeEach
    void setUpQueue() {
        clock = new MutableClock();
        queue = createQueue(clock);
    }

    // ===== 1. Visibility =====

    @Test
    void enqueue_Immediate_IsWaitingAndLeasable() {
        // when
        JobHandle handle = queue.enqueue(EMAIL, Payload.of("{\"n\":1}"), JobOptions.immediate());

        // then
        assertThat(queue.findById(handle.id()))
            .hasValueSatisfying(job -> assertThat(job.state()).isEqualTo(JobState.WAITING));
        List<Job> leased = queue.lease(EMAIL, 10);
        assertThat(leased).hasSize(1);
        assertThat(leased.get(0).id()).isEqualTo(handle.id());
        assertThat(leased.get(0).state()).isEqualTo(JobState.ACTIVE);
        assertThat(leased.get(0).attemptCount()).isEqualTo(1);
        assertThat(leased.get(0).payload()).isEqualTo(Payload.of("{\"n\":1}"));
    }

    @Test
    void enqueue_Delayed_NotLeasableBeforeVisibleAt() {
        // given
        JobHandle handle = queue.enqueue(EMAIL, Payload.of("{}"), JobOptions.delayed(Duration.ofMinutes(5)));

        // when
        clock.advance(Duration.ofMinutes(5).minusMillis(1));

        // then
        assertThat(queue.findById(handle.id()))
            .hasValueSatisfying(job -> assertThat(job.state()).isEqualTo(JobState.DELAYED));
        assertThat(queue.lease(EMAIL, 10)).isEmpty();
        assertThat(handle.visibleAt()).isEqualTo(clock.millis() + 1);
    }

    @Test
    void enqueue_Delayed_LeasableOnceDelayElapsed() {
        // given
        JobHandle handle = queue.enqueue(EMAIL, Payload.of("{}"), JobOptions.delayed(Duration.ofMinutes(5)));

        // when
        clock.advance(Duration.ofMinutes(5));

        // then
        assertThat(queue.lease(EMAIL, 10)).extracting(Job::id).containsExactly(handle.id());
    }

    // ===== 2. Lease =====

    @Test
    void lease_RespectsMax() {
        // given
        for (int i = 0; i < 5; i++) {
            queue.enqueue(EMAIL, Payload.of("{}"), JobOptions.immediate());
        }

        // when & then
        assertThat(queue.lease(EMAIL, 3)).hasSize(3);
        assertThat(queue.lease(EMAIL, 3)).hasSize(2);
        assertThat(queue.lease(EMAIL, 3)).isEmpty();
    }

    @Test
    void lease_OrdersByEligibleTime() {
        // given
        JobHandle late = queue.enqueue(EMAIL, Payload.of("late"), new JobOptions(200));
        JobHandle early = queue.enqueue(EMAIL, Payload.of("early"), new JobOptions(100));
        clock.advance(Duration.ofMillis(50));
        JobHandle middle = queue.enqueue(EMAIL, Payload.of("middle"), new JobOptions(100));

        // when
        clock.advance(Duration.ofMillis(500));

        // then
        assertThat(queue.lease(EMAIL, 10)).extracting(Job::id)
            .containsExactly(early.id(), middle.id(), late.id());
    }

    @Test
    void lease_QueuesAreIsolated() {
        // given
        queue.enqueue(REPORT, Payload.of("{}"), JobOptions.immediate());

        // when & then
        assertThat(queue.lease(EMAIL, 10)).isEmpty();
        assertThat(queue.lease(REPORT, 10)).hasSize(1);
    }

    @Test
    void lease_NonPositiveMax_ThrowsException() {
        assertThatThrownBy(() -> queue.lease(EMAIL, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void lease_ConcurrentCallers_NeverShareAJob() throws Exception {
        // given
        int jobCount = 200;
        for (int i = 0; i < jobCount; i++) {
            queue.enqueue(EMAIL, Payload.of("{\"n\":" + i + "}"), JobOptions.immediate());
        }
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        ConcurrentLinkedQueue<JobId> leasedIds = new ConcurrentLinkedQueue<>();

        // when
        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                start.await();
                List<Job> batch;
                while (!(batch = queue.lease(EMAIL, 3)).isEmpty()) {
                    batch.forEach(job -> leasedIds.add(job.id()));
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // then
        List<JobId> all = new ArrayList<>(leasedIds);
        Set<JobId> unique = new HashSet<>(all);
        assertThat(all).hasSize(jobCount);
        assertThat(unique).hasSize(jobCount);
    }

    // ===== 3. Outcome =====

    @Test
    void complete_StoresResultAndIsFinal() {
        // given
        JobHandle handle = queue.enqueue(EMAIL, Payload.of("{}"), JobOptions.immediate());
        queue.lease(EMAIL, 1);

        // when
        queue.complete(handle.id(), new Ok(handle.id(), Payload.of("{\"messageId\":\"m-1\"}")));

        // then
        Job job = queue.findById(handle.id()).orElseThrow();
        assertThat(job.state()).isEqualTo(JobState.COMPLETED);
        assertThat(job.result()).isEqualTo(Payload.of("{\"messageId\":\"m-1\"}"));
        assertThatThrownBy(() -> queue.complete(handle.id(), Ok.of(handle.id())))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void fail_IsFinalAndNotRequeued() {
        // given
        JobHandle handle = queue.enqueue(EMAIL, Payload.of("{}"), JobOptions.immediate());
        queue.lease(EMAIL, 1);

        // when
        queue.fail(handle.id(), Fail.of("HANDLER_ERROR", "smtp down"));

        // then
        Job job = queue.findById(handle.id()).orElseThrow();
        assertThat(job.state()).isEqualTo(JobState.FAILED);
        assertThat(job.failedReason()).contains("smtp down");
        clock.advance(Duration.ofHours(1));
        assertThat(queue.lease(EMAIL, 10)).isEmpty();
    }

    @Test
    void complete_PendingJob_ThrowsIllegalState() {
        // given
        JobHandle handle = queue.enqueue(EMAIL, Payload.of("{}"), JobOptions.immediate());

        // when & then
        assertThatThrownBy(() -> queue.complete(handle.id(), Ok.of(handle.id())))
            .isInstanceOf(IllegalStateException.class);
    }

    // ===== 4. updateData =====

    @Test
    void updateData_PendingJob_ReplacesPayloadKeepsVisibility() {
        // given
        JobHandle handle = queue.enqueue(EMAIL, Payload.of("{\"v\":1}"), JobOptions.delayed(Duration.ofMinutes(5)));

        // when
        boolean updated = queue.updateData(handle.id(), Payload.of("{\"v\":2}"));

        // then
        assertThat(updated).isTrue();
        Job job = queue.findById(handle.id()).orElseThrow();
        assertThat(job.payload()).isEqualTo(Payload.of("{\"v\":2}"));
        assertThat(job.visibleAt()).isEqualTo(handle.visibleAt());
        clock.advance(Duration.ofMinutes(5));
        assertThat(queue.lease(EMAIL, 1)).extracting(Job::payload).containsExactly(Payload.of("{\"v\":2}"));
    }

    @Test
    void updateData_ActiveJob_ThrowsIllegalState() {
        // given
        JobHandle handle = queue.enqueue(EMAIL, Payload.of("{}"), JobOptions.immediate());
        queue.lease(EMAIL, 1);

        // when & then
        assertThatThrownBy(() -> queue.updateData(handle.id(), Payload.of("{\"v\":2}")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void updateData_UnknownJob_ReturnsFalse() {
        assertThat(queue.updateData(JobId.of("missing"), Payload.of("{}"))).isFalse();
        assertThat(queue.findById(JobId.of("missing"))).isEmpty();
    }
}
