package com.ryuqq.reportflow.core.spi;

import com.ryuqq.reportflow.core.contract.Job;
import com.ryuqq.reportflow.core.contract.JobHandle;
import com.ryuqq.reportflow.core.contract.JobOptions;
import com.ryuqq.reportflow.core.model.JobId;
import com.ryuqq.reportflow.core.model.Payload;
import com.ryuqq.reportflow.core.model.QueueName;
import com.ryuqq.reportflow.core.outcome.Fail;
import com.ryuqq.reportflow.core.outcome.Ok;

import java.util.List;
import java.util.Optional;

/**
 * Durable Queue SPI with delayed-visibility scheduling.
 *
 * <p>This interface abstracts the external job broker used by the worker pool,
 * the report pipeline and the delivery dispatcher.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Enqueueing jobs with an optional visibility delay</li>
 *   <li>Leasing eligible jobs exclusively (at most one active handler per job)</li>
 *   <li>Recording the terminal outcome of a leased job</li>
 *   <li>Patching the payload of a job that has not been leased yet</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Exclusive Lease: A job must never be returned by two lease calls</li>
 *   <li>Ordering: FIFO by eligible time within one queue, nothing across queues</li>
 *   <li>No Requeue: FAILED jobs are not requeued by this contract (broker retry is external)</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * // Schedule a delivery 5 minutes from now
 * JobHandle handle = queue.enqueue(QueueName.of("email"), payload, JobOptions.delayed(Duration.ofMinutes(5)));
 *
 * // Worker side
 * for (Job job : queue.lease(QueueName.of("email"), 5)) {
 *     try {
 *         queue.complete(job.id(), new Ok(job.id(), handler.handle(job)));
 *     } catch (Exception e) {
 *         queue.fail(job.id(), Fail.from("HANDLER_ERROR", e));
 *     }
 * }
 * </pre>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public interface JobQueue {

    /**
     * Enqueues a job on the named queue.
     *
     * <p>The job becomes eligible for leasing at {@code enqueueTime + options.delayMs()}.
     * A zero delay yields a WAITING job, a positive delay a DELAYED job.</p>
     *
     * @param queueName target queue
     * @param payload job data
     * @param options visibility options
     * @return handle carrying the new job id
     * @throws IllegalArgumentException if any argument is null
     */
    JobHandle enqueue(QueueName queueName, Payload payload, JobOptions options);

    /**
     * Leases up to {@code max} eligible jobs from the named queue.
     *
     * <p>Returned jobs are ACTIVE with their attempt count incremented. Jobs are
     * ordered by eligible time.</p>
     *
     * @param queueName queue to lease from
     * @param max maximum number of jobs
     * @return leased jobs (may be empty)
     * @throws IllegalArgumentException if queueName is null or max is not positive
     */
    List<Job> lease(QueueName queueName, int max);

    /**
     * Marks an active job completed and stores its result.
     *
     * @param jobId leased job
     * @param ok success outcome
     * @throws IllegalArgumentException if an argument is null or the job is unknown
     * @throws IllegalStateException if the job is not ACTIVE
     */
    void complete(JobId jobId, Ok ok);

    /**
     * Marks an active job failed.
     *
     * @param jobId leased job
     * @param fail failure details
     * @throws IllegalArgumentException if an argument is null or the job is unknown
     * @throws IllegalStateException if the job is not ACTIVE
     */
    void fail(JobId jobId, Fail fail);

    /**
     * Looks up a job snapshot by id.
     *
     * @param jobId job id
     * @return the job, or empty if unknown
     */
    Optional<Job> findById(JobId jobId);

    /**
     * Replaces the payload of a still-pending job in place.
     *
     * <p>Used to patch an already scheduled delivery before it becomes eligible.
     * The visibility time is not changed.</p>
     *
     * @param jobId job id
     * @param payload new payload
     * @return true if replaced, false if the job is unknown
     * @throws IllegalArgumentException if an argument is null
     * @throws IllegalStateException if the job is ACTIVE or terminal
     */
    boolean updateData(JobId jobId, Payload payload);
}
