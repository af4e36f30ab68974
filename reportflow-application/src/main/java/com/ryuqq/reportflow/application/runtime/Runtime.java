package com.ryuqq.reportflow.application.runtime;

/**
 * Queue lease-loop runtime.
 *
 * <p>This interface defines one cycle of the worker pool's lease loop for a single queue.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * pump() starts
 *   ↓
 * 1. Count free worker slots (concurrency - running handlers)
 * 2. Lease up to that many eligible jobs from the JobQueue
 * 3. For each Job (on a worker thread):
 *    a. handler.handle(job)
 *    b. returned → queue.complete(Ok)
 *    c. thrown → log, queue.fail(Fail HANDLER_ERROR)
 * </pre>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>pump() is invoked periodically by a scheduler (see QueueWorkerRunner.start())</li>
 *   <li>pump() never blocks on handler execution</li>
 *   <li>Failed jobs are not requeued; retry is an external broker policy</li>
 * </ul>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Executes a single pump cycle: lease and dispatch to free worker slots.
     *
     * <p><strong>Exception Handling:</strong></p>
     * <ul>
     *   <li>Handler failures are caught per job and recorded as Fail</li>
     *   <li>Thrown exceptions indicate infrastructure failures (queue unavailable)</li>
     * </ul>
     *
     * @throws RuntimeException if the queue cannot be leased from
     */
    void pump();
}
