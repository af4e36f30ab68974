package com.ryuqq.reportflow.adapter.inmemory.queue;

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
import com.ryuqq.reportflow.core.statemachine.JobStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link JobQueue} SPI for testing and reference purposes.
 *
 * <p>This implementation keeps one {@link DelayQueue} per queue name for delayed
 * visibility and a job table holding the authoritative job snapshots.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Schedule:</strong> DelayQueue&lt;ScheduledEntry&gt; per queue - ordered by (visibleAt, enqueue sequence)</li>
 *   <li><strong>Job Table:</strong> ConcurrentHashMap&lt;JobId, Job&gt; - state, payload, outcome</li>
 * </ul>
 *
 * <p><strong>Exclusive Lease:</strong> an entry is removed from the DelayQueue by exactly one
 * {@code poll()}, and the WAITING/DELAYED → ACTIVE change is made inside
 * {@link ConcurrentHashMap#compute}, which also serializes it against {@link #updateData}.</p>
 *
 * <p><strong>Retention:</strong> COMPLETED and FAILED jobs stay queryable until more than
 * {@code terminalRetention} jobs have finished; the oldest finished jobs are then dropped from
 * the job table, after which {@link #findById} no longer returns them.</p>
 *
 * <p><strong>Time:</strong> visibility is decided by the injected {@link Clock}, so tests can
 * cross a 5-minute delivery delay without sleeping.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * JobQueue queue = new InMemoryJobQueue(Clock.systemUTC());
 * JobHandle handle = queue.enqueue(QueueName.of("email"), payload, JobOptions.delayed(Duration.ofMinutes(5)));
 * </pre>
 *
 * @author ReportFlow Team
 * @since 1.0.0
 */
public class InMemoryJobQueue implements JobQueue {

    /** Default number of finished jobs kept queryable. */
    public static final int DEFAULT_TERMINAL_RETENTION = 1000;

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobQueue.class);

    private final Clock clock;
    private final int terminalRetention;
    private final ConcurrentLinkedQueue<JobId> finishedOrder = new ConcurrentLinkedQueue<>();
    private final AtomicInteger finishedCount = new AtomicInteger();
    private final ConcurrentHashMap<JobId, Job> jobs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<QueueName, DelayQueue<ScheduledEntry>> schedules = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Creates a queue using the system UTC clock.
     */
    public InMemoryJobQueue() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a queue using the given clock for visibility decisions.
     *
     * @param clock time source
     * @throws IllegalArgumentException if clock is null
     */
    public InMemoryJobQueue(Clock clock) {
        this(clock, DEFAULT_TERMINAL_RETENTION);
    }

    /**
     * Creates a queue that keeps at most {@code terminalRetention} finished jobs.
     *
     * @param clock time source
     * @param terminalRetention number of COMPLETED/FAILED jobs kept queryable
     * @throws IllegalArgumentException if clock is null or terminalRetention is negative
     */
    public InMemoryJobQueue(Clock clock, int terminalRetention) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (terminalRetention < 0) {
            throw new IllegalArgumentException("terminalRetention must not be negative, but was: " + terminalRetention);
        }
        this.clock = clock;
        this.terminalRetention = terminalRetention;
    }

    @Override
    public JobHandle enqueue(QueueName queueName, Payload payload, JobOptions options) {
        if (queueName == null) {
            throw new IllegalArgumentException("queueName cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }

        JobId id = JobId.generate();
        Job job = Job.enqueued(id, queueName, payload, clock.millis(), options.delayMs());
        jobs.put(id, job);
        schedule(queueName).put(new ScheduledEntry(id, job.visibleAt(), sequence.incrementAndGet(), clock));

        log.debug("Enqueued {} on {} (state={}, visibleAt={})", id, queueName, job.state(), job.visibleAt());
        return new JobHandle(id, queueName, job.visibleAt());
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Polls the DelayQueue for entries whose visibleAt has passed</li>
     *   <li>Entries whose job is no longer pending are skipped</li>
     * </ul>
     */
    @Override
    public List<Job> lease(QueueName queueName, int max) {
        if (queueName == null) {
            throw new IllegalArgumentException("queueName cannot be null");
        }
        if (max <= 0) {
            throw new IllegalArgumentException("max must be positive, but was: " + max);
        }

        DelayQueue<ScheduledEntry> schedule = schedule(queueName);
        List<Job> leased = new ArrayList<>();
        while (leased.size() < max) {
            ScheduledEntry entry = schedule.poll();
            if (entry == null) {
                break;
            }
            Job[] claimed = new Job[1];
            jobs.computeIfPresent(entry.jobId, (id, current) -> {
                if (!current.state().isPending()) {
                    return current;
                }
                JobStateTransition.validate(current.state(), JobState.ACTIVE);
                claimed[0] = current.leased();
                return claimed[0];
            });
            if (claimed[0] != null) {
                leased.add(claimed[0]);
            }
        }
        return leased;
    }

    @Override
    public void complete(JobId jobId, Ok ok) {
        if (ok == null) {
            throw new IllegalArgumentException("ok cannot be null");
        }
        finish(jobId, JobState.COMPLETED, job -> job.completed(ok.result()));
    }

    @Override
    public void fail(JobId jobId, Fail fail) {
        if (fail == null) {
            throw new IllegalArgumentException("fail cannot be null");
        }
        finish(jobId, JobState.FAILED, job -> job.failed(fail.errorCode() + ": " + fail.message()));
    }

    /**
     * {@inheritDoc}
     *
     * <p>A DELAYED job whose visibility time has passed is reported as WAITING.</p>
     */
    @Override
    public Optional<Job> findById(JobId jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        return Optional.ofNullable(jobs.computeIfPresent(jobId, (id, job) -> promoteIfVisible(job)));
    }

    @Override
    public boolean updateData(JobId jobId, Payload payload) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }

        Job updated = jobs.computeIfPresent(jobId, (id, job) -> {
            if (!job.state().isPending()) {
                throw new IllegalStateException("Cannot update data of " + job.state() + " job: " + id.getValue());
            }
            return job.withPayload(payload);
        });
        return updated != null;
    }

    /**
     * Returns snapshots of every job ever enqueued on a queue, oldest first. Used for test assertions.
     *
     * @param queueName queue name
     * @return job snapshots
     */
    public List<Job> jobs(QueueName queueName) {
        return jobs.values().stream()
            .filter(job -> job.queueName().equals(queueName))
            .map(this::promoteIfVisible)
            .sorted(Comparator.comparingLong(Job::enqueuedAt).thenComparingLong(Job::visibleAt))
            .collect(Collectors.toList());
    }

    /**
     * Returns the number of not-yet-leased jobs on a queue. Used for test assertions.
     *
     * @param queueName queue name
     * @return pending job count
     */
    public int pendingCount(QueueName queueName) {
        return (int) jobs.values().stream()
            .filter(job -> job.queueName().equals(queueName) && job.state().isPending())
            .count();
    }

    /**
     * Clears all queues and jobs. Used for test cleanup.
     */
    public void clear() {
        schedules.clear();
        jobs.clear();
        finishedOrder.clear();
        finishedCount.set(0);
    }

    private DelayQueue<ScheduledEntry> schedule(QueueName queueName) {
        return schedules.computeIfAbsent(queueName, name -> new DelayQueue<>());
    }

    private Job promoteIfVisible(Job job) {
        if (job.state() == JobState.DELAYED && job.visibleAt() <= clock.millis()) {
            return job.withState(JobStateTransition.transition(JobState.DELAYED, JobState.WAITING));
        }
        return job;
    }

    private void finish(JobId jobId, JobState target, UnaryOperator<Job> change) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId cannot be null");
        }
        Job finished = jobs.computeIfPresent(jobId, (id, job) -> {
            JobStateTransition.validate(job.state(), target);
            return change.apply(job);
        });
        if (finished == null) {
            throw new IllegalArgumentException("Unknown job: " + jobId.getValue());
        }
        log.debug("Job {} finished as {}", jobId, target);
        retain(jobId);
    }

    private void retain(JobId finishedId) {
        finishedOrder.add(finishedId);
        finishedCount.incrementAndGet();
        while (finishedCount.get() > terminalRetention) {
            JobId oldest = finishedOrder.poll();
            if (oldest == null) {
                break;
            }
            finishedCount.decrementAndGet();
            jobs.remove(oldest);
        }
    }

    /**
     * Schedule entry ordered by visibility time, then enqueue order.
     */
    private static final class ScheduledEntry implements Delayed {
        private final JobId jobId;
        private final long visibleAt;
        private final long sequence;
        private final Clock clock;

        ScheduledEntry(JobId jobId, long visibleAt, long sequence, Clock clock) {
            this.jobId = jobId;
            this.visibleAt = visibleAt;
            this.sequence = sequence;
            this.clock = clock;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(visibleAt - clock.millis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            ScheduledEntry that = (ScheduledEntry) other;
            int byTime = Long.compare(visibleAt, that.visibleAt);
            return byTime != 0 ? byTime : Long.compare(sequence, that.sequence);
        }
    }
}
