package com.jobflow.broker;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Handle to one named durable queue.
 *
 * <p>The producer side ({@code add}, {@code addBulk}, job schedulers) is used by any process that
 * triggers jobs. The consumer side ({@code moveTo*}, locks, stalled recovery) is used by the worker
 * runtime. Within a queue, lower priority values are claimed first and equal priorities in FIFO
 * order.</p>
 *
 * <p><b>Thread Safety:</b> implementations must be safe for concurrent use by all worker threads
 * of a process.</p>
 */
public interface BrokerQueue extends AutoCloseable {

    String getName();

    // ==================== PRODUCER ====================

    /**
     * Enqueue one job. With {@link JobOptions#getRepeat()} set, a repeatable entry is upserted instead
     * and the first scheduled occurrence is returned.
     *
     * @param name logical job name
     * @param data JSON payload
     * @param options execution policy, already merged by the caller
     * @return handle of the stored job
     */
    BrokerJob add(String name, String data, JobOptions options);

    /**
     * Enqueue several jobs in one round trip and one transaction.
     *
     * @return one handle per entry, in the same order
     */
    List<BrokerJob> addBulk(List<BulkJob> jobs);

    Optional<BrokerJob> getJob(String jobId);

    /**
     * Number of jobs per state. Every state is present in the map, with zero when empty.
     */
    Map<JobState, Long> getJobCounts();

    /**
     * Remove a job that is not currently active, together with its logs.
     *
     * @return true if a job was removed
     */
    boolean remove(String jobId);

    /**
     * Move a failed job back to waiting, resetting its attempt counter.
     *
     * @return true if the job was failed and is now waiting
     */
    boolean retry(String jobId);

    /**
     * Make a delayed job claimable right away.
     *
     * @return true if the job was delayed and is now waiting
     */
    boolean promote(String jobId);

    List<String> getJobLogs(String jobId);

    // ==================== JOB SCHEDULERS ====================

    /**
     * Create or replace the scheduler with the given id. Re-submitting the same id never creates a
     * second scheduler nor a second pending occurrence.
     *
     * @param schedulerId stable id, e.g. {@code scheduler:daily-report}
     * @param repeat cron rule and bounds
     * @param jobName name of the produced jobs
     * @param data JSON payload of the produced jobs
     * @param options execution policy of the produced jobs
     * @return the stored scheduler
     */
    SchedulerEntry upsertJobScheduler(String schedulerId, RepeatOptions repeat, String jobName, String data,
                                      JobOptions options);

    /**
     * Remove the scheduler and its pending occurrence.
     *
     * @return true if the scheduler existed
     */
    boolean removeJobScheduler(String schedulerId);

    Optional<SchedulerEntry> getJobScheduler(String schedulerId);

    List<SchedulerEntry> getJobSchedulers();

    // ==================== CONSUMER ====================

    /**
     * Atomically claim the next due job and lock it for {@code lockDuration}.
     *
     * @param token identifies the claiming worker; required to complete or fail the job
     * @return the claimed job, or empty when nothing is due
     */
    Optional<BrokerJob> moveToActive(String token, Duration lockDuration);

    /**
     * Record a successful execution, notify the flow parent and trim completed jobs.
     *
     * @param returnValue handler result as JSON text
     * @param retention overrides the job's own completed retention when not null
     * @throws BrokerException if the lock was lost (the job was recovered as stalled)
     */
    void moveToCompleted(BrokerJob job, String token, String returnValue, Retention retention);

    /**
     * Record a failed execution. Schedules another attempt with backoff while attempts remain,
     * otherwise marks the job failed and trims failed jobs.
     *
     * @param retention overrides the job's own failed retention when not null
     * @return true if another attempt was scheduled
     * @throws BrokerException if the lock was lost
     */
    boolean moveToFailed(BrokerJob job, String token, Throwable error, Retention retention);

    /**
     * Put an active job back in line without counting the attempt, for a worker that stops before
     * the job finished.
     *
     * @return false if {@code token} no longer holds the job
     */
    boolean moveToWaiting(BrokerJob job, String token);

    /**
     * Extend the locks of every active job held by {@code token}.
     *
     * @return number of locks extended
     */
    int extendLocks(String token, Duration lockDuration);

    /**
     * Move active jobs whose lock expired back to waiting. Jobs that already stalled
     * {@code maxStalledCount} times are failed instead.
     *
     * @return number of jobs recovered or failed
     */
    int recoverStalledJobs(int maxStalledCount);

    void addProgressListener(ProgressListener listener);

    void removeProgressListener(ProgressListener listener);

    @Override
    void close();
}
