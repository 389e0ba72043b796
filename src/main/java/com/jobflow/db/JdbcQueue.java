package com.jobflow.db;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonParser;
import com.jobflow.broker.Backoff;
import com.jobflow.broker.BrokerException;
import com.jobflow.broker.BrokerJob;
import com.jobflow.broker.BrokerQueue;
import com.jobflow.broker.BulkJob;
import com.jobflow.broker.CronSchedule;
import com.jobflow.broker.Dependencies;
import com.jobflow.broker.DependencyCounts;
import com.jobflow.broker.JobOptions;
import com.jobflow.broker.JobState;
import com.jobflow.broker.ProgressListener;
import com.jobflow.broker.RepeatOptions;
import com.jobflow.broker.Retention;
import com.jobflow.broker.SchedulerEntry;
import com.jobflow.db.JobRepository.DependencyRow;
import com.jobflow.db.JobRepository.JobRow;

/**
 * {@link BrokerQueue} over the {@code jobs} table of a {@link JdbcBroker}.
 *
 * <p><b>Claiming:</b> {@link #moveToActive} reads a few due candidates in claim order and tries to
 * claim them one by one with a conditional update; the first update that matches wins. A job that
 * another process claimed in between is simply skipped.</p>
 *
 * <p><b>Job schedulers:</b> a scheduler row holds the repeat rule and the job template; exactly
 * one pending occurrence exists per scheduler, with the deterministic id
 * {@code repeat:<schedulerId>:<epochMillis>}. Claiming an occurrence enqueues the next one in the
 * same transaction, so nothing needs to stay resident as a timer.</p>
 *
 * <p><b>Failures:</b> a failed attempt goes back to DELAYED with the job's backoff while attempts
 * remain, otherwise the job is FAILED. Finished jobs are trimmed per retention right after the
 * transition.</p>
 *
 * <p><b>Thread Safety:</b> stateless apart from the progress listeners; every operation borrows
 * its own connection.</p>
 */
public class JdbcQueue implements BrokerQueue {
    private static final Logger logger = Logger.getLogger(JdbcQueue.class.getName());

    private static final int CLAIM_CANDIDATES = 5;
    // Runs of one write transaction that lost a race on a key against another process
    static final int CONFLICT_ATTEMPTS = 8;
    private static final String REPEAT_PREFIX = "repeat:";

    private final String name;
    private final JdbcBroker broker;
    private final Database database;
    private final JobRepository jobs;
    private final SchedulerRepository schedulers;
    private final List<ProgressListener> progressListeners = new CopyOnWriteArrayList<>();
    private volatile boolean closed = false;

    JdbcQueue(String name, JdbcBroker broker) {
        this.name = name;
        this.broker = broker;
        this.database = broker.database();
        this.jobs = broker.jobs();
        this.schedulers = broker.schedulers();
    }

    @Override
    public String getName() {
        return name;
    }

    // ==================== PRODUCER ====================

    @Override
    public BrokerJob add(String jobName, String data, JobOptions options) {
        ensureOpen();
        JobOptions effective = JobOptions.DEFAULTS.mergedWith(options);
        RepeatOptions repeat = effective.getRepeat();
        if (repeat != null) {
            return addRepeatable(jobName, data, effective, repeat);
        }

        try {
            JobRow row = database.inTransaction(conn -> insertOrGet(conn, jobName, data, effective),
                    CONFLICT_ATTEMPTS);
            return new JdbcJob(row, this);
        } catch (SQLException e) {
            throw new BrokerException("Failed to add job " + jobName + " to queue " + name, e);
        }
    }

    @Override
    public List<BrokerJob> addBulk(List<BulkJob> bulk) {
        ensureOpen();
        for (BulkJob job : bulk) {
            if (job.getOptions().getRepeat() != null) {
                throw new IllegalArgumentException("Repeatable jobs cannot be added in bulk: " + job.getName());
            }
        }

        try {
            List<JobRow> rows = database.inTransaction(conn -> {
                List<JobRow> inserted = new ArrayList<>(bulk.size());
                for (BulkJob job : bulk) {
                    inserted.add(insertOrGet(conn, job.getName(), job.getData(),
                            JobOptions.DEFAULTS.mergedWith(job.getOptions())));
                }
                return inserted;
            }, CONFLICT_ATTEMPTS);
            List<BrokerJob> result = new ArrayList<>(rows.size());
            for (JobRow row : rows) {
                result.add(new JdbcJob(row, this));
            }
            return result;
        } catch (SQLException e) {
            throw new BrokerException("Failed to add " + bulk.size() + " jobs to queue " + name, e);
        }
    }

    /**
     * Insert a job, or return the existing one when a custom id is already taken. A concurrent
     * insert of the same id fails this transaction with a duplicate key; the caller runs it again
     * and then finds the winner's row.
     */
    private JobRow insertOrGet(Connection conn, String jobName, String data, JobOptions options) throws SQLException {
        if (options.getJobId() != null) {
            JobRow existing = jobs.find(conn, name, options.getJobId());
            if (existing != null) {
                logger.fine("Job " + options.getJobId() + " already exists in queue " + name);
                return existing;
            }
        }

        long now = broker.now();
        long delay = options.getDelay() != null ? options.getDelay() : 0L;
        JobState state = delay > 0 ? JobState.DELAYED : JobState.WAITING;
        String id = options.getJobId() != null ? options.getJobId() : UUID.randomUUID().toString();

        JobRow row = newRow(name, id, jobName, data, options, state, now, now + delay);
        jobs.insert(conn, row);
        return jobs.find(conn, name, id);
    }

    static JobRow newRow(String queueName, String id, String jobName, String data, JobOptions options,
                         JobState state, long now, long processAt) {
        JobRow row = new JobRow();
        row.setQueueName(queueName);
        row.setId(id);
        row.setName(jobName);
        row.setData(data);
        row.setOptions(options.toJson());
        row.setState(state);
        row.setPriority(options.getPriority());
        row.setAttempts(options.getAttempts());
        row.setCreatedAt(now);
        row.setProcessAt(processAt);
        return row;
    }

    /**
     * Repeatable jobs added through {@link #add} are schedulers keyed by name, pattern and timezone.
     */
    private BrokerJob addRepeatable(String jobName, String data, JobOptions options, RepeatOptions repeat) {
        String schedulerId = REPEAT_PREFIX + jobName + ":" + repeat.getPattern() + ":" + repeat.getTimezone();
        JobOptions template = options.toBuilder().repeat(null).jobId(null).build();

        SchedulerEntry entry = upsertJobScheduler(schedulerId, repeat, jobName, data, template);
        if (entry.getNextRun() == null) {
            throw new IllegalArgumentException("Repeat rule never fires: " + repeat);
        }
        return getJob(occurrenceId(schedulerId, entry.getNextRun().toEpochMilli()))
                .orElseThrow(() -> new BrokerException("Scheduled occurrence of " + schedulerId + " vanished"));
    }

    @Override
    public Optional<BrokerJob> getJob(String jobId) {
        ensureOpen();
        try (Connection conn = database.getConnection()) {
            JobRow row = jobs.find(conn, name, jobId);
            return row != null ? Optional.of(new JdbcJob(row, this)) : Optional.empty();
        } catch (SQLException e) {
            throw new BrokerException("Failed to read job " + jobId + " from queue " + name, e);
        }
    }

    @Override
    public Map<JobState, Long> getJobCounts() {
        ensureOpen();
        try (Connection conn = database.getConnection()) {
            return jobs.countByState(conn, name);
        } catch (SQLException e) {
            throw new BrokerException("Failed to count jobs of queue " + name, e);
        }
    }

    @Override
    public boolean remove(String jobId) {
        ensureOpen();
        try {
            boolean removed = database.inTransaction(conn -> jobs.delete(conn, name, jobId));
            if (removed) {
                logger.info("Removed job " + jobId + " from queue " + name);
            }
            return removed;
        } catch (SQLException e) {
            throw new BrokerException("Failed to remove job " + jobId + " from queue " + name, e);
        }
    }

    @Override
    public boolean retry(String jobId) {
        ensureOpen();
        try (Connection conn = database.getConnection()) {
            boolean retried = jobs.retryFailed(conn, name, jobId, broker.now());
            if (retried) {
                logger.info("Job " + jobId + " of queue " + name + " moved back to waiting");
            }
            return retried;
        } catch (SQLException e) {
            throw new BrokerException("Failed to retry job " + jobId + " of queue " + name, e);
        }
    }

    @Override
    public boolean promote(String jobId) {
        ensureOpen();
        try (Connection conn = database.getConnection()) {
            return jobs.promote(conn, name, jobId, broker.now());
        } catch (SQLException e) {
            throw new BrokerException("Failed to promote job " + jobId + " of queue " + name, e);
        }
    }

    @Override
    public List<String> getJobLogs(String jobId) {
        ensureOpen();
        try (Connection conn = database.getConnection()) {
            return jobs.findLogs(conn, name, jobId);
        } catch (SQLException e) {
            throw new BrokerException("Failed to read logs of job " + jobId, e);
        }
    }

    // ==================== JOB SCHEDULERS ====================

    @Override
    public SchedulerEntry upsertJobScheduler(String schedulerId, RepeatOptions repeat, String jobName, String data,
                                             JobOptions options) {
        ensureOpen();
        CronSchedule cron = CronSchedule.parse(repeat.getPattern(), repeat.getTimezone());
        JobOptions template = (options != null ? options : JobOptions.empty()).toBuilder().repeat(null).build();

        // Processes upserting the same scheduler at once collide on the occurrence key; the loser
        // runs again on the winner's committed rows and ends in the same state.
        try {
            SchedulerEntry entry = database.inTransaction(conn -> {
                SchedulerEntry existing = schedulers.find(conn, name, schedulerId);
                int removed = jobs.deletePendingForScheduler(conn, name, schedulerId);
                int iterations = existing != null ? Math.max(0, existing.getIterationCount() - removed) : 0;

                long now = broker.now();
                Instant from = Instant.ofEpochMilli(now);
                if (repeat.getStartDate() != null && repeat.getStartDate().isAfter(from)) {
                    from = repeat.getStartDate().minusMillis(1);
                }
                Instant next = nextRun(cron, repeat, iterations, from);
                if (next != null) {
                    enqueueOccurrence(conn, schedulerId, jobName, data, template, next, now);
                    iterations++;
                }

                SchedulerEntry updated = new SchedulerEntry(schedulerId, name, jobName, repeat, data, template,
                        iterations, next);
                schedulers.merge(conn, updated);
                return updated;
            }, CONFLICT_ATTEMPTS);
            logger.fine("Upserted job scheduler " + schedulerId + " on queue " + name + ", next run " + entry.getNextRun());
            return entry;
        } catch (SQLException e) {
            throw new BrokerException("Failed to upsert job scheduler " + schedulerId + " on queue " + name, e);
        }
    }

    @Override
    public boolean removeJobScheduler(String schedulerId) {
        ensureOpen();
        try {
            return database.inTransaction(conn -> {
                jobs.deletePendingForScheduler(conn, name, schedulerId);
                return schedulers.delete(conn, name, schedulerId);
            });
        } catch (SQLException e) {
            throw new BrokerException("Failed to remove job scheduler " + schedulerId + " from queue " + name, e);
        }
    }

    @Override
    public Optional<SchedulerEntry> getJobScheduler(String schedulerId) {
        ensureOpen();
        try (Connection conn = database.getConnection()) {
            return Optional.ofNullable(schedulers.find(conn, name, schedulerId));
        } catch (SQLException e) {
            throw new BrokerException("Failed to read job scheduler " + schedulerId, e);
        }
    }

    @Override
    public List<SchedulerEntry> getJobSchedulers() {
        ensureOpen();
        try (Connection conn = database.getConnection()) {
            return schedulers.findAll(conn, name);
        } catch (SQLException e) {
            throw new BrokerException("Failed to list job schedulers of queue " + name, e);
        }
    }

    /**
     * Next fire time after {@code from}, or null once the limit or the end date is reached.
     */
    private static Instant nextRun(CronSchedule cron, RepeatOptions repeat, int iterations, Instant from) {
        if (repeat.getLimit() != null && iterations >= repeat.getLimit()) {
            return null;
        }
        Instant next = cron.nextAfter(from);
        if (next == null || (repeat.getEndDate() != null && next.isAfter(repeat.getEndDate()))) {
            return null;
        }
        return next;
    }

    private void enqueueOccurrence(Connection conn, String schedulerId, String jobName, String data,
                                   JobOptions template, Instant runAt, long now) throws SQLException {
        String id = occurrenceId(schedulerId, runAt.toEpochMilli());
        if (jobs.find(conn, name, id) != null) {
            return;
        }
        JobOptions options = JobOptions.DEFAULTS.mergedWith(template);
        long processAt = runAt.toEpochMilli();
        JobState state = processAt > now ? JobState.DELAYED : JobState.WAITING;

        JobRow row = newRow(name, id, jobName, data, options, state, now, processAt);
        row.setSchedulerId(schedulerId);
        jobs.insert(conn, row);
    }

    /**
     * Enqueue the occurrence following a claimed scheduler job, unless the scheduler was removed,
     * replaced, or is exhausted.
     */
    private void scheduleFollowing(Connection conn, JobRow claimed, long now) throws SQLException {
        SchedulerEntry entry = schedulers.find(conn, name, claimed.getSchedulerId());
        if (entry == null || entry.getNextRun() == null
                || entry.getNextRun().toEpochMilli() != claimed.getProcessAt()) {
            return;
        }

        CronSchedule cron = CronSchedule.parse(entry.getRepeat().getPattern(), entry.getRepeat().getTimezone());
        Instant from = Instant.ofEpochMilli(Math.max(claimed.getProcessAt(), now));
        Instant next = nextRun(cron, entry.getRepeat(), entry.getIterationCount(), from);
        int iterations = entry.getIterationCount();
        if (next != null) {
            enqueueOccurrence(conn, entry.getId(), entry.getJobName(), entry.getData(), entry.getOptions(), next, now);
            iterations++;
        } else {
            logger.info("Job scheduler " + entry.getId() + " on queue " + name + " is exhausted after "
                    + iterations + " runs");
        }
        schedulers.updateIteration(conn, name, entry.getId(), iterations, next);
    }

    static String occurrenceId(String schedulerId, long runAtMillis) {
        return REPEAT_PREFIX + schedulerId + ":" + runAtMillis;
    }

    // ==================== CONSUMER ====================

    @Override
    public Optional<BrokerJob> moveToActive(String token, Duration lockDuration) {
        ensureOpen();
        try {
            long now = broker.now();
            List<String> candidates;
            try (Connection conn = database.getConnection()) {
                candidates = jobs.findClaimCandidates(conn, name, now, CLAIM_CANDIDATES);
            }

            for (String id : candidates) {
                JobRow claimed = database.inTransaction(conn -> {
                    if (!jobs.claim(conn, name, id, token, now + lockDuration.toMillis(), now)) {
                        return null;
                    }
                    JobRow row = jobs.find(conn, name, id);
                    if (row.getSchedulerId() != null) {
                        scheduleFollowing(conn, row, now);
                    }
                    return row;
                });
                if (claimed != null) {
                    return Optional.of(new JdbcJob(claimed, this));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new BrokerException("Failed to claim a job from queue " + name, e);
        }
    }

    @Override
    public void moveToCompleted(BrokerJob job, String token, String returnValue, Retention retention) {
        ensureOpen();
        try {
            database.inTransaction(conn -> {
                long now = broker.now();
                int attemptsMade = job.getAttemptsMade() + 1;
                if (!jobs.complete(conn, name, job.getId(), token, attemptsMade, returnValue, now)) {
                    throw new BrokerException("Lock lost for job " + job.getId() + " of queue " + name);
                }

                if (job.getParentId() != null) {
                    JobRow row = jobs.find(conn, name, job.getId());
                    jobs.markChildProcessed(conn, row.getParentQueue(), row.getParentId(), name, job.getId(), returnValue);
                    if (jobs.countUnprocessed(conn, row.getParentQueue(), row.getParentId()) == 0
                            && jobs.releaseParent(conn, row.getParentQueue(), row.getParentId(), now)) {
                        logger.fine("All children of " + row.getParentQueue() + ":" + row.getParentId() + " completed");
                    }
                }

                Retention effective = retention != null ? retention : job.getOptions().getRemoveOnComplete();
                jobs.trim(conn, name, JobState.COMPLETED, effective, now);
                return null;
            });
        } catch (SQLException e) {
            throw new BrokerException("Failed to complete job " + job.getId() + " of queue " + name, e);
        }
    }

    @Override
    public boolean moveToFailed(BrokerJob job, String token, Throwable error, Retention retention) {
        ensureOpen();
        String reason = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
        String stacktrace = stackTraceOf(error);

        try {
            return database.inTransaction(conn -> {
                long now = broker.now();
                int attemptsMade = job.getAttemptsMade() + 1;

                if (attemptsMade < job.getAttempts()) {
                    Backoff backoff = job.getOptions().getBackoff();
                    long delay = backoff != null ? backoff.computeDelay(attemptsMade) : 0L;
                    JobState state = delay > 0 ? JobState.DELAYED : JobState.WAITING;
                    if (!jobs.scheduleRetry(conn, name, job.getId(), token, attemptsMade, state, now + delay,
                            reason, stacktrace)) {
                        throw new BrokerException("Lock lost for job " + job.getId() + " of queue " + name);
                    }
                    return true;
                }

                if (!jobs.fail(conn, name, job.getId(), token, attemptsMade, reason, stacktrace, now)) {
                    throw new BrokerException("Lock lost for job " + job.getId() + " of queue " + name);
                }
                if (job.getParentId() != null && job.getOptions().isFailParentOnFailure()) {
                    failParents(conn, jobs.find(conn, name, job.getId()), now);
                }

                Retention effective = retention != null ? retention : job.getOptions().getRemoveOnFail();
                jobs.trim(conn, name, JobState.FAILED, effective, now);
                return false;
            });
        } catch (SQLException e) {
            throw new BrokerException("Failed to record failure of job " + job.getId() + " of queue " + name, e);
        }
    }

    /**
     * Fail the parent of a permanently failed child, and its own parent while each failed node
     * carries failParentOnFailure.
     */
    private void failParents(Connection conn, JobRow child, long now) throws SQLException {
        JobRow current = child;
        while (current != null && current.getParentId() != null
                && JobOptions.fromJson(current.getOptions()).isFailParentOnFailure()) {
            String reason = "child " + current.getQueueName() + ":" + current.getId() + " failed";
            if (!jobs.failWaitingParent(conn, current.getParentQueue(), current.getParentId(), reason, now)) {
                return;
            }
            logger.info("Failed parent " + current.getParentQueue() + ":" + current.getParentId() + ", " + reason);
            current = jobs.find(conn, current.getParentQueue(), current.getParentId());
        }
    }

    @Override
    public boolean moveToWaiting(BrokerJob job, String token) {
        ensureOpen();
        try (Connection conn = database.getConnection()) {
            boolean released = jobs.releaseActive(conn, name, job.getId(), token, broker.now());
            if (released) {
                logger.info("Job " + job.getId() + " of queue " + name + " moved back to waiting");
            }
            return released;
        } catch (SQLException e) {
            throw new BrokerException("Failed to move job " + job.getId() + " of queue " + name + " back to waiting", e);
        }
    }

    @Override
    public int extendLocks(String token, Duration lockDuration) {
        ensureOpen();
        try (Connection conn = database.getConnection()) {
            return jobs.extendLocks(conn, name, token, broker.now() + lockDuration.toMillis());
        } catch (SQLException e) {
            throw new BrokerException("Failed to extend locks on queue " + name, e);
        }
    }

    @Override
    public int recoverStalledJobs(int maxStalledCount) {
        ensureOpen();
        try {
            List<JobRow> stalled;
            long now = broker.now();
            try (Connection conn = database.getConnection()) {
                stalled = jobs.findStalled(conn, name, now);
            }

            int recovered = 0;
            for (JobRow row : stalled) {
                boolean changed = database.inTransaction(conn -> {
                    if (row.getStalledCount() + 1 > maxStalledCount) {
                        String reason = "job stalled more than allowable limit";
                        if (!jobs.fail(conn, name, row.getId(), row.getLockToken(), row.getAttemptsMade(), reason, null, now)) {
                            return false;
                        }
                        if (row.getParentId() != null && JobOptions.fromJson(row.getOptions()).isFailParentOnFailure()) {
                            failParents(conn, row, now);
                        }
                        logger.warning("Job " + row.getId() + " of queue " + name + " failed: " + reason);
                        return true;
                    }
                    boolean requeued = jobs.requeueStalled(conn, name, row.getId(), row.getLockToken(), now);
                    if (requeued) {
                        logger.warning("Job " + row.getId() + " of queue " + name + " stalled, moved back to waiting");
                    }
                    return requeued;
                });
                if (changed) {
                    recovered++;
                }
            }
            return recovered;
        } catch (SQLException e) {
            throw new BrokerException("Failed to recover stalled jobs of queue " + name, e);
        }
    }

    @Override
    public void addProgressListener(ProgressListener listener) {
        progressListeners.add(listener);
    }

    @Override
    public void removeProgressListener(ProgressListener listener) {
        progressListeners.remove(listener);
    }

    @Override
    public void close() {
        closed = true;
        progressListeners.clear();
    }

    // ==================== JOB HANDLE SUPPORT ====================

    void updateProgress(JdbcJob job, int progress) {
        ensureOpen();
        try (Connection conn = database.getConnection()) {
            jobs.updateProgress(conn, name, job.getId(), progress);
        } catch (SQLException e) {
            throw new BrokerException("Failed to update progress of job " + job.getId(), e);
        }
        for (ProgressListener listener : progressListeners) {
            try {
                listener.onProgress(job, progress);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Progress listener failed for job " + job.getId(), e);
            }
        }
    }

    void log(String jobId, String message) {
        ensureOpen();
        try (Connection conn = database.getConnection()) {
            jobs.insertLog(conn, name, jobId, message, broker.now());
        } catch (SQLException e) {
            throw new BrokerException("Failed to write log of job " + jobId, e);
        }
    }

    Dependencies dependencies(String jobId) {
        ensureOpen();
        List<DependencyRow> rows;
        try (Connection conn = database.getConnection()) {
            rows = jobs.findDependencies(conn, name, jobId);
        } catch (SQLException e) {
            throw new BrokerException("Failed to read dependencies of job " + jobId, e);
        }

        Map<String, JsonElement> processed = new LinkedHashMap<>();
        List<String> unprocessed = new ArrayList<>();
        for (DependencyRow row : rows) {
            if (row.isProcessed()) {
                processed.put(row.getKey(), parse(row.getReturnValue()));
            } else {
                unprocessed.add(row.getKey());
            }
        }
        return new Dependencies(processed, unprocessed);
    }

    DependencyCounts dependencyCounts(String jobId) {
        Dependencies dependencies = dependencies(jobId);
        return new DependencyCounts(dependencies.getProcessed().size(), dependencies.getUnprocessed().size());
    }

    static JsonElement parse(String json) {
        return json == null || json.isEmpty() ? JsonNull.INSTANCE : JsonParser.parseString(json);
    }

    private static String stackTraceOf(Throwable error) {
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    private void ensureOpen() {
        if (closed) {
            throw new BrokerException("Queue " + name + " is closed");
        }
    }

    @Override
    public String toString() {
        return "JdbcQueue{name='" + name + "'}";
    }
}
