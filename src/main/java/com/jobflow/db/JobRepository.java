package com.jobflow.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.jobflow.broker.JobState;
import com.jobflow.broker.Retention;

/**
 * SQL access to the {@code jobs}, {@code job_dependencies} and {@code job_logs} tables.
 *
 * <p>Every method runs on a connection supplied by the caller, so that the broker can compose
 * several of them into one transaction. All statements are prepared through
 * {@link Database#prepare(Connection, String)} and closed with try-with-resources.</p>
 *
 * <p>State changes of a claimed job are guarded by its lock token: an update whose token does
 * not match (the job was recovered as stalled and claimed again) changes nothing and returns
 * false.</p>
 */
public class JobRepository {

    private static final int MAX_REASON_LENGTH = 4000;

    private final Database database;

    /**
     * One row of the {@code jobs} table.
     */
    public static class JobRow {
        private String queueName;
        private String id;
        private long seq;
        private String name;
        private String data;
        private String options;
        private JobState state;
        private int priority;
        private int attempts;
        private int attemptsMade;
        private long createdAt;
        private long processAt;
        private Long processedOn;
        private Long finishedOn;
        private String lockToken;
        private Long lockUntil;
        private int stalledCount;
        private int progress;
        private String returnValue;
        private String failedReason;
        private String stacktrace;
        private String parentQueue;
        private String parentId;
        private String schedulerId;

        public String getQueueName() { return queueName; }
        public void setQueueName(String queueName) { this.queueName = queueName; }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public long getSeq() { return seq; }
        public void setSeq(long seq) { this.seq = seq; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getData() { return data; }
        public void setData(String data) { this.data = data; }

        public String getOptions() { return options; }
        public void setOptions(String options) { this.options = options; }

        public JobState getState() { return state; }
        public void setState(JobState state) { this.state = state; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public int getAttempts() { return attempts; }
        public void setAttempts(int attempts) { this.attempts = attempts; }

        public int getAttemptsMade() { return attemptsMade; }
        public void setAttemptsMade(int attemptsMade) { this.attemptsMade = attemptsMade; }

        public long getCreatedAt() { return createdAt; }
        public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }

        public long getProcessAt() { return processAt; }
        public void setProcessAt(long processAt) { this.processAt = processAt; }

        public Long getProcessedOn() { return processedOn; }
        public void setProcessedOn(Long processedOn) { this.processedOn = processedOn; }

        public Long getFinishedOn() { return finishedOn; }
        public void setFinishedOn(Long finishedOn) { this.finishedOn = finishedOn; }

        public String getLockToken() { return lockToken; }
        public void setLockToken(String lockToken) { this.lockToken = lockToken; }

        public Long getLockUntil() { return lockUntil; }
        public void setLockUntil(Long lockUntil) { this.lockUntil = lockUntil; }

        public int getStalledCount() { return stalledCount; }
        public void setStalledCount(int stalledCount) { this.stalledCount = stalledCount; }

        public int getProgress() { return progress; }
        public void setProgress(int progress) { this.progress = progress; }

        public String getReturnValue() { return returnValue; }
        public void setReturnValue(String returnValue) { this.returnValue = returnValue; }

        public String getFailedReason() { return failedReason; }
        public void setFailedReason(String failedReason) { this.failedReason = failedReason; }

        public String getStacktrace() { return stacktrace; }
        public void setStacktrace(String stacktrace) { this.stacktrace = stacktrace; }

        public String getParentQueue() { return parentQueue; }
        public void setParentQueue(String parentQueue) { this.parentQueue = parentQueue; }

        public String getParentId() { return parentId; }
        public void setParentId(String parentId) { this.parentId = parentId; }

        public String getSchedulerId() { return schedulerId; }
        public void setSchedulerId(String schedulerId) { this.schedulerId = schedulerId; }

        @Override
        public String toString() {
            return "JobRow{queue='" + queueName + "', id='" + id + "', name='" + name + "', state=" + state
                    + ", priority=" + priority + "}";
        }
    }

    /**
     * One row of the {@code job_dependencies} table, seen from the parent.
     */
    public static class DependencyRow {
        private final String childQueue;
        private final String childId;
        private final boolean processed;
        private final String returnValue;

        DependencyRow(String childQueue, String childId, boolean processed, String returnValue) {
            this.childQueue = childQueue;
            this.childId = childId;
            this.processed = processed;
            this.returnValue = returnValue;
        }

        /**
         * Key of the child in the form {@code <queue>:<jobId>}.
         */
        public String getKey() { return childQueue + ":" + childId; }

        public boolean isProcessed() { return processed; }

        public String getReturnValue() { return returnValue; }
    }

    public JobRepository(Database database) {
        this.database = database;
    }

    // ==================== INSERT & LOOKUP ====================

    /**
     * Insert a job. The FIFO sequence number is drawn from {@code job_seq}.
     */
    public void insert(Connection conn, JobRow job) throws SQLException {
        String sql = "INSERT INTO jobs (queue_name, id, seq, job_name, job_data, job_opts, status, priority, attempts, " +
                     "attempts_made, created_at, process_at, parent_queue, parent_id, scheduler_id) " +
                     "VALUES (?, ?, NEXT VALUE FOR job_seq, ?, ?, ?, ?, ?, ?, 0, ?, ?, ?, ?, ?)";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, job.getQueueName());
            stmt.setString(2, job.getId());
            stmt.setString(3, job.getName());
            stmt.setString(4, job.getData());
            stmt.setString(5, job.getOptions());
            stmt.setString(6, job.getState().name());
            stmt.setInt(7, job.getPriority());
            stmt.setInt(8, job.getAttempts());
            stmt.setLong(9, job.getCreatedAt());
            stmt.setLong(10, job.getProcessAt());
            stmt.setString(11, job.getParentQueue());
            stmt.setString(12, job.getParentId());
            stmt.setString(13, job.getSchedulerId());
            stmt.executeUpdate();
        }
    }

    /**
     * @return the job, or null if it does not exist (or was removed by retention)
     */
    public JobRow find(Connection conn, String queueName, String id) throws SQLException {
        String sql = "SELECT * FROM jobs WHERE queue_name = ? AND id = ?";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, queueName);
            stmt.setString(2, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return mapRow(rs);
                }
            }
        }
        return null;
    }

    /**
     * Ids of due jobs in claim order: lowest priority value first, then earliest process time,
     * then insertion order.
     */
    public List<String> findClaimCandidates(Connection conn, String queueName, long now, int limit) throws SQLException {
        String sql = "SELECT id FROM jobs WHERE queue_name = ? AND status IN (?, ?) AND process_at <= ? " +
                     "ORDER BY priority ASC, process_at ASC, seq ASC LIMIT ?";

        List<String> ids = new ArrayList<>();
        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, queueName);
            stmt.setString(2, JobState.WAITING.name());
            stmt.setString(3, JobState.DELAYED.name());
            stmt.setLong(4, now);
            stmt.setInt(5, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString("id"));
                }
            }
        }
        return ids;
    }

    public Map<JobState, Long> countByState(Connection conn, String queueName) throws SQLException {
        String sql = "SELECT status, COUNT(*) AS total FROM jobs WHERE queue_name = ? GROUP BY status";

        Map<JobState, Long> counts = new EnumMap<>(JobState.class);
        for (JobState state : JobState.values()) {
            counts.put(state, 0L);
        }
        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, queueName);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    counts.put(JobState.valueOf(rs.getString("status")), rs.getLong("total"));
                }
            }
        }
        return counts;
    }

    // ==================== STATE TRANSITIONS ====================

    /**
     * Atomically move a due job to ACTIVE. Only one claimer can win: the update matches the row
     * only while it is still waiting or delayed.
     *
     * @return true if this call claimed the job
     */
    public boolean claim(Connection conn, String queueName, String id, String token, long lockUntil, long now)
            throws SQLException {
        String sql = "UPDATE jobs SET status = ?, lock_token = ?, lock_until = ?, processed_on = ? " +
                     "WHERE queue_name = ? AND id = ? AND status IN (?, ?) AND process_at <= ?";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, JobState.ACTIVE.name());
            stmt.setString(2, token);
            stmt.setLong(3, lockUntil);
            stmt.setLong(4, now);
            stmt.setString(5, queueName);
            stmt.setString(6, id);
            stmt.setString(7, JobState.WAITING.name());
            stmt.setString(8, JobState.DELAYED.name());
            stmt.setLong(9, now);
            return stmt.executeUpdate() == 1;
        }
    }

    public boolean complete(Connection conn, String queueName, String id, String token, int attemptsMade,
                            String returnValue, long now) throws SQLException {
        String sql = "UPDATE jobs SET status = ?, attempts_made = ?, return_value = ?, finished_on = ?, " +
                     "lock_token = NULL, lock_until = NULL " +
                     "WHERE queue_name = ? AND id = ? AND status = ? AND lock_token = ?";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, JobState.COMPLETED.name());
            stmt.setInt(2, attemptsMade);
            stmt.setString(3, returnValue);
            stmt.setLong(4, now);
            stmt.setString(5, queueName);
            stmt.setString(6, id);
            stmt.setString(7, JobState.ACTIVE.name());
            stmt.setString(8, token);
            return stmt.executeUpdate() == 1;
        }
    }

    /**
     * Put a failed attempt back in line, to be claimed again at {@code processAt}.
     */
    public boolean scheduleRetry(Connection conn, String queueName, String id, String token, int attemptsMade,
                                 JobState state, long processAt, String failedReason, String stacktrace)
            throws SQLException {
        String sql = "UPDATE jobs SET status = ?, attempts_made = ?, process_at = ?, failed_reason = ?, stacktrace = ?, " +
                     "lock_token = NULL, lock_until = NULL " +
                     "WHERE queue_name = ? AND id = ? AND status = ? AND lock_token = ?";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, state.name());
            stmt.setInt(2, attemptsMade);
            stmt.setLong(3, processAt);
            stmt.setString(4, truncate(failedReason));
            stmt.setString(5, stacktrace);
            stmt.setString(6, queueName);
            stmt.setString(7, id);
            stmt.setString(8, JobState.ACTIVE.name());
            stmt.setString(9, token);
            return stmt.executeUpdate() == 1;
        }
    }

    public boolean fail(Connection conn, String queueName, String id, String token, int attemptsMade,
                        String failedReason, String stacktrace, long now) throws SQLException {
        String sql = "UPDATE jobs SET status = ?, attempts_made = ?, failed_reason = ?, stacktrace = ?, finished_on = ?, " +
                     "lock_token = NULL, lock_until = NULL " +
                     "WHERE queue_name = ? AND id = ? AND status = ? AND lock_token = ?";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, JobState.FAILED.name());
            stmt.setInt(2, attemptsMade);
            stmt.setString(3, truncate(failedReason));
            stmt.setString(4, stacktrace);
            stmt.setLong(5, now);
            stmt.setString(6, queueName);
            stmt.setString(7, id);
            stmt.setString(8, JobState.ACTIVE.name());
            stmt.setString(9, token);
            return stmt.executeUpdate() == 1;
        }
    }

    /**
     * Fail a job that is waiting for its children (a child failed with failParentOnFailure).
     */
    public boolean failWaitingParent(Connection conn, String queueName, String id, String failedReason, long now)
            throws SQLException {
        String sql = "UPDATE jobs SET status = ?, failed_reason = ?, finished_on = ? " +
                     "WHERE queue_name = ? AND id = ? AND status = ?";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, JobState.FAILED.name());
            stmt.setString(2, truncate(failedReason));
            stmt.setLong(3, now);
            stmt.setString(4, queueName);
            stmt.setString(5, id);
            stmt.setString(6, JobState.WAITING_CHILDREN.name());
            return stmt.executeUpdate() == 1;
        }
    }

    /**
     * Move a parent whose children all completed from WAITING_CHILDREN to WAITING.
     */
    public boolean releaseParent(Connection conn, String queueName, String id, long now) throws SQLException {
        String sql = "UPDATE jobs SET status = ?, process_at = ? WHERE queue_name = ? AND id = ? AND status = ?";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, JobState.WAITING.name());
            stmt.setLong(2, now);
            stmt.setString(3, queueName);
            stmt.setString(4, id);
            stmt.setString(5, JobState.WAITING_CHILDREN.name());
            return stmt.executeUpdate() == 1;
        }
    }

    public boolean retryFailed(Connection conn, String queueName, String id, long now) throws SQLException {
        String sql = "UPDATE jobs SET status = ?, attempts_made = 0, process_at = ?, finished_on = NULL, " +
                     "failed_reason = NULL, stacktrace = NULL, stalled_count = 0 " +
                     "WHERE queue_name = ? AND id = ? AND status = ?";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, JobState.WAITING.name());
            stmt.setLong(2, now);
            stmt.setString(3, queueName);
            stmt.setString(4, id);
            stmt.setString(5, JobState.FAILED.name());
            return stmt.executeUpdate() == 1;
        }
    }

    public boolean promote(Connection conn, String queueName, String id, long now) throws SQLException {
        String sql = "UPDATE jobs SET status = ?, process_at = ? WHERE queue_name = ? AND id = ? AND status = ?";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, JobState.WAITING.name());
            stmt.setLong(2, now);
            stmt.setString(3, queueName);
            stmt.setString(4, id);
            stmt.setString(5, JobState.DELAYED.name());
            return stmt.executeUpdate() == 1;
        }
    }

    public boolean updateProgress(Connection conn, String queueName, String id, int progress) throws SQLException {
        String sql = "UPDATE jobs SET progress = ? WHERE queue_name = ? AND id = ?";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setInt(1, progress);
            stmt.setString(2, queueName);
            stmt.setString(3, id);
            return stmt.executeUpdate() == 1;
        }
    }

    // ==================== LOCKS & STALLED JOBS ====================

    public int extendLocks(Connection conn, String queueName, String token, long lockUntil) throws SQLException {
        String sql = "UPDATE jobs SET lock_until = ? WHERE queue_name = ? AND status = ? AND lock_token = ?";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setLong(1, lockUntil);
            stmt.setString(2, queueName);
            stmt.setString(3, JobState.ACTIVE.name());
            stmt.setString(4, token);
            return stmt.executeUpdate();
        }
    }

    public List<JobRow> findStalled(Connection conn, String queueName, long now) throws SQLException {
        String sql = "SELECT * FROM jobs WHERE queue_name = ? AND status = ? AND lock_until < ?";

        List<JobRow> rows = new ArrayList<>();
        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, queueName);
            stmt.setString(2, JobState.ACTIVE.name());
            stmt.setLong(3, now);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(mapRow(rs));
                }
            }
        }
        return rows;
    }

    /**
     * Move a stalled job back to WAITING, unless another process recovered or completed it first.
     */
    public boolean requeueStalled(Connection conn, String queueName, String id, String token, long now)
            throws SQLException {
        String sql = "UPDATE jobs SET status = ?, stalled_count = stalled_count + 1, lock_token = NULL, " +
                     "lock_until = NULL, process_at = ? " +
                     "WHERE queue_name = ? AND id = ? AND status = ? AND lock_token = ? AND lock_until < ?";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, JobState.WAITING.name());
            stmt.setLong(2, now);
            stmt.setString(3, queueName);
            stmt.setString(4, id);
            stmt.setString(5, JobState.ACTIVE.name());
            stmt.setString(6, token);
            stmt.setLong(7, now);
            return stmt.executeUpdate() == 1;
        }
    }

    /**
     * Move an active job back to WAITING without counting an attempt, while {@code token} still
     * holds its lock.
     */
    public boolean releaseActive(Connection conn, String queueName, String id, String token, long now)
            throws SQLException {
        String sql = "UPDATE jobs SET status = ?, lock_token = NULL, lock_until = NULL, " +
                     "process_at = ? WHERE queue_name = ? AND id = ? AND status = ? AND lock_token = ?";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, JobState.WAITING.name());
            stmt.setLong(2, now);
            stmt.setString(3, queueName);
            stmt.setString(4, id);
            stmt.setString(5, JobState.ACTIVE.name());
            stmt.setString(6, token);
            return stmt.executeUpdate() == 1;
        }
    }

    // ==================== FLOW DEPENDENCIES ====================

    public void insertDependency(Connection conn, String parentQueue, String parentId, String childQueue,
                                 String childId) throws SQLException {
        String sql = "INSERT INTO job_dependencies (parent_queue, parent_id, child_queue, child_id, processed) " +
                     "VALUES (?, ?, ?, ?, FALSE)";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, parentQueue);
            stmt.setString(2, parentId);
            stmt.setString(3, childQueue);
            stmt.setString(4, childId);
            stmt.executeUpdate();
        }
    }

    public boolean markChildProcessed(Connection conn, String parentQueue, String parentId, String childQueue,
                                      String childId, String returnValue) throws SQLException {
        String sql = "UPDATE job_dependencies SET processed = TRUE, return_value = ? " +
                     "WHERE parent_queue = ? AND parent_id = ? AND child_queue = ? AND child_id = ?";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, returnValue);
            stmt.setString(2, parentQueue);
            stmt.setString(3, parentId);
            stmt.setString(4, childQueue);
            stmt.setString(5, childId);
            return stmt.executeUpdate() == 1;
        }
    }

    public int countUnprocessed(Connection conn, String parentQueue, String parentId) throws SQLException {
        String sql = "SELECT COUNT(*) FROM job_dependencies WHERE parent_queue = ? AND parent_id = ? AND processed = FALSE";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, parentQueue);
            stmt.setString(2, parentId);
            try (ResultSet rs = stmt.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    public List<DependencyRow> findDependencies(Connection conn, String parentQueue, String parentId)
            throws SQLException {
        String sql = "SELECT child_queue, child_id, processed, return_value FROM job_dependencies " +
                     "WHERE parent_queue = ? AND parent_id = ? ORDER BY child_queue, child_id";

        List<DependencyRow> rows = new ArrayList<>();
        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, parentQueue);
            stmt.setString(2, parentId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    rows.add(new DependencyRow(rs.getString("child_queue"), rs.getString("child_id"),
                            rs.getBoolean("processed"), rs.getString("return_value")));
                }
            }
        }
        return rows;
    }

    // ==================== LOGS ====================

    public void insertLog(Connection conn, String queueName, String jobId, String message, long now)
            throws SQLException {
        String sql = "INSERT INTO job_logs (seq, queue_name, job_id, logged_at, message) " +
                     "VALUES (NEXT VALUE FOR job_log_seq, ?, ?, ?, ?)";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, queueName);
            stmt.setString(2, jobId);
            stmt.setLong(3, now);
            stmt.setString(4, truncate(message));
            stmt.executeUpdate();
        }
    }

    public List<String> findLogs(Connection conn, String queueName, String jobId) throws SQLException {
        String sql = "SELECT message FROM job_logs WHERE queue_name = ? AND job_id = ? ORDER BY seq";

        List<String> logs = new ArrayList<>();
        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, queueName);
            stmt.setString(2, jobId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    logs.add(rs.getString("message"));
                }
            }
        }
        return logs;
    }

    // ==================== REMOVAL & RETENTION ====================

    /**
     * Delete a job that is not active, with its logs and its own dependency rows.
     */
    public boolean delete(Connection conn, String queueName, String id) throws SQLException {
        String sql = "DELETE FROM jobs WHERE queue_name = ? AND id = ? AND status <> ?";

        int deleted;
        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, queueName);
            stmt.setString(2, id);
            stmt.setString(3, JobState.ACTIVE.name());
            deleted = stmt.executeUpdate();
        }
        if (deleted == 0) {
            return false;
        }
        deleteLogs(conn, queueName, List.of(id));
        try (PreparedStatement stmt = database.prepare(conn,
                "DELETE FROM job_dependencies WHERE parent_queue = ? AND parent_id = ?")) {
            stmt.setString(1, queueName);
            stmt.setString(2, id);
            stmt.executeUpdate();
        }
        return true;
    }

    /**
     * Delete the pending (waiting or delayed) occurrences produced by a job scheduler.
     */
    public int deletePendingForScheduler(Connection conn, String queueName, String schedulerId) throws SQLException {
        String sql = "DELETE FROM jobs WHERE queue_name = ? AND scheduler_id = ? AND status IN (?, ?)";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, queueName);
            stmt.setString(2, schedulerId);
            stmt.setString(3, JobState.WAITING.name());
            stmt.setString(4, JobState.DELAYED.name());
            return stmt.executeUpdate();
        }
    }

    /**
     * Remove finished jobs of one state beyond the retention: everything older than the max age,
     * then everything but the newest {@code count}.
     *
     * @return number of jobs removed
     */
    public int trim(Connection conn, String queueName, JobState state, Retention retention, long now)
            throws SQLException {
        if (retention == null || (retention.getCount() == null && retention.getMaxAgeSeconds() == null)) {
            return 0;
        }
        String sql = "SELECT id, finished_on FROM jobs WHERE queue_name = ? AND status = ? " +
                     "ORDER BY finished_on DESC, seq DESC";

        long cutoff = retention.getMaxAgeSeconds() != null ? now - retention.getMaxAgeSeconds() * 1000 : Long.MIN_VALUE;
        int keep = retention.getCount() != null ? retention.getCount() : Integer.MAX_VALUE;

        List<String> expired = new ArrayList<>();
        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, queueName);
            stmt.setString(2, state.name());
            try (ResultSet rs = stmt.executeQuery()) {
                int position = 0;
                while (rs.next()) {
                    long finishedOn = rs.getLong("finished_on");
                    if (position >= keep || finishedOn < cutoff) {
                        expired.add(rs.getString("id"));
                    }
                    position++;
                }
            }
        }
        if (expired.isEmpty()) {
            return 0;
        }

        try (PreparedStatement stmt = database.prepare(conn, "DELETE FROM jobs WHERE queue_name = ? AND id = ?")) {
            for (String id : expired) {
                stmt.setString(1, queueName);
                stmt.setString(2, id);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
        deleteLogs(conn, queueName, expired);
        return expired.size();
    }

    private void deleteLogs(Connection conn, String queueName, List<String> jobIds) throws SQLException {
        try (PreparedStatement stmt = database.prepare(conn, "DELETE FROM job_logs WHERE queue_name = ? AND job_id = ?")) {
            for (String id : jobIds) {
                stmt.setString(1, queueName);
                stmt.setString(2, id);
                stmt.addBatch();
            }
            stmt.executeBatch();
        }
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_REASON_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_REASON_LENGTH);
    }

    /**
     * Map the current row. Nullable numeric columns are read as boxed values.
     */
    private JobRow mapRow(ResultSet rs) throws SQLException {
        JobRow job = new JobRow();

        job.setQueueName(rs.getString("queue_name"));
        job.setId(rs.getString("id"));
        job.setSeq(rs.getLong("seq"));
        job.setName(rs.getString("job_name"));
        job.setData(rs.getString("job_data"));
        job.setOptions(rs.getString("job_opts"));
        job.setState(JobState.valueOf(rs.getString("status")));
        job.setPriority(rs.getInt("priority"));
        job.setAttempts(rs.getInt("attempts"));
        job.setAttemptsMade(rs.getInt("attempts_made"));
        job.setCreatedAt(rs.getLong("created_at"));
        job.setProcessAt(rs.getLong("process_at"));
        job.setProcessedOn(getNullableLong(rs, "processed_on"));
        job.setFinishedOn(getNullableLong(rs, "finished_on"));
        job.setLockToken(rs.getString("lock_token"));
        job.setLockUntil(getNullableLong(rs, "lock_until"));
        job.setStalledCount(rs.getInt("stalled_count"));
        job.setProgress(rs.getInt("progress"));
        job.setReturnValue(rs.getString("return_value"));
        job.setFailedReason(rs.getString("failed_reason"));
        job.setStacktrace(rs.getString("stacktrace"));
        job.setParentQueue(rs.getString("parent_queue"));
        job.setParentId(rs.getString("parent_id"));
        job.setSchedulerId(rs.getString("scheduler_id"));

        return job;
    }

    static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    static void setNullableLong(PreparedStatement stmt, int index, Long value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.BIGINT);
        } else {
            stmt.setLong(index, value);
        }
    }
}
