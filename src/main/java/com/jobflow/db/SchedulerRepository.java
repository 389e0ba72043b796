package com.jobflow.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.jobflow.broker.JobOptions;
import com.jobflow.broker.RepeatOptions;
import com.jobflow.broker.SchedulerEntry;

/**
 * SQL access to the {@code job_schedulers} table. One row per {@code (queue, scheduler id)}.
 */
public class SchedulerRepository {

    private final Database database;

    public SchedulerRepository(Database database) {
        this.database = database;
    }

    /**
     * Insert or replace a scheduler row.
     */
    public void merge(Connection conn, SchedulerEntry entry) throws SQLException {
        String sql = "MERGE INTO job_schedulers (queue_name, id, job_name, pattern, tz, start_date, end_date, " +
                     "repeat_limit, iteration_count, job_data, job_opts, next_run) " +
                     "KEY (queue_name, id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        RepeatOptions repeat = entry.getRepeat();
        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, entry.getQueueName());
            stmt.setString(2, entry.getId());
            stmt.setString(3, entry.getJobName());
            stmt.setString(4, repeat.getPattern());
            stmt.setString(5, repeat.getTimezone());
            JobRepository.setNullableLong(stmt, 6, toMillis(repeat.getStartDate()));
            JobRepository.setNullableLong(stmt, 7, toMillis(repeat.getEndDate()));
            if (repeat.getLimit() != null) {
                stmt.setInt(8, repeat.getLimit());
            } else {
                stmt.setNull(8, Types.INTEGER);
            }
            stmt.setInt(9, entry.getIterationCount());
            stmt.setString(10, entry.getData());
            stmt.setString(11, entry.getOptions().toJson());
            JobRepository.setNullableLong(stmt, 12, toMillis(entry.getNextRun()));
            stmt.executeUpdate();
        }
    }

    public SchedulerEntry find(Connection conn, String queueName, String id) throws SQLException {
        String sql = "SELECT * FROM job_schedulers WHERE queue_name = ? AND id = ?";

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

    public List<SchedulerEntry> findAll(Connection conn, String queueName) throws SQLException {
        String sql = "SELECT * FROM job_schedulers WHERE queue_name = ? ORDER BY id";

        List<SchedulerEntry> entries = new ArrayList<>();
        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, queueName);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    entries.add(mapRow(rs));
                }
            }
        }
        return entries;
    }

    /**
     * Record that the scheduler produced another job.
     */
    public void updateIteration(Connection conn, String queueName, String id, int iterationCount, Instant nextRun)
            throws SQLException {
        String sql = "UPDATE job_schedulers SET iteration_count = ?, next_run = ? WHERE queue_name = ? AND id = ?";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setInt(1, iterationCount);
            JobRepository.setNullableLong(stmt, 2, toMillis(nextRun));
            stmt.setString(3, queueName);
            stmt.setString(4, id);
            stmt.executeUpdate();
        }
    }

    public boolean delete(Connection conn, String queueName, String id) throws SQLException {
        String sql = "DELETE FROM job_schedulers WHERE queue_name = ? AND id = ?";

        try (PreparedStatement stmt = database.prepare(conn, sql)) {
            stmt.setString(1, queueName);
            stmt.setString(2, id);
            return stmt.executeUpdate() == 1;
        }
    }

    private SchedulerEntry mapRow(ResultSet rs) throws SQLException {
        RepeatOptions.Builder repeat = RepeatOptions.builder(rs.getString("pattern"))
                .timezone(rs.getString("tz"))
                .startDate(toInstant(JobRepository.getNullableLong(rs, "start_date")))
                .endDate(toInstant(JobRepository.getNullableLong(rs, "end_date")));
        int limit = rs.getInt("repeat_limit");
        if (!rs.wasNull()) {
            repeat.limit(limit);
        }

        return new SchedulerEntry(
                rs.getString("id"),
                rs.getString("queue_name"),
                rs.getString("job_name"),
                repeat.build(),
                rs.getString("job_data"),
                JobOptions.fromJson(rs.getString("job_opts")),
                rs.getInt("iteration_count"),
                toInstant(JobRepository.getNullableLong(rs, "next_run")));
    }

    private static Long toMillis(Instant instant) {
        return instant != null ? instant.toEpochMilli() : null;
    }

    private static Instant toInstant(Long millis) {
        return millis != null ? Instant.ofEpochMilli(millis) : null;
    }
}
