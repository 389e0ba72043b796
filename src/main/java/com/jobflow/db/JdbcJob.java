package com.jobflow.db;

import java.util.Map;

import com.google.gson.JsonElement;
import com.jobflow.broker.BrokerJob;
import com.jobflow.broker.Dependencies;
import com.jobflow.broker.DependencyCounts;
import com.jobflow.broker.JobOptions;
import com.jobflow.broker.JobState;
import com.jobflow.db.JobRepository.JobRow;

/**
 * Snapshot of a {@code jobs} row. Progress, logs and dependencies go back to the owning queue.
 */
class JdbcJob implements BrokerJob {

    private final JobRow row;
    private final JdbcQueue queue;
    private final JobOptions options;
    private volatile int progress;

    JdbcJob(JobRow row, JdbcQueue queue) {
        this.row = row;
        this.queue = queue;
        this.options = JobOptions.fromJson(row.getOptions());
        this.progress = row.getProgress();
    }

    @Override
    public String getId() {
        return row.getId();
    }

    @Override
    public String getName() {
        return row.getName();
    }

    @Override
    public String getQueueName() {
        return row.getQueueName();
    }

    @Override
    public String getRawData() {
        return row.getData();
    }

    @Override
    public JsonElement getData() {
        return JdbcQueue.parse(row.getData());
    }

    @Override
    public JobOptions getOptions() {
        return options;
    }

    @Override
    public JobState getState() {
        return row.getState();
    }

    @Override
    public int getPriority() {
        return row.getPriority();
    }

    @Override
    public int getAttemptsMade() {
        return row.getAttemptsMade();
    }

    @Override
    public int getAttempts() {
        return row.getAttempts();
    }

    @Override
    public long getTimestamp() {
        return row.getCreatedAt();
    }

    @Override
    public long getProcessAt() {
        return row.getProcessAt();
    }

    @Override
    public Long getProcessedOn() {
        return row.getProcessedOn();
    }

    @Override
    public Long getFinishedOn() {
        return row.getFinishedOn();
    }

    @Override
    public int getProgress() {
        return progress;
    }

    @Override
    public String getReturnValue() {
        return row.getReturnValue();
    }

    @Override
    public String getFailedReason() {
        return row.getFailedReason();
    }

    @Override
    public String getStacktrace() {
        return row.getStacktrace();
    }

    @Override
    public String getParentId() {
        return row.getParentId();
    }

    @Override
    public String getSchedulerId() {
        return row.getSchedulerId();
    }

    @Override
    public void updateProgress(int progress) {
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("Progress must be between 0 and 100: " + progress);
        }
        queue.updateProgress(this, progress);
        this.progress = progress;
    }

    @Override
    public void log(String message) {
        queue.log(row.getId(), message);
    }

    @Override
    public Map<String, JsonElement> getChildrenValues() {
        return queue.dependencies(row.getId()).getProcessed();
    }

    @Override
    public Dependencies getDependencies() {
        return queue.dependencies(row.getId());
    }

    @Override
    public DependencyCounts getDependenciesCount() {
        return queue.dependencyCounts(row.getId());
    }

    @Override
    public String toString() {
        return "JdbcJob{" + row + "}";
    }
}
