package com.jobflow.broker;

import java.util.Map;

import com.google.gson.JsonElement;

/**
 * Handle to one job stored in the broker.
 *
 * <p>Returned by every enqueue operation and handed to workers when a job is claimed. Accessors
 * reflect the job as it was when the handle was read; {@link #updateProgress(int)}, {@link #log(String)}
 * and the dependency queries go back to the broker.</p>
 */
public interface BrokerJob {

    /**
     * Broker-assigned id (or the custom id given through {@link JobOptions#getJobId()}).
     */
    String getId();

    /**
     * Logical name, used by workers to route the job to its definition.
     */
    String getName();

    String getQueueName();

    /**
     * Payload as stored (JSON text).
     */
    String getRawData();

    /**
     * Payload parsed into a JSON tree.
     */
    JsonElement getData();

    /**
     * Effective execution policy the job was stored with.
     */
    JobOptions getOptions();

    JobState getState();

    int getPriority();

    /**
     * Executions made so far. A job that failed on every attempt ends with
     * {@code getAttemptsMade() == getAttempts()}.
     */
    int getAttemptsMade();

    int getAttempts();

    /**
     * Creation time, epoch millis.
     */
    long getTimestamp();

    /**
     * Earliest time the job may be claimed, epoch millis.
     */
    long getProcessAt();

    Long getProcessedOn();

    Long getFinishedOn();

    int getProgress();

    /**
     * Handler result as JSON text, null until the job completed.
     */
    String getReturnValue();

    String getFailedReason();

    String getStacktrace();

    /**
     * Id of the flow parent, null for jobs outside a flow.
     */
    String getParentId();

    /**
     * Id of the job scheduler that produced this job, null for one-off jobs.
     */
    String getSchedulerId();

    void updateProgress(int progress);

    /**
     * Append a line to the job's log, kept with the job until it is removed.
     */
    void log(String message);

    /**
     * Results of the children that already completed, keyed by {@code <queue>:<jobId>}.
     */
    Map<String, JsonElement> getChildrenValues();

    Dependencies getDependencies();

    DependencyCounts getDependenciesCount();
}
