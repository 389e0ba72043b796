package com.jobflow.core;

/**
 * Wraps the failure of a job handler.
 *
 * <p>Propagates out of {@link JobDefinition#execute} to the worker, which reports the failure to
 * the broker so the retry and backoff policy of the job applies.</p>
 */
public class JobExecutionException extends RuntimeException {

    private final String jobName;
    private final String brokerJobId;

    public JobExecutionException(String jobName, String brokerJobId, Throwable cause) {
        super("Job " + jobName + " (" + brokerJobId + ") failed: " + cause.getMessage(), cause);
        this.jobName = jobName;
        this.brokerJobId = brokerJobId;
    }

    public String getJobName() {
        return jobName;
    }

    public String getBrokerJobId() {
        return brokerJobId;
    }
}
