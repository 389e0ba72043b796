package com.jobflow.core;

import java.util.List;

/**
 * Exception thrown when a payload is rejected by the schema of a job.
 *
 * <p>Thrown synchronously by every trigger operation before anything is enqueued, and by
 * {@link JobDefinition#execute} when a dequeued payload no longer matches the schema of the
 * running code. Never retried by the caller side.</p>
 *
 * <p><b>Example Handling:</b></p>
 * <pre>{@code
 * try {
 *     sendInvite.trigger(Map.of("email", "a@b.com"));
 * } catch (JobValidationException e) {
 *     logger.warning(e.getJobId() + " rejected: " + e.getViolations());
 * }
 * }</pre>
 */
public class JobValidationException extends RuntimeException {

    private final String jobId;
    private final List<String> violations;

    public JobValidationException(String jobId, SchemaViolationException cause) {
        super("Invalid payload for job " + jobId + ": " + cause.getMessage(), cause);
        this.jobId = jobId;
        this.violations = cause.getViolations();
    }

    public String getJobId() {
        return jobId;
    }

    public List<String> getViolations() {
        return violations;
    }
}
