package com.jobflow.core;

/**
 * Thrown when a job id or scheduler template cannot be resolved: no queue registered for a job,
 * no definition for a dequeued job name, or an unknown template.
 */
public class QueueResolutionException extends RuntimeException {

    public QueueResolutionException(String message) {
        super(message);
    }

    public QueueResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
