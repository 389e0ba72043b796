package com.jobflow.core;

/**
 * Business logic of a job.
 *
 * <p>Handlers may be invoked more than once for the same job (retries, stalled-job recovery), so
 * they must be idempotent or guard their own side effects.</p>
 *
 * @param <T> type of the validated payload
 */
@FunctionalInterface
public interface JobHandler<T> {

    /**
     * @param payload validated payload
     * @param context job metadata, data access and logger
     * @return result stored as the job's return value (serialized to JSON), may be null
     * @throws Exception any failure; the attempt is recorded failed and retried per the job's policy
     */
    Object handle(T payload, JobContext context) throws Exception;
}
