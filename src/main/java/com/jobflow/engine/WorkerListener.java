package com.jobflow.engine;

import com.jobflow.broker.BrokerJob;

/**
 * Lifecycle events of a {@link QueueWorker}. Every method has an empty default, implement only
 * what you need. Listener failures are logged and never affect the job.
 */
public interface WorkerListener {

    default void onReady(String queueName) {
    }

    default void onActive(BrokerJob job) {
    }

    default void onProgress(BrokerJob job, int progress) {
    }

    /**
     * @param durationMillis time spent in the processor
     */
    default void onCompleted(BrokerJob job, Object result, long durationMillis) {
    }

    /**
     * @param willRetry true if the broker scheduled another attempt
     */
    default void onFailed(BrokerJob job, Throwable error, boolean willRetry) {
    }

    /**
     * Errors of the worker itself (broker unreachable, lock lost), not of a handler.
     */
    default void onError(String queueName, Throwable error) {
    }

    default void onClosing(String queueName) {
    }
}
