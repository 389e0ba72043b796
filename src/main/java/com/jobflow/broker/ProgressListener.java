package com.jobflow.broker;

/**
 * Notified when a job of the queue reports progress.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(BrokerJob job, int progress);
}
