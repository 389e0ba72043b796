package com.jobflow.core;

import com.jobflow.broker.BrokerQueue;

/**
 * Maps a job to a live queue handle owned by the worker runtime.
 *
 * @see JobRegistry#setQueueResolver(QueueResolver)
 */
@FunctionalInterface
public interface QueueResolver {

    /**
     * @param jobId id of the job being triggered, null when resolving by queue name only
     * @param queueName queue the job is bound to
     * @return the handle, or null if this resolver does not own the queue
     */
    BrokerQueue resolve(String jobId, String queueName);
}
