package com.jobflow.engine;

import com.jobflow.broker.BrokerJob;

/**
 * Runs one claimed job. Returning completes the job with the returned value; throwing fails the
 * attempt, and the broker retries it while attempts remain.
 */
@FunctionalInterface
public interface JobProcessor {

    Object process(BrokerJob job) throws Exception;
}
