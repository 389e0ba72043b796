package com.jobflow.engine;

import java.util.logging.Level;
import java.util.logging.Logger;

import com.jobflow.broker.BrokerJob;

/**
 * Default listener of the worker runtime: writes every worker event to the log.
 */
public class LoggingWorkerListener implements WorkerListener {
    private static final Logger logger = Logger.getLogger(LoggingWorkerListener.class.getName());

    @Override
    public void onReady(String queueName) {
        logger.info("Worker ready on queue " + queueName);
    }

    @Override
    public void onActive(BrokerJob job) {
        logger.fine("Job " + job.getId() + " (" + job.getName() + ") active on queue " + job.getQueueName()
                + ", attempt " + (job.getAttemptsMade() + 1) + "/" + job.getAttempts());
    }

    @Override
    public void onProgress(BrokerJob job, int progress) {
        logger.fine("Job " + job.getId() + " (" + job.getName() + ") progress " + progress + "%");
    }

    @Override
    public void onCompleted(BrokerJob job, Object result, long durationMillis) {
        logger.info("Job " + job.getId() + " (" + job.getName() + ") completed on queue " + job.getQueueName()
                + " in " + durationMillis + " ms");
    }

    @Override
    public void onFailed(BrokerJob job, Throwable error, boolean willRetry) {
        String message = "Job " + job.getId() + " (" + job.getName() + ") failed on queue " + job.getQueueName()
                + ", attempt " + (job.getAttemptsMade() + 1) + "/" + job.getAttempts()
                + (willRetry ? ", will retry" : ", giving up") + "; payload: " + job.getRawData();
        logger.log(willRetry ? Level.WARNING : Level.SEVERE, message, error);
    }

    @Override
    public void onError(String queueName, Throwable error) {
        logger.log(Level.SEVERE, "Worker error on queue " + queueName, error);
    }

    @Override
    public void onClosing(String queueName) {
        logger.info("Worker closing on queue " + queueName);
    }
}
