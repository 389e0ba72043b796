package com.jobflow.engine;

import java.util.logging.Level;
import java.util.logging.Logger;

import com.jobflow.broker.BrokerException;
import com.jobflow.broker.BrokerJob;
import com.jobflow.broker.BrokerQueue;
import com.jobflow.core.Payloads;

/**
 * Executes one claimed job on a thread of its {@link QueueWorker}'s pool.
 *
 * <p><b>Execution Flow:</b></p>
 * <ol>
 *   <li>Notify listeners that the job is active</li>
 *   <li>Run the queue's {@link JobProcessor}</li>
 *   <li>On success: record the result as JSON and move the job to COMPLETED</li>
 *   <li>On failure: move the job to FAILED; the broker schedules another attempt with the job's
 *       backoff while attempts remain</li>
 *   <li>Interrupted by a forced shutdown: move the job back to waiting, the attempt is not
 *       counted</li>
 *   <li>Always: release the concurrency slot</li>
 * </ol>
 *
 * <p>If the job's lock was lost in the meantime (the job was recovered as stalled and may already
 * run elsewhere), the outcome is reported to {@link WorkerListener#onError} and discarded.</p>
 */
public class Worker implements Runnable {
    private static final Logger logger = Logger.getLogger(Worker.class.getName());

    private final BrokerJob job;
    private final QueueWorker owner;

    public Worker(BrokerJob job, QueueWorker owner) {
        this.job = job;
        this.owner = owner;
    }

    @Override
    public void run() {
        BrokerQueue queue = owner.getQueue();
        WorkerOptions options = owner.getOptions();
        String jobId = job.getId();

        try {
            owner.fireActive(job);
            long started = System.nanoTime();

            Object result;
            try {
                result = owner.getProcessor().process(job);
            } catch (Exception e) {
                if (owner.isClosing() && isInterruption(e)) {
                    requeue(queue);
                } else {
                    if (e instanceof InterruptedException) {
                        Thread.currentThread().interrupt();
                    }
                    recordFailure(queue, options, e);
                }
                return;
            }

            long durationMillis = (System.nanoTime() - started) / 1_000_000;
            try {
                queue.moveToCompleted(job, owner.getToken(), Payloads.toJson(result), options.getRemoveOnComplete());
                owner.fireCompleted(job, result, durationMillis);
            } catch (BrokerException e) {
                owner.fireError(new BrokerException("Failed to record completion of job " + jobId, e));
            }
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Unexpected error running job " + jobId, e);
            owner.fireError(e);
        } finally {
            owner.release(job);
        }
    }

    /**
     * The job was interrupted by a forced shutdown and did not fail: put it back in line without
     * using up an attempt.
     */
    private void requeue(BrokerQueue queue) {
        // Cleared so the broker call is not cut short, restored for the pool afterwards
        boolean interrupted = Thread.interrupted();
        try {
            if (queue.moveToWaiting(job, owner.getToken())) {
                logger.warning("Job " + job.getId() + " of queue " + queue.getName()
                        + " interrupted by shutdown, moved back to waiting");
            }
        } catch (BrokerException e) {
            owner.fireError(new BrokerException("Failed to requeue interrupted job " + job.getId(), e));
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static boolean isInterruption(Throwable error) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }

    private void recordFailure(BrokerQueue queue, WorkerOptions options, Exception error) {
        try {
            boolean willRetry = queue.moveToFailed(job, owner.getToken(), error, options.getRemoveOnFail());
            owner.fireFailed(job, error, willRetry);
        } catch (BrokerException e) {
            e.addSuppressed(error);
            owner.fireError(new BrokerException("Failed to record failure of job " + job.getId(), e));
        }
    }
}
