package com.jobflow.core;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.gson.JsonElement;
import com.jobflow.broker.BrokerJob;
import com.jobflow.broker.Dependencies;
import com.jobflow.broker.DependencyCounts;

/**
 * Execution context handed to a {@link JobHandler}.
 *
 * <p>This class is the bridge between a handler's business logic and the broker. It provides:</p>
 * <ul>
 *   <li>The dequeued job (id, name, attempt counter, options)</li>
 *   <li>The data-access dependency of the worker process</li>
 *   <li>A logger, mirrored into the job's own log kept by the broker</li>
 *   <li>Progress reporting for long-running jobs</li>
 *   <li>Results of completed children when the job is a flow parent</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> one context is created per execution and used by the handler thread
 * only.</p>
 *
 * <p><b>Usage Pattern:</b></p>
 * <pre>{@code
 * registry.job("match-receipts", JobSchema.of(MatchPayload.class), config, (payload, context) -> {
 *     context.log("INFO", "Matching " + payload.receiptIds().size() + " receipts");
 *     try (Connection conn = context.getDataContext().getConnection()) {
 *         // ...
 *     }
 *     context.updateProgress(100);
 *     return Map.of("matched", true);
 * });
 * }</pre>
 */
public class JobContext {

    private final BrokerJob job;
    private final DataContext dataContext;
    private final Logger logger;

    public JobContext(BrokerJob job, DataContext dataContext) {
        this.job = job;
        this.dataContext = dataContext;
        this.logger = Logger.getLogger("com.jobflow.job." + job.getName());
    }

    public BrokerJob getJob() {
        return job;
    }

    /**
     * Broker id of the running job.
     */
    public String getJobId() {
        return job.getId();
    }

    public String getJobName() {
        return job.getName();
    }

    /**
     * 1 on the first execution, 2 on the first retry, and so on.
     */
    public int getAttempt() {
        return job.getAttemptsMade() + 1;
    }

    public DataContext getDataContext() {
        return dataContext;
    }

    public Logger getLogger() {
        return logger;
    }

    /**
     * Log a message to the process log and to the job's log in the broker.
     *
     * <p>A failure to write the broker-side entry is reported on the process log and does not
     * fail the job.</p>
     *
     * @param level INFO, WARN, ERROR or DEBUG
     * @param message the log message
     */
    public void log(String level, String message) {
        logger.log(toLevel(level), "[" + job.getId() + "] " + message);
        try {
            job.log("[" + level + "] " + message);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to write job log for " + job.getId(), e);
        }
    }

    /**
     * Report progress (0-100) of the running job.
     */
    public void updateProgress(int progress) {
        job.updateProgress(progress);
    }

    // ==================== FLOW PARENTS ====================

    /**
     * Results of the children that already completed, keyed by {@code <queue>:<jobId>}.
     */
    public Map<String, JsonElement> getChildrenValues() {
        return job.getChildrenValues();
    }

    public Dependencies getDependencies() {
        return job.getDependencies();
    }

    public DependencyCounts getDependenciesCount() {
        return job.getDependenciesCount();
    }

    private static Level toLevel(String level) {
        if (level == null) {
            return Level.INFO;
        }
        switch (level.toUpperCase()) {
            case "ERROR":
                return Level.SEVERE;
            case "WARN":
            case "WARNING":
                return Level.WARNING;
            case "DEBUG":
                return Level.FINE;
            default:
                return Level.INFO;
        }
    }

    @Override
    public String toString() {
        return "JobContext{" +
                "jobId='" + job.getId() + '\'' +
                ", name='" + job.getName() + '\'' +
                ", attempt=" + getAttempt() +
                '}';
    }
}
