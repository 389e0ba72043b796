package com.jobflow.broker;

import java.time.Instant;

/**
 * A job scheduler as stored by the broker: the repeat rule plus the template of the job it produces.
 */
public final class SchedulerEntry {

    private final String id;
    private final String queueName;
    private final String jobName;
    private final RepeatOptions repeat;
    private final String data;
    private final JobOptions options;
    private final int iterationCount;
    private final Instant nextRun;

    public SchedulerEntry(String id, String queueName, String jobName, RepeatOptions repeat, String data,
                          JobOptions options, int iterationCount, Instant nextRun) {
        this.id = id;
        this.queueName = queueName;
        this.jobName = jobName;
        this.repeat = repeat;
        this.data = data;
        this.options = options;
        this.iterationCount = iterationCount;
        this.nextRun = nextRun;
    }

    public String getId() {
        return id;
    }

    public String getQueueName() {
        return queueName;
    }

    public String getJobName() {
        return jobName;
    }

    public RepeatOptions getRepeat() {
        return repeat;
    }

    public String getData() {
        return data;
    }

    public JobOptions getOptions() {
        return options;
    }

    /**
     * Number of jobs produced so far.
     */
    public int getIterationCount() {
        return iterationCount;
    }

    /**
     * Due time of the pending job, null once the scheduler is exhausted (limit or end date reached).
     */
    public Instant getNextRun() {
        return nextRun;
    }

    @Override
    public String toString() {
        return "SchedulerEntry{id='" + id + "', queue='" + queueName + "', job='" + jobName
                + "', pattern='" + repeat.getPattern() + "', nextRun=" + nextRun + "}";
    }
}
