package com.jobflow.engine;

import java.time.Duration;

import com.jobflow.broker.Retention;

/**
 * Settings of one {@link QueueWorker}.
 *
 * <p>Defaults: concurrency 5, 30 s lock renewed every 15 s, 1 s idle poll, stalled check every
 * 30 s with at most one stall per job, 60 s shutdown grace period, no retention override.</p>
 */
public final class WorkerOptions {

    public static final int DEFAULT_CONCURRENCY = 5;

    private final int concurrency;
    private final Duration lockDuration;
    private final Duration lockRenewInterval;
    private final Duration pollInterval;
    private final Duration stalledInterval;
    private final int maxStalledCount;
    private final Duration shutdownTimeout;
    private final Retention removeOnComplete;
    private final Retention removeOnFail;

    private WorkerOptions(Builder builder) {
        this.concurrency = builder.concurrency;
        this.lockDuration = builder.lockDuration;
        this.lockRenewInterval = builder.lockRenewInterval != null
                ? builder.lockRenewInterval
                : builder.lockDuration.dividedBy(2);
        this.pollInterval = builder.pollInterval;
        this.stalledInterval = builder.stalledInterval;
        this.maxStalledCount = builder.maxStalledCount;
        this.shutdownTimeout = builder.shutdownTimeout;
        this.removeOnComplete = builder.removeOnComplete;
        this.removeOnFail = builder.removeOnFail;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static WorkerOptions defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.concurrency = concurrency;
        builder.lockDuration = lockDuration;
        builder.lockRenewInterval = lockRenewInterval;
        builder.pollInterval = pollInterval;
        builder.stalledInterval = stalledInterval;
        builder.maxStalledCount = maxStalledCount;
        builder.shutdownTimeout = shutdownTimeout;
        builder.removeOnComplete = removeOnComplete;
        builder.removeOnFail = removeOnFail;
        return builder;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public Duration getLockDuration() {
        return lockDuration;
    }

    public Duration getLockRenewInterval() {
        return lockRenewInterval;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getStalledInterval() {
        return stalledInterval;
    }

    public int getMaxStalledCount() {
        return maxStalledCount;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    /**
     * Completed retention applied instead of the job's own, or null to keep the job's.
     */
    public Retention getRemoveOnComplete() {
        return removeOnComplete;
    }

    /**
     * Failed retention applied instead of the job's own, or null to keep the job's.
     */
    public Retention getRemoveOnFail() {
        return removeOnFail;
    }

    @Override
    public String toString() {
        return "WorkerOptions{concurrency=" + concurrency + ", lock=" + lockDuration + ", poll=" + pollInterval
                + ", stalledInterval=" + stalledInterval + ", maxStalled=" + maxStalledCount + "}";
    }

    public static final class Builder {
        private int concurrency = DEFAULT_CONCURRENCY;
        private Duration lockDuration = Duration.ofSeconds(30);
        private Duration lockRenewInterval;
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration stalledInterval = Duration.ofSeconds(30);
        private int maxStalledCount = 1;
        private Duration shutdownTimeout = Duration.ofSeconds(60);
        private Retention removeOnComplete;
        private Retention removeOnFail;

        private Builder() {
        }

        public Builder concurrency(int concurrency) {
            if (concurrency < 1) {
                throw new IllegalArgumentException("Concurrency must be at least 1: " + concurrency);
            }
            this.concurrency = concurrency;
            return this;
        }

        public Builder lockDuration(Duration lockDuration) {
            this.lockDuration = lockDuration;
            return this;
        }

        public Builder lockRenewInterval(Duration lockRenewInterval) {
            this.lockRenewInterval = lockRenewInterval;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder stalledInterval(Duration stalledInterval) {
            this.stalledInterval = stalledInterval;
            return this;
        }

        public Builder maxStalledCount(int maxStalledCount) {
            this.maxStalledCount = maxStalledCount;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder removeOnComplete(Retention removeOnComplete) {
            this.removeOnComplete = removeOnComplete;
            return this;
        }

        public Builder removeOnFail(Retention removeOnFail) {
            this.removeOnFail = removeOnFail;
            return this;
        }

        public WorkerOptions build() {
            return new WorkerOptions(this);
        }
    }
}
