package com.jobflow.broker;

import java.time.Duration;
import java.util.Objects;

import org.json.JSONObject;

/**
 * Execution policy attached to an enqueued job.
 *
 * <p>Every field is optional. Options are layered with {@link #mergedWith(JobOptions)}, where the
 * argument's non-null fields win. The usual stack, lowest precedence first:</p>
 * <pre>
 * JobOptions.DEFAULTS
 *     .mergedWith(queueBindingOptions)
 *     .mergedWith(definitionOptions)
 *     .mergedWith(callSiteOptions)
 * </pre>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public final class JobOptions {

    /** Retention used for completed jobs when nothing else is configured. */
    public static final Duration COMPLETED_MAX_AGE = Duration.ofHours(24);

    /** Retention used for failed jobs when nothing else is configured. */
    public static final Duration FAILED_MAX_AGE = Duration.ofDays(7);

    /**
     * Hard defaults: priority 1, 3 attempts, no delay, exponential backoff from 2000ms,
     * keep 50 completed jobs for 24h and 50 failed jobs for 7 days.
     */
    public static final JobOptions DEFAULTS = builder()
            .priority(1)
            .attempts(3)
            .delay(0L)
            .backoff(Backoff.exponential(2000))
            .removeOnComplete(Retention.keepLast(50, COMPLETED_MAX_AGE))
            .removeOnFail(Retention.keepLast(50, FAILED_MAX_AGE))
            .build();

    private static final JobOptions EMPTY = builder().build();

    private final Integer priority;
    private final Integer attempts;
    private final Long delay;
    private final Backoff backoff;
    private final Retention removeOnComplete;
    private final Retention removeOnFail;
    private final RepeatOptions repeat;
    private final String jobId;
    private final Boolean failParentOnFailure;

    private JobOptions(Builder builder) {
        if (builder.attempts != null && builder.attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1: " + builder.attempts);
        }
        if (builder.delay != null && builder.delay < 0) {
            throw new IllegalArgumentException("delay must not be negative: " + builder.delay);
        }
        this.priority = builder.priority;
        this.attempts = builder.attempts;
        this.delay = builder.delay;
        this.backoff = builder.backoff;
        this.removeOnComplete = builder.removeOnComplete;
        this.removeOnFail = builder.removeOnFail;
        this.repeat = builder.repeat;
        this.jobId = builder.jobId;
        this.failParentOnFailure = builder.failParentOnFailure;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Options with no field set. Merging it changes nothing.
     */
    public static JobOptions empty() {
        return EMPTY;
    }

    /**
     * Return a copy where every non-null field of {@code override} replaces the field of this instance.
     *
     * @param override higher-precedence options, may be null
     * @return merged options
     */
    public JobOptions mergedWith(JobOptions override) {
        if (override == null || override == EMPTY) {
            return this;
        }
        return builder()
                .priority(override.priority != null ? override.priority : priority)
                .attempts(override.attempts != null ? override.attempts : attempts)
                .delay(override.delay != null ? override.delay : delay)
                .backoff(override.backoff != null ? override.backoff : backoff)
                .removeOnComplete(override.removeOnComplete != null ? override.removeOnComplete : removeOnComplete)
                .removeOnFail(override.removeOnFail != null ? override.removeOnFail : removeOnFail)
                .repeat(override.repeat != null ? override.repeat : repeat)
                .jobId(override.jobId != null ? override.jobId : jobId)
                .failParentOnFailure(override.failParentOnFailure != null
                        ? override.failParentOnFailure : failParentOnFailure)
                .build();
    }

    public Builder toBuilder() {
        return builder()
                .priority(priority)
                .attempts(attempts)
                .delay(delay)
                .backoff(backoff)
                .removeOnComplete(removeOnComplete)
                .removeOnFail(removeOnFail)
                .repeat(repeat)
                .jobId(jobId)
                .failParentOnFailure(failParentOnFailure);
    }

    public Integer getPriority() {
        return priority;
    }

    public Integer getAttempts() {
        return attempts;
    }

    public Long getDelay() {
        return delay;
    }

    public Backoff getBackoff() {
        return backoff;
    }

    public Retention getRemoveOnComplete() {
        return removeOnComplete;
    }

    public Retention getRemoveOnFail() {
        return removeOnFail;
    }

    public RepeatOptions getRepeat() {
        return repeat;
    }

    public String getJobId() {
        return jobId;
    }

    public boolean isFailParentOnFailure() {
        return Boolean.TRUE.equals(failParentOnFailure);
    }

    /**
     * Serialize for storage next to the job row.
     */
    public String toJson() {
        JSONObject json = new JSONObject();
        if (priority != null) {
            json.put("priority", priority);
        }
        if (attempts != null) {
            json.put("attempts", attempts);
        }
        if (delay != null) {
            json.put("delay", delay);
        }
        if (backoff != null) {
            json.put("backoff", backoff.toJson());
        }
        if (removeOnComplete != null) {
            json.put("removeOnComplete", removeOnComplete.toJson());
        }
        if (removeOnFail != null) {
            json.put("removeOnFail", removeOnFail.toJson());
        }
        if (repeat != null) {
            json.put("repeat", repeat.toJson());
        }
        if (jobId != null) {
            json.put("jobId", jobId);
        }
        if (failParentOnFailure != null) {
            json.put("failParentOnFailure", failParentOnFailure);
        }
        return json.toString();
    }

    public static JobOptions fromJson(String value) {
        if (value == null || value.isEmpty()) {
            return EMPTY;
        }
        JSONObject json = new JSONObject(value);
        Builder builder = builder();
        if (json.has("priority")) {
            builder.priority(json.getInt("priority"));
        }
        if (json.has("attempts")) {
            builder.attempts(json.getInt("attempts"));
        }
        if (json.has("delay")) {
            builder.delay(json.getLong("delay"));
        }
        if (json.has("backoff")) {
            builder.backoff(Backoff.fromJson(json.getJSONObject("backoff")));
        }
        if (json.has("removeOnComplete")) {
            builder.removeOnComplete(Retention.fromJson(json.getJSONObject("removeOnComplete")));
        }
        if (json.has("removeOnFail")) {
            builder.removeOnFail(Retention.fromJson(json.getJSONObject("removeOnFail")));
        }
        if (json.has("repeat")) {
            builder.repeat(RepeatOptions.fromJson(json.getJSONObject("repeat")));
        }
        if (json.has("jobId")) {
            builder.jobId(json.getString("jobId"));
        }
        if (json.has("failParentOnFailure")) {
            builder.failParentOnFailure(json.getBoolean("failParentOnFailure"));
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof JobOptions)) {
            return false;
        }
        JobOptions other = (JobOptions) o;
        return Objects.equals(priority, other.priority)
                && Objects.equals(attempts, other.attempts)
                && Objects.equals(delay, other.delay)
                && Objects.equals(backoff, other.backoff)
                && Objects.equals(removeOnComplete, other.removeOnComplete)
                && Objects.equals(removeOnFail, other.removeOnFail)
                && Objects.equals(repeat, other.repeat)
                && Objects.equals(jobId, other.jobId)
                && Objects.equals(failParentOnFailure, other.failParentOnFailure);
    }

    @Override
    public int hashCode() {
        return Objects.hash(priority, attempts, delay, backoff, removeOnComplete, removeOnFail, repeat, jobId,
                failParentOnFailure);
    }

    @Override
    public String toString() {
        return "JobOptions" + toJson();
    }

    public static final class Builder {
        private Integer priority;
        private Integer attempts;
        private Long delay;
        private Backoff backoff;
        private Retention removeOnComplete;
        private Retention removeOnFail;
        private RepeatOptions repeat;
        private String jobId;
        private Boolean failParentOnFailure;

        private Builder() {
        }

        /**
         * Lower values run first. Jobs of equal priority run in FIFO order.
         */
        public Builder priority(Integer priority) {
            this.priority = priority;
            return this;
        }

        /**
         * Total number of executions, including the first one.
         */
        public Builder attempts(Integer attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder delay(Long delay) {
            this.delay = delay;
            return this;
        }

        public Builder backoff(Backoff backoff) {
            this.backoff = backoff;
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

        public Builder repeat(RepeatOptions repeat) {
            this.repeat = repeat;
            return this;
        }

        /**
         * Custom job id. Adding a job whose id already exists returns the existing job. In a flow
         * this holds for the root; a child with an existing id is rejected.
         */
        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder failParentOnFailure(Boolean failParentOnFailure) {
            this.failParentOnFailure = failParentOnFailure;
            return this;
        }

        public JobOptions build() {
            return new JobOptions(this);
        }
    }
}
