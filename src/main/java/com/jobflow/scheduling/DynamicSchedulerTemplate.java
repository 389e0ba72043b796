package com.jobflow.scheduling;

import java.util.Objects;
import java.util.function.Function;

/**
 * Blueprint for per-account schedulers created at runtime, e.g. one nightly sync per connected
 * bank account.
 *
 * <pre>{@code
 * DynamicSchedulerTemplate.builder("bank-sync", "banking", "sync-account")
 *         .cronFor(CronPatterns::dailyCronFor)
 *         .payloadFor(accountId -> Map.of("accountId", accountId))
 *         .jobKeyFor(accountId -> "bank-sync-" + accountId)
 *         .build();
 * }</pre>
 */
public final class DynamicSchedulerTemplate {

    private final String id;
    private final String queueName;
    private final String jobName;
    private final Function<String, String> cronFor;
    private final Function<String, Object> payloadFor;
    private final Function<String, String> jobKeyFor;

    private DynamicSchedulerTemplate(Builder builder) {
        this.id = builder.id;
        this.queueName = builder.queueName;
        this.jobName = builder.jobName;
        this.cronFor = builder.cronFor;
        this.payloadFor = builder.payloadFor;
        this.jobKeyFor = builder.jobKeyFor;
    }

    public static Builder builder(String id, String queueName, String jobName) {
        return new Builder(id, queueName, jobName);
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

    public String cronFor(String accountId) {
        return cronFor.apply(accountId);
    }

    public Object payloadFor(String accountId) {
        return payloadFor.apply(accountId);
    }

    public String jobKeyFor(String accountId) {
        return jobKeyFor.apply(accountId);
    }

    @Override
    public String toString() {
        return "DynamicSchedulerTemplate{id='" + id + "', queue='" + queueName + "', job='" + jobName + "'}";
    }

    public static final class Builder {
        private final String id;
        private final String queueName;
        private final String jobName;
        private Function<String, String> cronFor = CronPatterns::dailyCronFor;
        private Function<String, Object> payloadFor = accountId -> null;
        private Function<String, String> jobKeyFor;

        private Builder(String id, String queueName, String jobName) {
            this.id = Objects.requireNonNull(id, "id");
            this.queueName = Objects.requireNonNull(queueName, "queueName");
            this.jobName = Objects.requireNonNull(jobName, "jobName");
            this.jobKeyFor = accountId -> id + "-" + accountId;
        }

        /**
         * Pattern used when a registration does not supply one. Defaults to
         * {@link CronPatterns#dailyCronFor(String)}.
         */
        public Builder cronFor(Function<String, String> cronFor) {
            this.cronFor = Objects.requireNonNull(cronFor, "cronFor");
            return this;
        }

        public Builder payloadFor(Function<String, Object> payloadFor) {
            this.payloadFor = Objects.requireNonNull(payloadFor, "payloadFor");
            return this;
        }

        /**
         * Stable key of the scheduler of one account. Defaults to {@code <templateId>-<accountId>}.
         */
        public Builder jobKeyFor(Function<String, String> jobKeyFor) {
            this.jobKeyFor = Objects.requireNonNull(jobKeyFor, "jobKeyFor");
            return this;
        }

        public DynamicSchedulerTemplate build() {
            return new DynamicSchedulerTemplate(this);
        }
    }
}
