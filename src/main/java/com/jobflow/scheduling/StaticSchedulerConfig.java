package com.jobflow.scheduling;

import java.time.Instant;
import java.util.Objects;

import com.jobflow.broker.RepeatOptions;

/**
 * A scheduler known at build time, registered by every worker process on startup.
 *
 * <pre>{@code
 * StaticSchedulerConfig.builder("daily-cleanup", "maintenance", "0 3 * * *")
 *         .jobName("cleanup-expired")
 *         .payload(Map.of("olderThanDays", 30))
 *         .build();
 * }</pre>
 */
public final class StaticSchedulerConfig {

    private final String name;
    private final String queueName;
    private final String cronPattern;
    private final String jobName;
    private final Object payload;
    private final String timezone;
    private final Integer limit;
    private final Instant startDate;
    private final Instant endDate;

    private StaticSchedulerConfig(Builder builder) {
        this.name = builder.name;
        this.queueName = builder.queueName;
        this.cronPattern = builder.cronPattern;
        this.jobName = builder.jobName != null ? builder.jobName : builder.name;
        this.payload = builder.payload;
        this.timezone = builder.timezone != null ? builder.timezone : RepeatOptions.DEFAULT_TIMEZONE;
        this.limit = builder.limit;
        this.startDate = builder.startDate;
        this.endDate = builder.endDate;
    }

    public static Builder builder(String name, String queueName, String cronPattern) {
        return new Builder(name, queueName, cronPattern);
    }

    public String getName() {
        return name;
    }

    public String getQueueName() {
        return queueName;
    }

    public String getCronPattern() {
        return cronPattern;
    }

    public String getJobName() {
        return jobName;
    }

    public Object getPayload() {
        return payload;
    }

    public String getTimezone() {
        return timezone;
    }

    public Integer getLimit() {
        return limit;
    }

    public Instant getStartDate() {
        return startDate;
    }

    public Instant getEndDate() {
        return endDate;
    }

    /**
     * Broker id of this scheduler.
     */
    public String getSchedulerKey() {
        return "scheduler:" + name;
    }

    RepeatOptions toRepeatOptions() {
        return RepeatOptions.builder(cronPattern)
                .timezone(timezone)
                .startDate(startDate)
                .endDate(endDate)
                .limit(limit)
                .build();
    }

    @Override
    public String toString() {
        return "StaticSchedulerConfig{name='" + name + "', queue='" + queueName + "', cron='" + cronPattern
                + "', tz=" + timezone + "}";
    }

    public static final class Builder {
        private final String name;
        private final String queueName;
        private final String cronPattern;
        private String jobName;
        private Object payload;
        private String timezone;
        private Integer limit;
        private Instant startDate;
        private Instant endDate;

        private Builder(String name, String queueName, String cronPattern) {
            this.name = Objects.requireNonNull(name, "name");
            this.queueName = Objects.requireNonNull(queueName, "queueName");
            this.cronPattern = Objects.requireNonNull(cronPattern, "cronPattern");
        }

        /**
         * Name of the produced jobs; defaults to the scheduler name.
         */
        public Builder jobName(String jobName) {
            this.jobName = jobName;
            return this;
        }

        public Builder payload(Object payload) {
            this.payload = payload;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder startDate(Instant startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder endDate(Instant endDate) {
            this.endDate = endDate;
            return this;
        }

        public StaticSchedulerConfig build() {
            return new StaticSchedulerConfig(this);
        }
    }
}
