package com.jobflow.core;

import java.util.Objects;

import com.jobflow.broker.JobOptions;
import com.jobflow.broker.Retention;

/**
 * Typed handle to one durable queue: its name plus the defaults shared by every job bound to it.
 *
 * <p>A binding is declared once per logical queue and shared by many job definitions. It never
 * holds a connection; queue handles are resolved through the {@link JobRegistry}.</p>
 *
 * <pre>{@code
 * public static final QueueBinding EMAIL = QueueBinding.builder("email")
 *         .concurrency(5)
 *         .priority(1)
 *         .build();
 * }</pre>
 */
public final class QueueBinding {

    private final String name;
    private final Integer concurrency;
    private final Integer priority;
    private final Retention removeOnComplete;
    private final Retention removeOnFail;

    private QueueBinding(Builder builder) {
        if (builder.name == null || builder.name.isBlank()) {
            throw new IllegalArgumentException("Queue name must not be blank");
        }
        if (builder.concurrency != null && builder.concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1: " + builder.concurrency);
        }
        this.name = builder.name;
        this.concurrency = builder.concurrency;
        this.priority = builder.priority;
        this.removeOnComplete = builder.removeOnComplete;
        this.removeOnFail = builder.removeOnFail;
    }

    public static QueueBinding of(String name) {
        return builder(name).build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    /**
     * Default number of jobs of this queue a worker runs at once, null when unset.
     */
    public Integer getConcurrency() {
        return concurrency;
    }

    public Integer getPriority() {
        return priority;
    }

    public Retention getRemoveOnComplete() {
        return removeOnComplete;
    }

    public Retention getRemoveOnFail() {
        return removeOnFail;
    }

    /**
     * The binding's defaults as a job options layer.
     */
    public JobOptions toJobOptions() {
        return JobOptions.builder()
                .priority(priority)
                .removeOnComplete(removeOnComplete)
                .removeOnFail(removeOnFail)
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QueueBinding)) {
            return false;
        }
        QueueBinding other = (QueueBinding) o;
        return name.equals(other.name)
                && Objects.equals(concurrency, other.concurrency)
                && Objects.equals(priority, other.priority)
                && Objects.equals(removeOnComplete, other.removeOnComplete)
                && Objects.equals(removeOnFail, other.removeOnFail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, concurrency, priority, removeOnComplete, removeOnFail);
    }

    @Override
    public String toString() {
        return "QueueBinding{name='" + name + "', concurrency=" + concurrency + ", priority=" + priority + "}";
    }

    public static final class Builder {
        private final String name;
        private Integer concurrency;
        private Integer priority;
        private Retention removeOnComplete;
        private Retention removeOnFail;

        private Builder(String name) {
            this.name = name;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
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

        public QueueBinding build() {
            return new QueueBinding(this);
        }
    }
}
