package com.jobflow.core;

import java.util.Objects;

import com.jobflow.broker.Backoff;
import com.jobflow.broker.JobOptions;
import com.jobflow.broker.Retention;

/**
 * Registration options of a job: the queue it is bound to and its own execution policy.
 *
 * <pre>{@code
 * JobConfig.on(Queues.EMAIL)
 *         .attempts(5)
 *         .removeOnComplete(100)
 *         .build();
 * }</pre>
 *
 * <p>{@code removeOnComplete(n)} keeps the newest {@code n} completed jobs for at most 24 hours,
 * {@code removeOnFail(n)} keeps the newest {@code n} failed jobs for at most 7 days.</p>
 */
public final class JobConfig {

    private final QueueBinding queue;
    private final JobOptions options;

    private JobConfig(QueueBinding queue, JobOptions options) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.options = options;
    }

    public static Builder on(QueueBinding queue) {
        return new Builder(queue);
    }

    public QueueBinding getQueue() {
        return queue;
    }

    /**
     * Options declared with the job, without the binding's or the hard defaults.
     */
    public JobOptions getOptions() {
        return options;
    }

    public static final class Builder {
        private final QueueBinding queue;
        private final JobOptions.Builder options = JobOptions.builder();

        private Builder(QueueBinding queue) {
            this.queue = queue;
        }

        public Builder priority(int priority) {
            options.priority(priority);
            return this;
        }

        public Builder attempts(int attempts) {
            options.attempts(attempts);
            return this;
        }

        public Builder delay(long delayMillis) {
            options.delay(delayMillis);
            return this;
        }

        public Builder backoff(Backoff backoff) {
            options.backoff(backoff);
            return this;
        }

        public Builder removeOnComplete(int count) {
            options.removeOnComplete(Retention.keepLast(count, JobOptions.COMPLETED_MAX_AGE));
            return this;
        }

        public Builder removeOnComplete(Retention retention) {
            options.removeOnComplete(retention);
            return this;
        }

        public Builder removeOnFail(int count) {
            options.removeOnFail(Retention.keepLast(count, JobOptions.FAILED_MAX_AGE));
            return this;
        }

        public Builder removeOnFail(Retention retention) {
            options.removeOnFail(retention);
            return this;
        }

        public JobConfig build() {
            return new JobConfig(queue, options.build());
        }
    }
}
