package com.jobflow.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.jobflow.broker.Broker;
import com.jobflow.broker.BrokerQueue;
import com.jobflow.broker.Retention;
import com.jobflow.core.DataContext;
import com.jobflow.core.JobRegistry;
import com.jobflow.core.QueueBinding;
import com.jobflow.scheduling.SchedulerRegistry;

/**
 * Runs one {@link QueueWorker} per known queue of a process.
 *
 * <p><b>Startup sequence:</b></p>
 * <ol>
 *   <li>Health check of the data context handed to job handlers</li>
 *   <li>Broker ping</li>
 *   <li>Open one queue handle per queue: every queue bound in the {@link JobRegistry} plus every
 *       queue a scheduler produces jobs on</li>
 *   <li>Install a queue resolver over those handles, so triggers made from handlers reuse them</li>
 *   <li>Register static schedulers</li>
 *   <li>Start the queue workers</li>
 * </ol>
 * Any failure aborts the startup, releases what was acquired so far and is rethrown.
 *
 * <p><b>Concurrency per queue:</b> the configured override for the queue, else the queue binding's
 * default, else {@link WorkerOptions#DEFAULT_CONCURRENCY}.</p>
 *
 * <p><b>Retention:</b> workers apply their own retention (completed: 50 jobs for 1 hour, failed:
 * 50 jobs for 24 hours) in place of the job's retention.</p>
 *
 * <pre>{@code
 * WorkerRuntime runtime = WorkerRuntime.builder(broker, registry, dataContext)
 *         .schedulerRegistry(schedulers)
 *         .concurrency("email", 10)
 *         .build();
 * runtime.start();
 * Runtime.getRuntime().addShutdownHook(new Thread(runtime::shutdown));
 * }</pre>
 */
public class WorkerRuntime {
    private static final Logger logger = Logger.getLogger(WorkerRuntime.class.getName());

    public static final Retention COMPLETED_RETENTION = Retention.keepLast(50, Duration.ofHours(1));
    public static final Retention FAILED_RETENTION = Retention.keepLast(50, Duration.ofHours(24));

    private final Broker broker;
    private final JobRegistry registry;
    private final SchedulerRegistry schedulerRegistry;
    private final DataContext dataContext;
    private final Map<String, Integer> concurrencyOverrides;
    private final WorkerOptions baseOptions;
    private final List<WorkerListener> listeners;

    private final Map<String, BrokerQueue> queues = new LinkedHashMap<>();
    private final Map<String, QueueWorker> workers = new LinkedHashMap<>();
    private boolean started = false;
    private boolean shutDown = false;

    private WorkerRuntime(Builder builder) {
        this.broker = builder.broker;
        this.registry = builder.registry;
        this.schedulerRegistry = builder.schedulerRegistry != null
                ? builder.schedulerRegistry
                : new SchedulerRegistry(builder.registry);
        this.dataContext = builder.dataContext;
        this.concurrencyOverrides = Map.copyOf(builder.concurrencyOverrides);
        this.baseOptions = builder.workerOptions;
        this.listeners = builder.listeners.isEmpty()
                ? List.of(new LoggingWorkerListener())
                : List.copyOf(builder.listeners);
    }

    public static Builder builder(Broker broker, JobRegistry registry, DataContext dataContext) {
        return new Builder(broker, registry, dataContext);
    }

    /**
     * Bring the runtime up. See the class documentation for the sequence.
     *
     * @throws IllegalStateException if already started or shut down
     * @throws RuntimeException the startup failure, after releasing acquired resources
     */
    public synchronized void start() {
        if (started || shutDown) {
            throw new IllegalStateException("Worker runtime already " + (shutDown ? "shut down" : "started"));
        }
        started = true;
        logger.info("Starting worker runtime");

        try {
            dataContext.healthCheck();
            logger.info("Data context healthy");

            broker.ping();
            logger.info("Broker reachable");

            for (String queueName : getQueueNames()) {
                queues.put(queueName, broker.openQueue(queueName));
            }
            logger.info("Opened " + queues.size() + " queue(s): " + queues.keySet());

            registry.setQueueResolver((jobId, queueName) -> queues.get(queueName));

            schedulerRegistry.registerStaticSchedulers();

            for (BrokerQueue queue : queues.values()) {
                QueueWorker worker = new QueueWorker(queue, processorFor(queue.getName()),
                        optionsFor(queue.getName()), listeners);
                workers.put(queue.getName(), worker);
                worker.start();
            }
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Worker runtime failed to start", e);
            shutdown();
            throw e;
        }

        logger.info("Worker runtime started with " + workers.size() + " queue worker(s)");
    }

    /**
     * Queues served by this runtime, in registration order.
     */
    public Set<String> getQueueNames() {
        Set<String> names = new LinkedHashSet<>();
        for (QueueBinding binding : registry.getQueueBindings()) {
            names.add(binding.getName());
        }
        names.addAll(schedulerRegistry.getQueueNames());
        return names;
    }

    /**
     * Concurrency of the worker of {@code queueName}.
     */
    public int concurrencyFor(String queueName) {
        Integer override = concurrencyOverrides.get(queueName);
        if (override != null) {
            return override;
        }
        QueueBinding binding = registry.getQueueBinding(queueName);
        if (binding != null && binding.getConcurrency() != null) {
            return binding.getConcurrency();
        }
        return WorkerOptions.DEFAULT_CONCURRENCY;
    }

    WorkerOptions optionsFor(String queueName) {
        return baseOptions.toBuilder().concurrency(concurrencyFor(queueName)).build();
    }

    /**
     * Adapter between a queue worker and the registry: dispatch by job name, log and rethrow
     * failures so the broker's retry policy applies.
     */
    JobProcessor processorFor(String queueName) {
        return job -> {
            try {
                return registry.executeJob(job.getName(), job, dataContext);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Job " + job.getId() + " (" + job.getName() + ") failed on queue "
                        + queueName + "; payload: " + job.getRawData(), e);
                throw e;
            }
        };
    }

    /**
     * Close every worker (waiting for in-flight jobs), the queue handles, the registry caches, the
     * data context and the broker. Close errors are logged and swallowed. Safe to call more than once.
     */
    public synchronized void shutdown() {
        if (shutDown) {
            return;
        }
        shutDown = true;
        logger.info("Shutting down worker runtime");

        for (QueueWorker worker : workers.values()) {
            try {
                worker.close();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Error closing worker of queue " + worker.getQueueName(), e);
            }
        }
        for (Map.Entry<String, BrokerQueue> entry : queues.entrySet()) {
            try {
                entry.getValue().close();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Error closing queue " + entry.getKey(), e);
            }
        }
        try {
            registry.close();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error closing job registry", e);
        }
        try {
            dataContext.close();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error closing data context", e);
        }
        try {
            broker.close();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error closing broker", e);
        }

        logger.info("Worker runtime shut down");
    }

    public synchronized boolean isRunning() {
        return started && !shutDown;
    }

    public synchronized Map<String, QueueWorker> getWorkers() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(workers));
    }

    public synchronized Map<String, BrokerQueue> getQueues() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(queues));
    }

    public JobRegistry getRegistry() {
        return registry;
    }

    public SchedulerRegistry getSchedulerRegistry() {
        return schedulerRegistry;
    }

    public static final class Builder {
        private final Broker broker;
        private final JobRegistry registry;
        private final DataContext dataContext;
        private SchedulerRegistry schedulerRegistry;
        private final Map<String, Integer> concurrencyOverrides = new LinkedHashMap<>();
        private WorkerOptions workerOptions = WorkerOptions.builder()
                .removeOnComplete(COMPLETED_RETENTION)
                .removeOnFail(FAILED_RETENTION)
                .build();
        private final List<WorkerListener> listeners = new ArrayList<>();

        private Builder(Broker broker, JobRegistry registry, DataContext dataContext) {
            this.broker = Objects.requireNonNull(broker, "broker");
            this.registry = Objects.requireNonNull(registry, "registry");
            this.dataContext = Objects.requireNonNull(dataContext, "dataContext");
        }

        public Builder schedulerRegistry(SchedulerRegistry schedulerRegistry) {
            this.schedulerRegistry = schedulerRegistry;
            return this;
        }

        public Builder concurrency(String queueName, int concurrency) {
            if (concurrency < 1) {
                throw new IllegalArgumentException("Concurrency of " + queueName + " must be at least 1");
            }
            concurrencyOverrides.put(queueName, concurrency);
            return this;
        }

        public Builder concurrency(Map<String, Integer> overrides) {
            overrides.forEach(this::concurrency);
            return this;
        }

        /**
         * Base settings of every queue worker; the concurrency is replaced per queue.
         */
        public Builder workerOptions(WorkerOptions workerOptions) {
            this.workerOptions = Objects.requireNonNull(workerOptions, "workerOptions");
            return this;
        }

        /**
         * Add a listener. Without any, a {@link LoggingWorkerListener} is used.
         */
        public Builder listener(WorkerListener listener) {
            listeners.add(listener);
            return this;
        }

        public WorkerRuntime build() {
            return new WorkerRuntime(this);
        }
    }
}
