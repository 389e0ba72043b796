package com.jobflow.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.jobflow.broker.Broker;
import com.jobflow.broker.BrokerJob;
import com.jobflow.broker.BrokerQueue;
import com.jobflow.broker.FlowProducer;

/**
 * Catalog of the job definitions of one process and the single place where queues are resolved.
 *
 * <p>There is one registry per process, constructed explicitly and passed to whatever needs it.
 * It maps every job id to its definition and to the name of its queue, and resolves queue names to
 * live {@link BrokerQueue} handles in one of two ways:</p>
 *
 * <ul>
 *   <li><b>Worker process:</b> the worker runtime installs a {@link QueueResolver} over the queue
 *       handles it owns ({@link #setQueueResolver}). Resolution always tries it first.</li>
 *   <li><b>Caller-only process:</b> no resolver is installed. The registry lazily opens one queue
 *       handle per queue name directly on the broker, caches it, and reuses it for every later
 *       trigger. {@link #closeExternalQueues()} closes them for a clean shutdown.</li>
 * </ul>
 *
 * <p>When an installed resolver fails or does not own a queue, the registry falls back to an
 * external handle and logs the fallback as a warning, since inside a worker this usually means a
 * queue was not opened at startup. A queue the resolver does not own is reported once; every
 * resolver failure is reported with its error.</p>
 *
 * <p><b>Duplicate ids:</b> registering a second job with an id that is already taken is rejected
 * with {@link IllegalArgumentException}. Two bindings with the same queue name must declare the
 * same defaults.</p>
 *
 * <p><b>Thread Safety:</b> registration, the external queue cache and the flow producer are
 * guarded by the registry's monitor (check-then-create), so concurrent first triggers never open
 * two handles for the same queue. Lookups used by workers are lock-free.</p>
 *
 * @see JobDefinition
 * @see ResolutionMode
 */
public class JobRegistry implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(JobRegistry.class.getName());

    private final Broker broker;
    private final Map<String, JobDefinition<?>> definitions = new ConcurrentHashMap<>();
    private final Map<String, String> jobQueues = new ConcurrentHashMap<>();
    private final Map<String, QueueBinding> bindings = new LinkedHashMap<>();   // guarded by this
    private final Map<String, BrokerQueue> externalQueues = new LinkedHashMap<>(); // guarded by this
    private final Set<String> unresolvedQueues = ConcurrentHashMap.newKeySet();

    private volatile QueueResolver resolver;
    private volatile ResolutionMode mode = ResolutionMode.UNINITIALIZED;
    private FlowProducer flowProducer; // guarded by this

    /**
     * @param broker broker used for external queue handles and the flow producer
     */
    public JobRegistry(Broker broker) {
        this.broker = Objects.requireNonNull(broker, "broker");
    }

    // ==================== REGISTRATION ====================

    /**
     * Register a job definition.
     *
     * @param id globally unique job id, also the name of every enqueued job
     * @param schema payload schema
     * @param config queue binding and job-level options
     * @param handler business logic
     * @return the definition, used to trigger the job
     * @throws IllegalArgumentException if {@code id} is already registered, or the queue name is
     *         already bound with different defaults
     */
    public synchronized <T> JobDefinition<T> job(String id, JobSchema<T> schema, JobConfig config, JobHandler<T> handler) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Job id must not be blank");
        }
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(handler, "handler");
        if (definitions.containsKey(id)) {
            throw new IllegalArgumentException("Job already registered: " + id);
        }

        QueueBinding binding = config.getQueue();
        QueueBinding existing = bindings.get(binding.getName());
        if (existing != null && !existing.equals(binding)) {
            throw new IllegalArgumentException("Queue " + binding.getName()
                    + " is already bound with different defaults: " + existing);
        }

        JobDefinition<T> definition = new JobDefinition<>(id, schema, config, handler, this);
        bindings.putIfAbsent(binding.getName(), binding);
        jobQueues.put(id, binding.getName());
        definitions.put(id, definition);

        logger.fine("Registered job " + id + " on queue " + binding.getName());
        return definition;
    }

    /**
     * @throws QueueResolutionException if no job is registered under {@code id}
     */
    public JobDefinition<?> getDefinition(String id) {
        JobDefinition<?> definition = definitions.get(id);
        if (definition == null) {
            throw new QueueResolutionException("No job registered with id: " + id);
        }
        return definition;
    }

    public boolean isRegistered(String id) {
        return definitions.containsKey(id);
    }

    public Collection<JobDefinition<?>> getDefinitions() {
        return Collections.unmodifiableCollection(definitions.values());
    }

    /**
     * Bindings of every queue at least one job is registered on, in registration order.
     */
    public synchronized List<QueueBinding> getQueueBindings() {
        return List.copyOf(bindings.values());
    }

    public synchronized QueueBinding getQueueBinding(String queueName) {
        return bindings.get(queueName);
    }

    // ==================== QUEUE RESOLUTION ====================

    /**
     * Install the resolver of a worker runtime. Queue handles cached so far (from triggers made
     * before the runtime started) are closed, since the resolver owns handles for the same queues.
     */
    public synchronized void setQueueResolver(QueueResolver resolver) {
        Objects.requireNonNull(resolver, "resolver");
        if (!externalQueues.isEmpty()) {
            logger.warning("Installing a queue resolver while " + externalQueues.size()
                    + " external queue(s) are cached; closing them: " + externalQueues.keySet());
            closeCachedQueues();
        }
        this.resolver = resolver;
        this.unresolvedQueues.clear();
        this.mode = ResolutionMode.RESOLVER_INSTALLED;
        logger.info("Queue resolver installed");
    }

    public ResolutionMode getResolutionMode() {
        return mode;
    }

    /**
     * Resolve the queue a job is bound to.
     *
     * @throws QueueResolutionException if no job is registered under {@code jobId}
     */
    public BrokerQueue getQueue(String jobId) {
        String queueName = jobQueues.get(jobId);
        if (queueName == null) {
            throw new QueueResolutionException("No queue registered for job: " + jobId);
        }
        return resolve(jobId, queueName);
    }

    /**
     * Resolve a queue by name, for producers that are not tied to one job (job schedulers).
     */
    public BrokerQueue getQueueByName(String queueName) {
        return resolve(null, queueName);
    }

    private BrokerQueue resolve(String jobId, String queueName) {
        QueueResolver current = resolver;
        if (current != null) {
            try {
                BrokerQueue queue = current.resolve(jobId, queueName);
                if (queue != null) {
                    return queue;
                }
                // Once per queue name and resolver; later triggers reuse the cached external handle
                if (unresolvedQueues.add(queueName)) {
                    logger.warning("Queue resolver has no queue " + queueName + " (job: " + jobId
                            + "), falling back to an external queue");
                }
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Queue resolver failed for queue " + queueName + " (job: " + jobId
                        + "), falling back to an external queue", e);
            }
        }
        return externalQueue(queueName);
    }

    private synchronized BrokerQueue externalQueue(String queueName) {
        BrokerQueue queue = externalQueues.get(queueName);
        if (queue == null) {
            queue = broker.openQueue(queueName);
            externalQueues.put(queueName, queue);
            logger.fine("Opened external queue " + queueName);
        }
        if (mode == ResolutionMode.UNINITIALIZED) {
            mode = ResolutionMode.EXTERNAL_CACHE_IN_USE;
        }
        return queue;
    }

    /**
     * Names of the queues currently cached as external handles.
     */
    public synchronized List<String> getExternalQueueNames() {
        return new ArrayList<>(externalQueues.keySet());
    }

    /**
     * Close and forget every cached external queue handle. Close failures are logged.
     */
    public synchronized void closeExternalQueues() {
        closeCachedQueues();
        if (mode == ResolutionMode.EXTERNAL_CACHE_IN_USE) {
            mode = ResolutionMode.UNINITIALIZED;
        }
    }

    private void closeCachedQueues() {
        for (Map.Entry<String, BrokerQueue> entry : externalQueues.entrySet()) {
            try {
                entry.getValue().close();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Failed to close external queue " + entry.getKey(), e);
            }
        }
        externalQueues.clear();
    }

    /**
     * Flow producer shared by every flow triggered from this process, created on first use.
     */
    public synchronized FlowProducer getFlowProducer() {
        if (flowProducer == null) {
            flowProducer = broker.openFlowProducer();
            logger.fine("Opened flow producer");
        }
        return flowProducer;
    }

    // ==================== EXECUTION ====================

    /**
     * Execute a dequeued job with the definition registered under {@code jobId}.
     *
     * @throws QueueResolutionException if no job is registered under {@code jobId}
     * @throws JobValidationException if the payload no longer matches the schema
     * @throws JobExecutionException if the handler fails
     */
    public Object executeJob(String jobId, BrokerJob job, DataContext dataContext) {
        return getDefinition(jobId).execute(job, dataContext);
    }

    /**
     * Close external queue handles and the flow producer. Queue handles obtained through an
     * installed resolver belong to the runtime and are left open.
     */
    @Override
    public synchronized void close() {
        closeExternalQueues();
        if (flowProducer != null) {
            try {
                flowProducer.close();
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Failed to close flow producer", e);
            }
            flowProducer = null;
        }
    }
}
