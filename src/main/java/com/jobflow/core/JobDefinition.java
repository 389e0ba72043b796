package com.jobflow.core;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.jobflow.broker.BrokerJob;
import com.jobflow.broker.BrokerQueue;
import com.jobflow.broker.BulkJob;
import com.jobflow.broker.FlowJob;
import com.jobflow.broker.JobNode;
import com.jobflow.broker.JobOptions;
import com.jobflow.broker.RepeatOptions;

/**
 * A named, schema-validated unit of work with its handler.
 *
 * <p>Definitions are created once through {@link JobRegistry#job} and are immutable afterwards.
 * A definition knows the <i>name</i> of its queue only; every trigger resolves the live queue
 * handle through the registry, so the same definition works from a worker process and from a
 * caller-only process.</p>
 *
 * <p><b>Option Precedence</b> (highest first):</p>
 * <ol>
 *   <li>Options passed at the call site</li>
 *   <li>Options declared with the job ({@link JobConfig})</li>
 *   <li>Defaults of the queue binding</li>
 *   <li>{@link JobOptions#DEFAULTS}: priority 1, 3 attempts, no delay, exponential backoff from
 *       2000ms, keep 50 completed jobs for 24h and 50 failed jobs for 7 days</li>
 * </ol>
 *
 * <p><b>Validation:</b> every trigger validates its payload before touching the broker. A payload
 * rejected by the schema raises {@link JobValidationException} and nothing is enqueued. A batch is
 * validated as a whole before the bulk enqueue, so it is never partially submitted.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * JobDefinition<InvitePayload> sendInvite = registry.job(
 *         "send-invite",
 *         JobSchema.of(InvitePayload.class),
 *         JobConfig.on(Queues.EMAIL).build(),
 *         (payload, context) -> mailer.sendInvite(payload.email(), payload.teamId()));
 *
 * sendInvite.trigger(new InvitePayload("a@b.com", "t1"));
 * sendInvite.triggerDelayed(new InvitePayload("a@b.com", "t1"), 60_000);
 * }</pre>
 *
 * <p><b>Thread Safety:</b> instances are immutable and may be triggered from any thread.</p>
 *
 * @param <T> type of the validated payload
 * @see JobRegistry
 * @see FlowNode
 */
public final class JobDefinition<T> {
    private static final Logger logger = Logger.getLogger(JobDefinition.class.getName());

    private final String id;
    private final JobSchema<T> schema;
    private final JobConfig config;
    private final JobHandler<T> handler;
    private final JobRegistry registry;

    JobDefinition(String id, JobSchema<T> schema, JobConfig config, JobHandler<T> handler, JobRegistry registry) {
        this.id = id;
        this.schema = schema;
        this.config = config;
        this.handler = handler;
        this.registry = registry;
    }

    public String getId() {
        return id;
    }

    public JobSchema<T> getSchema() {
        return schema;
    }

    public JobConfig getConfig() {
        return config;
    }

    public String getQueueName() {
        return config.getQueue().getName();
    }

    /**
     * Validate a payload against this job's schema.
     *
     * @param payload a JSON tree, a map, a record or a bean
     * @return the typed payload
     * @throws JobValidationException if the schema rejects it
     */
    public T validate(Object payload) {
        try {
            return schema.parse(Payloads.toTree(payload));
        } catch (SchemaViolationException e) {
            throw new JobValidationException(id, e);
        }
    }

    /**
     * Options a job triggered with {@code callSite} is enqueued with.
     *
     * @param callSite call-site options, may be null
     * @return fully merged options
     */
    public JobOptions effectiveOptions(JobOptions callSite) {
        return JobOptions.DEFAULTS
                .mergedWith(config.getQueue().toJobOptions())
                .mergedWith(config.getOptions())
                .mergedWith(callSite);
    }

    // ==================== TRIGGERS ====================

    public BrokerJob trigger(Object payload) {
        return trigger(payload, null);
    }

    /**
     * Validate {@code payload} and enqueue one job on the bound queue.
     *
     * @param payload job payload
     * @param options call-site options, may be null
     * @return handle of the enqueued job
     * @throws JobValidationException if the payload is rejected; nothing is enqueued
     * @throws QueueResolutionException if the job's queue cannot be resolved
     */
    public BrokerJob trigger(Object payload, JobOptions options) {
        T value = validate(payload);
        JobOptions effective = effectiveOptions(options);

        BrokerQueue queue = registry.getQueue(id);
        BrokerJob job = queue.add(id, Payloads.toJson(value), effective);
        logger.fine("Triggered job " + id + " on queue " + queue.getName() + " (id: " + job.getId() + ")");
        return job;
    }

    /**
     * Validate every item, then enqueue all of them in one bulk operation.
     *
     * @param items payloads with optional per-item options
     * @return one handle per item, in the order of {@code items}
     * @throws JobValidationException on the first rejected item; nothing is enqueued
     */
    public List<BrokerJob> batchTrigger(List<BatchItem> items) {
        List<BulkJob> bulk = new ArrayList<>(items.size());
        for (BatchItem item : items) {
            T value = validate(item.getPayload());
            bulk.add(new BulkJob(id, Payloads.toJson(value), effectiveOptions(item.getOptions())));
        }
        if (bulk.isEmpty()) {
            return List.of();
        }

        BrokerQueue queue = registry.getQueue(id);
        List<BrokerJob> jobs = queue.addBulk(bulk);
        logger.fine("Triggered " + jobs.size() + " jobs " + id + " on queue " + queue.getName());
        return jobs;
    }

    public BrokerJob triggerDelayed(Object payload, long delayMillis) {
        return triggerDelayed(payload, delayMillis, null);
    }

    /**
     * Trigger a single execution that becomes claimable after {@code delayMillis}.
     */
    public BrokerJob triggerDelayed(Object payload, long delayMillis, JobOptions options) {
        JobOptions base = options != null ? options : JobOptions.empty();
        return trigger(payload, base.toBuilder().delay(delayMillis).build());
    }

    public BrokerJob triggerRecurring(Object payload, String cronPattern) {
        return triggerRecurring(payload, cronPattern, null);
    }

    /**
     * Attach a repeat rule to this job. The broker keeps one repeatable entry per job name,
     * pattern and timezone, so calling this again with the same pattern does not duplicate it.
     *
     * @param cronPattern 5-field cron pattern ({@code minute hour day month weekday})
     * @param options call-site options; a repeat rule in them supplies timezone and bounds
     * @return the first scheduled occurrence
     */
    public BrokerJob triggerRecurring(Object payload, String cronPattern, JobOptions options) {
        JobOptions base = options != null ? options : JobOptions.empty();
        RepeatOptions given = base.getRepeat();
        RepeatOptions.Builder repeat = RepeatOptions.builder(cronPattern);
        if (given != null) {
            repeat.timezone(given.getTimezone())
                    .startDate(given.getStartDate())
                    .endDate(given.getEndDate())
                    .limit(given.getLimit());
        }
        return trigger(payload, base.toBuilder().repeat(repeat.build()).build());
    }

    public JobNode triggerFlow(Object payload, JobOptions options, List<FlowNode> children) {
        return triggerFlow(FlowNode.of(this, payload).options(options).children(children));
    }

    /**
     * Submit a flow rooted at this job. Every node is validated by its own definition's schema
     * and enqueued on its own definition's queue with its own definition's options, unless the
     * node overrides them.
     *
     * @param flow root node; its definition must be this job
     * @return the stored tree; {@code getJob()} is the parent handle
     * @throws JobValidationException if any node's payload is rejected; nothing is enqueued
     */
    public JobNode triggerFlow(FlowNode flow) {
        if (flow.getDefinition() != this) {
            throw new IllegalArgumentException("Flow root is " + flow.getDefinition().getId() + ", expected " + id);
        }
        FlowJob lowered = lower(flow);
        JobNode node = registry.getFlowProducer().add(lowered);
        logger.fine("Triggered flow " + id + " (parent id: " + node.getJob().getId() + ")");
        return node;
    }

    /**
     * Lower a flow tree into the broker's nested structure. No broker call is made here, so a
     * rejected payload anywhere in the tree aborts before anything is submitted.
     */
    static FlowJob lower(FlowNode node) {
        JobDefinition<?> definition = node.getDefinition();
        JobOptions options = definition.effectiveOptions(node.getOptions());
        if (options.getRepeat() != null) {
            throw new IllegalArgumentException("Flow nodes cannot repeat: " + definition.getId());
        }

        List<FlowJob> children = new ArrayList<>(node.getChildren().size());
        for (FlowNode child : node.getChildren()) {
            children.add(lower(child));
        }
        Object value = definition.validate(node.getPayload());
        return new FlowJob(definition.getId(), definition.getQueueName(), Payloads.toJson(value), options, children);
    }

    // ==================== EXECUTION ====================

    /**
     * Run the handler for a dequeued job.
     *
     * <p>The payload is validated again, since producer and worker may run different versions of
     * the schema.</p>
     *
     * @param job the claimed job
     * @param dataContext data-access dependency of the worker process
     * @return the handler's result
     * @throws JobValidationException if the stored payload no longer matches the schema
     * @throws JobExecutionException if the handler fails
     */
    public Object execute(BrokerJob job, DataContext dataContext) {
        T payload;
        try {
            payload = schema.parse(job.getData());
        } catch (SchemaViolationException e) {
            logger.severe("Job " + id + " (" + job.getId() + ") has an invalid payload: " + e.getMessage());
            throw new JobValidationException(id, e);
        }

        JobContext context = new JobContext(job, dataContext);
        logger.info("Starting job " + id + " (" + job.getId() + "), attempt " + context.getAttempt());
        long startTime = System.currentTimeMillis();

        try {
            Object result = handler.handle(payload, context);
            logger.info("Job " + id + " (" + job.getId() + ") succeeded in "
                    + (System.currentTimeMillis() - startTime) + "ms");
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warning("Job " + id + " (" + job.getId() + ") was interrupted");
            throw new JobExecutionException(id, job.getId(), e);
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Job " + id + " (" + job.getId() + ") failed", e);
            throw new JobExecutionException(id, job.getId(), e);
        }
    }

    @Override
    public String toString() {
        return "JobDefinition{id='" + id + "', queue='" + getQueueName() + "'}";
    }
}
