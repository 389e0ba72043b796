package com.jobflow.scheduling;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.jobflow.broker.BrokerQueue;
import com.jobflow.broker.CronSchedule;
import com.jobflow.broker.JobOptions;
import com.jobflow.broker.RepeatOptions;
import com.jobflow.broker.SchedulerEntry;
import com.jobflow.core.JobDefinition;
import com.jobflow.core.JobRegistry;
import com.jobflow.core.Payloads;
import com.jobflow.core.QueueResolutionException;

/**
 * Registers recurring jobs as broker job schedulers.
 *
 * <p><b>Static schedulers</b> are declared in code and registered by every worker process on
 * startup under the id {@code scheduler:<name>}. <b>Dynamic schedulers</b> are created per account
 * at runtime from a {@link DynamicSchedulerTemplate} under {@code scheduler:<jobKey>}.</p>
 *
 * <p><b>Idempotency:</b> the broker upserts schedulers by id, so registering the same scheduler from
 * several processes, or several times, leaves one scheduler and one pending occurrence. Dynamic
 * registrations are additionally tracked per process; a second registration of a tracked key is
 * skipped with a warning.</p>
 *
 * <p><b>Payloads:</b> when the produced job name is registered in the {@link JobRegistry}, the payload
 * is validated by that job's schema and the job's options are used for the produced jobs.</p>
 *
 * <p><b>Thread Safety:</b> registration methods are synchronized; the tracking maps are
 * process-local.</p>
 */
public class SchedulerRegistry {
    private static final Logger logger = Logger.getLogger(SchedulerRegistry.class.getName());

    private static final String KEY_PREFIX = "scheduler:";

    private final JobRegistry jobRegistry;
    private final Map<String, StaticSchedulerConfig> staticConfigs = new LinkedHashMap<>();
    private final Map<String, DynamicSchedulerTemplate> templates = new LinkedHashMap<>();

    private final Map<String, BrokerQueue> registeredStatic = new LinkedHashMap<>();
    private final Map<String, BrokerQueue> registeredDynamic = new LinkedHashMap<>();

    public SchedulerRegistry(JobRegistry jobRegistry) {
        this.jobRegistry = jobRegistry;
    }

    // ==================== DECLARATION ====================

    /**
     * @throws IllegalArgumentException if a static scheduler with the same name exists or the cron
     *         pattern is invalid
     */
    public synchronized SchedulerRegistry addStatic(StaticSchedulerConfig config) {
        if (staticConfigs.containsKey(config.getName())) {
            throw new IllegalArgumentException("Static scheduler already declared: " + config.getName());
        }
        CronSchedule.parse(config.getCronPattern(), config.getTimezone());
        staticConfigs.put(config.getName(), config);
        return this;
    }

    public synchronized SchedulerRegistry addTemplate(DynamicSchedulerTemplate template) {
        if (templates.containsKey(template.getId())) {
            throw new IllegalArgumentException("Scheduler template already declared: " + template.getId());
        }
        templates.put(template.getId(), template);
        return this;
    }

    public synchronized List<StaticSchedulerConfig> getStaticConfigs() {
        return List.copyOf(staticConfigs.values());
    }

    public synchronized List<DynamicSchedulerTemplate> getTemplates() {
        return List.copyOf(templates.values());
    }

    /**
     * Queues that static schedulers and templates produce jobs on.
     */
    public synchronized Set<String> getQueueNames() {
        Set<String> names = new LinkedHashSet<>();
        staticConfigs.values().forEach(config -> names.add(config.getQueueName()));
        templates.values().forEach(template -> names.add(template.getQueueName()));
        return names;
    }

    // ==================== STATIC ====================

    /**
     * Upsert every declared static scheduler. Called once on worker startup.
     *
     * @throws RuntimeException the first registration failure, after logging it
     */
    public synchronized void registerStaticSchedulers() {
        for (StaticSchedulerConfig config : staticConfigs.values()) {
            try {
                BrokerQueue queue = jobRegistry.getQueueByName(config.getQueueName());
                SchedulerEntry entry = queue.upsertJobScheduler(config.getSchedulerKey(), config.toRepeatOptions(),
                        config.getJobName(), payloadJson(config.getJobName(), config.getPayload()),
                        optionsFor(config.getJobName()));
                registeredStatic.put(config.getName(), queue);
                logger.info("Registered static scheduler " + config.getName() + " on queue " + config.getQueueName()
                        + " (" + config.getCronPattern() + " " + config.getTimezone() + "), next run " + entry.getNextRun());
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Failed to register static scheduler " + config.getName(), e);
                throw e;
            }
        }
        logger.info("Registered " + staticConfigs.size() + " static scheduler(s)");
    }

    // ==================== DYNAMIC ====================

    /**
     * Create the scheduler of one account. Skipped with a warning when the same key was already
     * registered by this process.
     *
     * @return the job key of the scheduler
     * @throws QueueResolutionException if the template is unknown
     */
    public synchronized String registerDynamicScheduler(DynamicSchedulerRequest request) {
        DynamicSchedulerTemplate template = getTemplate(request.getTemplateId());
        String jobKey = template.jobKeyFor(request.getAccountId());

        if (registeredDynamic.containsKey(jobKey)) {
            logger.warning("Dynamic scheduler " + jobKey + " is already registered, skipping");
            return jobKey;
        }

        String pattern = request.getCronPattern() != null
                ? request.getCronPattern()
                : template.cronFor(request.getAccountId());
        try {
            BrokerQueue queue = jobRegistry.getQueueByName(template.getQueueName());
            SchedulerEntry entry = queue.upsertJobScheduler(KEY_PREFIX + jobKey,
                    RepeatOptions.builder(pattern).timezone(RepeatOptions.DEFAULT_TIMEZONE).build(),
                    template.getJobName(), payloadJson(template.getJobName(), template.payloadFor(request.getAccountId())),
                    optionsFor(template.getJobName()));
            registeredDynamic.put(jobKey, queue);
            logger.info("Registered dynamic scheduler " + jobKey + " (" + pattern + ") on queue "
                    + template.getQueueName() + ", next run " + entry.getNextRun());
            return jobKey;
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to register dynamic scheduler " + jobKey + " from template "
                    + template.getId(), e);
            throw e;
        }
    }

    /**
     * Remove the scheduler of one account and its pending occurrence.
     *
     * @return true if a tracked scheduler was removed
     * @throws QueueResolutionException if the template is unknown
     */
    public synchronized boolean unregisterDynamicScheduler(String templateId, String accountId) {
        DynamicSchedulerTemplate template = getTemplate(templateId);
        String jobKey = template.jobKeyFor(accountId);

        BrokerQueue queue = registeredDynamic.get(jobKey);
        if (queue == null) {
            logger.warning("Dynamic scheduler " + jobKey + " is not registered, nothing to remove");
            return false;
        }
        try {
            queue.removeJobScheduler(KEY_PREFIX + jobKey);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to remove dynamic scheduler " + jobKey, e);
            throw e;
        }
        registeredDynamic.remove(jobKey);
        logger.info("Unregistered dynamic scheduler " + jobKey);
        return true;
    }

    public synchronized Map<String, BrokerQueue> getRegisteredDynamicSchedulers() {
        return Map.copyOf(registeredDynamic);
    }

    public synchronized Map<String, BrokerQueue> getRegisteredStaticSchedulers() {
        return Map.copyOf(registeredStatic);
    }

    private DynamicSchedulerTemplate getTemplate(String templateId) {
        DynamicSchedulerTemplate template = templates.get(templateId);
        if (template == null) {
            throw new QueueResolutionException("Unknown scheduler template: " + templateId);
        }
        return template;
    }

    private String payloadJson(String jobName, Object payload) {
        if (jobRegistry.isRegistered(jobName)) {
            return Payloads.toJson(jobRegistry.getDefinition(jobName).validate(payload));
        }
        return Payloads.toJson(payload);
    }

    private JobOptions optionsFor(String jobName) {
        if (jobRegistry.isRegistered(jobName)) {
            JobDefinition<?> definition = jobRegistry.getDefinition(jobName);
            return definition.effectiveOptions(null);
        }
        return JobOptions.empty();
    }
}
