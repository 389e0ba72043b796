package com.jobflow.scheduling;

import com.jobflow.broker.BrokerJob;
import com.jobflow.broker.BrokerQueue;
import com.jobflow.broker.JobState;
import com.jobflow.broker.SchedulerEntry;
import com.jobflow.core.JobConfig;
import com.jobflow.core.JobRegistry;
import com.jobflow.core.JobValidationException;
import com.jobflow.core.Payloads;
import com.jobflow.core.QueueBinding;
import com.jobflow.core.QueueResolutionException;
import com.jobflow.core.SchemaViolationException;
import com.jobflow.db.Database;
import com.jobflow.db.JdbcBroker;
import com.jobflow.db.MutableClock;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for static and dynamic job schedulers.
 */
public class SchedulerRegistryTest {

    private static final QueueBinding MAINTENANCE = QueueBinding.of("maintenance");

    private MutableClock clock;
    private JdbcBroker broker;
    private JobRegistry jobs;
    private SchedulerRegistry schedulers;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        broker = new JdbcBroker(new Database("jdbc:h2:mem:schedulers-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
                "sa", ""), clock);
        broker.initialize();
        jobs = new JobRegistry(broker);
        schedulers = new SchedulerRegistry(jobs);

        jobs.job("cleanup", payload -> Payloads.fromTree(payload, Map.class),
                JobConfig.on(MAINTENANCE).attempts(5).build(), (payload, context) -> null);
        schedulers.addTemplate(DynamicSchedulerTemplate.builder("daily-sync", "sync", "sync-account")
                .payloadFor(accountId -> Map.of("accountId", accountId))
                .build());
    }

    @AfterEach
    public void tearDown() {
        jobs.close();
        broker.close();
    }

    // ==================== STATIC ====================

    @Test
    public void testDeclarationIsValidated() {
        schedulers.addStatic(StaticSchedulerConfig.builder("nightly", "maintenance", "0 3 * * *").jobName("cleanup").build());

        assertThrows(IllegalArgumentException.class, () -> schedulers.addStatic(
                StaticSchedulerConfig.builder("nightly", "maintenance", "0 4 * * *").build()));
        assertThrows(IllegalArgumentException.class, () -> schedulers.addStatic(
                StaticSchedulerConfig.builder("broken", "maintenance", "not a cron").build()));
        assertThrows(IllegalArgumentException.class, () -> schedulers.addTemplate(
                DynamicSchedulerTemplate.builder("daily-sync", "sync", "sync-account").build()));
        assertEquals(Set.of("maintenance", "sync"), schedulers.getQueueNames());
    }

    /**
     * Registering static schedulers from several processes leaves one scheduler and one pending job.
     */
    @Test
    public void testStaticRegistrationIsIdempotent() {
        schedulers.addStatic(StaticSchedulerConfig.builder("nightly", "maintenance", "0 3 * * *")
                .jobName("cleanup")
                .payload(Map.of("days", 30))
                .build());

        schedulers.registerStaticSchedulers();
        new SchedulerRegistry(jobs).addStatic(schedulers.getStaticConfigs().get(0)).registerStaticSchedulers();

        BrokerQueue queue = jobs.getQueueByName("maintenance");
        SchedulerEntry entry = queue.getJobScheduler("scheduler:nightly").orElseThrow();
        assertEquals(Instant.parse("2024-01-01T03:00:00Z"), entry.getNextRun());
        assertEquals(1, queue.getJobSchedulers().size());
        assertEquals(1L, queue.getJobCounts().get(JobState.DELAYED));
        assertTrue(schedulers.getRegisteredStaticSchedulers().containsKey("nightly"));
    }

    @Test
    public void testStaticJobsUseRegisteredJobOptions() {
        schedulers.addStatic(StaticSchedulerConfig.builder("nightly", "maintenance", "0 3 * * *")
                .jobName("cleanup")
                .payload(Map.of("days", 30))
                .build());
        schedulers.registerStaticSchedulers();

        clock.set(Instant.parse("2024-01-01T03:00:00Z"));
        BrokerJob job = jobs.getQueueByName("maintenance").moveToActive("token", Duration.ofSeconds(30)).orElseThrow();

        assertEquals("cleanup", job.getName());
        assertEquals(5, job.getAttempts());
        assertEquals(30, job.getData().getAsJsonObject().get("days").getAsInt());
    }

    @Test
    public void testStaticPayloadIsValidated() {
        jobs.job("strict", payload -> {
            throw new SchemaViolationException(List.of("payload: rejected"));
        }, JobConfig.on(MAINTENANCE).build(), (payload, context) -> null);
        schedulers.addStatic(StaticSchedulerConfig.builder("strict", "maintenance", "0 3 * * *").build());

        assertThrows(JobValidationException.class, () -> schedulers.registerStaticSchedulers());
        assertTrue(schedulers.getRegisteredStaticSchedulers().isEmpty());
    }

    // ==================== DYNAMIC ====================

    @Test
    public void testDynamicSchedulerPerAccount() {
        String key = schedulers.registerDynamicScheduler(DynamicSchedulerRequest.of("daily-sync", "acct-1"));

        assertEquals("daily-sync-acct-1", key);
        BrokerQueue queue = jobs.getQueueByName("sync");
        SchedulerEntry entry = queue.getJobScheduler("scheduler:daily-sync-acct-1").orElseThrow();
        assertEquals(CronPatterns.dailyCronFor("acct-1"), entry.getRepeat().getPattern());
        assertEquals("UTC", entry.getRepeat().getTimezone());
        assertEquals("sync-account", entry.getJobName());
        assertEquals("acct-1", Payloads.parse(entry.getData()).getAsJsonObject().get("accountId").getAsString());
    }

    @Test
    public void testDuplicateDynamicRegistrationIsSkipped() {
        schedulers.registerDynamicScheduler(DynamicSchedulerRequest.of("daily-sync", "acct-1"));
        String again = schedulers.registerDynamicScheduler(
                new DynamicSchedulerRequest("daily-sync", "acct-1", "0 6 * * *"));

        assertEquals("daily-sync-acct-1", again);
        SchedulerEntry entry = jobs.getQueueByName("sync").getJobScheduler("scheduler:daily-sync-acct-1").orElseThrow();
        assertEquals(CronPatterns.dailyCronFor("acct-1"), entry.getRepeat().getPattern(), "First registration wins");
        assertEquals(1, schedulers.getRegisteredDynamicSchedulers().size());
    }

    @Test
    public void testExplicitCronOverridesTemplate() {
        schedulers.registerDynamicScheduler(new DynamicSchedulerRequest("daily-sync", "acct-2", "0 6 * * *"));

        SchedulerEntry entry = jobs.getQueueByName("sync").getJobScheduler("scheduler:daily-sync-acct-2").orElseThrow();
        assertEquals("0 6 * * *", entry.getRepeat().getPattern());
        assertEquals(Instant.parse("2024-01-01T06:00:00Z"), entry.getNextRun());
    }

    @Test
    public void testUnregisterDynamicScheduler() {
        schedulers.registerDynamicScheduler(DynamicSchedulerRequest.of("daily-sync", "acct-1"));
        BrokerQueue queue = jobs.getQueueByName("sync");

        assertTrue(schedulers.unregisterDynamicScheduler("daily-sync", "acct-1"));

        assertTrue(queue.getJobScheduler("scheduler:daily-sync-acct-1").isEmpty());
        assertEquals(0L, queue.getJobCounts().get(JobState.DELAYED));
        assertFalse(schedulers.unregisterDynamicScheduler("daily-sync", "acct-1"));
    }

    @Test
    public void testUnknownTemplate() {
        assertThrows(QueueResolutionException.class,
                () -> schedulers.registerDynamicScheduler(DynamicSchedulerRequest.of("weekly-sync", "acct-1")));
        assertThrows(QueueResolutionException.class,
                () -> schedulers.unregisterDynamicScheduler("weekly-sync", "acct-1"));
    }
}
