package com.jobflow.db;

import com.google.gson.JsonElement;
import com.jobflow.broker.Backoff;
import com.jobflow.broker.BrokerException;
import com.jobflow.broker.BrokerJob;
import com.jobflow.broker.BrokerQueue;
import com.jobflow.broker.BulkJob;
import com.jobflow.broker.DependencyCounts;
import com.jobflow.broker.FlowJob;
import com.jobflow.broker.FlowProducer;
import com.jobflow.broker.JobNode;
import com.jobflow.broker.JobOptions;
import com.jobflow.broker.JobState;
import com.jobflow.broker.RepeatOptions;
import com.jobflow.broker.Retention;
import com.jobflow.broker.SchedulerEntry;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the H2 broker: claiming, attempts and backoff, locks, stalled recovery, retention,
 * flows and job schedulers. Time is driven by a {@link MutableClock}.
 */
public class JdbcBrokerTest {

    private static final String TOKEN = "worker-1";
    private static final Duration LOCK = Duration.ofSeconds(30);
    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private MutableClock clock;
    private JdbcBroker broker;
    private BrokerQueue queue;

    @BeforeEach
    public void setUp() {
        Database database = new Database("jdbc:h2:mem:broker-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        clock = new MutableClock(START);
        broker = new JdbcBroker(database, clock);
        broker.initialize();
        queue = broker.openQueue("email");
    }

    @AfterEach
    public void tearDown() {
        queue.close();
        broker.close();
    }

    // ==================== CLAIMING ====================

    /**
     * Lower priority values are claimed first, equal priorities in insertion order.
     */
    @Test
    public void testClaimOrderIsPriorityThenFifo() {
        BrokerJob low = queue.add("send", "{\"n\":1}", JobOptions.builder().priority(5).build());
        BrokerJob first = queue.add("send", "{\"n\":2}", JobOptions.builder().priority(1).build());
        BrokerJob second = queue.add("send", "{\"n\":3}", JobOptions.builder().priority(1).build());

        assertEquals(first.getId(), claim().getId());
        assertEquals(second.getId(), claim().getId());
        assertEquals(low.getId(), claim().getId());
        assertTrue(queue.moveToActive(TOKEN, LOCK).isEmpty(), "Queue should be drained");
    }

    @Test
    public void testAddAppliesDefaults() {
        BrokerJob job = queue.add("send", "{\"to\":\"a@example.com\"}", JobOptions.empty());

        assertEquals(JobState.WAITING, job.getState());
        assertEquals(1, job.getPriority());
        assertEquals(3, job.getAttempts());
        assertEquals(0, job.getAttemptsMade());
        assertEquals(START.toEpochMilli(), job.getTimestamp());
        assertEquals("a@example.com", job.getData().getAsJsonObject().get("to").getAsString());
        assertEquals(Backoff.exponential(2000), job.getOptions().getBackoff());
    }

    @Test
    public void testDelayedJobIsClaimableOnlyWhenDue() {
        BrokerJob job = queue.add("send", "{}", JobOptions.builder().delay(5000L).build());
        assertEquals(JobState.DELAYED, job.getState());

        assertTrue(queue.moveToActive(TOKEN, LOCK).isEmpty(), "Delayed job must not be claimable yet");

        clock.advance(Duration.ofMillis(5000));
        assertEquals(job.getId(), claim().getId());
    }

    @Test
    public void testPromoteMakesDelayedJobClaimable() {
        BrokerJob job = queue.add("send", "{}", JobOptions.builder().delay(60_000L).build());

        assertTrue(queue.promote(job.getId()));
        assertEquals(JobState.WAITING, state(job.getId()));
        assertEquals(job.getId(), claim().getId());
        assertFalse(queue.promote(job.getId()), "Only delayed jobs can be promoted");
    }

    @Test
    public void testCustomJobIdIsDeduplicated() {
        JobOptions options = JobOptions.builder().jobId("invite-42").build();

        BrokerJob first = queue.add("send", "{\"n\":1}", options);
        BrokerJob second = queue.add("send", "{\"n\":2}", options);

        assertEquals("invite-42", first.getId());
        assertEquals(first.getId(), second.getId());
        assertEquals(1L, queue.getJobCounts().get(JobState.WAITING));
        assertEquals(1, second.getData().getAsJsonObject().get("n").getAsInt(), "Existing job is returned unchanged");
    }

    @Test
    public void testAddBulkKeepsOrder() {
        List<BulkJob> bulk = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            bulk.add(new BulkJob("send", "{\"n\":" + i + "}", JobOptions.empty()));
        }

        List<BrokerJob> jobs = queue.addBulk(bulk);

        assertEquals(5, jobs.size());
        for (int i = 0; i < 5; i++) {
            assertEquals(i, jobs.get(i).getData().getAsJsonObject().get("n").getAsInt());
            assertEquals(jobs.get(i).getId(), claim().getId());
        }
    }

    // ==================== COMPLETION & FAILURE ====================

    @Test
    public void testCompletionRecordsReturnValue() {
        queue.add("send", "{}", JobOptions.empty());
        BrokerJob active = claim();
        assertEquals(JobState.ACTIVE, active.getState());

        queue.moveToCompleted(active, TOKEN, "{\"sent\":true}", null);

        BrokerJob done = queue.getJob(active.getId()).orElseThrow();
        assertEquals(JobState.COMPLETED, done.getState());
        assertEquals(1, done.getAttemptsMade());
        assertEquals("{\"sent\":true}", done.getReturnValue());
        assertNotNull(done.getFinishedOn());
    }

    /**
     * A job failing on every attempt is retried with exponential backoff and ends FAILED after
     * exactly {@code attempts} executions.
     */
    @Test
    public void testFailureRetriesWithBackoffThenFails() {
        queue.add("send", "{}", JobOptions.builder().attempts(3).backoff(Backoff.exponential(1000)).build());

        BrokerJob attempt1 = claim();
        assertTrue(queue.moveToFailed(attempt1, TOKEN, new IllegalStateException("boom"), null));
        BrokerJob afterFirst = queue.getJob(attempt1.getId()).orElseThrow();
        assertEquals(JobState.DELAYED, afterFirst.getState());
        assertEquals(1, afterFirst.getAttemptsMade());
        assertEquals(START.toEpochMilli() + 1000, afterFirst.getProcessAt());

        clock.advance(Duration.ofMillis(1000));
        BrokerJob attempt2 = claim();
        assertTrue(queue.moveToFailed(attempt2, TOKEN, new IllegalStateException("boom"), null));
        assertEquals(clock.millis() + 2000, queue.getJob(attempt2.getId()).orElseThrow().getProcessAt());

        clock.advance(Duration.ofMillis(2000));
        BrokerJob attempt3 = claim();
        assertFalse(queue.moveToFailed(attempt3, TOKEN, new IllegalStateException("boom"), null));

        BrokerJob failed = queue.getJob(attempt3.getId()).orElseThrow();
        assertEquals(JobState.FAILED, failed.getState());
        assertEquals(3, failed.getAttemptsMade());
        assertEquals("boom", failed.getFailedReason());
        assertTrue(failed.getStacktrace().contains("IllegalStateException"));
    }

    @Test
    public void testLostLockRejectsCompletion() {
        queue.add("send", "{}", JobOptions.empty());
        BrokerJob active = claim();

        assertThrows(BrokerException.class, () -> queue.moveToCompleted(active, "someone-else", "null", null));
        assertEquals(JobState.ACTIVE, state(active.getId()));
    }

    @Test
    public void testRetryMovesFailedJobBackToWaiting() {
        queue.add("send", "{}", JobOptions.builder().attempts(1).build());
        BrokerJob active = claim();
        assertFalse(queue.moveToFailed(active, TOKEN, new RuntimeException("down"), null));

        assertTrue(queue.retry(active.getId()));

        BrokerJob retried = queue.getJob(active.getId()).orElseThrow();
        assertEquals(JobState.WAITING, retried.getState());
        assertEquals(0, retried.getAttemptsMade());
        assertNull(retried.getFailedReason());
        assertFalse(queue.retry(active.getId()), "Only failed jobs can be retried");
    }

    // ==================== LOCKS & STALLED JOBS ====================

    @Test
    public void testStalledJobIsRequeuedThenFailed() {
        queue.add("send", "{}", JobOptions.empty());

        BrokerJob first = queue.moveToActive(TOKEN, Duration.ofSeconds(1)).orElseThrow();
        clock.advance(Duration.ofSeconds(2));
        assertEquals(1, queue.recoverStalledJobs(1));
        assertEquals(JobState.WAITING, state(first.getId()));

        queue.moveToActive(TOKEN, Duration.ofSeconds(1)).orElseThrow();
        clock.advance(Duration.ofSeconds(2));
        assertEquals(1, queue.recoverStalledJobs(1));

        BrokerJob failed = queue.getJob(first.getId()).orElseThrow();
        assertEquals(JobState.FAILED, failed.getState());
        assertTrue(failed.getFailedReason().contains("stalled"));
    }

    @Test
    public void testExtendedLockIsNotStalled() {
        queue.add("send", "{}", JobOptions.empty());
        BrokerJob active = queue.moveToActive(TOKEN, Duration.ofSeconds(1)).orElseThrow();

        clock.advance(Duration.ofMillis(500));
        assertEquals(1, queue.extendLocks(TOKEN, Duration.ofSeconds(1)));
        clock.advance(Duration.ofMillis(800));

        assertEquals(0, queue.recoverStalledJobs(1));
        assertEquals(JobState.ACTIVE, state(active.getId()));
    }

    /**
     * A worker stopped mid-job hands the job back without using up an attempt.
     */
    @Test
    public void testMoveToWaitingDoesNotCountAttempt() {
        queue.add("send", "{}", JobOptions.builder().attempts(1).build());
        BrokerJob active = claim();

        assertFalse(queue.moveToWaiting(active, "worker-2"), "Only the lock holder can hand the job back");
        assertTrue(queue.moveToWaiting(active, TOKEN));

        BrokerJob waiting = queue.getJob(active.getId()).orElseThrow();
        assertEquals(JobState.WAITING, waiting.getState());
        assertEquals(0, waiting.getAttemptsMade());
        assertEquals(active.getId(), claim().getId());
    }

    // ==================== RETENTION ====================

    @Test
    public void testCompletedJobsAreTrimmedToRetention() {
        JobOptions keepTwo = JobOptions.builder().removeOnComplete(Retention.keepLast(2)).build();
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            ids.add(queue.add("send", "{}", keepTwo).getId());
        }
        for (int i = 0; i < 3; i++) {
            clock.advance(Duration.ofSeconds(1));
            queue.moveToCompleted(claim(), TOKEN, "null", null);
        }

        assertEquals(2L, queue.getJobCounts().get(JobState.COMPLETED));
        assertTrue(queue.getJob(ids.get(0)).isEmpty(), "Oldest completed job should be removed");
        assertTrue(queue.getJob(ids.get(2)).isPresent());
    }

    @Test
    public void testRetentionOverrideReplacesJobRetention() {
        BrokerJob job = queue.add("send", "{}", JobOptions.builder().removeOnComplete(Retention.keepLast(100)).build());

        queue.moveToCompleted(claim(), TOKEN, "null", Retention.keepLast(0));

        assertTrue(queue.getJob(job.getId()).isEmpty());
    }

    @Test
    public void testOldFailedJobsExpire() {
        JobOptions options = JobOptions.builder().attempts(1)
                .removeOnFail(Retention.keepLast(50, Duration.ofHours(1))).build();
        BrokerJob old = queue.add("send", "{}", options);
        queue.moveToFailed(claim(), TOKEN, new RuntimeException("x"), null);

        clock.advance(Duration.ofHours(2));
        queue.add("send", "{}", options);
        queue.moveToFailed(claim(), TOKEN, new RuntimeException("y"), null);

        assertTrue(queue.getJob(old.getId()).isEmpty(), "Failed job older than max age should be removed");
        assertEquals(1L, queue.getJobCounts().get(JobState.FAILED));
    }

    // ==================== INTROSPECTION ====================

    @Test
    public void testJobCountsIncludeEveryState() {
        Map<JobState, Long> counts = queue.getJobCounts();

        for (JobState state : JobState.values()) {
            assertEquals(0L, counts.get(state), "Missing or non-zero count for " + state);
        }
    }

    @Test
    public void testRemoveDeletesJobAndLogs() {
        BrokerJob job = queue.add("send", "{}", JobOptions.empty());
        job.log("queued for later");
        assertEquals(List.of("queued for later"), queue.getJobLogs(job.getId()));

        assertTrue(queue.remove(job.getId()));

        assertTrue(queue.getJob(job.getId()).isEmpty());
        assertTrue(queue.getJobLogs(job.getId()).isEmpty());
        assertFalse(queue.remove(job.getId()));
    }

    @Test
    public void testActiveJobCannotBeRemoved() {
        queue.add("send", "{}", JobOptions.empty());
        BrokerJob active = claim();

        assertFalse(queue.remove(active.getId()));
    }

    @Test
    public void testProgressIsStoredAndPublished() {
        List<Integer> published = new ArrayList<>();
        queue.addProgressListener((job, progress) -> published.add(progress));
        queue.add("send", "{}", JobOptions.empty());
        BrokerJob active = claim();

        active.updateProgress(40);

        assertEquals(List.of(40), published);
        assertEquals(40, active.getProgress());
        assertEquals(40, queue.getJob(active.getId()).orElseThrow().getProgress());
        assertThrows(IllegalArgumentException.class, () -> active.updateProgress(101));
    }

    // ==================== FLOWS ====================

    @Test
    public void testFlowParentWaitsForChildren() {
        BrokerQueue reports = broker.openQueue("reports");
        FlowProducer producer = broker.openFlowProducer();

        FlowJob flow = new FlowJob("summarize", "reports", "{}", JobOptions.empty(), List.of(
                new FlowJob("send", "email", "{\"n\":1}", JobOptions.empty(), null),
                new FlowJob("send", "email", "{\"n\":2}", JobOptions.empty(), null)));
        JobNode node = producer.add(flow);

        BrokerJob parent = node.getJob();
        assertEquals(JobState.WAITING_CHILDREN, parent.getState());
        assertEquals(2, node.getChildren().size());
        assertEquals("email", node.getChildren().get(0).getJob().getQueueName());
        assertTrue(reports.moveToActive(TOKEN, LOCK).isEmpty(), "Parent must wait for its children");

        BrokerJob child1 = claim();
        queue.moveToCompleted(child1, TOKEN, "1", null);
        assertEquals(JobState.WAITING_CHILDREN, reports.getJob(parent.getId()).orElseThrow().getState());

        BrokerJob child2 = claim();
        queue.moveToCompleted(child2, TOKEN, "\"x\"", null);

        BrokerJob released = reports.moveToActive(TOKEN, LOCK).orElseThrow();
        assertEquals(parent.getId(), released.getId());

        Map<String, JsonElement> values = released.getChildrenValues();
        assertEquals(1, values.get("email:" + child1.getId()).getAsInt());
        assertEquals("x", values.get("email:" + child2.getId()).getAsString());
        DependencyCounts counts = released.getDependenciesCount();
        assertEquals(2, counts.getProcessed());
        assertEquals(0, counts.getUnprocessed());

        producer.close();
        reports.close();
    }

    @Test
    public void testFailedChildFailsParentOnlyWhenAsked() {
        BrokerQueue reports = broker.openQueue("reports");
        FlowProducer producer = broker.openFlowProducer();

        JobNode lenient = producer.add(new FlowJob("summarize", "reports", "{}", null, List.of(
                new FlowJob("send", "email", "{}", JobOptions.builder().attempts(1).build(), null))));
        queue.moveToFailed(claim(), TOKEN, new RuntimeException("smtp down"), null);
        assertEquals(JobState.WAITING_CHILDREN, reports.getJob(lenient.getJob().getId()).orElseThrow().getState());

        JobNode strict = producer.add(new FlowJob("summarize", "reports", "{}", null, List.of(
                new FlowJob("send", "email", "{}",
                        JobOptions.builder().attempts(1).failParentOnFailure(true).build(), null))));
        queue.moveToFailed(claim(), TOKEN, new RuntimeException("smtp down"), null);

        BrokerJob parent = reports.getJob(strict.getJob().getId()).orElseThrow();
        assertEquals(JobState.FAILED, parent.getState());
        assertTrue(parent.getFailedReason().contains("failed"));

        producer.close();
        reports.close();
    }

    @Test
    public void testUnprocessedDependenciesAreListed() {
        FlowProducer producer = broker.openFlowProducer();
        JobNode node = producer.add(new FlowJob("summarize", "reports", "{}", null, List.of(
                new FlowJob("send", "email", "{}", null, null))));

        String childKey = "email:" + node.getChildren().get(0).getJob().getId();
        assertEquals(List.of(childKey), node.getJob().getDependencies().getUnprocessed());
        assertTrue(node.getJob().getDependencies().getProcessed().isEmpty());

        producer.close();
    }

    @Test
    public void testFlowRootWithExistingIdIsNotAddedAgain() {
        FlowProducer producer = broker.openFlowProducer();
        FlowJob flow = new FlowJob("summarize", "reports", "{}", JobOptions.builder().jobId("report-t1").build(),
                List.of(new FlowJob("send", "email", "{}", null, null)));

        producer.add(flow);
        JobNode again = producer.add(flow);

        assertEquals("report-t1", again.getJob().getId());
        assertEquals(JobState.WAITING_CHILDREN, again.getJob().getState());
        assertTrue(again.getChildren().isEmpty());
        assertEquals(1L, queue.getJobCounts().get(JobState.WAITING), "Children are not added twice");
        producer.close();
    }

    @Test
    public void testFlowChildWithExistingIdIsRejected() {
        queue.add("send", "{}", JobOptions.builder().jobId("invite-t1").build());
        FlowProducer producer = broker.openFlowProducer();

        assertThrows(IllegalArgumentException.class, () -> producer.add(new FlowJob("summarize", "reports", "{}", null,
                List.of(new FlowJob("send", "email", "{}", JobOptions.builder().jobId("invite-t1").build(), null)))));

        BrokerQueue reports = broker.openQueue("reports");
        assertEquals(0L, reports.getJobCounts().get(JobState.WAITING_CHILDREN), "Nothing of the flow is stored");
        assertNull(queue.getJob("invite-t1").orElseThrow().getParentId());
        reports.close();
        producer.close();
    }

    @Test
    public void testFlowHandlesOutliveProducer() {
        FlowProducer producer = broker.openFlowProducer();
        JobNode node = producer.add(new FlowJob("summarize", "reports", "{}", null, List.of(
                new FlowJob("send", "email", "{}", null, null))));

        producer.close();

        assertEquals(1, node.getJob().getDependenciesCount().getUnprocessed());
        assertTrue(node.getJob().getChildrenValues().isEmpty());
        assertThrows(BrokerException.class, () -> producer.add(new FlowJob("send", "email", "{}", null, null)));
    }

    // ==================== JOB SCHEDULERS ====================

    @Test
    public void testSchedulerUpsertIsIdempotent() {
        RepeatOptions daily = RepeatOptions.cron("0 3 * * *");

        queue.upsertJobScheduler("scheduler:daily", daily, "cleanup", "{}", JobOptions.empty());
        SchedulerEntry entry = queue.upsertJobScheduler("scheduler:daily", daily, "cleanup", "{}", JobOptions.empty());

        assertEquals(1, queue.getJobSchedulers().size());
        assertEquals(1L, queue.getJobCounts().get(JobState.DELAYED));
        assertEquals(Instant.parse("2024-01-01T03:00:00Z"), entry.getNextRun());
        assertEquals(1, entry.getIterationCount());
    }

    @Test
    public void testClaimingScheduledJobEnqueuesNextOccurrence() {
        queue.upsertJobScheduler("scheduler:daily", RepeatOptions.cron("0 3 * * *"), "cleanup", "{\"days\":30}",
                JobOptions.empty());

        clock.set(Instant.parse("2024-01-01T03:00:00Z"));
        BrokerJob job = claim();

        assertEquals("cleanup", job.getName());
        assertEquals("scheduler:daily", job.getSchedulerId());
        assertEquals("repeat:scheduler:daily:" + clock.millis(), job.getId());
        assertEquals(30, job.getData().getAsJsonObject().get("days").getAsInt());

        SchedulerEntry entry = queue.getJobScheduler("scheduler:daily").orElseThrow();
        assertEquals(Instant.parse("2024-01-02T03:00:00Z"), entry.getNextRun());
        assertEquals(2, entry.getIterationCount());
        assertEquals(1L, queue.getJobCounts().get(JobState.DELAYED));
    }

    @Test
    public void testSchedulerStopsAtLimit() {
        RepeatOptions once = RepeatOptions.builder("0 3 * * *").limit(1).build();
        queue.upsertJobScheduler("scheduler:once", once, "cleanup", "{}", JobOptions.empty());

        clock.set(Instant.parse("2024-01-01T03:00:00Z"));
        claim();

        assertNull(queue.getJobScheduler("scheduler:once").orElseThrow().getNextRun());
        assertEquals(0L, queue.getJobCounts().get(JobState.DELAYED));
    }

    @Test
    public void testRemoveSchedulerDeletesPendingOccurrence() {
        queue.upsertJobScheduler("scheduler:daily", RepeatOptions.cron("0 3 * * *"), "cleanup", "{}", JobOptions.empty());

        assertTrue(queue.removeJobScheduler("scheduler:daily"));

        assertTrue(queue.getJobScheduler("scheduler:daily").isEmpty());
        assertEquals(0L, queue.getJobCounts().get(JobState.DELAYED));
        assertFalse(queue.removeJobScheduler("scheduler:daily"));
    }

    @Test
    public void testRepeatableAddReturnsFirstOccurrence() {
        JobOptions options = JobOptions.builder().repeat(RepeatOptions.cron("*/15 * * * *")).build();

        BrokerJob first = queue.add("digest", "{}", options);
        BrokerJob again = queue.add("digest", "{}", options);

        assertEquals(Instant.parse("2024-01-01T00:15:00Z").toEpochMilli(), first.getProcessAt());
        assertEquals(first.getId(), again.getId());
        assertEquals(1, queue.getJobSchedulers().size());
        assertEquals("repeat:digest:*/15 * * * *:UTC", queue.getJobSchedulers().get(0).getId());
    }

    @Test
    public void testClosedQueueRejectsCalls() {
        BrokerQueue closed = broker.openQueue("closed");
        closed.close();

        assertThrows(BrokerException.class, () -> closed.add("send", "{}", JobOptions.empty()));
    }

    // ==================== CONCURRENT WRITERS ====================

    /**
     * Worker processes starting together register the same scheduler at once.
     */
    @Test
    public void testConcurrentSchedulerUpsertsAgree() throws Exception {
        List<Object> results = race(4, () -> broker.openQueue("maintenance").upsertJobScheduler("scheduler:nightly",
                RepeatOptions.cron("0 2 * * *"), "cleanup", "{}", JobOptions.empty()));

        for (Object result : results) {
            assertInstanceOf(SchedulerEntry.class, result, "Every upsert should succeed: " + result);
            assertEquals(Instant.parse("2024-01-01T02:00:00Z"), ((SchedulerEntry) result).getNextRun());
        }
        BrokerQueue maintenance = broker.openQueue("maintenance");
        assertEquals(1, maintenance.getJobSchedulers().size());
        assertEquals(1L, maintenance.getJobCounts().get(JobState.DELAYED));
        assertEquals(1, maintenance.getJobScheduler("scheduler:nightly").orElseThrow().getIterationCount());
        maintenance.close();
    }

    @Test
    public void testConcurrentAddsWithCustomIdCreateOneJob() throws Exception {
        JobOptions options = JobOptions.builder().jobId("invite-t1").build();

        List<Object> results = race(4, () -> queue.add("send", "{}", options).getId());

        assertEquals(List.of("invite-t1", "invite-t1", "invite-t1", "invite-t1"), results);
        assertEquals(1L, queue.getJobCounts().get(JobState.WAITING));
    }

    /**
     * Run {@code task} on {@code threads} threads released together. Each entry of the result is
     * the task's value or the exception it threw.
     */
    private static List<Object> race(int threads, Callable<?> task) throws Exception {
        CyclicBarrier barrier = new CyclicBarrier(threads);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Object>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Object> attempt = () -> {
                    barrier.await();
                    return task.call();
                };
                futures.add(pool.submit(attempt));
            }
            List<Object> results = new ArrayList<>();
            for (Future<Object> future : futures) {
                try {
                    results.add(future.get(30, TimeUnit.SECONDS));
                } catch (ExecutionException e) {
                    results.add(e.getCause());
                }
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private BrokerJob claim() {
        Optional<BrokerJob> job = queue.moveToActive(TOKEN, LOCK);
        assertTrue(job.isPresent(), "Expected a claimable job");
        return job.get();
    }

    private JobState state(String jobId) {
        return queue.getJob(jobId).orElseThrow().getState();
    }
}
