package com.jobflow.core;

import com.jobflow.broker.BrokerException;
import com.jobflow.broker.BrokerQueue;
import com.jobflow.broker.JobOptions;
import com.jobflow.db.Database;
import com.jobflow.db.JdbcBroker;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for job registration and dual-mode queue resolution.
 */
public class JobRegistryTest {

    private static final QueueBinding EMAIL = QueueBinding.builder("email").concurrency(5).build();

    private JdbcBroker jdbcBroker;
    private CountingBroker broker;
    private JobRegistry registry;
    private JobDefinition<InvitePayload> sendInvite;

    private final List<LogRecord> warnings = new ArrayList<>();
    private final Handler capture = new Handler() {
        @Override
        public void publish(LogRecord record) {
            if (record.getLevel().intValue() >= Level.WARNING.intValue()) {
                warnings.add(record);
            }
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    };

    @BeforeEach
    public void setUp() {
        jdbcBroker = new JdbcBroker(new Database("jdbc:h2:mem:registry-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
                "sa", ""));
        jdbcBroker.initialize();
        broker = new CountingBroker(jdbcBroker);
        registry = new JobRegistry(broker);
        sendInvite = registry.job("send-invite", JobSchema.of(InvitePayload.class), JobConfig.on(EMAIL).build(),
                (payload, context) -> null);
        Logger.getLogger(JobRegistry.class.getName()).addHandler(capture);
    }

    @AfterEach
    public void tearDown() {
        Logger.getLogger(JobRegistry.class.getName()).removeHandler(capture);
        registry.close();
        jdbcBroker.close();
    }

    // ==================== REGISTRATION ====================

    @Test
    public void testDuplicateIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.job("send-invite",
                JobSchema.of(InvitePayload.class), JobConfig.on(EMAIL).build(), (payload, context) -> null));
        assertSame(sendInvite, registry.getDefinition("send-invite"));
    }

    @Test
    public void testConflictingBindingIsRejected() {
        QueueBinding other = QueueBinding.builder("email").concurrency(10).build();

        assertThrows(IllegalArgumentException.class, () -> registry.job("send-reminder",
                JobSchema.of(InvitePayload.class), JobConfig.on(other).build(), (payload, context) -> null));
        assertFalse(registry.isRegistered("send-reminder"));
    }

    @Test
    public void testEqualBindingsShareTheQueue() {
        QueueBinding same = QueueBinding.builder("email").concurrency(5).build();
        registry.job("send-reminder", JobSchema.of(InvitePayload.class), JobConfig.on(same).build(),
                (payload, context) -> null);

        assertEquals(1, registry.getQueueBindings().size());
        assertEquals(2, registry.getDefinitions().size());
        assertEquals(EMAIL, registry.getQueueBinding("email"));
    }

    @Test
    public void testUnknownJob() {
        assertThrows(QueueResolutionException.class, () -> registry.getDefinition("missing"));
        assertThrows(QueueResolutionException.class, () -> registry.getQueue("missing"));
    }

    // ==================== RESOLUTION ====================

    /**
     * Without a resolver, one external handle per queue is opened and reused.
     */
    @Test
    public void testExternalQueuesAreCached() {
        assertEquals(ResolutionMode.UNINITIALIZED, registry.getResolutionMode());

        sendInvite.trigger(new InvitePayload("a@example.com", "t1"));
        sendInvite.trigger(new InvitePayload("b@example.com", "t1"));

        assertEquals(ResolutionMode.EXTERNAL_CACHE_IN_USE, registry.getResolutionMode());
        assertEquals(List.of("email"), broker.getOpenedQueues());
        assertEquals(List.of("email"), registry.getExternalQueueNames());
    }

    @Test
    public void testCloseExternalQueues() {
        BrokerQueue queue = registry.getQueue("send-invite");

        registry.closeExternalQueues();

        assertTrue(registry.getExternalQueueNames().isEmpty());
        assertEquals(ResolutionMode.UNINITIALIZED, registry.getResolutionMode());
        assertThrows(BrokerException.class, () -> queue.add("send-invite", "{}", JobOptions.empty()));
    }

    @Test
    public void testInstalledResolverWins() {
        BrokerQueue owned = jdbcBroker.openQueue("email");
        registry.setQueueResolver((jobId, queueName) -> "email".equals(queueName) ? owned : null);

        assertEquals(ResolutionMode.RESOLVER_INSTALLED, registry.getResolutionMode());
        assertSame(owned, registry.getQueue("send-invite"));
        assertTrue(broker.getOpenedQueues().isEmpty());
        assertTrue(warnings.isEmpty());
        owned.close();
    }

    @Test
    public void testInstallingResolverClosesCachedQueues() {
        BrokerQueue cached = registry.getQueue("send-invite");
        BrokerQueue owned = jdbcBroker.openQueue("email");

        registry.setQueueResolver((jobId, queueName) -> owned);

        assertTrue(registry.getExternalQueueNames().isEmpty());
        assertThrows(BrokerException.class, () -> cached.getJobCounts());
        owned.close();
    }

    @Test
    public void testResolverMissFallsBackWithWarning() {
        registry.setQueueResolver((jobId, queueName) -> null);

        BrokerQueue queue = registry.getQueue("send-invite");

        assertEquals("email", queue.getName());
        assertEquals(List.of("email"), broker.getOpenedQueues());
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).getMessage().contains("falling back"));
        assertEquals(ResolutionMode.RESOLVER_INSTALLED, registry.getResolutionMode());
    }

    @Test
    public void testResolverMissIsReportedOncePerQueue() {
        registry.setQueueResolver((jobId, queueName) -> null);

        BrokerQueue first = registry.getQueue("send-invite");
        sendInvite.trigger(new InvitePayload("a@example.com", "t1"));
        sendInvite.trigger(new InvitePayload("b@example.com", "t1"));

        assertSame(first, registry.getQueue("send-invite"));
        assertEquals(1, warnings.size());
        assertEquals(List.of("email"), broker.getOpenedQueues());
    }

    @Test
    public void testResolverFailureFallsBackWithWarning() {
        registry.setQueueResolver((jobId, queueName) -> {
            throw new IllegalStateException("worker not ready");
        });

        BrokerQueue queue = registry.getQueueByName("email");

        assertEquals("email", queue.getName());
        assertEquals(1, warnings.size());
        assertInstanceOf(IllegalStateException.class, warnings.get(0).getThrown());
    }

    /**
     * Concurrent first triggers share one handle per queue and one flow producer.
     */
    @Test
    public void testConcurrentFirstUseOpensOneHandle() throws Exception {
        registry.job("send-report", JobSchema.of(InvitePayload.class), JobConfig.on(QueueBinding.of("reports")).build(),
                (payload, context) -> null);
        int threads = 8;
        CyclicBarrier barrier = new CyclicBarrier(threads);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        List<Future<Object>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            String jobId = i % 2 == 0 ? "send-invite" : "send-report";
            futures.add(pool.submit(() -> {
                barrier.await();
                registry.getQueue(jobId);
                registry.getFlowProducer();
                return null;
            }));
        }
        try {
            for (Future<Object> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<String> opened = broker.getOpenedQueues();
        opened.sort(null);
        assertEquals(List.of("email", "reports"), opened);
        assertEquals(1, broker.getFlowProducers());
        assertEquals(ResolutionMode.EXTERNAL_CACHE_IN_USE, registry.getResolutionMode());
    }

    @Test
    public void testFlowProducerIsShared() {
        assertSame(registry.getFlowProducer(), registry.getFlowProducer());
        assertEquals(1, broker.getFlowProducers());
    }
}
