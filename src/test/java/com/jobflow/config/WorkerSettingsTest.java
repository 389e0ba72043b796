package com.jobflow.config;

import org.junit.jupiter.api.*;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class WorkerSettingsTest {

    private final Map<String, String> env = new HashMap<>();

    @Test
    public void testDefaults() {
        WorkerSettings settings = WorkerSettings.from(env::get);

        assertFalse(settings.isDebug());
        assertEquals(WorkerSettings.DEFAULT_HEALTH_PORT, settings.getHealthPort());
        assertTrue(settings.isHealthServerEnabled());
        assertTrue(settings.getQueueConcurrency().isEmpty());
    }

    @Test
    public void testHealthPort() {
        env.put(WorkerSettings.HEALTH_PORT, "0");
        assertFalse(WorkerSettings.from(env::get).isHealthServerEnabled());

        env.put(WorkerSettings.HEALTH_PORT, "70000");
        assertThrows(IllegalStateException.class, () -> WorkerSettings.from(env::get));

        env.put(WorkerSettings.HEALTH_PORT, "http");
        assertThrows(IllegalStateException.class, () -> WorkerSettings.from(env::get));
    }

    @Test
    public void testDebugFlag() {
        env.put(WorkerSettings.DEBUG, "true");

        assertTrue(WorkerSettings.from(env::get).isDebug());
    }

    @Test
    public void testQueueConcurrency() {
        assertEquals(Map.of("email", 10, "reports", 2), WorkerSettings.parseConcurrency("email=10, reports=2"));
        assertEquals(Map.of("email", 10), WorkerSettings.parseConcurrency("email=10,"));
        assertTrue(WorkerSettings.parseConcurrency("  ").isEmpty());

        assertThrows(IllegalStateException.class, () -> WorkerSettings.parseConcurrency("email"));
        assertThrows(IllegalStateException.class, () -> WorkerSettings.parseConcurrency("email=0"));
        assertThrows(IllegalStateException.class, () -> WorkerSettings.parseConcurrency("email=many"));
        assertThrows(IllegalStateException.class, () -> WorkerSettings.parseConcurrency("=4"));
    }
}
